package com.wangbin.otconnector.core.connection.driver.milo;

import com.wangbin.otconnector.common.exception.OtConnectionException;
import com.wangbin.otconnector.core.connection.driver.OpcUaChannel;
import com.wangbin.otconnector.core.connection.driver.ProtocolDriver;
import com.wangbin.otconnector.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.milo.opcua.sdk.client.DiscoveryClient;
import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.OpcUaClientConfigBuilder;
import org.eclipse.milo.opcua.sdk.client.identity.AnonymousProvider;
import org.eclipse.milo.opcua.sdk.client.identity.IdentityProvider;
import org.eclipse.milo.opcua.sdk.client.identity.UsernameProvider;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.eclipse.milo.opcua.stack.core.types.structured.EndpointDescription;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Eclipse Milo 的 OPC UA 驱动
 */
@Slf4j
public class MiloOpcUaDriver implements ProtocolDriver<OpcUaChannel> {

    private static final String OPC_POLICY_URI_PREFIX = "http://opcfoundation.org/UA/SecurityPolicy#";
    private static final String DISCOVERY_SUFFIX = "/discovery";

    @Override
    public String getName() {
        return "OPC UA (Milo)";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public OpcUaChannel open(ConnectionConfig config) throws Exception {
        String endpointUrl = config.getEndpoint();
        String securityPolicy = resolveSecurityPolicy(config.getSecurityPolicy());
        MessageSecurityMode securityMode = resolveSecurityMode(config.getSecurityMode());
        long timeout = config.resolveConnectTimeoutMs();

        List<EndpointDescription> endpoints = discoverEndpoints(endpointUrl, timeout);
        EndpointDescription endpoint = selectEndpoint(endpoints, securityPolicy, securityMode, endpointUrl);

        OpcUaClientConfigBuilder builder = new OpcUaClientConfigBuilder();
        builder.setEndpoint(endpoint);
        builder.setRequestTimeout(Unsigned.uint(timeout));
        builder.setIdentityProvider(resolveIdentityProvider(config));

        OpcUaClient client = OpcUaClient.create(builder.build());
        MiloOpcUaChannel channel = ProtocolDriver.connectOrClose(
                new MiloOpcUaChannel(client, endpointUrl), client::connect);
        log.info("OPC UA 会话已建立: endpoint={}, policy={}, mode={}",
                endpointUrl, securityPolicy, securityMode);
        return channel;
    }

    private List<EndpointDescription> discoverEndpoints(String url, long timeout) throws Exception {
        try {
            return DiscoveryClient.getEndpoints(url).get(timeout, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            if (!url.endsWith(DISCOVERY_SUFFIX)) {
                log.debug("端点发现失败，尝试 discovery 地址: {}", url);
                return DiscoveryClient.getEndpoints(url + DISCOVERY_SUFFIX).get(timeout, TimeUnit.MILLISECONDS);
            }
            throw e;
        }
    }

    private EndpointDescription selectEndpoint(List<EndpointDescription> endpoints, String securityPolicy,
                                               MessageSecurityMode securityMode, String endpointUrl) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw OtConnectionException.connectException("No OPC UA endpoints available", endpointUrl, null);
        }
        for (EndpointDescription endpoint : endpoints) {
            boolean policyMatch = endpoint.getSecurityPolicyUri() != null
                    && endpoint.getSecurityPolicyUri().equalsIgnoreCase(securityPolicy);
            boolean modeMatch = endpoint.getSecurityMode() == securityMode;
            if (policyMatch && modeMatch) {
                return endpoint;
            }
        }
        log.debug("未找到匹配的安全端点，使用第一个: policy={}, mode={}", securityPolicy, securityMode);
        return endpoints.get(0);
    }

    static String resolveSecurityPolicy(String policy) {
        String text = policy == null || policy.isBlank() ? "None" : policy.trim();
        if (text.startsWith(OPC_POLICY_URI_PREFIX)) {
            return text;
        }
        return OPC_POLICY_URI_PREFIX + text;
    }

    static MessageSecurityMode resolveSecurityMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return MessageSecurityMode.None;
        }
        String text = mode.trim();
        for (MessageSecurityMode value : MessageSecurityMode.values()) {
            if (value.name().equalsIgnoreCase(text)) {
                return value;
            }
        }
        return MessageSecurityMode.None;
    }

    private IdentityProvider resolveIdentityProvider(ConnectionConfig config) {
        if (config.hasCredentials()) {
            String password = config.getPassword();
            return new UsernameProvider(config.getUsername(), password != null ? password : "");
        }
        return new AnonymousProvider();
    }
}
