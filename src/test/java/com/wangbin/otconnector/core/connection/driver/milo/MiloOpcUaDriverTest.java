package com.wangbin.otconnector.core.connection.driver.milo;

import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MiloOpcUaDriverTest {

    @Test
    void securityPolicyAcceptsShortNameOrUri() {
        assertEquals("http://opcfoundation.org/UA/SecurityPolicy#None",
                MiloOpcUaDriver.resolveSecurityPolicy(null));
        assertEquals("http://opcfoundation.org/UA/SecurityPolicy#Basic256Sha256",
                MiloOpcUaDriver.resolveSecurityPolicy("Basic256Sha256"));
        assertEquals("http://opcfoundation.org/UA/SecurityPolicy#Aes128_Sha256_RsaOaep",
                MiloOpcUaDriver.resolveSecurityPolicy("http://opcfoundation.org/UA/SecurityPolicy#Aes128_Sha256_RsaOaep"));
    }

    @Test
    void securityModeIsCaseInsensitiveWithNoneFallback() {
        assertEquals(MessageSecurityMode.None, MiloOpcUaDriver.resolveSecurityMode(""));
        assertEquals(MessageSecurityMode.SignAndEncrypt, MiloOpcUaDriver.resolveSecurityMode("signandencrypt"));
        assertEquals(MessageSecurityMode.Sign, MiloOpcUaDriver.resolveSecurityMode(" Sign "));
        assertEquals(MessageSecurityMode.None, MiloOpcUaDriver.resolveSecurityMode("bogus"));
    }
}
