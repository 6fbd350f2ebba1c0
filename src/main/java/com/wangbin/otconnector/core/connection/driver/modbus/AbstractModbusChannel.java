package com.wangbin.otconnector.core.connection.driver.modbus;

import com.digitalpetri.modbus.client.ModbusClient;
import com.digitalpetri.modbus.pdu.ReadCoilsRequest;
import com.digitalpetri.modbus.pdu.ReadCoilsResponse;
import com.digitalpetri.modbus.pdu.ReadDiscreteInputsRequest;
import com.digitalpetri.modbus.pdu.ReadDiscreteInputsResponse;
import com.digitalpetri.modbus.pdu.ReadHoldingRegistersRequest;
import com.digitalpetri.modbus.pdu.ReadHoldingRegistersResponse;
import com.digitalpetri.modbus.pdu.ReadInputRegistersRequest;
import com.digitalpetri.modbus.pdu.ReadInputRegistersResponse;
import com.wangbin.otconnector.core.connection.driver.ModbusChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Modbus TCP/RTU 共用的读取实现
 */
@Slf4j
abstract class AbstractModbusChannel implements ModbusChannel {

    protected final ModbusClient client;
    protected final int unitId;
    private final long requestTimeoutMs;

    AbstractModbusChannel(ModbusClient client, int unitId, long requestTimeoutMs) {
        this.client = client;
        this.unitId = unitId;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public boolean readCoil(int address) throws Exception {
        CompletionStage<ReadCoilsResponse> future = client.readCoilsAsync(unitId,
                new ReadCoilsRequest(address, 1));
        ReadCoilsResponse response = await(future);
        return firstBit(response.coils(), address);
    }

    @Override
    public boolean readDiscreteInput(int address) throws Exception {
        CompletionStage<ReadDiscreteInputsResponse> future = client.readDiscreteInputsAsync(unitId,
                new ReadDiscreteInputsRequest(address, 1));
        ReadDiscreteInputsResponse response = await(future);
        return firstBit(response.inputs(), address);
    }

    @Override
    public int readHoldingRegister(int address) throws Exception {
        CompletionStage<ReadHoldingRegistersResponse> future = client.readHoldingRegistersAsync(unitId,
                new ReadHoldingRegistersRequest(address, 1));
        ReadHoldingRegistersResponse response = await(future);
        return firstRegister(response.registers(), address);
    }

    @Override
    public int readInputRegister(int address) throws Exception {
        CompletionStage<ReadInputRegistersResponse> future = client.readInputRegistersAsync(unitId,
                new ReadInputRegistersRequest(address, 1));
        ReadInputRegistersResponse response = await(future);
        return firstRegister(response.registers(), address);
    }

    @Override
    public void close() throws Exception {
        client.disconnect();
        log.info("Modbus 连接已关闭: {}", describe());
    }

    protected abstract String describe();

    private <T> T await(CompletionStage<T> future) throws Exception {
        try {
            return future.toCompletableFuture().get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private static boolean firstBit(byte[] bits, int address) {
        if (bits == null || bits.length == 0) {
            throw new IllegalStateException("Empty response for address " + address);
        }
        return (bits[0] & 0x01) != 0;
    }

    private static int firstRegister(byte[] registers, int address) {
        if (registers == null || registers.length < 2) {
            throw new IllegalStateException("Empty response for address " + address);
        }
        return ((registers[0] & 0xFF) << 8) | (registers[1] & 0xFF);
    }
}
