package com.wangbin.otconnector.core.connection.driver;

/**
 * Modbus 主站通道，每次只读一个地址
 */
public interface ModbusChannel extends AutoCloseable {

    /**
     * FC1
     */
    boolean readCoil(int address) throws Exception;

    /**
     * FC2
     */
    boolean readDiscreteInput(int address) throws Exception;

    /**
     * FC3，返回无符号16位值
     */
    int readHoldingRegister(int address) throws Exception;

    /**
     * FC4，返回无符号16位值
     */
    int readInputRegister(int address) throws Exception;
}
