package com.brianxiadong.insertbenchmark.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * 基准测试的一行数据
 * 1个整型设备ID + 9个浮点型传感器读数，生成后不可变
 */
@EqualsAndHashCode
public final class Row {

    /**
     * 每行的列数
     */
    public static final int FIELD_COUNT = 10;

    /**
     * 传感器读数的列数
     */
    public static final int READING_COUNT = FIELD_COUNT - 1;

    @Getter
    private final int deviceId;

    private final double[] readings;

    public Row(int deviceId, double[] readings) {
        if (readings.length != READING_COUNT) {
            throw new IllegalArgumentException("读数个数必须为" + READING_COUNT + ", 实际为" + readings.length);
        }
        this.deviceId = deviceId;
        this.readings = readings.clone();
    }

    /**
     * 获取第 i 个传感器读数（从0开始）
     */
    public double getReading(int i) {
        return readings[i];
    }

    /**
     * 按列顺序返回绑定参数
     *
     * @return 长度为 {@link #FIELD_COUNT} 的参数数组
     */
    public Object[] toParameters() {
        Object[] params = new Object[FIELD_COUNT];
        params[0] = deviceId;
        for (int i = 0; i < READING_COUNT; i++) {
            params[i + 1] = readings[i];
        }
        return params;
    }

    @Override
    public String toString() {
        return "Row{deviceId=" + deviceId + ", readings=" + Arrays.toString(readings) + "}";
    }
}
