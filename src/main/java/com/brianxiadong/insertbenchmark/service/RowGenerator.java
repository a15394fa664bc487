package com.brianxiadong.insertbenchmark.service;

import com.brianxiadong.insertbenchmark.model.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * 测试数据生成器
 * 每行由其全局序号唯一确定：设备ID为序号，读数用以序号为种子的随机数在固定区间内生成。
 * 无状态，可被多个线程同时调用
 */
public class RowGenerator {

    // 各读数列的取值区间 [min, max)：TEMPERATUR, HUMIDITY, CO2, CO, LPG, SMOKE, PRESENCE, LIGHT, SOUND
    private static final double[][] RANGES = {
            {25, 26},
            {40, 60},
            {500, 600},
            {0.9, 1.1},
            {23, 25},
            {50, 60},
            {0, 1},
            {600, 800},
            {400, 500},
    };

    /**
     * 生成序号为 index 的行
     */
    public Row row(int index) {
        SplittableRandom random = new SplittableRandom(index);
        double[] readings = new double[Row.READING_COUNT];
        for (int i = 0; i < readings.length; i++) {
            readings[i] = random.nextDouble(RANGES[i][0], RANGES[i][1]);
        }
        return new Row(index, readings);
    }

    /**
     * 生成第 blockIndex 块的 size 行，序号为 [blockIndex*size, (blockIndex+1)*size)
     */
    public List<Row> rows(int blockIndex, int size) {
        List<Row> rows = new ArrayList<>(size);
        int first = blockIndex * size;
        for (int j = 0; j < size; j++) {
            rows.add(row(first + j));
        }
        return rows;
    }

    /**
     * 读数列 i 的下界（含）
     */
    public static double minOf(int i) {
        return RANGES[i][0];
    }

    /**
     * 读数列 i 的上界（不含）
     */
    public static double maxOf(int i) {
        return RANGES[i][1];
    }
}
