package com.brianxiadong.insertbenchmark.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一种策略在一组参数下重复试验的汇总报告
 */
@Data
public class BenchmarkReport {

    private String test;

    private int batchCount;

    private int batchSize;

    private int bulkSize;

    private int repetitions;

    /**
     * 每次试验的耗时（秒），按执行顺序
     */
    private List<Double> trialSeconds = new ArrayList<>();

    /**
     * 统计值，试验失败时为空
     */
    private AggregateStatistics statistics;

    /**
     * 错误信息，成功时为空
     */
    private String errorMessage;

    @Override
    public String toString() {
        if (errorMessage != null) {
            return String.format("%s %dx%d: %s", test, batchCount, batchSize, errorMessage);
        }
        return String.format("%s %dx%d: %s", test, batchCount, batchSize, statistics);
    }
}
