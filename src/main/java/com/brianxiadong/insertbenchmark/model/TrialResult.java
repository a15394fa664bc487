package com.brianxiadong.insertbenchmark.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.Duration;

/**
 * 单次试验结果
 */
@Data
public class TrialResult {

    /**
     * 测试名，例如 BulkSeq
     */
    private String test;

    private int batchCount;

    private int batchSize;

    /**
     * 驱动实际使用的自动刷新阈值
     */
    private int bulkSize;

    /**
     * 纯执行耗时（纳秒）
     */
    private long durationNanos;

    /**
     * 纯执行耗时（秒）
     */
    private double seconds;

    /**
     * 错误信息，成功时为空
     */
    private String errorMessage;

    public TrialResult() {
    }

    public TrialResult(String test, int batchCount, int batchSize) {
        this.test = test;
        this.batchCount = batchCount;
        this.batchSize = batchSize;
    }

    @JsonIgnore
    public Duration getDuration() {
        return Duration.ofNanos(durationNanos);
    }

    public void setDuration(Duration duration) {
        this.durationNanos = duration.toNanos();
        this.seconds = durationNanos / 1e9;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return errorMessage == null || errorMessage.isEmpty();
    }

    public long totalRows() {
        return (long) batchCount * batchSize;
    }

    @Override
    public String toString() {
        if (!isSuccess()) {
            return test + ": " + errorMessage;
        }
        return String.format("%s: insert of %d rows in %f seconds (batchCount %d batchSize %d bulkSize %d)",
                test, totalRows(), seconds, batchCount, batchSize, bulkSize);
    }
}
