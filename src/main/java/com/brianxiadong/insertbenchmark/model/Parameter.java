package com.brianxiadong.insertbenchmark.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 测试参数：批次数 x 批大小
 */
@Getter
@EqualsAndHashCode
public final class Parameter {

    /**
     * 并行任务数（或顺序执行的迭代次数）
     */
    private final int batchCount;

    /**
     * 每个任务/迭代的行数
     */
    private final int batchSize;

    public Parameter(int batchCount, int batchSize) {
        this.batchCount = batchCount;
        this.batchSize = batchSize;
    }

    public long totalRows() {
        return (long) batchCount * batchSize;
    }

    @Override
    public String toString() {
        return batchCount + "x" + batchSize;
    }
}
