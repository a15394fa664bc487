package com.brianxiadong.insertbenchmark.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 四种插入策略，声明顺序即报告顺序
 */
public enum Strategy {

    /**
     * 单连接，逐行写入驱动缓冲区，按批量大小自动刷新
     */
    BULK_SEQ("BulkSeq", true, false),

    /**
     * 单连接，每次迭代一次性提交 batchSize 行
     */
    MANY_SEQ("ManySeq", false, false),

    /**
     * 每个任务一个连接，逐行写入缓冲区，所有任务并行
     */
    BULK_PAR("BulkPar", true, true),

    /**
     * 每个任务一个连接，一次性提交整批行，所有任务并行
     */
    MANY_PAR("ManyPar", false, true);

    private final String testName;
    private final boolean bulk;
    private final boolean parallel;

    Strategy(String testName, boolean bulk, boolean parallel) {
        this.testName = testName;
        this.bulk = bulk;
        this.parallel = parallel;
    }

    public String getTestName() {
        return testName;
    }

    public boolean isBulk() {
        return bulk;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * 按测试名（如 "BulkSeq"）查找策略，忽略大小写
     */
    public static Optional<Strategy> fromTestName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.testName.equalsIgnoreCase(name))
                .findFirst();
    }
}
