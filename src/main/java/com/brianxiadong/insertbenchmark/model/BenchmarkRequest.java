package com.brianxiadong.insertbenchmark.model;

import lombok.Data;

/**
 * 基准测试请求参数
 * 为空的字段使用配置中的默认值
 */
@Data
public class BenchmarkRequest {

    /**
     * 测试名（BulkSeq、ManySeq、BulkPar、ManyPar），为空时依次运行全部策略
     */
    private String strategy;

    /**
     * 批次数
     */
    private Integer batchCount;

    /**
     * 批大小
     */
    private Integer batchSize;

    /**
     * 重复次数
     */
    private Integer repetitions;
}
