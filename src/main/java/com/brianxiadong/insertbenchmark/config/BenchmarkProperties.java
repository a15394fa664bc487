package com.brianxiadong.insertbenchmark.config;

import com.brianxiadong.insertbenchmark.exception.ConfigurationException;
import com.brianxiadong.insertbenchmark.model.ParameterSet;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 基准测试配置
 * 启动时绑定一次，通过构造函数注入各组件。环境变量可覆盖，例如 BENCHMARK_BATCHCOUNT=100
 */
@ConfigurationProperties(prefix = "benchmark")
@Getter
@Setter
public class BenchmarkProperties {

    public static final String DEFAULT_PARAMETERS = "1x100000 10x10000 100x1000 1x1000000 10x100000 100x10000 1000x1000";

    private String schemaName = "PUBLIC";

    private String tableName = "GOMESSAGE";

    /**
     * 未指定时的批次数
     */
    private int batchCount = 10;

    /**
     * 未指定时的批大小
     */
    private int batchSize = 10000;

    /**
     * 驱动自动刷新阈值上限
     */
    private int maxBulkSize = 100000;

    /**
     * 测试前删除并重建表
     */
    private boolean drop = false;

    /**
     * 并行测试时每个任务使用单独的表
     */
    private boolean separate = false;

    /**
     * 准备完成后、开始计时前的等待时间（秒）
     */
    private int waitSeconds = 0;

    /**
     * 基准测试中每种策略的重复次数
     */
    private int repetitions = 5;

    /**
     * 建表时使用 "create column table"（列存数据库）
     */
    private boolean columnTable = false;

    /**
     * 参数网格
     */
    private String parameters = DEFAULT_PARAMETERS;

    /**
     * 校验配置，非法时抛出 {@link ConfigurationException}
     */
    public void validate() {
        requirePositive("batchCount", batchCount);
        requirePositive("batchSize", batchSize);
        requirePositive("maxBulkSize", maxBulkSize);
        requirePositive("repetitions", repetitions);
        if (waitSeconds < 0) {
            throw new ConfigurationException("waitSeconds不能为负数: " + waitSeconds);
        }
        if (schemaName == null || schemaName.isBlank()) {
            throw new ConfigurationException("schemaName不能为空");
        }
        if (tableName == null || tableName.isBlank()) {
            throw new ConfigurationException("tableName不能为空");
        }
        parameterSet();
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + "必须大于0: " + value);
        }
    }

    public ParameterSet parameterSet() {
        return ParameterSet.parse(parameters);
    }

    public Duration getWait() {
        return Duration.ofSeconds(waitSeconds);
    }

    /**
     * 驱动实际使用的自动刷新阈值，限制在 [1, maxBulkSize]
     */
    public int effectiveBulkSize(int requested) {
        return Math.min(Math.max(requested, 1), maxBulkSize);
    }
}
