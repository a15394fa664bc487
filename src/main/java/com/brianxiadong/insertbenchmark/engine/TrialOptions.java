package com.brianxiadong.insertbenchmark.engine;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import lombok.Getter;

import java.time.Duration;

/**
 * 单次试验的表准备选项
 */
@Getter
public final class TrialOptions {

    /**
     * 试验前删除并重建表
     */
    private final boolean drop;

    /**
     * 并行策略中每个任务使用单独的表
     */
    private final boolean separate;

    /**
     * 准备完成后、开始计时前的等待
     */
    private final Duration wait;

    public TrialOptions(boolean drop, boolean separate, Duration wait) {
        this.drop = drop;
        this.separate = separate;
        this.wait = wait == null ? Duration.ZERO : wait;
    }

    public static TrialOptions from(BenchmarkProperties properties) {
        return new TrialOptions(properties.isDrop(), properties.isSeparate(), properties.getWait());
    }

    public TrialOptions withDrop(boolean drop) {
        return new TrialOptions(drop, separate, wait);
    }
}
