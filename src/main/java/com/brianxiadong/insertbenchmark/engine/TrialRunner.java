package com.brianxiadong.insertbenchmark.engine;

import com.brianxiadong.insertbenchmark.exception.TrialFailedException;
import com.brianxiadong.insertbenchmark.model.AggregateStatistics;
import com.brianxiadong.insertbenchmark.model.TrialResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 重复执行同一试验并汇总统计
 * 任何一次失败都会终止整组试验，失败样本不会被静默剔除
 */
@Slf4j
public class TrialRunner {

    /**
     * 重复执行试验
     *
     * @return 按执行顺序的全部结果
     * @throws TrialFailedException 某次试验返回错误时
     */
    public List<TrialResult> repeat(Supplier<TrialResult> trial, int repetitions) {
        if (repetitions <= 0) {
            throw new IllegalArgumentException("重复次数必须大于0: " + repetitions);
        }
        List<TrialResult> results = new ArrayList<>(repetitions);
        for (int i = 0; i < repetitions; i++) {
            TrialResult result = trial.get();
            if (!result.isSuccess()) {
                log.error("第{}次试验失败: {}", i + 1, result.getErrorMessage());
                throw new TrialFailedException(i, result);
            }
            results.add(result);
        }
        return results;
    }

    /**
     * 重复执行试验并计算平均值、最小值、最大值和中位数
     *
     * @throws TrialFailedException 某次试验返回错误时
     */
    public AggregateStatistics runTrials(Supplier<TrialResult> trial, int repetitions) {
        return statistics(repeat(trial, repetitions));
    }

    public static AggregateStatistics statistics(List<TrialResult> results) {
        List<Duration> durations = results.stream()
                .map(TrialResult::getDuration)
                .collect(Collectors.toList());
        return AggregateStatistics.of(durations);
    }
}
