package com.brianxiadong.insertbenchmark.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 多次重复试验耗时的统计值：平均值、最小值、最大值、中位数
 */
@Getter
public final class AggregateStatistics {

    private static final Duration MAX_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private final int count;

    @JsonIgnore
    private final Duration mean;

    @JsonIgnore
    private final Duration min;

    @JsonIgnore
    private final Duration max;

    @JsonIgnore
    private final Duration median;

    private AggregateStatistics(int count, Duration mean, Duration min, Duration max, Duration median) {
        this.count = count;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.median = median;
    }

    /**
     * 根据一组耗时计算统计值
     *
     * @param durations 同参数重复试验的耗时
     * @return 统计结果；空输入时各项为0（最小值除外，保持初始最大值）
     */
    public static AggregateStatistics of(List<Duration> durations) {
        Duration sum = Duration.ZERO;
        Duration min = MAX_DURATION;
        Duration max = Duration.ZERO;
        for (Duration d : durations) {
            sum = sum.plus(d);
            if (d.compareTo(min) < 0) {
                min = d;
            }
            if (d.compareTo(max) > 0) {
                max = d;
            }
        }
        Duration mean = durations.isEmpty() ? Duration.ZERO : sum.dividedBy(durations.size());
        return new AggregateStatistics(durations.size(), mean, min, max, median(durations));
    }

    /**
     * 中位数：奇数个取中间值，偶数个取中间两个的平均值，空列表为0
     */
    public static Duration median(List<Duration> durations) {
        List<Duration> sorted = new ArrayList<>(durations);
        Collections.sort(sorted);
        int l = sorted.size();
        if (l == 0) {
            return Duration.ZERO;
        }
        if (l % 2 != 0) {
            return sorted.get(l / 2);
        }
        return sorted.get(l / 2).plus(sorted.get(l / 2 - 1)).dividedBy(2);
    }

    public double getMeanSeconds() {
        return toSeconds(mean);
    }

    public double getMinSeconds() {
        return toSeconds(min);
    }

    public double getMaxSeconds() {
        return toSeconds(max);
    }

    public double getMedianSeconds() {
        return toSeconds(median);
    }

    private static double toSeconds(Duration d) {
        return d.getSeconds() + d.getNano() / 1e9;
    }

    @Override
    public String toString() {
        return String.format("avg %.6fs min %.6fs max %.6fs med %.6fs (n=%d)",
                getMeanSeconds(), getMinSeconds(), getMaxSeconds(), getMedianSeconds(), count);
    }
}
