package com.brianxiadong.insertbenchmark.model;

import java.time.Duration;
import java.util.Optional;

/**
 * 策略执行结果：纯执行耗时 + 可选错误
 * 失败时耗时仍为截至失败时累计的值
 */
public final class InsertOutcome {

    private final Duration elapsed;
    private final Exception error;

    private InsertOutcome(Duration elapsed, Exception error) {
        this.elapsed = elapsed;
        this.error = error;
    }

    public static InsertOutcome success(Duration elapsed) {
        return new InsertOutcome(elapsed, null);
    }

    public static InsertOutcome failure(Duration elapsed, Exception error) {
        return new InsertOutcome(elapsed, error);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
