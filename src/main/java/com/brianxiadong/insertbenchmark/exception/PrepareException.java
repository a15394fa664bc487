package com.brianxiadong.insertbenchmark.exception;

/**
 * 预编译语句失败
 */
public class PrepareException extends BenchmarkException {

    public PrepareException(String message) {
        super(message);
    }

    public PrepareException(String message, Throwable cause) {
        super(message, cause);
    }
}
