package com.brianxiadong.insertbenchmark.exception;

/**
 * 基准测试异常基类
 */
public class BenchmarkException extends RuntimeException {

    public BenchmarkException(String message) {
        super(message);
    }

    public BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
