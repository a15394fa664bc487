package com.brianxiadong.insertbenchmark.exception;

/**
 * 写入数据时执行语句失败
 */
public class InsertExecutionException extends BenchmarkException {

    public InsertExecutionException(String message) {
        super(message);
    }

    public InsertExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
