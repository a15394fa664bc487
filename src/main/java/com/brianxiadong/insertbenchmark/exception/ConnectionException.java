package com.brianxiadong.insertbenchmark.exception;

/**
 * 获取数据库连接失败
 */
public class ConnectionException extends BenchmarkException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
