package com.brianxiadong.insertbenchmark.exception;

/**
 * 配置错误：参数网格格式不正确、整数配置非法等
 */
public class ConfigurationException extends BenchmarkException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
