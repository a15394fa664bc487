package com.brianxiadong.insertbenchmark.driver;

import java.sql.SQLException;

/**
 * 驱动连接
 */
public interface InsertConnection extends AutoCloseable {

    /**
     * 预编译插入语句
     *
     * @param query 插入语句，10个占位符
     * @param bulk  是否为批量（缓冲）模式
     */
    InsertStatement prepare(String query, boolean bulk) throws SQLException;

    @Override
    void close() throws SQLException;
}
