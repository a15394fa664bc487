package com.brianxiadong.insertbenchmark.driver;

import com.brianxiadong.insertbenchmark.model.Row;

import java.sql.SQLException;
import java.util.List;

/**
 * 预编译的插入语句
 */
public interface InsertStatement extends AutoCloseable {

    /**
     * 绑定并执行一行
     * 批量模式下只写入缓冲区，缓冲行数达到 bulkSize 时自动刷新
     */
    void exec(Row row) throws SQLException;

    /**
     * 刷新缓冲区中尚未提交的行，非批量模式下为空操作
     */
    void flush() throws SQLException;

    /**
     * 一次调用提交整组行
     */
    void execMany(List<Row> rows) throws SQLException;

    @Override
    void close() throws SQLException;
}
