package com.brianxiadong.insertbenchmark.driver;

import com.brianxiadong.insertbenchmark.model.Row;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * JDBC 预编译语句的包装
 * 非线程安全，只能由持有它的任务使用
 */
class JdbcInsertStatement implements InsertStatement {

    private final PreparedStatement statement;
    private final boolean bulk;
    private final int bulkSize;

    // 缓冲区中尚未提交的行数
    private int pending;

    JdbcInsertStatement(PreparedStatement statement, boolean bulk, int bulkSize) {
        this.statement = statement;
        this.bulk = bulk;
        this.bulkSize = bulkSize;
    }

    @Override
    public void exec(Row row) throws SQLException {
        bind(row);
        if (!bulk) {
            statement.executeUpdate();
            return;
        }
        statement.addBatch();
        pending++;
        if (pending >= bulkSize) {
            flush();
        }
    }

    @Override
    public void flush() throws SQLException {
        if (pending == 0) {
            return;
        }
        try {
            statement.executeBatch();
        } finally {
            // 失败后不再重复提交缓冲区中的行
            statement.clearBatch();
            pending = 0;
        }
    }

    @Override
    public void execMany(List<Row> rows) throws SQLException {
        if (rows.isEmpty()) {
            return;
        }
        for (Row row : rows) {
            bind(row);
            statement.addBatch();
        }
        try {
            statement.executeBatch();
        } finally {
            statement.clearBatch();
        }
    }

    private void bind(Row row) throws SQLException {
        statement.setInt(1, row.getDeviceId());
        for (int i = 0; i < Row.READING_COUNT; i++) {
            statement.setDouble(i + 2, row.getReading(i));
        }
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}
