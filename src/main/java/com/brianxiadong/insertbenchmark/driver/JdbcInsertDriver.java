package com.brianxiadong.insertbenchmark.driver;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * 基于 JDBC 的写入驱动
 * 批量模式使用 addBatch/executeBatch 实现缓冲和自动刷新
 */
@Slf4j
public class JdbcInsertDriver implements InsertDriver {

    private final DataSource dataSource;
    private final int bulkSize;

    /**
     * @param dataSource 不带连接池的数据源，每次取连接都会建立新的物理连接
     * @param bulkSize   自动刷新阈值
     */
    public JdbcInsertDriver(DataSource dataSource, int bulkSize) {
        if (bulkSize <= 0) {
            throw new IllegalArgumentException("bulkSize必须大于0: " + bulkSize);
        }
        this.dataSource = dataSource;
        this.bulkSize = bulkSize;
    }

    @Override
    public InsertConnection openConnection() throws SQLException {
        return new JdbcInsertConnection(dataSource.getConnection(), bulkSize);
    }

    @Override
    public int bulkSize() {
        return bulkSize;
    }

    @Override
    public String driverName() {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            return md.getDriverName() + " " + md.getDriverVersion();
        } catch (SQLException e) {
            log.warn("获取驱动版本失败: {}", e.getMessage());
            return e.getMessage();
        }
    }

    /**
     * 读取数据库产品及版本
     */
    public String databaseVersion() {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            return md.getDatabaseProductName() + " " + md.getDatabaseProductVersion();
        } catch (SQLException e) {
            log.warn("获取数据库版本失败: {}", e.getMessage());
            return e.getMessage();
        }
    }
}
