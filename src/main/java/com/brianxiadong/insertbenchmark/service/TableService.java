package com.brianxiadong.insertbenchmark.service;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;

/**
 * 表和 schema 的生命周期管理
 * 大表不使用 delete 清空（目标库删除上百万行时可能内存溢出），重置只通过删表重建完成
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableService {

    public static final String COLUMNS = "DEVICEID INTEGER, TEMPERATUR DOUBLE, HUMIDITY DOUBLE, CO2 DOUBLE, CO DOUBLE, "
            + "LPG DOUBLE, SMOKE DOUBLE, PRESENCE DOUBLE, LIGHT DOUBLE, SOUND DOUBLE";

    private final JdbcTemplate jdbcTemplate;
    private final BenchmarkProperties properties;

    /**
     * 给标识符加双引号
     */
    public static String identifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    public static String qualifiedName(String schemaName, String tableName) {
        return identifier(schemaName) + "." + identifier(tableName);
    }

    /**
     * 插入语句，10个占位符
     */
    public static String insertQuery(String schemaName, String tableName) {
        return "insert into " + qualifiedName(schemaName, tableName) + " values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    }

    public boolean tableExists(String schemaName, String tableName) {
        Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) conn -> {
            // 名称里的 '_' 在元数据查询中是通配符，需要逐行比较
            try (ResultSet rs = conn.getMetaData().getTables(null, schemaName, tableName, null)) {
                while (rs.next()) {
                    if (schemaName.equals(rs.getString("TABLE_SCHEM")) && tableName.equals(rs.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
                return false;
            }
        });
        return Boolean.TRUE.equals(exists);
    }

    public void createTable(String schemaName, String tableName) {
        String tableType = properties.isColumnTable() ? "create column table " : "create table ";
        jdbcTemplate.execute(tableType + qualifiedName(schemaName, tableName) + " (" + COLUMNS + ")");
        log.info("已创建表 {}.{}", schemaName, tableName);
    }

    public void dropTable(String schemaName, String tableName) {
        jdbcTemplate.execute("drop table " + qualifiedName(schemaName, tableName));
        log.info("已删除表 {}.{}", schemaName, tableName);
    }

    /**
     * 确保表存在：不存在则创建；存在且 forceRecreate 时删除后重建；否则不做任何操作
     */
    public void ensureTable(String schemaName, String tableName, boolean forceRecreate) {
        boolean exists = tableExists(schemaName, tableName);
        if (exists && forceRecreate) {
            dropTable(schemaName, tableName);
            createTable(schemaName, tableName);
        } else if (!exists) {
            createTable(schemaName, tableName);
        }
    }

    public void createSchema(String schemaName) {
        jdbcTemplate.execute("create schema " + identifier(schemaName));
        log.info("已创建schema {}", schemaName);
    }

    /**
     * 删除 schema，schema 非空时由数据库报错
     */
    public void dropSchema(String schemaName) {
        jdbcTemplate.execute("drop schema " + identifier(schemaName));
        log.info("已删除schema {}", schemaName);
    }

    public long countRows(String schemaName, String tableName) {
        Long count = jdbcTemplate.queryForObject("select count(*) from " + qualifiedName(schemaName, tableName), Long.class);
        return count == null ? 0 : count;
    }

    /**
     * 删除表中所有行，只作为命令提供，基准测试过程中不调用
     */
    public long deleteRows(String schemaName, String tableName) {
        return jdbcTemplate.update("delete from " + qualifiedName(schemaName, tableName));
    }
}
