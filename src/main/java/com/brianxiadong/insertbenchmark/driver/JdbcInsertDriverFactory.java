package com.brianxiadong.insertbenchmark.driver;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * 使用 spring.datasource.* 配置创建不带连接池的 JDBC 驱动
 * 并行任务各自持有一个物理连接，不受连接池大小限制
 */
public class JdbcInsertDriverFactory implements InsertDriverFactory {

    private final DataSourceProperties dataSourceProperties;
    private final BenchmarkProperties properties;

    public JdbcInsertDriverFactory(DataSourceProperties dataSourceProperties, BenchmarkProperties properties) {
        this.dataSourceProperties = dataSourceProperties;
        this.properties = properties;
    }

    @Override
    public JdbcInsertDriver create(int requestedBulkSize) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                dataSourceProperties.determineUrl(),
                dataSourceProperties.determineUsername(),
                dataSourceProperties.determinePassword());
        String driverClassName = dataSourceProperties.determineDriverClassName();
        if (driverClassName != null) {
            dataSource.setDriverClassName(driverClassName);
        }
        return new JdbcInsertDriver(dataSource, properties.effectiveBulkSize(requestedBulkSize));
    }
}
