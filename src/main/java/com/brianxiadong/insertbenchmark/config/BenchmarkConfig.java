package com.brianxiadong.insertbenchmark.config;

import com.brianxiadong.insertbenchmark.driver.InsertDriverFactory;
import com.brianxiadong.insertbenchmark.driver.JdbcInsertDriverFactory;
import com.brianxiadong.insertbenchmark.engine.InsertEngine;
import com.brianxiadong.insertbenchmark.engine.TrialRunner;
import com.brianxiadong.insertbenchmark.model.ParameterSet;
import com.brianxiadong.insertbenchmark.service.RowGenerator;
import com.brianxiadong.insertbenchmark.service.TableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 基准测试组件装配
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BenchmarkProperties.class)
public class BenchmarkConfig {

    @Bean
    public ParameterSet parameterSet(BenchmarkProperties properties) {
        properties.validate();
        ParameterSet parameterSet = properties.parameterSet();
        log.info("参数网格: {}", parameterSet);
        return parameterSet;
    }

    @Bean
    public InsertDriverFactory insertDriverFactory(DataSourceProperties dataSourceProperties,
                                                   BenchmarkProperties properties) {
        return new JdbcInsertDriverFactory(dataSourceProperties, properties);
    }

    @Bean
    public RowGenerator rowGenerator() {
        return new RowGenerator();
    }

    @Bean
    public InsertEngine insertEngine(TableService tableService, RowGenerator rowGenerator,
                                     BenchmarkProperties properties) {
        return new InsertEngine(tableService, rowGenerator, properties);
    }

    @Bean
    public TrialRunner trialRunner() {
        return new TrialRunner();
    }
}
