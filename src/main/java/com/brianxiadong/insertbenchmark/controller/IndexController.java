package com.brianxiadong.insertbenchmark.controller;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.driver.InsertDriver;
import com.brianxiadong.insertbenchmark.driver.InsertDriverFactory;
import com.brianxiadong.insertbenchmark.driver.JdbcInsertDriver;
import com.brianxiadong.insertbenchmark.model.DbCommand;
import com.brianxiadong.insertbenchmark.model.ParameterSet;
import com.brianxiadong.insertbenchmark.model.Strategy;
import com.brianxiadong.insertbenchmark.service.BenchmarkService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运行环境和可用测试的概览
 */
@RestController
@RequestMapping("/api")
public class IndexController {

    @Autowired
    private BenchmarkService benchmarkService;

    @Autowired
    private InsertDriverFactory driverFactory;

    @Autowired
    private BenchmarkProperties properties;

    @GetMapping("/index")
    public Map<String, Object> index() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("availableProcessors", Runtime.getRuntime().availableProcessors());
        response.put("maxMemoryMB", Runtime.getRuntime().maxMemory() / (1024 * 1024));

        InsertDriver driver = driverFactory.create(properties.getBatchSize());
        response.put("driverVersion", driver.driverName());
        if (driver instanceof JdbcInsertDriver) {
            response.put("databaseVersion", ((JdbcInsertDriver) driver).databaseVersion());
        }

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("schemaName", properties.getSchemaName());
        config.put("tableName", properties.getTableName());
        config.put("batchCount", properties.getBatchCount());
        config.put("batchSize", properties.getBatchSize());
        config.put("maxBulkSize", properties.getMaxBulkSize());
        config.put("drop", properties.isDrop());
        config.put("separate", properties.isSeparate());
        config.put("waitSeconds", properties.getWaitSeconds());
        config.put("repetitions", properties.getRepetitions());
        config.put("parameters", properties.getParameters());
        response.put("config", config);

        List<ParameterSet> groups = benchmarkService.getParameterSet().groupByTotalRows();
        response.put("parameterGroups", groups.stream().map(ParameterSet::format).collect(Collectors.toList()));
        response.put("tests", Arrays.stream(Strategy.values()).map(Strategy::getTestName).collect(Collectors.toList()));
        response.put("dbCommands", Arrays.stream(DbCommand.values()).map(DbCommand::getCommand).collect(Collectors.toList()));
        return response;
    }
}
