package com.brianxiadong.insertbenchmark.service;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.driver.InsertDriver;
import com.brianxiadong.insertbenchmark.driver.InsertDriverFactory;
import com.brianxiadong.insertbenchmark.engine.InsertEngine;
import com.brianxiadong.insertbenchmark.engine.TrialOptions;
import com.brianxiadong.insertbenchmark.engine.TrialRunner;
import com.brianxiadong.insertbenchmark.exception.TrialFailedException;
import com.brianxiadong.insertbenchmark.model.BenchmarkReport;
import com.brianxiadong.insertbenchmark.model.Parameter;
import com.brianxiadong.insertbenchmark.model.ParameterSet;
import com.brianxiadong.insertbenchmark.model.Strategy;
import com.brianxiadong.insertbenchmark.model.TrialResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 基准测试服务
 * 单次试验供交互调用，重复试验供基准测试循环使用
 */
@Slf4j
@Service
public class BenchmarkService {

    private final InsertEngine engine;
    private final TrialRunner trialRunner;
    private final InsertDriverFactory driverFactory;
    private final TableService tableService;
    private final BenchmarkProperties properties;
    private final ParameterSet parameterSet;

    public BenchmarkService(InsertEngine engine, TrialRunner trialRunner, InsertDriverFactory driverFactory,
                            TableService tableService, BenchmarkProperties properties, ParameterSet parameterSet) {
        this.engine = engine;
        this.trialRunner = trialRunner;
        this.driverFactory = driverFactory;
        this.tableService = tableService;
        this.properties = properties;
        this.parameterSet = parameterSet;
    }

    /**
     * 执行一次试验，使用配置中的 drop/separate/wait
     * 驱动的自动刷新阈值设为批大小
     */
    public TrialResult runTest(Strategy strategy, int batchCount, int batchSize) {
        return runTest(strategy, batchCount, batchSize, TrialOptions.from(properties));
    }

    public TrialResult runTest(Strategy strategy, int batchCount, int batchSize, TrialOptions options) {
        // 尽量让每次试验在相近的堆状态下开始
        System.gc();
        InsertDriver driver = driverFactory.create(batchSize);
        return engine.run(strategy, driver, batchCount, batchSize, options);
    }

    /**
     * 按固定顺序对每种策略执行重复试验
     * 每种策略开始前重建表，试验之间不删除数据
     */
    public List<BenchmarkReport> runBenchmark(Parameter parameter, int repetitions) {
        return runBenchmark(Arrays.asList(Strategy.values()), parameter, repetitions);
    }

    public List<BenchmarkReport> runBenchmark(List<Strategy> strategies, Parameter parameter, int repetitions) {
        List<BenchmarkReport> reports = new ArrayList<>();
        for (Strategy strategy : strategies) {
            reports.add(runStrategy(strategy, parameter, repetitions));
        }
        return reports;
    }

    /**
     * 对参数网格中的全部参数执行基准测试，按总行数分组顺序执行
     */
    public List<BenchmarkReport> runGrid(int repetitions) {
        List<BenchmarkReport> reports = new ArrayList<>();
        for (ParameterSet group : parameterSet.groupByTotalRows()) {
            log.info("开始参数组: {}", group);
            for (Parameter parameter : group.getParameters()) {
                reports.addAll(runBenchmark(parameter, repetitions));
            }
        }
        return reports;
    }

    private BenchmarkReport runStrategy(Strategy strategy, Parameter parameter, int repetitions) {
        BenchmarkReport report = new BenchmarkReport();
        report.setTest(strategy.getTestName());
        report.setBatchCount(parameter.getBatchCount());
        report.setBatchSize(parameter.getBatchSize());
        report.setRepetitions(repetitions);
        report.setBulkSize(properties.effectiveBulkSize(parameter.getBatchSize()));

        try {
            TrialOptions options = TrialOptions.from(properties);
            recreateTables(strategy, parameter, options);
            // 表已在本组开始前重建，组内试验不再删表
            TrialOptions trialOptions = options.withDrop(false);
            List<TrialResult> results = trialRunner.repeat(
                    () -> runTest(strategy, parameter.getBatchCount(), parameter.getBatchSize(), trialOptions),
                    repetitions);
            results.forEach(r -> report.getTrialSeconds().add(r.getSeconds()));
            report.setStatistics(TrialRunner.statistics(results));
        } catch (TrialFailedException e) {
            report.setErrorMessage(e.getMessage());
        } catch (DataAccessException e) {
            log.error("准备表失败", e);
            report.setErrorMessage(e.getMessage());
        }
        log.info("{}", report);
        return report;
    }

    private void recreateTables(Strategy strategy, Parameter parameter, TrialOptions options) {
        String schemaName = properties.getSchemaName();
        if (strategy.isParallel() && options.isSeparate()) {
            for (int i = 0; i < parameter.getBatchCount(); i++) {
                tableService.ensureTable(schemaName, engine.separateTableName(i), true);
            }
        } else {
            tableService.ensureTable(schemaName, properties.getTableName(), true);
        }
    }

    public Parameter defaultParameter() {
        return new Parameter(properties.getBatchCount(), properties.getBatchSize());
    }

    public ParameterSet getParameterSet() {
        return parameterSet;
    }
}
