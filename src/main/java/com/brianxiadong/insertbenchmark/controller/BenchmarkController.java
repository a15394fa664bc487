package com.brianxiadong.insertbenchmark.controller;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.model.BenchmarkReport;
import com.brianxiadong.insertbenchmark.model.BenchmarkRequest;
import com.brianxiadong.insertbenchmark.model.Parameter;
import com.brianxiadong.insertbenchmark.model.Strategy;
import com.brianxiadong.insertbenchmark.service.BenchmarkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基准测试控制器
 * 对策略做重复试验并返回统计值
 */
@RestController
@RequestMapping("/api/benchmark")
public class BenchmarkController {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkController.class);

    @Autowired
    private BenchmarkService benchmarkService;

    @Autowired
    private BenchmarkProperties properties;

    /**
     * 运行基准测试
     *
     * @param request 测试参数，策略为空时依次运行全部策略
     * @return 每种策略一条报告
     */
    @PostMapping("/run")
    public List<BenchmarkReport> runBenchmark(@RequestBody BenchmarkRequest request) {
        log.info("收到基准测试请求: {}", request);

        // 设置默认值
        if (request.getBatchCount() == null || request.getBatchCount() <= 0) {
            request.setBatchCount(properties.getBatchCount());
        }

        if (request.getBatchSize() == null || request.getBatchSize() <= 0) {
            request.setBatchSize(properties.getBatchSize());
        }

        if (request.getRepetitions() == null || request.getRepetitions() <= 0) {
            request.setRepetitions(properties.getRepetitions());
        }

        Parameter parameter = new Parameter(request.getBatchCount(), request.getBatchSize());

        if (request.getStrategy() == null || request.getStrategy().trim().isEmpty()) {
            return benchmarkService.runBenchmark(Arrays.asList(Strategy.values()), parameter, request.getRepetitions());
        }

        Optional<Strategy> strategy = Strategy.fromTestName(request.getStrategy().trim());
        if (strategy.isEmpty()) {
            BenchmarkReport errorReport = new BenchmarkReport();
            errorReport.setTest(request.getStrategy());
            errorReport.setBatchCount(parameter.getBatchCount());
            errorReport.setBatchSize(parameter.getBatchSize());
            errorReport.setErrorMessage("无效的测试: " + request.getStrategy());
            return Collections.singletonList(errorReport);
        }

        return benchmarkService.runBenchmark(Collections.singletonList(strategy.get()), parameter,
                request.getRepetitions());
    }

    /**
     * 对配置的参数网格运行全部策略
     *
     * @param repetitions 重复次数，为空时使用配置值
     */
    @PostMapping("/grid")
    public List<BenchmarkReport> runGrid(@RequestParam(value = "repetitions", required = false) Integer repetitions) {
        log.info("收到参数网格测试请求: repetitions={}", repetitions);
        int n = repetitions == null || repetitions <= 0 ? properties.getRepetitions() : repetitions;
        return benchmarkService.runGrid(n);
    }
}
