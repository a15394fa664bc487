package com.brianxiadong.insertbenchmark.controller;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.model.Strategy;
import com.brianxiadong.insertbenchmark.model.TrialResult;
import com.brianxiadong.insertbenchmark.service.BenchmarkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * 单次试验控制器
 * 例如 GET /test/BulkPar?batchcount=10&batchsize=10000
 */
@Slf4j
@RestController
@RequestMapping("/test")
public class TestController {

    @Autowired
    private BenchmarkService benchmarkService;

    @Autowired
    private BenchmarkProperties properties;

    /**
     * 执行一次试验
     *
     * @param test       测试名：BulkSeq、ManySeq、BulkPar、ManyPar
     * @param batchCount 批次数，为空时使用配置值
     * @param batchSize  批大小，为空时使用配置值
     * @return 试验结果，失败时包含错误信息和截至失败的耗时
     */
    @GetMapping("/{test}")
    public TrialResult runTest(@PathVariable("test") String test,
                               @RequestParam(value = "batchcount", required = false) String batchCount,
                               @RequestParam(value = "batchsize", required = false) String batchSize) {
        log.info("收到试验请求: test={}, batchcount={}, batchsize={}", test, batchCount, batchSize);

        int count = toInt(batchCount, properties.getBatchCount());
        int size = toInt(batchSize, properties.getBatchSize());

        Optional<Strategy> strategy = Strategy.fromTestName(test);
        if (strategy.isEmpty()) {
            TrialResult errorResult = new TrialResult(test, count, size);
            errorResult.setErrorMessage("无效的测试: " + test);
            return errorResult;
        }

        return benchmarkService.runTest(strategy.get(), count, size);
    }

    // 为空或无法转换时返回默认值
    private static int toInt(String s, int defaultValue) {
        if (s == null || s.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            log.warn("整数转换失败 {}: {}", s, e.getMessage());
            return defaultValue;
        }
    }
}
