package com.brianxiadong.insertbenchmark.engine;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.driver.InsertDriver;
import com.brianxiadong.insertbenchmark.driver.InsertStatement;
import com.brianxiadong.insertbenchmark.exception.BenchmarkException;
import com.brianxiadong.insertbenchmark.exception.ConfigurationException;
import com.brianxiadong.insertbenchmark.exception.InsertExecutionException;
import com.brianxiadong.insertbenchmark.model.InsertOutcome;
import com.brianxiadong.insertbenchmark.model.Row;
import com.brianxiadong.insertbenchmark.model.Strategy;
import com.brianxiadong.insertbenchmark.model.TrialResult;
import com.brianxiadong.insertbenchmark.service.RowGenerator;
import com.brianxiadong.insertbenchmark.service.TableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 插入策略执行引擎
 * 只统计语句执行调用内的耗时（纯执行耗时），连接获取、语句预编译、数据生成和资源释放不计时
 */
@Slf4j
public class InsertEngine {

    private static final long WORKER_TERMINATION_TIMEOUT_SECONDS = 30;

    private final TableService tableService;
    private final RowGenerator rowGenerator;
    private final String schemaName;
    private final String tableName;

    public InsertEngine(TableService tableService, RowGenerator rowGenerator, BenchmarkProperties properties) {
        this.tableService = tableService;
        this.rowGenerator = rowGenerator;
        this.schemaName = properties.getSchemaName();
        this.tableName = properties.getTableName();
    }

    /**
     * 执行一次试验
     * 失败不会抛出异常，错误信息和截至失败时的耗时一起放在结果中
     */
    public TrialResult run(Strategy strategy, InsertDriver driver, int batchCount, int batchSize, TrialOptions options) {
        TrialResult result = new TrialResult(strategy.getTestName(), batchCount, batchSize);
        result.setBulkSize(driver.bulkSize());

        InsertOutcome outcome;
        try {
            checkParameters(batchCount, batchSize);
            outcome = execute(strategy, driver, batchCount, batchSize, options);
        } catch (BenchmarkException | DataAccessException e) {
            outcome = InsertOutcome.failure(Duration.ZERO, e);
        }

        result.setDuration(outcome.getElapsed());
        outcome.getError().ifPresent(e -> result.setErrorMessage(errorMessage(e)));
        log.info("{}", result);
        return result;
    }

    /**
     * 按策略分派，返回纯执行耗时
     */
    public InsertOutcome execute(Strategy strategy, InsertDriver driver, int batchCount, int batchSize,
                                 TrialOptions options) {
        switch (strategy) {
            case BULK_SEQ:
                return bulkSequential(driver, batchCount, batchSize, options);
            case MANY_SEQ:
                return manySequential(driver, batchCount, batchSize, options);
            case BULK_PAR:
                return bulkParallel(driver, batchCount, batchSize, options);
            case MANY_PAR:
                return manyParallel(driver, batchCount, batchSize, options);
            default:
                throw new IllegalStateException("未知策略: " + strategy);
        }
    }

    /**
     * 单连接逐行写入，驱动按 bulkSize 自动刷新，循环结束后再刷新一次
     */
    public InsertOutcome bulkSequential(InsertDriver driver, int batchCount, int batchSize, TrialOptions options) {
        int numRow = batchCount * batchSize;
        prepareTable(tableName, options);
        waitBeforeStart(options.getWait());

        try (Task task = Task.create(driver, TableService.insertQuery(schemaName, tableName), true, rowGenerator, 0, 0)) {
            InsertStatement stmt = task.getStatement();
            long d = 0;

            for (int i = 0; i < numRow; i++) {
                Row row = rowGenerator.row(i);
                long t = System.nanoTime();
                try {
                    stmt.exec(row);
                } catch (SQLException e) {
                    return InsertOutcome.failure(Duration.ofNanos(d), new InsertExecutionException(e.getMessage(), e));
                }
                d += System.nanoTime() - t;
            }

            long t = System.nanoTime();
            try {
                stmt.flush();
            } catch (SQLException e) {
                return InsertOutcome.failure(Duration.ofNanos(d), new InsertExecutionException(e.getMessage(), e));
            }
            d += System.nanoTime() - t;

            return InsertOutcome.success(Duration.ofNanos(d));
        }
    }

    /**
     * 单连接，每次迭代一次调用提交 batchSize 行
     */
    public InsertOutcome manySequential(InsertDriver driver, int batchCount, int batchSize, TrialOptions options) {
        prepareTable(tableName, options);
        waitBeforeStart(options.getWait());

        try (Task task = Task.create(driver, TableService.insertQuery(schemaName, tableName), false, rowGenerator, 0, 0)) {
            InsertStatement stmt = task.getStatement();
            long d = 0;

            for (int i = 0; i < batchCount; i++) {
                List<Row> rows = rowGenerator.rows(i, batchSize);
                long t = System.nanoTime();
                try {
                    stmt.execMany(rows);
                } catch (SQLException e) {
                    return InsertOutcome.failure(Duration.ofNanos(d), new InsertExecutionException(e.getMessage(), e));
                }
                d += System.nanoTime() - t;
            }

            return InsertOutcome.success(Duration.ofNanos(d));
        }
    }

    /**
     * 每个任务一个工作线程，逐行写入后刷新，计时为从启动全部线程到全部汇合的墙钟时间
     */
    public InsertOutcome bulkParallel(InsertDriver driver, int batchCount, int batchSize, TrialOptions options) {
        return runParallel(driver, batchCount, batchSize, true, options, task -> {
            InsertStatement stmt = task.getStatement();
            for (Row row : task.getRows()) {
                try {
                    stmt.exec(row);
                } catch (SQLException e) {
                    task.setError(new InsertExecutionException(e.getMessage(), e));
                }
            }
            try {
                stmt.flush();
            } catch (SQLException e) {
                task.setError(new InsertExecutionException(e.getMessage(), e));
            }
        });
    }

    /**
     * 每个任务一个工作线程，一次调用提交整组行，计时方式同 {@link #bulkParallel}
     */
    public InsertOutcome manyParallel(InsertDriver driver, int batchCount, int batchSize, TrialOptions options) {
        return runParallel(driver, batchCount, batchSize, false, options, task -> {
            try {
                task.getStatement().execMany(task.getRows());
            } catch (SQLException e) {
                task.setError(new InsertExecutionException(e.getMessage(), e));
            }
        });
    }

    @FunctionalInterface
    private interface Worker {
        void work(Task task);
    }

    private InsertOutcome runParallel(InsertDriver driver, int batchCount, int batchSize, boolean bulk,
                                      TrialOptions options, Worker worker) {
        if (!options.isSeparate()) {
            prepareTable(tableName, options);
        }

        List<Task> tasks = Task.createAll(driver, i -> {
            String name = tableName;
            if (options.isSeparate()) {
                name = separateTableName(i);
                prepareTable(name, options);
            }
            return TableService.insertQuery(schemaName, name);
        }, bulk, rowGenerator, batchCount, batchSize);

        ExecutorService executor = null;
        long start = System.nanoTime();
        try {
            waitBeforeStart(options.getWait());

            executor = Executors.newFixedThreadPool(batchCount);
            CountDownLatch latch = new CountDownLatch(batchCount);

            start = System.nanoTime();
            for (Task task : tasks) {
                executor.submit(() -> {
                    try {
                        worker.work(task);
                    } catch (RuntimeException e) {
                        task.setError(e);
                    } finally {
                        latch.countDown();
                    }
                });
            }
            latch.await();
            Duration d = Duration.ofNanos(System.nanoTime() - start);

            return outcome(d, tasks);
        } catch (InterruptedException e) {
            Duration d = Duration.ofNanos(System.nanoTime() - start);
            // 工作线程结束后才能关闭它们使用的语句
            executor.shutdownNow();
            awaitWorkers(executor);
            Thread.currentThread().interrupt();
            return InsertOutcome.failure(d, new InsertExecutionException("试验被中断", e));
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
            Task.closeAll(tasks);
        }
    }

    private static void awaitWorkers(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(WORKER_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("工作线程在{}秒内未结束", WORKER_TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            log.warn("等待工作线程结束时被中断");
            Thread.currentThread().interrupt();
        }
    }

    // 按创建顺序取最后一个出错任务的错误
    private static InsertOutcome outcome(Duration d, List<Task> tasks) {
        Exception err = null;
        for (Task task : tasks) {
            if (task.getError() != null) {
                err = task.getError();
            }
        }
        return err == null ? InsertOutcome.success(d) : InsertOutcome.failure(d, err);
    }

    /**
     * 并行且分表时第 i 个任务使用的表名
     */
    public String separateTableName(int i) {
        return tableName + "_" + i;
    }

    private void prepareTable(String name, TrialOptions options) {
        tableService.ensureTable(schemaName, name, options.isDrop());
    }

    // 等待不计入耗时
    private static void waitBeforeStart(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InsertExecutionException("试验被中断", e);
        }
    }

    private static void checkParameters(int batchCount, int batchSize) {
        if (batchCount <= 0) {
            throw new ConfigurationException("batchCount必须大于0: " + batchCount);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("batchSize必须大于0: " + batchSize);
        }
        if ((long) batchCount * batchSize > Integer.MAX_VALUE) {
            throw new ConfigurationException("总行数超出范围: " + batchCount + "x" + batchSize);
        }
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
