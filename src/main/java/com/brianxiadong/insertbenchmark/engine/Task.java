package com.brianxiadong.insertbenchmark.engine;

import com.brianxiadong.insertbenchmark.driver.InsertConnection;
import com.brianxiadong.insertbenchmark.driver.InsertDriver;
import com.brianxiadong.insertbenchmark.driver.InsertStatement;
import com.brianxiadong.insertbenchmark.exception.ConnectionException;
import com.brianxiadong.insertbenchmark.exception.PrepareException;
import com.brianxiadong.insertbenchmark.model.Row;
import com.brianxiadong.insertbenchmark.service.RowGenerator;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 并行试验的执行单元：一个独占连接 + 一个独占预编译语句 + 预先生成的行 + 错误槽位
 * 每个任务只由一个工作线程使用，因此不需要加锁；试验结束后立即关闭，不复用
 */
@Slf4j
public final class Task implements AutoCloseable {

    private final int index;
    private final InsertConnection connection;
    private final InsertStatement statement;
    private final List<Row> rows;

    // 只由处理该任务的工作线程写入，汇合后读取
    private Exception error;

    private Task(int index, InsertConnection connection, InsertStatement statement, List<Row> rows) {
        this.index = index;
        this.connection = connection;
        this.statement = statement;
        this.rows = rows;
    }

    /**
     * 创建任务：获取连接、预编译语句、生成第 blockIndex 块的 size 行
     * 预编译失败时会关闭已获取的连接
     *
     * @throws ConnectionException 获取连接失败
     * @throws PrepareException    预编译失败
     */
    public static Task create(InsertDriver driver, String query, boolean bulk, RowGenerator generator,
                              int blockIndex, int size) {
        InsertConnection connection;
        try {
            connection = driver.openConnection();
        } catch (SQLException e) {
            throw new ConnectionException(e.getMessage(), e);
        }

        InsertStatement statement;
        try {
            statement = connection.prepare(query, bulk);
        } catch (SQLException | RuntimeException e) {
            closeConnection(connection, blockIndex);
            throw new PrepareException(e.getMessage(), e);
        }

        List<Row> rows = size == 0 ? Collections.emptyList() : generator.rows(blockIndex, size);
        return new Task(blockIndex, connection, statement, Collections.unmodifiableList(rows));
    }

    /**
     * 依次创建 batchCount 个任务
     * 任一任务创建失败时关闭之前已创建的所有任务并抛出原异常，不返回部分列表
     *
     * @param queries 第 i 个任务使用的插入语句
     */
    public static List<Task> createAll(InsertDriver driver, IntFunction<String> queries, boolean bulk,
                                       RowGenerator generator, int batchCount, int batchSize) {
        List<Task> tasks = new ArrayList<>(batchCount);
        try {
            for (int i = 0; i < batchCount; i++) {
                tasks.add(create(driver, queries.apply(i), bulk, generator, i, batchSize));
            }
        } catch (RuntimeException e) {
            log.warn("创建第{}个任务失败，关闭已创建的{}个任务: {}", tasks.size(), tasks.size(), e.getMessage());
            closeAll(tasks);
            throw e;
        }
        return tasks;
    }

    public static void closeAll(List<Task> tasks) {
        for (Task task : tasks) {
            task.close();
        }
    }

    public int getIndex() {
        return index;
    }

    public InsertStatement getStatement() {
        return statement;
    }

    public List<Row> getRows() {
        return rows;
    }

    public Exception getError() {
        return error;
    }

    public void setError(Exception error) {
        this.error = error;
    }

    /**
     * 先关闭语句再归还连接，任何一步失败只记录日志
     */
    @Override
    public void close() {
        try {
            statement.close();
        } catch (SQLException | RuntimeException e) {
            log.warn("任务{}关闭语句失败: {}", index, e.getMessage());
        }
        closeConnection(connection, index);
    }

    private static void closeConnection(InsertConnection connection, int index) {
        try {
            connection.close();
        } catch (SQLException | RuntimeException e) {
            log.warn("任务{}关闭连接失败: {}", index, e.getMessage());
        }
    }
}
