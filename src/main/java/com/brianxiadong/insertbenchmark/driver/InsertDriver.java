package com.brianxiadong.insertbenchmark.driver;

import java.sql.SQLException;

/**
 * 数据写入驱动
 * 每次 {@link #openConnection()} 返回一个独占的连接，不在任务之间共享
 */
public interface InsertDriver {

    /**
     * 打开一个新的独占连接
     */
    InsertConnection openConnection() throws SQLException;

    /**
     * 批量模式下缓冲区自动刷新的行数阈值
     */
    int bulkSize();

    /**
     * 驱动名称及版本，用于展示
     */
    String driverName();
}
