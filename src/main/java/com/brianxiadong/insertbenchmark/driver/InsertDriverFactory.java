package com.brianxiadong.insertbenchmark.driver;

/**
 * 按试验创建写入驱动
 * 每次试验使用新的驱动实例，自动刷新阈值随批大小变化
 */
public interface InsertDriverFactory {

    /**
     * @param requestedBulkSize 期望的自动刷新阈值
     * @return 新驱动，实际阈值见 {@link InsertDriver#bulkSize()}
     */
    InsertDriver create(int requestedBulkSize);
}
