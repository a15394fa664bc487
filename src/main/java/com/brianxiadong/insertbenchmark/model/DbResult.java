package com.brianxiadong.insertbenchmark.model;

import lombok.Data;

/**
 * 数据库命令执行结果
 */
@Data
public class DbResult {

    private String command;

    /**
     * 对象类型：table 或 schema
     */
    private String objectType;

    /**
     * 操作：Count rows、Delete rows、Create、Drop
     */
    private String operation;

    private String objectName;

    /**
     * 行数，不涉及行数的命令为 -1
     */
    private long numRows = -1;

    private String errorMessage;

    public DbResult() {
    }

    public DbResult(String command) {
        this.command = command;
    }

    @Override
    public String toString() {
        if (errorMessage != null) {
            return String.format("%s %s %s error: %s", operation, objectType, objectName, errorMessage);
        }
        if (numRows != -1) {
            return String.format("%s %s %s: %d rows", operation, objectType, objectName, numRows);
        }
        return String.format("%s %s %s: ok", operation, objectType, objectName);
    }
}
