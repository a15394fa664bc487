package com.brianxiadong.insertbenchmark.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 数据库命令
 */
public enum DbCommand {

    CREATE_SCHEMA("createSchema", "schema", "Create"),
    DROP_SCHEMA("dropSchema", "schema", "Drop"),
    CREATE_TABLE("createTable", "table", "Create"),
    DROP_TABLE("dropTable", "table", "Drop"),
    DELETE_ROWS("deleteRows", "table", "Delete rows"),
    COUNT_ROWS("countRows", "table", "Count rows");

    private final String command;
    private final String objectType;
    private final String operation;

    DbCommand(String command, String objectType, String operation) {
        this.command = command;
        this.objectType = objectType;
        this.operation = operation;
    }

    public String getCommand() {
        return command;
    }

    public String getObjectType() {
        return objectType;
    }

    public String getOperation() {
        return operation;
    }

    public boolean isTableCommand() {
        return "table".equals(objectType);
    }

    public static Optional<DbCommand> fromCommand(String command) {
        return Arrays.stream(values())
                .filter(c -> c.command.equals(command))
                .findFirst();
    }
}
