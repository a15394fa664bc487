package com.brianxiadong.insertbenchmark.controller;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.model.DbCommand;
import com.brianxiadong.insertbenchmark.model.DbResult;
import com.brianxiadong.insertbenchmark.service.TableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * 数据库命令控制器
 * 例如 GET /db/createTable?schemaname=PUBLIC&tablename=GOMESSAGE
 */
@Slf4j
@RestController
@RequestMapping("/db")
public class DbController {

    @Autowired
    private TableService tableService;

    @Autowired
    private BenchmarkProperties properties;

    @GetMapping("/{command}")
    public DbResult execute(@PathVariable("command") String command,
                            @RequestParam(value = "schemaname", required = false) String schemaName,
                            @RequestParam(value = "tablename", required = false) String tableName) {
        DbResult result = new DbResult(command);

        Optional<DbCommand> dbCommand = DbCommand.fromCommand(command);
        if (dbCommand.isEmpty()) {
            result.setErrorMessage("无效的命令: " + command);
            log.info("{}", result);
            return result;
        }

        DbCommand cmd = dbCommand.get();
        String schema = isBlank(schemaName) ? properties.getSchemaName() : schemaName;
        String table = isBlank(tableName) ? properties.getTableName() : tableName;

        result.setObjectType(cmd.getObjectType());
        result.setOperation(cmd.getOperation());
        result.setObjectName(cmd.isTableCommand() ? schema + "." + table : schema);

        try {
            switch (cmd) {
                case CREATE_SCHEMA:
                    tableService.createSchema(schema);
                    break;
                case DROP_SCHEMA:
                    tableService.dropSchema(schema);
                    break;
                case CREATE_TABLE:
                    tableService.createTable(schema, table);
                    break;
                case DROP_TABLE:
                    tableService.dropTable(schema, table);
                    break;
                case DELETE_ROWS:
                    result.setNumRows(tableService.deleteRows(schema, table));
                    break;
                case COUNT_ROWS:
                    result.setNumRows(tableService.countRows(schema, table));
                    break;
                default:
                    throw new IllegalStateException("未处理的命令: " + cmd);
            }
        } catch (DataAccessException e) {
            result.setErrorMessage(e.getMostSpecificCause().getMessage());
        }

        log.info("{}", result);
        return result;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
