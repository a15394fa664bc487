package com.brianxiadong.insertbenchmark.driver;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * JDBC 连接的包装
 */
class JdbcInsertConnection implements InsertConnection {

    private final Connection connection;
    private final int bulkSize;

    JdbcInsertConnection(Connection connection, int bulkSize) {
        this.connection = connection;
        this.bulkSize = bulkSize;
    }

    @Override
    public InsertStatement prepare(String query, boolean bulk) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(query);
        return new JdbcInsertStatement(ps, bulk, bulkSize);
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
