package com.brianxiadong.insertbenchmark.driver;

import com.brianxiadong.insertbenchmark.service.RowGenerator;
import com.brianxiadong.insertbenchmark.service.TableService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.sql.BatchUpdateException;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * JdbcInsertDriver 的测试类，直接连接内存H2
 */
class JdbcInsertDriverTest {

    private static final String QUERY = TableService.insertQuery("PUBLIC", "DRIVERMSG");

    private final RowGenerator generator = new RowGenerator();
    private DriverManagerDataSource dataSource;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:jdbcdriver;DB_CLOSE_DELAY=-1", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("create table \"PUBLIC\".\"DRIVERMSG\" (" + TableService.COLUMNS + ")");
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.execute("drop table \"PUBLIC\".\"DRIVERMSG\"");
    }

    private long count() {
        Long n = jdbcTemplate.queryForObject("select count(*) from \"PUBLIC\".\"DRIVERMSG\"", Long.class);
        return n == null ? 0 : n;
    }

    @Test
    void bulkStatementFlushesAutomaticallyAtBulkSize() throws SQLException {
        JdbcInsertDriver driver = new JdbcInsertDriver(dataSource, 3);

        try (InsertConnection conn = driver.openConnection();
             InsertStatement stmt = conn.prepare(QUERY, true)) {
            stmt.exec(generator.row(0));
            stmt.exec(generator.row(1));
            assertEquals(0, count());

            stmt.exec(generator.row(2));
            assertEquals(3, count());

            stmt.exec(generator.row(3));
            assertEquals(3, count());

            stmt.flush();
            assertEquals(4, count());

            // 缓冲区为空时 flush 不提交任何行
            stmt.flush();
            assertEquals(4, count());
        }
    }

    @Test
    void plainStatementExecutesEachRow() throws SQLException {
        JdbcInsertDriver driver = new JdbcInsertDriver(dataSource, 100);

        try (InsertConnection conn = driver.openConnection();
             InsertStatement stmt = conn.prepare(QUERY, false)) {
            stmt.exec(generator.row(0));
            assertEquals(1, count());
        }
    }

    @Test
    void execManySubmitsWholeArray() throws SQLException {
        JdbcInsertDriver driver = new JdbcInsertDriver(dataSource, 2);

        try (InsertConnection conn = driver.openConnection();
             InsertStatement stmt = conn.prepare(QUERY, false)) {
            stmt.execMany(generator.rows(0, 5));
            assertEquals(5, count());

            stmt.execMany(generator.rows(1, 5));
            assertEquals(10, count());
        }

        List<Integer> ids = jdbcTemplate.queryForList(
                "select DEVICEID from \"PUBLIC\".\"DRIVERMSG\" order by DEVICEID", Integer.class);
        assertEquals(0, ids.get(0));
        assertEquals(9, ids.get(9));
    }

    @Test
    void prepareFailsForUnknownTable() throws SQLException {
        JdbcInsertDriver driver = new JdbcInsertDriver(dataSource, 2);

        try (InsertConnection conn = driver.openConnection()) {
            assertThrows(SQLException.class,
                    () -> conn.prepare(TableService.insertQuery("PUBLIC", "MISSING"), true));
        }
    }

    @Test
    void bulkSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcInsertDriver(dataSource, 0));
    }

    @Test
    void driverNameIsReported() {
        assertTrue(new JdbcInsertDriver(dataSource, 1).driverName().startsWith("H2"));
    }

    @Test
    void failedFlushDiscardsPendingBatch() throws SQLException {
        PreparedStatement ps = mock(PreparedStatement.class);
        when(ps.executeBatch())
                .thenThrow(new BatchUpdateException("duplicate key", new int[0]))
                .thenReturn(new int[]{1});
        InsertStatement stmt = new JdbcInsertStatement(ps, true, 10);

        stmt.exec(generator.row(0));
        stmt.exec(generator.row(1));
        assertThrows(BatchUpdateException.class, stmt::flush);

        stmt.exec(generator.row(2));
        stmt.flush();

        InOrder order = inOrder(ps);
        order.verify(ps, times(2)).addBatch();
        order.verify(ps).executeBatch();
        order.verify(ps).clearBatch();
        order.verify(ps).addBatch();
        order.verify(ps).executeBatch();
        verify(ps, times(2)).clearBatch();
    }
}
