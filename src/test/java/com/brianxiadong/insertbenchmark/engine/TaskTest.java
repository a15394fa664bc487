package com.brianxiadong.insertbenchmark.engine;

import com.brianxiadong.insertbenchmark.driver.InsertConnection;
import com.brianxiadong.insertbenchmark.driver.InsertDriver;
import com.brianxiadong.insertbenchmark.driver.InsertStatement;
import com.brianxiadong.insertbenchmark.exception.ConnectionException;
import com.brianxiadong.insertbenchmark.exception.PrepareException;
import com.brianxiadong.insertbenchmark.model.Row;
import com.brianxiadong.insertbenchmark.service.RowGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskTest {

    private InsertDriver driver;
    private InsertConnection connection;
    private InsertStatement statement;
    private final RowGenerator generator = new RowGenerator();

    @BeforeEach
    void setUp() throws SQLException {
        driver = mock(InsertDriver.class);
        connection = mock(InsertConnection.class);
        statement = mock(InsertStatement.class);
        when(driver.openConnection()).thenReturn(connection);
        when(connection.prepare(anyString(), anyBoolean())).thenReturn(statement);
    }

    @Test
    void createLoadsRowSliceOfBlock() throws SQLException {
        Task task = Task.create(driver, "insert", true, generator, 2, 3);

        List<Integer> ids = task.getRows().stream().map(Row::getDeviceId).collect(Collectors.toList());
        assertEquals(List.of(6, 7, 8), ids);
        assertEquals(2, task.getIndex());
        assertNull(task.getError());
        verify(connection).prepare("insert", true);
    }

    @Test
    void closeReleasesStatementBeforeConnection() throws SQLException {
        Task task = Task.create(driver, "insert", false, generator, 0, 1);

        task.close();

        InOrder order = inOrder(statement, connection);
        order.verify(statement).close();
        order.verify(connection).close();
    }

    @Test
    void closeToleratesStatementFailure() throws SQLException {
        doThrow(new SQLException("statement already closed")).when(statement).close();
        Task task = Task.create(driver, "insert", false, generator, 0, 1);

        assertDoesNotThrow(task::close);
        verify(connection).close();
    }

    @Test
    void connectionFailureIsReportedAsConnectionError() throws SQLException {
        when(driver.openConnection()).thenThrow(new SQLException("no route to host"));

        ConnectionException e = assertThrows(ConnectionException.class,
                () -> Task.create(driver, "insert", false, generator, 0, 1));
        assertEquals("no route to host", e.getMessage());
    }

    @Test
    void prepareFailureReleasesConnection() throws SQLException {
        when(connection.prepare(anyString(), anyBoolean())).thenThrow(new SQLException("syntax error"));

        PrepareException e = assertThrows(PrepareException.class,
                () -> Task.create(driver, "insert", false, generator, 0, 1));
        assertEquals("syntax error", e.getMessage());
        verify(connection).close();
    }

    @Test
    void createAllReturnsTasksInCreationOrder() {
        List<Task> tasks = Task.createAll(driver, i -> "insert " + i, true, generator, 3, 2);

        assertEquals(3, tasks.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, tasks.get(i).getIndex());
            assertEquals(i * 2, tasks.get(i).getRows().get(0).getDeviceId());
        }
    }
}
