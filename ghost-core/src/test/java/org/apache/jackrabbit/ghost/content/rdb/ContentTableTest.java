/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.ghost.content.rdb;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Savepoint;

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

/**
 * Statement sequence of {@link ContentTable#upsert} when the insert races
 * with another writer.
 */
public class ContentTableTest {

    private final ContentTable table = new ContentTable(new GhostTables(new RDBGhostOptions()));

    private Connection connection;

    private Savepoint savepoint;

    private PreparedStatement update;

    private PreparedStatement insert;

    @Before
    public void setUp() throws SQLException {
        connection = mock(Connection.class);
        savepoint = mock(Savepoint.class);
        update = mock(PreparedStatement.class);
        insert = mock(PreparedStatement.class);
        PreparedStatement select = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);

        when(connection.setSavepoint()).thenReturn(savepoint);
        when(connection.prepareStatement(startsWith("update"))).thenReturn(update);
        when(connection.prepareStatement(startsWith("insert"))).thenReturn(insert);
        when(connection.prepareStatement(startsWith("select"))).thenReturn(select);
        when(select.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(42L);
        when(rs.getString(2)).thenReturn("C");
    }

    @Test
    public void insert() throws SQLException {
        when(update.executeUpdate()).thenReturn(0);
        when(insert.executeUpdate()).thenReturn(1);

        assertEquals(42L, table.upsert(connection, "flows", "c.json", "C"));
        verify(connection).releaseSavepoint(savepoint);
        verify(connection, never()).rollback(savepoint);
    }

    @Test
    public void concurrentInsertFallsBackToUpdate() throws SQLException {
        when(update.executeUpdate()).thenReturn(0, 1);
        when(insert.executeUpdate()).thenThrow(
                new SQLIntegrityConstraintViolationException("duplicate key", "23505"));

        assertEquals(42L, table.upsert(connection, "flows", "c.json", "C"));

        InOrder order = inOrder(connection, update, insert);
        order.verify(update).executeUpdate();
        order.verify(connection).setSavepoint();
        order.verify(insert).executeUpdate();
        order.verify(connection).rollback(savepoint);
        order.verify(update).executeUpdate();
    }

    @Test
    public void otherInsertFailurePropagates() throws SQLException {
        SQLException failure = new SQLException("value too long", "22001");
        when(update.executeUpdate()).thenReturn(0);
        when(insert.executeUpdate()).thenThrow(failure);

        try {
            table.upsert(connection, "flows", "c.json", "C");
            fail("insert failure must propagate");
        } catch (SQLException e) {
            assertEquals(failure, e);
        }
        verify(connection, never()).rollback(savepoint);
    }
}
