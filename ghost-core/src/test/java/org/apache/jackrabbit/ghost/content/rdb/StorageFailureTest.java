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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.File;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.apache.commons.io.FileUtils;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.apache.jackrabbit.ghost.content.FolderNormalizer;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Operations against a database which is not reachable.
 */
public class StorageFailureTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder(new File("target"));

    private final SQLException failure = new SQLException("Connection refused");

    private RDBGhostContentManager manager;

    @Before
    public void setUp() throws Exception {
        DataSource ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(failure);
        manager = new RDBGhostContentManager(new FolderNormalizer(folder.getRoot()), ds,
                new GhostTables(new RDBGhostOptions()), RDBGhostContentManager.DEFAULT_CREATED_BY);
    }

    @Test
    public void register() throws Exception {
        try {
            manager.register("flows", "*.json");
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isReconciliationFailure());
            assertSame(failure, e.getCause());
        }
        // still registered
        assertEquals(1, manager.getRegistrations().size());
    }

    @Test
    public void read() {
        try {
            manager.read("flows", "a.json");
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isStorageFailure());
        }
    }

    @Test
    public void recordRevision() {
        try {
            manager.recordRevision("flows", "a.json", "A");
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isTransactionFailure());
            assertEquals(1, e.getCode());
        }
        assertTrue(manager.getPending().isEmpty());
    }

    @Test
    public void softDelete() {
        try {
            manager.softDelete("flows", "a.json");
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isTransactionFailure());
            assertEquals(2, e.getCode());
        }
    }

    @Test
    public void list() {
        try {
            manager.list("flows");
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isStorageFailure());
        }
    }

    @Test
    public void refreshAllReportsEveryFolder() throws Exception {
        for (String name : new String[] {"flows", "other"}) {
            FileUtils.forceMkdir(new File(folder.getRoot(), name));
            try {
                manager.register(name, "*.json");
                fail();
            } catch (GhostContentException e) {
                assertTrue(e.isReconciliationFailure());
            }
        }
        try {
            manager.refreshAll();
            fail();
        } catch (GhostContentException e) {
            assertTrue(e.isStorageFailure());
            assertEquals(1, e.getSuppressed().length);
        }
    }
}
