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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.jackrabbit.ghost.api.GhostContentManager.REVISIONS_FILE_NAME;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import com.google.common.base.Joiner;
import org.apache.commons.io.FileUtils;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.apache.jackrabbit.ghost.content.FolderNormalizer;
import org.h2.jdbcx.JdbcConnectionPool;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;

/**
 * Base class for tests running against an in-memory H2 database. The
 * sentinel connection keeps the database alive while the pool hands out
 * and closes connections.
 */
public abstract class AbstractRDBGhostTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder(new File("target"));

    protected JdbcConnectionPool cp;

    protected GhostTables tables;

    protected RDBGhostContentManager manager;

    private Connection sentinel;

    @Before
    public void setUp() throws Exception {
        cp = JdbcConnectionPool.create(
                "jdbc:h2:mem:ghost" + UUID.randomUUID().toString().replace("-", ""), "", "");
        sentinel = cp.getConnection();
        tables = new GhostTables(new RDBGhostOptions());
        tables.createIfMissing(cp);
        manager = newManager();
    }

    @After
    public void tearDown() throws Exception {
        if (sentinel != null) {
            sentinel.close();
        }
        cp.dispose();
    }

    /**
     * Creates another manager on the same database and project location,
     * as a restarted or concurrently running process would.
     */
    protected RDBGhostContentManager newManager() {
        return new RDBGhostContentManager(new FolderNormalizer(folder.getRoot()), cp, tables,
                RDBGhostContentManager.DEFAULT_CREATED_BY);
    }

    protected File write(String path, String content) throws IOException {
        File file = new File(folder.getRoot(), path);
        FileUtils.writeStringToFile(file, content, UTF_8);
        return file;
    }

    protected void release(String folderName, List<RevisionInfo> revisions) throws IOException {
        StringBuilder manifest = new StringBuilder("# released revisions\n\n");
        for (RevisionInfo revision : revisions) {
            manifest.append(revision.getRevision()).append('\n');
        }
        write(Joiner.on('/').join(folderName, REVISIONS_FILE_NAME), manifest.toString());
    }

    protected int countRevisions() throws SQLException {
        return count("select count(*) from " + tables.getRevisionsTable());
    }

    protected int countRows(String folderName, String file) throws SQLException {
        try (Connection connection = cp.getConnection();
             PreparedStatement stmt = connection.prepareStatement(
                     "select count(*) from " + tables.getContentTable() + " where FOLDER = ? and FILE = ?")) {
            stmt.setString(1, folderName);
            stmt.setString(2, file);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    protected void execute(String sql) throws SQLException {
        try (Connection connection = cp.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    private int count(String sql) throws SQLException {
        try (Connection connection = cp.getConnection();
             Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
