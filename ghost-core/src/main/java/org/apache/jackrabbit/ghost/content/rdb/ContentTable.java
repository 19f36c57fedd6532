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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import org.apache.jackrabbit.ghost.api.ContentFile;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Access to the content table. All methods run on the connection passed in
 * and leave transaction handling to the caller.
 */
class ContentTable {

    /**
     * SQL state of a unique constraint violation.
     */
    private static final String UNIQUE_VIOLATION = "23505";

    /**
     * Maximum number of values bound in a single {@code in} clause.
     */
    static final int MAX_IN_CLAUSE = 100;

    private final String table;

    ContentTable(@NotNull GhostTables tables) {
        this.table = tables.getContentTable();
    }

    /**
     * Reads the entry of a file, tombstones included.
     *
     * @return the entry or {@code null} if there is none.
     */
    @Nullable
    ContentEntry find(Connection connection, String folder, String file) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "select ID, CONTENT, DELETED from " + table + " where FOLDER = ? and FILE = ?")) {
            stmt.setString(1, folder);
            stmt.setString(2, file);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new ContentEntry(rs.getLong(1), rs.getString(2), rs.getBoolean(3));
            }
        }
    }

    /**
     * Sets the content of a file and clears its deleted flag, inserting the
     * row if it does not exist yet. If another writer inserts the same file
     * concurrently, the unique constraint on {@code (FOLDER, FILE)} rejects
     * the insert and the row is updated instead. The insert runs behind a
     * savepoint, so the transaction stays usable on databases which abort it
     * on a failed statement. Requires auto commit to be off.
     *
     * @return the id of the row.
     */
    long upsert(Connection connection, String folder, String file, String content) throws SQLException {
        if (update(connection, folder, file, content) == 0) {
            Savepoint savepoint = connection.setSavepoint();
            try {
                insert(connection, folder, file, content);
                connection.releaseSavepoint(savepoint);
            } catch (SQLException e) {
                if (!isUniqueViolation(e)) {
                    throw e;
                }
                connection.rollback(savepoint);
                if (update(connection, folder, file, content) == 0) {
                    throw e;
                }
            }
        }
        ContentEntry entry = find(connection, folder, file);
        if (entry == null) {
            throw new SQLException("Row for " + folder + "/" + file + " vanished after upsert");
        }
        return entry.getId();
    }

    private int update(Connection connection, String folder, String file, String content) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "update " + table + " set CONTENT = ?, DELETED = false where FOLDER = ? and FILE = ?")) {
            stmt.setString(1, content);
            stmt.setString(2, folder);
            stmt.setString(3, file);
            return stmt.executeUpdate();
        }
    }

    private void insert(Connection connection, String folder, String file, String content) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "insert into " + table + "(FOLDER, FILE, CONTENT, DELETED) values(?, ?, ?, false)")) {
            stmt.setString(1, folder);
            stmt.setString(2, file);
            stmt.setString(3, content);
            stmt.executeUpdate();
        }
    }

    /**
     * Turns the row into a tombstone.
     */
    void markDeleted(Connection connection, long id) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "update " + table + " set CONTENT = null, DELETED = true where ID = ?")) {
            stmt.setLong(1, id);
            stmt.executeUpdate();
        }
    }

    /**
     * Lists the files of a folder which are not deleted and whose name ends
     * with the given suffix. The suffix is compared literally.
     */
    @NotNull
    SortedSet<String> listFiles(Connection connection, String folder, String suffix) throws SQLException {
        SortedSet<String> files = new TreeSet<String>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "select FILE from " + table + " where FOLDER = ? and DELETED = false")) {
            stmt.setString(1, folder);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String file = rs.getString(1);
                    if (file.endsWith(suffix)) {
                        files.add(file);
                    }
                }
            }
        }
        return files;
    }

    /**
     * Reads the current state of the given files of a folder. Files without
     * a row are skipped.
     *
     * @return the files, sorted by name.
     */
    @NotNull
    List<ContentFile> read(Connection connection, String folder, Collection<String> files) throws SQLException {
        List<ContentFile> result = new ArrayList<ContentFile>();
        for (List<String> chunk : Iterables.partition(files, MAX_IN_CLAUSE)) {
            try (PreparedStatement stmt = connection.prepareStatement(
                    "select FILE, CONTENT, DELETED from " + table
                            + " where FOLDER = ? and FILE in (" + placeholders(chunk.size()) + ")")) {
                stmt.setString(1, folder);
                int idx = 2;
                for (String file : chunk) {
                    stmt.setString(idx++, file);
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(new ContentFile(rs.getString(1), rs.getString(2), rs.getBoolean(3)));
                    }
                }
            }
        }
        result.sort((a, b) -> a.getFile().compareTo(b.getFile()));
        return result;
    }

    /**
     * Returns the ids of the rows of a folder whose file is not contained in
     * {@code keep}.
     */
    @NotNull
    List<Long> findOthers(Connection connection, String folder, Set<String> keep) throws SQLException {
        List<Long> ids = Lists.newArrayList();
        try (PreparedStatement stmt = connection.prepareStatement(
                "select ID, FILE from " + table + " where FOLDER = ?")) {
            stmt.setString(1, folder);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    if (!keep.contains(rs.getString(2))) {
                        ids.add(rs.getLong(1));
                    }
                }
            }
        }
        return ids;
    }

    /**
     * Removes rows permanently. Revisions referencing them must have been
     * removed before.
     *
     * @return the number of removed rows.
     */
    int delete(Connection connection, Collection<Long> ids) throws SQLException {
        int count = 0;
        try (PreparedStatement stmt = connection.prepareStatement(
                "delete from " + table + " where ID = ?")) {
            for (Long id : ids) {
                stmt.setLong(1, id);
                count += stmt.executeUpdate();
            }
        }
        return count;
    }

    private static String placeholders(int count) {
        return Joiner.on(", ").join(Collections.nCopies(count, "?"));
    }

    private static boolean isUniqueViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || UNIQUE_VIOLATION.equals(e.getSQLState());
    }
}
