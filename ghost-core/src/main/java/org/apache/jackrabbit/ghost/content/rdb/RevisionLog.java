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
import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;

import com.google.common.collect.Lists;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.jetbrains.annotations.NotNull;

/**
 * Append only log of the revisions of the files in the content table.
 * Records are never updated, only removed once released or when their file
 * is removed.
 */
class RevisionLog {

    private final String table;

    private final String contentTable;

    RevisionLog(@NotNull GhostTables tables) {
        this.table = tables.getRevisionsTable();
        this.contentTable = tables.getContentTable();
    }

    void append(Connection connection, long contentId, String revision,
                long createdOn, String createdBy) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "insert into " + table + "(CONTENT_ID, REVISION, CREATED_ON, CREATED_BY) values(?, ?, ?, ?)")) {
            stmt.setLong(1, contentId);
            stmt.setString(2, revision);
            stmt.setTimestamp(3, new Timestamp(createdOn));
            stmt.setString(4, createdBy);
            stmt.executeUpdate();
        }
    }

    /**
     * Reads all revisions of the files in a folder, most recent first.
     */
    @NotNull
    List<RevisionInfo> findByFolder(Connection connection, String folder) throws SQLException {
        List<RevisionInfo> revisions = Lists.newArrayList();
        try (PreparedStatement stmt = connection.prepareStatement(
                "select r.ID, c.FILE, r.REVISION, r.CREATED_ON, r.CREATED_BY"
                        + " from " + table + " r join " + contentTable + " c on c.ID = r.CONTENT_ID"
                        + " where c.FOLDER = ?"
                        + " order by r.CREATED_ON desc, r.ID desc")) {
            stmt.setString(1, folder);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    revisions.add(new RevisionInfo(rs.getLong(1), rs.getString(2), rs.getString(3),
                            rs.getTimestamp(4).getTime(), rs.getString(5)));
                }
            }
        }
        return revisions;
    }

    /**
     * Removes revisions permanently.
     *
     * @param ids the ids of the revisions.
     * @return the number of removed revisions.
     */
    int delete(Connection connection, Collection<Long> ids) throws SQLException {
        return deleteWhere(connection, "ID", ids);
    }

    /**
     * Removes all revisions of the given content rows.
     *
     * @param contentIds the ids of the content rows.
     * @return the number of removed revisions.
     */
    int deleteByContent(Connection connection, Collection<Long> contentIds) throws SQLException {
        return deleteWhere(connection, "CONTENT_ID", contentIds);
    }

    private int deleteWhere(Connection connection, String column, Collection<Long> ids) throws SQLException {
        int count = 0;
        try (PreparedStatement stmt = connection.prepareStatement(
                "delete from " + table + " where " + column + " = ?")) {
            for (Long id : ids) {
                stmt.setLong(1, id);
                count += stmt.executeUpdate();
            }
        }
        return count;
    }
}
