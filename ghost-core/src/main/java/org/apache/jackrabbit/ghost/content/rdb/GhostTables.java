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
import java.sql.SQLException;
import java.sql.Statement;

import javax.sql.DataSource;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names and definitions of the tables holding ghost content:
 * <ul>
 * <li>{@code GHOST_CONTENT}: one row per file and folder, unique on
 * {@code (FOLDER, FILE)}. Deleted files keep their row with
 * {@code DELETED = true} and no content.</li>
 * <li>{@code GHOST_REVISIONS}: one row per change of a file, referencing the
 * content row.</li>
 * </ul>
 */
public class GhostTables {

    private static final Logger LOG = LoggerFactory.getLogger(GhostTables.class);

    private final String contentTable;

    private final String revisionsTable;

    public GhostTables(@NotNull RDBGhostOptions options) {
        this.contentTable = options.getTablePrefix() + "GHOST_CONTENT";
        this.revisionsTable = options.getTablePrefix() + "GHOST_REVISIONS";
    }

    @NotNull
    public String getContentTable() {
        return contentTable;
    }

    @NotNull
    public String getRevisionsTable() {
        return revisionsTable;
    }

    /**
     * Creates the tables unless they already exist.
     */
    public void createIfMissing(@NotNull DataSource dataSource) throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            Statement stmt = connection.createStatement();
            try {
                stmt.execute("create table if not exists " + contentTable
                        + "(ID bigint generated by default as identity primary key,"
                        + " FOLDER varchar(512) not null,"
                        + " FILE varchar(512) not null,"
                        + " CONTENT clob,"
                        + " DELETED boolean default false not null,"
                        + " constraint " + contentTable + "_KEY unique (FOLDER, FILE))");
                stmt.execute("create table if not exists " + revisionsTable
                        + "(ID bigint generated by default as identity primary key,"
                        + " CONTENT_ID bigint not null,"
                        + " REVISION varchar(64) not null,"
                        + " CREATED_ON timestamp not null,"
                        + " CREATED_BY varchar(128) not null,"
                        + " constraint " + revisionsTable + "_TOKEN unique (REVISION),"
                        + " constraint " + revisionsTable + "_CONTENT foreign key (CONTENT_ID)"
                        + " references " + contentTable + "(ID))");
            } finally {
                stmt.close();
            }
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
        } finally {
            connection.close();
        }
        LOG.debug("Ensured tables {} and {} exist", contentTable, revisionsTable);
    }
}
