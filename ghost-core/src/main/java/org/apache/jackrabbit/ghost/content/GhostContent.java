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
package org.apache.jackrabbit.ghost.content;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static org.apache.jackrabbit.ghost.api.GhostContentException.STORAGE;

import java.io.File;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.apache.jackrabbit.ghost.api.GhostContentManager;
import org.apache.jackrabbit.ghost.content.rdb.GhostTables;
import org.apache.jackrabbit.ghost.content.rdb.RDBGhostContentManager;
import org.apache.jackrabbit.ghost.content.rdb.RDBGhostOptions;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for creating a {@link GhostContentManager}.
 * <pre>
 * GhostContentManager manager = GhostContent.builder()
 *         .setProjectLocation(new File("/srv/project"))
 *         .setDataSource(dataSource)
 *         .build();
 * </pre>
 */
public final class GhostContent {

    private static final Logger LOG = LoggerFactory.getLogger(GhostContent.class);

    /**
     * System property providing the default for
     * {@link Builder#setEnabled(boolean)}.
     */
    public static final String ENABLED_PROPERTY = "ghost.content.enabled";

    private GhostContent() {
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    static boolean isEnabledByDefault() {
        String value = System.getProperty(ENABLED_PROPERTY);
        if (value == null) {
            return true;
        }
        boolean enabled = Boolean.parseBoolean(value);
        if (!enabled) {
            LOG.info("System property {} found to be '{}', revision tracking disabled", ENABLED_PROPERTY, value);
        }
        return enabled;
    }

    public static class Builder {

        private File projectLocation;
        private boolean enabled = isEnabledByDefault();
        private DataSource dataSource;
        private RDBGhostOptions options = new RDBGhostOptions();
        private String createdBy = RDBGhostContentManager.DEFAULT_CREATED_BY;

        Builder() {
        }

        /**
         * The location folders are resolved against and made relative to.
         */
        public Builder setProjectLocation(@NotNull File projectLocation) {
            this.projectLocation = checkNotNull(projectLocation);
            return this;
        }

        /**
         * Whether revisions are tracked in the database. When disabled all
         * operations act directly on the file system. Defaults to the value
         * of the {@value GhostContent#ENABLED_PROPERTY} system property, or {@code true}.
         */
        public Builder setEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * The database to use. Required when tracking is enabled.
         */
        public Builder setDataSource(@NotNull DataSource dataSource) {
            this.dataSource = checkNotNull(dataSource);
            return this;
        }

        public Builder setOptions(@NotNull RDBGhostOptions options) {
            this.options = checkNotNull(options);
            return this;
        }

        /**
         * The actor recorded on revisions, {@code admin} by default.
         */
        public Builder setCreatedBy(@NotNull String createdBy) {
            this.createdBy = checkNotNull(createdBy);
            return this;
        }

        /**
         * Creates the manager. When tracking is enabled and the options ask
         * for it, missing tables are created.
         *
         * @throws GhostContentException of type {@code Storage} if the tables
         *          cannot be created.
         * @throws IllegalStateException if the project location, or the data
         *          source of an enabled manager, is not set.
         */
        @NotNull
        public GhostContentManager build() throws GhostContentException {
            checkState(projectLocation != null, "Project location not set");
            FolderNormalizer normalizer = new FolderNormalizer(projectLocation);
            if (!enabled) {
                return new TransparentGhostContentManager(normalizer);
            }
            checkState(dataSource != null, "DataSource required when revision tracking is enabled");
            GhostTables tables = new GhostTables(options);
            if (options.isCreateTables()) {
                try {
                    tables.createIfMissing(dataSource);
                } catch (SQLException e) {
                    throw new GhostContentException(STORAGE, 5, "Unable to create ghost content tables", e);
                }
            }
            return new RDBGhostContentManager(normalizer, dataSource, tables, createdBy);
        }
    }
}
