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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import org.jetbrains.annotations.NotNull;

/**
 * Options applying to the database tables of the ghost content store.
 */
public class RDBGhostOptions {

    private static final CharMatcher IDENTIFIER = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.is('_'));

    private String tablePrefix = "";

    private boolean createTables = true;

    public RDBGhostOptions() {
    }

    /**
     * Prefix for table names, consisting of letters, digits and underscores.
     */
    public RDBGhostOptions tablePrefix(@NotNull String tablePrefix) {
        checkArgument(IDENTIFIER.matchesAllOf(checkNotNull(tablePrefix)),
                "Invalid table prefix: %s", tablePrefix);
        this.tablePrefix = tablePrefix;
        return this;
    }

    @NotNull
    public String getTablePrefix() {
        return this.tablePrefix;
    }

    /**
     * Whether missing tables are created on startup (default {@code true}).
     */
    public RDBGhostOptions createTables(boolean createTables) {
        this.createTables = createTables;
        return this;
    }

    public boolean isCreateTables() {
        return this.createTables;
    }
}
