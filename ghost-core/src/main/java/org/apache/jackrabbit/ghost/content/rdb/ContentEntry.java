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

import org.jetbrains.annotations.Nullable;

/**
 * A row of the content table.
 */
final class ContentEntry {

    private final long id;

    private final String content;

    private final boolean deleted;

    ContentEntry(long id, @Nullable String content, boolean deleted) {
        this.id = id;
        this.content = content;
        this.deleted = deleted;
    }

    long getId() {
        return id;
    }

    @Nullable
    String getContent() {
        return content;
    }

    boolean isDeleted() {
        return deleted;
    }

    /**
     * @return {@code true} if the entry exists and holds exactly the given
     *          content.
     */
    boolean hasContent(String other) {
        return !deleted && other.equals(content);
    }
}
