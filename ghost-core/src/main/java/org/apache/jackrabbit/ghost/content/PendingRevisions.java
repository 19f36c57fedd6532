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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.jetbrains.annotations.NotNull;

/**
 * Process local index of the pending revisions per folder. Entries are
 * replaced as a whole, so readers never see a partially updated folder.
 */
public class PendingRevisions {

    private final ConcurrentMap<String, List<RevisionInfo>> byFolder =
            new ConcurrentHashMap<String, List<RevisionInfo>>();

    /**
     * Replaces the pending revisions of a folder. An empty list removes the
     * folder from the index.
     *
     * @param folder the normalized folder name.
     * @param revisions the pending revisions, most recent first.
     */
    public void put(@NotNull String folder, @NotNull List<RevisionInfo> revisions) {
        checkNotNull(folder);
        if (revisions.isEmpty()) {
            byFolder.remove(folder);
        } else {
            byFolder.put(folder, ImmutableList.copyOf(revisions));
        }
    }

    /**
     * @return an immutable copy of the index, sorted by folder name.
     */
    @NotNull
    public Map<String, List<RevisionInfo>> snapshot() {
        return ImmutableSortedMap.copyOf(byFolder);
    }
}
