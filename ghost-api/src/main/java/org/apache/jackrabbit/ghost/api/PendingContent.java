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
package org.apache.jackrabbit.ghost.api;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

/**
 * The unreleased changes of a folder: the current state of every file
 * touched by a pending revision, and the pending revision tokens. Export
 * tooling packages the files and later adds the tokens to the folder's
 * known revisions manifest.
 */
public final class PendingContent {

    private final List<ContentFile> files;

    private final List<String> revisions;

    public PendingContent(@NotNull Iterable<ContentFile> files,
                          @NotNull Iterable<String> revisions) {
        this.files = ImmutableList.copyOf(files);
        this.revisions = ImmutableList.copyOf(revisions);
    }

    /**
     * @return the files referenced by pending revisions, sorted by name.
     */
    @NotNull
    public List<ContentFile> getFiles() {
        return files;
    }

    /**
     * @return the distinct pending revision tokens, most recent first.
     */
    @NotNull
    public List<String> getRevisions() {
        return revisions;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PendingContent)) {
            return false;
        }
        PendingContent other = (PendingContent) obj;
        return files.equals(other.files) && revisions.equals(other.revisions);
    }

    @Override
    public int hashCode() {
        return 31 * files.hashCode() + revisions.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("files", files)
                .add("revisions", revisions)
                .toString();
    }
}
