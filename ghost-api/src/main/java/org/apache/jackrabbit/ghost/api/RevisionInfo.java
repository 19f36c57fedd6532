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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;

/**
 * A single committed mutation of a file in a tracked folder. Instances are
 * immutable.
 */
public final class RevisionInfo {

    private final long id;

    private final String file;

    private final String revision;

    private final long createdOn;

    private final String createdBy;

    public RevisionInfo(long id, @NotNull String file, @NotNull String revision,
                        long createdOn, @NotNull String createdBy) {
        this.id = id;
        this.file = checkNotNull(file);
        this.revision = checkNotNull(revision);
        this.createdOn = createdOn;
        this.createdBy = checkNotNull(createdBy);
    }

    /**
     * @return the database id of the revision record.
     */
    public long getId() {
        return id;
    }

    /**
     * @return the name of the file, relative to its folder.
     */
    @NotNull
    public String getFile() {
        return file;
    }

    /**
     * @return the opaque revision token.
     */
    @NotNull
    public String getRevision() {
        return revision;
    }

    /**
     * @return the creation time in milliseconds since the epoch.
     */
    public long getCreatedOn() {
        return createdOn;
    }

    @NotNull
    public String getCreatedBy() {
        return createdBy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RevisionInfo)) {
            return false;
        }
        RevisionInfo other = (RevisionInfo) obj;
        return id == other.id
                && createdOn == other.createdOn
                && file.equals(other.file)
                && revision.equals(other.revision)
                && createdBy.equals(other.createdBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, file, revision, createdOn, createdBy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("file", file)
                .add("revision", revision)
                .add("createdOn", createdOn)
                .add("createdBy", createdBy)
                .toString();
    }
}
