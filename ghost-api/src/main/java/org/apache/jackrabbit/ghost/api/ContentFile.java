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
import org.jetbrains.annotations.Nullable;

/**
 * The current state of a file as stored by a {@link GhostContentManager}.
 * A deleted file has no content.
 */
public final class ContentFile {

    private final String file;

    private final String content;

    private final boolean deleted;

    public ContentFile(@NotNull String file, @Nullable String content, boolean deleted) {
        this.file = checkNotNull(file);
        this.content = content;
        this.deleted = deleted;
    }

    @NotNull
    public String getFile() {
        return file;
    }

    /**
     * @return the content or {@code null} if the file is deleted.
     */
    @Nullable
    public String getContent() {
        return content;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ContentFile)) {
            return false;
        }
        ContentFile other = (ContentFile) obj;
        return deleted == other.deleted
                && file.equals(other.file)
                && Objects.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, content, deleted);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("file", file)
                .add("deleted", deleted)
                .toString();
    }
}
