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

import java.io.File;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;

/**
 * A folder registered with a {@link GhostContentManager}.
 */
public final class FolderRegistration {

    private final String name;

    private final File folderPath;

    private final String globPattern;

    public FolderRegistration(@NotNull String name, @NotNull File folderPath,
                              @NotNull String globPattern) {
        this.name = checkNotNull(name);
        this.folderPath = checkNotNull(folderPath);
        this.globPattern = checkNotNull(globPattern);
    }

    /**
     * @return the normalized folder name, relative to the project location.
     */
    @NotNull
    public String getName() {
        return name;
    }

    /**
     * @return the absolute location of the folder on the file system.
     */
    @NotNull
    public File getFolderPath() {
        return folderPath;
    }

    @NotNull
    public String getGlobPattern() {
        return globPattern;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FolderRegistration)) {
            return false;
        }
        FolderRegistration other = (FolderRegistration) obj;
        return name.equals(other.name)
                && folderPath.equals(other.folderPath)
                && globPattern.equals(other.globPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, folderPath, globPattern);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("folderPath", folderPath)
                .add("globPattern", globPattern)
                .toString();
    }
}
