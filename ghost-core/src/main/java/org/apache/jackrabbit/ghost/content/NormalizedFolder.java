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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.File;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * A folder as returned by {@link FolderNormalizer#normalize(String)}.
 */
public final class NormalizedFolder {

    private final String name;

    private final File folderPath;

    NormalizedFolder(@NotNull String name, @NotNull File folderPath) {
        this.name = checkNotNull(name);
        this.folderPath = checkNotNull(folderPath);
    }

    /**
     * @return the storage key of the folder.
     */
    @NotNull
    public String getName() {
        return name;
    }

    /**
     * @return the absolute location of the folder.
     */
    @NotNull
    public File getFolderPath() {
        return folderPath;
    }

    /**
     * @param file a file name relative to this folder.
     * @return the location of the file.
     * @throws IllegalArgumentException if the file is not located below this
     *          folder.
     */
    @NotNull
    public File resolve(@NotNull String file) {
        Path folder = folderPath.toPath();
        Path resolved = folder.resolve(checkNotNull(file)).normalize();
        checkArgument(resolved.startsWith(folder) && !resolved.equals(folder),
                "File %s is outside of folder %s", file, name);
        return resolved.toFile();
    }

    @Override
    public String toString() {
        return name;
    }
}
