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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import org.jetbrains.annotations.NotNull;

/**
 * Maps folders given by callers to the name used as storage key. The name
 * is the path of the folder relative to the project location, with
 * {@code /} as separator and without leading or trailing slash.
 */
public final class FolderNormalizer {

    private static final CharMatcher SLASH = CharMatcher.is('/');

    private final Path projectLocation;

    public FolderNormalizer(@NotNull File projectLocation) {
        this.projectLocation = checkNotNull(projectLocation).toPath().toAbsolutePath().normalize();
    }

    @NotNull
    public File getProjectLocation() {
        return projectLocation.toFile();
    }

    /**
     * Normalizes a folder.
     *
     * @param rootFolder a folder relative to the project location, or an
     *                   absolute folder within it.
     * @return the normalized folder.
     * @throws IllegalArgumentException if the folder is outside the project
     *          location.
     */
    @NotNull
    public NormalizedFolder normalize(@NotNull String rootFolder) {
        checkNotNull(rootFolder);
        Path folderPath = projectLocation.resolve(rootFolder).normalize();
        checkArgument(folderPath.startsWith(projectLocation),
                "Folder %s is outside of the project location %s", rootFolder, projectLocation);
        String name = SLASH.trimFrom(Joiner.on('/').join(projectLocation.relativize(folderPath)));
        return new NormalizedFolder(name, folderPath.toFile());
    }
}
