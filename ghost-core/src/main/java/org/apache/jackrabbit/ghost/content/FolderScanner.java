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

import java.io.File;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

import com.google.common.base.Joiner;
import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;
import org.jetbrains.annotations.NotNull;

/**
 * Enumerates the files of a folder. Names are relative to the folder and use
 * {@code /} as separator. Files and directories whose name starts with a dot
 * are skipped.
 */
public final class FolderScanner {

    private static final String ANY_DIRECTORY_PREFIX = "**/";

    private static final Traverser<File> TRAVERSER = Traverser.forTree(new FileSystemTree());

    private FolderScanner() {
    }

    /**
     * Returns the files of {@code folder} matching a glob pattern. A pattern
     * starting with {@code **}{@code /} also matches files located directly
     * in the folder.
     *
     * @param folder the folder to scan. A missing folder has no files.
     * @param globPattern the pattern, in {@link java.nio.file.FileSystem#getPathMatcher(String)}
     *                    glob syntax.
     * @return the matching file names, sorted.
     */
    @NotNull
    public static SortedSet<String> glob(@NotNull File folder, @NotNull String globPattern) {
        final PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        final PathMatcher topLevel = globPattern.startsWith(ANY_DIRECTORY_PREFIX)
                ? FileSystems.getDefault().getPathMatcher(
                        "glob:" + globPattern.substring(ANY_DIRECTORY_PREFIX.length()))
                : matcher;
        return scan(folder, name -> {
            Path path = Paths.get(name);
            return matcher.matches(path) || topLevel.matches(path);
        });
    }

    /**
     * Returns the files of {@code folder} whose name ends with
     * {@code suffix}.
     */
    @NotNull
    public static SortedSet<String> withSuffix(@NotNull File folder, @NotNull String suffix) {
        checkNotNull(suffix);
        return scan(folder, name -> name.endsWith(suffix));
    }

    private static SortedSet<String> scan(File folder, Predicate<String> filter) {
        SortedSet<String> files = new TreeSet<String>();
        if (!folder.isDirectory()) {
            return files;
        }
        Path root = folder.toPath();
        for (File file : TRAVERSER.depthFirstPreOrder(folder)) {
            if (file.isFile()) {
                String name = Joiner.on('/').join(root.relativize(file.toPath()));
                if (filter.test(name)) {
                    files.add(name);
                }
            }
        }
        return files;
    }

    private static class FileSystemTree implements SuccessorsFunction<File> {
        @Override
        public @NotNull Iterable<? extends File> successors(File file) {
            if (!file.isDirectory()) {
                return Set.of();
            }
            File[] children = file.listFiles(child -> !child.getName().startsWith("."));
            if (children == null || children.length == 0) {
                return Set.of();
            }
            return Arrays.asList(children);
        }
    }
}
