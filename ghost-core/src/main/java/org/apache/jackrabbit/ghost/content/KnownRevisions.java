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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.jackrabbit.ghost.api.GhostContentException.MANIFEST;
import static org.apache.jackrabbit.ghost.api.GhostContentManager.REVISIONS_FILE_NAME;

import java.io.File;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.LineProcessor;
import com.google.common.io.MoreFiles;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.jetbrains.annotations.NotNull;

/**
 * Reads the known revisions manifest of a folder. The manifest is produced
 * by the release process and never written here.
 */
public final class KnownRevisions {

    private static final String COMMENT_PREFIX = "#";

    private KnownRevisions() {
    }

    /**
     * Reads the revision tokens listed in the manifest of the given folder.
     *
     * @param folder the folder.
     * @return the tokens; empty if the folder has no manifest.
     * @throws GhostContentException of type {@code Manifest} if the manifest
     *          exists but cannot be read.
     */
    @NotNull
    public static Set<String> read(@NotNull NormalizedFolder folder) throws GhostContentException {
        File manifest = folder.resolve(REVISIONS_FILE_NAME);
        try {
            return MoreFiles.asCharSource(manifest.toPath(), UTF_8).readLines(new LineProcessor<Set<String>>() {

                private final ImmutableSet.Builder<String> tokens = ImmutableSet.builder();

                @Override
                public boolean processLine(@NotNull String line) {
                    String token = line.trim();
                    if (!token.isEmpty() && !token.startsWith(COMMENT_PREFIX)) {
                        tokens.add(token);
                    }
                    return true;
                }

                @Override
                public Set<String> getResult() {
                    return tokens.build();
                }
            });
        } catch (NoSuchFileException e) {
            return ImmutableSet.of();
        } catch (IOException e) {
            throw new GhostContentException(MANIFEST, 1,
                    "Unable to read known revisions of folder " + folder.getName() + " from " + manifest, e);
        }
    }
}
