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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.jackrabbit.ghost.api.GhostContentException.NOT_FOUND;
import static org.apache.jackrabbit.ghost.api.GhostContentException.STORAGE;
import static org.apache.jackrabbit.ghost.api.GhostContentException.TRANSACTION;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.io.FileUtils;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.apache.jackrabbit.ghost.api.PendingContent;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link org.apache.jackrabbit.ghost.api.GhostContentManager} passing all
 * calls to the file system. It records no revisions and is used when
 * tracking is disabled, typically during development.
 */
public class TransparentGhostContentManager extends AbstractGhostContentManager {

    private static final Logger LOG = LoggerFactory.getLogger(TransparentGhostContentManager.class);

    public TransparentGhostContentManager(@NotNull FolderNormalizer normalizer) {
        super(normalizer);
        LOG.info("Initialized transparent ghost content manager for {}", normalizer.getProjectLocation());
    }

    @Override
    public void register(@NotNull String rootFolder, @NotNull String globPattern) {
        NormalizedFolder folder = normalize(rootFolder);
        track(folder, globPattern);
        LOG.debug("Registered folder {}, nothing to reconcile", folder);
    }

    @NotNull
    @Override
    public String read(@NotNull String folder, @NotNull String file) throws GhostContentException {
        NormalizedFolder f = normalize(folder);
        File target = f.resolve(file);
        try {
            return FileUtils.readFileToString(target, UTF_8);
        } catch (FileNotFoundException | NoSuchFileException e) {
            throw notFound(f, file, e);
        } catch (IOException e) {
            throw new GhostContentException(STORAGE, 1, "Unable to read " + target, e);
        }
    }

    @Override
    public void recordRevision(@NotNull String folder, @NotNull String file, @NotNull String content)
            throws GhostContentException {
        checkNotNull(content);
        File target = normalize(folder).resolve(file);
        try {
            FileUtils.writeStringToFile(target, content, UTF_8);
        } catch (IOException e) {
            throw new GhostContentException(TRANSACTION, 1, "Unable to write " + target, e);
        }
    }

    @Override
    public void softDelete(@NotNull String folder, @NotNull String file) throws GhostContentException {
        NormalizedFolder f = normalize(folder);
        File target = f.resolve(file);
        try {
            Files.delete(target.toPath());
        } catch (NoSuchFileException e) {
            throw notFound(f, file, e);
        } catch (IOException e) {
            throw new GhostContentException(TRANSACTION, 2, "Unable to delete " + target, e);
        }
    }

    @NotNull
    @Override
    public SortedSet<String> list(@NotNull String folder, @NotNull String suffix) {
        return FolderScanner.withSuffix(normalize(folder).getFolderPath(), suffix);
    }

    @NotNull
    @Override
    public Map<String, List<RevisionInfo>> getPending() {
        return ImmutableMap.of();
    }

    @NotNull
    @Override
    public Map<String, PendingContent> getPendingWithContent() {
        return ImmutableMap.of();
    }

    @Override
    public void refresh(@NotNull String folder) {
        // no revisions
    }

    @Override
    public void refreshAll() {
        // no revisions
    }

    @Override
    public boolean isTracking() {
        return false;
    }

    private static GhostContentException notFound(NormalizedFolder folder, String file, IOException cause) {
        return new GhostContentException(NOT_FOUND, 1,
                "Unable to find file " + file + " in folder " + folder.getName(), cause);
    }
}
