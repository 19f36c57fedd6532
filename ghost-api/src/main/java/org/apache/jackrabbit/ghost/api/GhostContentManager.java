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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import org.jetbrains.annotations.NotNull;

/**
 * Stores folders of text files on behalf of a hosting application.
 * <p>
 * A tracking implementation keeps the files in a database and records a
 * revision for every change. Revisions whose token is listed in the known
 * revisions manifest of a folder (see {@link #REVISIONS_FILE_NAME}) are
 * considered released; all others are pending and reported by
 * {@link #getPending()} and {@link #getPendingWithContent()}.
 * <p>
 * A non tracking implementation reads and writes the file system directly
 * and never reports pending revisions. Callers use both through this
 * interface and must not depend on which one is active.
 * <p>
 * Folders are passed as paths relative to the project location (or
 * absolute paths within it) and are normalized before use. File names are
 * relative to their folder and use {@code /} as separator.
 */
public interface GhostContentManager {

    /**
     * Name of the known revisions manifest, located in the root of a
     * registered folder. It contains one revision token per line. Blank lines
     * and lines starting with {@code #} are ignored.
     */
    String REVISIONS_FILE_NAME = ".ghost-revisions";

    /**
     * Registers a folder and reconciles the stored content with the file
     * system. Revisions listed in the manifest are dropped. If no pending
     * revisions remain, the stored files of the folder are replaced with the
     * files matching {@code globPattern}; otherwise the stored files are left
     * untouched.
     *
     * @param rootFolder the folder to register.
     * @param globPattern pattern selecting the files of the folder.
     * @throws GhostContentException of type {@code Manifest} if the manifest
     *          cannot be read, of type {@code Reconciliation} for any other
     *          failure.
     */
    void register(@NotNull String rootFolder, @NotNull String globPattern)
            throws GhostContentException;

    /**
     * Reads the content of a file.
     *
     * @throws GhostContentException of type {@code NotFound} if the file does
     *          not exist or was deleted.
     */
    @NotNull
    String read(@NotNull String folder, @NotNull String file)
            throws GhostContentException;

    /**
     * Writes the content of a file, creating it if needed. Writing content
     * equal to the current content does nothing.
     *
     * @throws GhostContentException of type {@code Transaction} if the change
     *          could not be committed. Nothing is changed in that case. Of
     *          type {@code Manifest} or {@code Storage} if the change was
     *          committed but the pending revisions of the folder could not be
     *          recomputed; the next {@link #refresh(String)} catches up.
     * @throws IllegalArgumentException if {@code file} resolves to a location
     *          outside of the folder.
     */
    void recordRevision(@NotNull String folder, @NotNull String file, @NotNull String content)
            throws GhostContentException;

    /**
     * Deletes a file.
     *
     * @throws GhostContentException of type {@code NotFound} if the file does
     *          not exist or was already deleted, of type {@code Transaction}
     *          if the change could not be committed. Of type {@code Manifest}
     *          or {@code Storage} if the change was committed but the pending
     *          revisions of the folder could not be recomputed.
     */
    void softDelete(@NotNull String folder, @NotNull String file)
            throws GhostContentException;

    /**
     * Lists the existing files of a folder.
     *
     * @return the file names, sorted.
     */
    @NotNull
    SortedSet<String> list(@NotNull String folder) throws GhostContentException;

    /**
     * Lists the existing files of a folder whose name ends with
     * {@code suffix}.
     *
     * @return the file names, sorted.
     */
    @NotNull
    SortedSet<String> list(@NotNull String folder, @NotNull String suffix)
            throws GhostContentException;

    /**
     * @return an immutable snapshot of the pending revisions, keyed by
     *          normalized folder name, most recent first. Folders without
     *          pending revisions are not contained.
     */
    @NotNull
    Map<String, List<RevisionInfo>> getPending();

    /**
     * @return for each folder with pending revisions, the current state of
     *          the affected files and the pending revision tokens.
     */
    @NotNull
    Map<String, PendingContent> getPendingWithContent() throws GhostContentException;

    /**
     * Recomputes the pending revisions of a folder. Mutations performed
     * through this instance refresh automatically; changes made by other
     * processes sharing the database require an explicit call.
     */
    void refresh(@NotNull String folder) throws GhostContentException;

    /**
     * Recomputes the pending revisions of all registered folders.
     */
    void refreshAll() throws GhostContentException;

    /**
     * @return the registered folders.
     */
    @NotNull
    Collection<FolderRegistration> getRegistrations();

    /**
     * @return {@code true} if this instance records revisions.
     */
    boolean isTracking();
}
