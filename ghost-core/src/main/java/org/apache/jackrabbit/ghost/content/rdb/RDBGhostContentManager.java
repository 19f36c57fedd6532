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
package org.apache.jackrabbit.ghost.content.rdb;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.jackrabbit.ghost.api.GhostContentException.NOT_FOUND;
import static org.apache.jackrabbit.ghost.api.GhostContentException.RECONCILIATION;
import static org.apache.jackrabbit.ghost.api.GhostContentException.STORAGE;
import static org.apache.jackrabbit.ghost.api.GhostContentException.TRANSACTION;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

import javax.sql.DataSource;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.util.concurrent.Striped;
import org.apache.commons.io.FileUtils;
import org.apache.jackrabbit.ghost.api.FolderRegistration;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.apache.jackrabbit.ghost.api.PendingContent;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.apache.jackrabbit.ghost.content.AbstractGhostContentManager;
import org.apache.jackrabbit.ghost.content.FolderNormalizer;
import org.apache.jackrabbit.ghost.content.FolderScanner;
import org.apache.jackrabbit.ghost.content.KnownRevisions;
import org.apache.jackrabbit.ghost.content.NormalizedFolder;
import org.apache.jackrabbit.ghost.content.PendingRevisions;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link org.apache.jackrabbit.ghost.api.GhostContentManager} keeping the
 * files in a relational database and recording a revision for every change.
 * <p>
 * Changing a file and recording its revision happen in a single
 * transaction. Changes of the same file are serialized within this process;
 * the unique constraint on the content table covers concurrent writers in
 * other processes. Pending revisions are cached per instance and refreshed
 * after each change made through this instance.
 */
public class RDBGhostContentManager extends AbstractGhostContentManager {

    private static final Logger LOG = LoggerFactory.getLogger(RDBGhostContentManager.class);

    /**
     * Actor recorded on revisions unless configured otherwise.
     */
    public static final String DEFAULT_CREATED_BY = "admin";

    private static final int LOCK_STRIPES = 64;

    private final DataSource dataSource;

    private final ContentTable contentTable;

    private final RevisionLog revisionLog;

    private final String createdBy;

    private final PendingRevisions pendingRevisions = new PendingRevisions();

    private final Striped<Lock> fileLocks = Striped.lock(LOCK_STRIPES);

    /**
     * Orders reading the revision log of a folder and publishing its pending
     * revisions, so that the last publisher has seen every earlier commit.
     */
    private final Striped<Lock> folderLocks = Striped.lock(LOCK_STRIPES);

    public RDBGhostContentManager(@NotNull FolderNormalizer normalizer,
                                  @NotNull DataSource dataSource,
                                  @NotNull GhostTables tables,
                                  @NotNull String createdBy) {
        super(normalizer);
        this.dataSource = checkNotNull(dataSource);
        this.contentTable = new ContentTable(tables);
        this.revisionLog = new RevisionLog(tables);
        this.createdBy = checkNotNull(createdBy);
        LOG.info("Initialized ghost content manager for {} using tables {} and {}",
                normalizer.getProjectLocation(), tables.getContentTable(), tables.getRevisionsTable());
    }

    //-------------------------------------------------< reconciliation >

    @Override
    public void register(@NotNull String rootFolder, @NotNull final String globPattern)
            throws GhostContentException {
        final NormalizedFolder folder = normalize(rootFolder);
        track(folder, globPattern);
        LOG.debug("Adding folder {}", folder);

        final Set<String> knownRevisions = KnownRevisions.read(folder);
        Lock lock = folderLocks.get(folder.getName());
        lock.lock();
        try {
            List<RevisionInfo> pending = inTransaction(RECONCILIATION, 1, "reconcile folder " + folder,
                    new ConnectionCallback<List<RevisionInfo>>() {
                @Override
                public List<RevisionInfo> run(Connection connection) throws SQLException, GhostContentException {
                    return reconcile(connection, folder, globPattern, knownRevisions);
                }
            });
            pendingRevisions.put(folder.getName(), pending);
        } finally {
            lock.unlock();
        }
    }

    private List<RevisionInfo> reconcile(Connection connection, NormalizedFolder folder,
                                         String globPattern, Set<String> knownRevisions)
            throws SQLException, GhostContentException {
        List<RevisionInfo> released = new ArrayList<RevisionInfo>();
        List<RevisionInfo> pending = new ArrayList<RevisionInfo>();
        for (RevisionInfo revision : revisionLog.findByFolder(connection, folder.getName())) {
            if (knownRevisions.contains(revision.getRevision())) {
                released.add(revision);
            } else {
                pending.add(revision);
            }
        }

        if (!released.isEmpty()) {
            LOG.debug("{}: deleting {} known revision(s)", folder, released.size());
            List<Long> ids = new ArrayList<Long>(released.size());
            for (RevisionInfo revision : released) {
                ids.add(revision.getId());
            }
            revisionLog.delete(connection, ids);
        }

        if (!pending.isEmpty()) {
            LOG.debug("{}: {} pending revision(s), keeping stored content", folder, pending.size());
            return pending;
        }

        LOG.debug("{} has no pending revisions, updating from the file system", folder);
        SortedSet<String> files = FolderScanner.glob(folder.getFolderPath(), globPattern);
        for (String file : files) {
            contentTable.upsert(connection, folder.getName(), file, readFile(folder, file));
        }
        List<Long> removed = contentTable.findOthers(connection, folder.getName(), files);
        if (!removed.isEmpty()) {
            revisionLog.deleteByContent(connection, removed);
            contentTable.delete(connection, removed);
        }
        LOG.debug("{}: imported {} file(s), removed {} file(s)", folder, files.size(), removed.size());
        return pending;
    }

    private static String readFile(NormalizedFolder folder, String file) throws GhostContentException {
        File source = folder.resolve(file);
        try {
            return FileUtils.readFileToString(source, UTF_8);
        } catch (IOException e) {
            throw new GhostContentException(RECONCILIATION, 2, "Unable to read " + source, e);
        }
    }

    //-------------------------------------------------< content access >

    @NotNull
    @Override
    public String read(@NotNull String folder, @NotNull final String file) throws GhostContentException {
        final NormalizedFolder f = normalize(folder);
        return withConnection(STORAGE, 1, "read " + file + " in folder " + f, new ConnectionCallback<String>() {
            @Override
            public String run(Connection connection) throws SQLException, GhostContentException {
                ContentEntry entry = contentTable.find(connection, f.getName(), file);
                if (entry == null || entry.isDeleted()) {
                    throw notFound(f, file);
                }
                return entry.getContent();
            }
        });
    }

    @Override
    public void recordRevision(@NotNull String folder, @NotNull final String file, @NotNull final String content)
            throws GhostContentException {
        checkNotNull(content);
        final NormalizedFolder f = normalize(folder);
        f.resolve(file);
        boolean changed;
        Lock lock = fileLocks.get(lockKey(f, file));
        lock.lock();
        try {
            changed = inTransaction(TRANSACTION, 1, "record revision of " + file + " in folder " + f,
                    new ConnectionCallback<Boolean>() {
                @Override
                public Boolean run(Connection connection) throws SQLException {
                    ContentEntry entry = contentTable.find(connection, f.getName(), file);
                    if (entry != null && entry.hasContent(content)) {
                        return false;
                    }
                    long id = contentTable.upsert(connection, f.getName(), file, content);
                    revisionLog.append(connection, id, newRevision(), System.currentTimeMillis(), createdBy);
                    return true;
                }
            });
        } finally {
            lock.unlock();
        }
        if (changed) {
            refresh(f);
        } else {
            LOG.trace("Content of {} in folder {} is unchanged", file, f);
        }
    }

    @Override
    public void softDelete(@NotNull String folder, @NotNull final String file) throws GhostContentException {
        final NormalizedFolder f = normalize(folder);
        Lock lock = fileLocks.get(lockKey(f, file));
        lock.lock();
        try {
            inTransaction(TRANSACTION, 2, "delete " + file + " in folder " + f, new ConnectionCallback<Void>() {
                @Override
                public Void run(Connection connection) throws SQLException, GhostContentException {
                    ContentEntry entry = contentTable.find(connection, f.getName(), file);
                    if (entry == null || entry.isDeleted()) {
                        throw notFound(f, file);
                    }
                    contentTable.markDeleted(connection, entry.getId());
                    revisionLog.append(connection, entry.getId(), newRevision(),
                            System.currentTimeMillis(), createdBy);
                    return null;
                }
            });
        } finally {
            lock.unlock();
        }
        refresh(f);
    }

    @NotNull
    @Override
    public SortedSet<String> list(@NotNull String folder, @NotNull final String suffix)
            throws GhostContentException {
        checkNotNull(suffix);
        final NormalizedFolder f = normalize(folder);
        return withConnection(STORAGE, 2, "list folder " + f, new ConnectionCallback<SortedSet<String>>() {
            @Override
            public SortedSet<String> run(Connection connection) throws SQLException {
                return contentTable.listFiles(connection, f.getName(), suffix);
            }
        });
    }

    //-------------------------------------------------< pending revisions >

    @NotNull
    @Override
    public Map<String, List<RevisionInfo>> getPending() {
        return pendingRevisions.snapshot();
    }

    @NotNull
    @Override
    public Map<String, PendingContent> getPendingWithContent() throws GhostContentException {
        final Map<String, List<RevisionInfo>> pending = pendingRevisions.snapshot();
        if (pending.isEmpty()) {
            return ImmutableMap.of();
        }
        return withConnection(STORAGE, 3, "read pending content",
                new ConnectionCallback<Map<String, PendingContent>>() {
            @Override
            public Map<String, PendingContent> run(Connection connection) throws SQLException {
                ImmutableSortedMap.Builder<String, PendingContent> result = ImmutableSortedMap.naturalOrder();
                for (Map.Entry<String, List<RevisionInfo>> entry : pending.entrySet()) {
                    Set<String> files = new TreeSet<String>();
                    Set<String> revisions = new LinkedHashSet<String>();
                    for (RevisionInfo revision : entry.getValue()) {
                        files.add(revision.getFile());
                        revisions.add(revision.getRevision());
                    }
                    result.put(entry.getKey(), new PendingContent(
                            contentTable.read(connection, entry.getKey(), files), revisions));
                }
                return result.build();
            }
        });
    }

    @Override
    public void refresh(@NotNull String folder) throws GhostContentException {
        refresh(normalize(folder));
    }

    @Override
    public void refreshAll() throws GhostContentException {
        GhostContentException failure = null;
        for (FolderRegistration registration : getRegistrations()) {
            try {
                refresh(normalize(registration.getFolderPath().getPath()));
            } catch (GhostContentException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public boolean isTracking() {
        return true;
    }

    /**
     * Recomputes the pending revisions of a folder: all revisions in the log
     * whose token is not listed in the known revisions manifest.
     */
    private void refresh(final NormalizedFolder folder) throws GhostContentException {
        final Set<String> knownRevisions = KnownRevisions.read(folder);
        Lock lock = folderLocks.get(folder.getName());
        lock.lock();
        try {
            List<RevisionInfo> pending = withConnection(STORAGE, 4, "refresh folder " + folder,
                    new ConnectionCallback<List<RevisionInfo>>() {
                @Override
                public List<RevisionInfo> run(Connection connection) throws SQLException {
                    List<RevisionInfo> result = new ArrayList<RevisionInfo>();
                    for (RevisionInfo revision : revisionLog.findByFolder(connection, folder.getName())) {
                        if (!knownRevisions.contains(revision.getRevision())) {
                            result.add(revision);
                        }
                    }
                    return result;
                }
            });
            pendingRevisions.put(folder.getName(), pending);
        } finally {
            lock.unlock();
        }
    }

    //-------------------------------------------------< internal >

    private interface ConnectionCallback<T> {
        T run(Connection connection) throws SQLException, GhostContentException;
    }

    /**
     * Runs {@code body} in a transaction on a fresh connection. The
     * transaction is committed if the body returns normally and rolled back
     * otherwise.
     */
    private <T> T inTransaction(String type, int code, String description, ConnectionCallback<T> body)
            throws GhostContentException {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = body.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | GhostContentException | RuntimeException e) {
                rollback(connection, e, description);
                throw e;
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        } catch (SQLException e) {
            throw new GhostContentException(type, code, "Unable to " + description, e);
        }
    }

    /**
     * Runs {@code body} on a fresh connection without a transaction.
     */
    private <T> T withConnection(String type, int code, String description, ConnectionCallback<T> body)
            throws GhostContentException {
        try (Connection connection = dataSource.getConnection()) {
            return body.run(connection);
        } catch (SQLException e) {
            throw new GhostContentException(type, code, "Unable to " + description, e);
        }
    }

    private static void rollback(Connection connection, Exception cause, String description) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed after error while trying to {}", description, e);
            cause.addSuppressed(e);
        }
    }

    private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.warn("Unable to reset auto commit on connection", e);
        }
    }

    private static GhostContentException notFound(NormalizedFolder folder, String file) {
        return new GhostContentException(NOT_FOUND, 1,
                "Unable to find file " + file + " in folder " + folder.getName());
    }

    private static String lockKey(NormalizedFolder folder, String file) {
        return folder.getName() + '/' + file;
    }

    private static String newRevision() {
        return UUID.randomUUID().toString();
    }
}
