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

import java.util.Collection;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.ghost.api.FolderRegistration;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.apache.jackrabbit.ghost.api.GhostContentManager;
import org.jetbrains.annotations.NotNull;

/**
 * Base class for {@link GhostContentManager} implementations. Keeps track of
 * the registered folders.
 */
public abstract class AbstractGhostContentManager implements GhostContentManager {

    private final FolderNormalizer normalizer;

    private final ConcurrentMap<String, FolderRegistration> registrations =
            new ConcurrentSkipListMap<String, FolderRegistration>();

    protected AbstractGhostContentManager(@NotNull FolderNormalizer normalizer) {
        this.normalizer = checkNotNull(normalizer);
    }

    @NotNull
    protected NormalizedFolder normalize(@NotNull String folder) {
        return normalizer.normalize(folder);
    }

    /**
     * Records the registration of a folder. Registering the same folder
     * again replaces the previous registration.
     */
    @NotNull
    protected FolderRegistration track(@NotNull NormalizedFolder folder, @NotNull String globPattern) {
        FolderRegistration registration = new FolderRegistration(
                folder.getName(), folder.getFolderPath(), checkNotNull(globPattern));
        registrations.put(folder.getName(), registration);
        return registration;
    }

    @NotNull
    @Override
    public SortedSet<String> list(@NotNull String folder) throws GhostContentException {
        return list(folder, "");
    }

    @NotNull
    @Override
    public Collection<FolderRegistration> getRegistrations() {
        return ImmutableList.copyOf(registrations.values());
    }
}
