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
import static java.lang.String.format;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Exception thrown by the methods of {@link GhostContentManager}. The
 * {@link #getType() type} tells callers what failed so they can decide
 * whether to retry, alert or abort.
 */
public class GhostContentException extends Exception {

    /**
     * Source name for exceptions thrown by the ghost content store.
     */
    public static final String GHOST = "Ghost";

    /**
     * Type name for reads or deletes of a file that does not exist or was
     * deleted.
     */
    public static final String NOT_FOUND = "NotFound";

    /**
     * Type name for failures inside a mutating transaction, including
     * failures to commit or to roll back.
     */
    public static final String TRANSACTION = "Transaction";

    /**
     * Type name for failures reading the known revisions manifest of a
     * folder. A missing manifest is not a failure.
     */
    public static final String MANIFEST = "Manifest";

    /**
     * Type name for failures while reconciling a folder at registration.
     */
    public static final String RECONCILIATION = "Reconciliation";

    /**
     * Type name for failures of non mutating access to the underlying
     * database or file system.
     */
    public static final String STORAGE = "Storage";

    private static final long serialVersionUID = -3196523720404371385L;

    private final String source;

    private final String type;

    private final int code;

    public GhostContentException(
            @NotNull String source, @NotNull String type, int code,
            @NotNull String message, @Nullable Throwable cause) {
        super(format("%s%s%04d: %s", checkNotNull(source), checkNotNull(type), code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public GhostContentException(
            @NotNull String type, int code, @NotNull String message, @Nullable Throwable cause) {
        this(GHOST, type, code, message, cause);
    }

    public GhostContentException(@NotNull String type, int code, @NotNull String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    public boolean isNotFound() {
        return isOfType(NOT_FOUND);
    }

    public boolean isTransactionFailure() {
        return isOfType(TRANSACTION);
    }

    public boolean isManifestFailure() {
        return isOfType(MANIFEST);
    }

    public boolean isReconciliationFailure() {
        return isOfType(RECONCILIATION);
    }

    public boolean isStorageFailure() {
        return isOfType(STORAGE);
    }

    /**
     * Returns the name of the source of this exception.
     *
     * @return source name
     */
    @NotNull
    public String getSource() {
        return source;
    }

    /**
     * Return the name of the type of this exception.
     *
     * @return type name
     */
    @NotNull
    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }

}
