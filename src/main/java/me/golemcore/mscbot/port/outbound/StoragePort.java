/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mscbot.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage within the local data directory.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, completing with {@code null} if it does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Replace a file while keeping its previous revision.
     *
     * <p>
     * The current file, if any, is renamed to {@code <path>.bak}; then the new
     * content is written to a temporary sibling and moved into place.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextWithBackup(String directory, String path, String content);
}
