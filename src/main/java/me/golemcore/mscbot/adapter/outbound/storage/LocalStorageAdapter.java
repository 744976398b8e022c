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

package me.golemcore.mscbot.adapter.outbound.storage;

import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.mscbot}. Operations complete synchronously on the
 * calling thread; the bot loop is single-threaded and the files are small.
 *
 * @see me.golemcore.mscbot.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(properties.getStorage().getRoomDataDirectory()));
            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        try {
            Path filePath = resolvePath(directory, path);
            createParent(filePath);
            Files.writeString(filePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Failed to write file: " + directory + "/" + path, e));
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        try {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.completedFuture(Files.readString(filePath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Failed to read file: " + directory + "/" + path, e));
        }
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> putTextWithBackup(String directory, String path, String content) {
        Path targetPath = resolvePath(directory, path);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

        try {
            createParent(targetPath);
            Files.writeString(tempPath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);

            if (Files.exists(targetPath)) {
                try {
                    Files.move(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Previous revision kept at: {}", backupPath);
                } catch (IOException e) {
                    log.warn("[Storage] Could not keep backup {}: {}", backupPath, e.getMessage());
                }
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }

            log.debug("[Storage] Write completed: {}/{}", directory, path);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Write failed: " + directory + "/" + path, e));
        }
    }

    private void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
