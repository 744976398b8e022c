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

package me.golemcore.mscbot.domain.service;

import me.golemcore.mscbot.domain.model.RoomSettingKey;
import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-room settings store backed by a single JSON file.
 *
 * <p>
 * The in-memory map is authoritative. Every mutation rewrites the whole map to
 * disk, keeping the previous file as {@code .bak}; a failed write is logged and
 * retried implicitly by the next mutation. At startup a persisted snapshot, if
 * present, replaces the map entirely. A snapshot that cannot be parsed aborts
 * startup.
 */
@Service
@Slf4j
public class RoomSettingsService {

    private static final TypeReference<LinkedHashMap<String, RoomSettings>> ROOM_MAP_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String fileName;

    private Map<String, RoomSettings> rooms = new LinkedHashMap<>();

    public RoomSettingsService(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getRoomDataDirectory();
        this.fileName = properties.getStorage().getRoomDataFile();
    }

    /**
     * Replace the in-memory map with the persisted snapshot, if one exists.
     *
     * @throws IllegalStateException
     *             if the snapshot exists but is not a valid room map
     */
    @PostConstruct
    public void load() {
        String json = storagePort.getText(directory, fileName).join();
        if (json == null || json.isBlank()) {
            log.info("[Settings] No room data at {}/{}, starting empty", directory, fileName);
            return;
        }
        try {
            Map<String, RoomSettings> loaded = objectMapper.readValue(json, ROOM_MAP_TYPE_REF);
            rooms = loaded != null ? loaded : new LinkedHashMap<>();
            log.info("[Settings] Loaded settings for {} rooms", rooms.size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed room data file " + directory + "/" + fileName, e);
        }
    }

    /**
     * Settings of a room, or empty settings if the room never stored any. The
     * returned instance is a copy.
     */
    public RoomSettings getSettings(String roomId) {
        RoomSettings settings = rooms.get(roomId);
        return settings != null ? settings.copy() : new RoomSettings();
    }

    /**
     * Value of a single key, if the room has it set.
     */
    public Optional<Object> get(String roomId, RoomSettingKey key) {
        RoomSettings settings = rooms.get(roomId);
        if (settings == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(key.read(settings));
    }

    /**
     * Merge the non-null fields of {@code patch} into the room's settings,
     * creating the room entry on first write, then persist.
     */
    public void update(String roomId, RoomSettings patch) {
        rooms.computeIfAbsent(roomId, id -> new RoomSettings()).merge(patch);
        log.debug("[Settings] Updated room {}: {}", roomId, patch);
        persist();
    }

    /**
     * Clear one key of a room, leaving the (possibly empty) room entry in place.
     */
    public void delete(String roomId, RoomSettingKey key) {
        RoomSettings settings = rooms.get(roomId);
        if (settings == null) {
            log.warn("[Settings] Tried to delete key {} of unknown room {}", key, roomId);
            return;
        }
        key.clear(settings);
        log.debug("[Settings] Cleared {} for room {}", key, roomId);
        persist();
    }

    /**
     * Read-only view of every room's settings, in insertion order.
     */
    public Map<String, RoomSettings> getAllRooms() {
        return Collections.unmodifiableMap(rooms);
    }

    private void persist() {
        try {
            String json = objectMapper.writeValueAsString(rooms);
            storagePort.putTextWithBackup(directory, fileName, json).join();
        } catch (Exception e) { // NOSONAR - in-memory state stays authoritative
            log.warn("[Settings] Unable to save room data to disk: {}", e.getMessage(), e);
        }
    }
}
