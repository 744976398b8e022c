package me.golemcore.mscbot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mscbot.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mscbot.domain.model.RoomSettingKey;
import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomSettingsServiceTest {

    private static final String ROOM = "!room:example.org";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private LocalStorageAdapter storage;
    private RoomSettingsService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        service = newService();
        service.load();
    }

    private RoomSettingsService newService() {
        return new RoomSettingsService(storage, new ObjectMapper(), properties);
    }

    private Path roomDataFile() {
        return tempDir.resolve("rooms").resolve("room_data.json");
    }

    @Test
    void shouldReturnEmptySettingsForUnknownRoom() {
        RoomSettings settings = service.getSettings(ROOM);

        assertTrue(settings.summariesEnabled());
        assertFalse(settings.hasPriorityMscs());
        assertTrue(service.get(ROOM, RoomSettingKey.SUMMARY_TIME).isEmpty());
    }

    @Test
    void shouldMergeUpdatesIdempotently() {
        RoomSettings patch = RoomSettings.builder().summaryTime("08:00").build();

        service.update(ROOM, patch);
        service.update(ROOM, patch);
        service.update(ROOM, RoomSettings.builder().summaryContent("fcp").build());

        RoomSettings settings = service.getSettings(ROOM);
        assertEquals("08:00", settings.getSummaryTime());
        assertEquals("fcp", settings.getSummaryContent());
        assertEquals(1, service.getAllRooms().size());
    }

    @Test
    void shouldNotExposeInternalState() {
        service.update(ROOM, RoomSettings.builder().summaryTime("08:00").build());

        service.getSettings(ROOM).setSummaryTime("09:00");

        assertEquals("08:00", service.getSettings(ROOM).getSummaryTime());
    }

    @Test
    void shouldReloadPersistedSettings() {
        service.update(ROOM, RoomSettings.builder().priorityMscs(List.of(123, 456)).summaryEnabled(false).build());

        RoomSettingsService reloaded = newService();
        reloaded.load();

        RoomSettings settings = reloaded.getSettings(ROOM);
        assertEquals(List.of(123, 456), settings.getPriorityMscs());
        assertFalse(settings.summariesEnabled());
    }

    @Test
    void shouldWriteSnakeCaseKeys() throws IOException {
        service.update(ROOM, RoomSettings.builder().summaryTime("08:00").build());

        String json = Files.readString(roomDataFile(), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"summary_time\":\"08:00\""));
        assertFalse(json.contains("priority_mscs"));
    }

    @Test
    void shouldKeepPreviousRevisionAsBackup() throws IOException {
        service.update(ROOM, RoomSettings.builder().summaryTime("08:00").build());
        service.update(ROOM, RoomSettings.builder().summaryTime("09:00").build());

        Path backup = roomDataFile().resolveSibling("room_data.json.bak");
        assertTrue(Files.exists(backup));
        assertTrue(Files.readString(backup, StandardCharsets.UTF_8).contains("08:00"));
        assertTrue(Files.readString(roomDataFile(), StandardCharsets.UTF_8).contains("09:00"));
    }

    @Test
    void shouldDeleteSingleKey() {
        service.update(ROOM, RoomSettings.builder().summaryTime("08:00").priorityMscs(List.of(1)).build());

        service.delete(ROOM, RoomSettingKey.PRIORITY_MSCS);

        assertEquals(Optional.empty(), service.get(ROOM, RoomSettingKey.PRIORITY_MSCS));
        assertEquals(Optional.of("08:00"), service.get(ROOM, RoomSettingKey.SUMMARY_TIME));
    }

    @Test
    void shouldIgnoreDeleteForUnknownRoom() {
        service.delete(ROOM, RoomSettingKey.SUMMARY_TIME);

        assertTrue(service.getAllRooms().isEmpty());
        assertFalse(Files.exists(roomDataFile()));
    }

    @Test
    void shouldFailOnMalformedFile() throws IOException {
        Files.writeString(roomDataFile(), "{not json", StandardCharsets.UTF_8);

        RoomSettingsService broken = newService();

        assertThrows(IllegalStateException.class, broken::load);
    }

    @Test
    void shouldStartEmptyWithoutFile() {
        assertTrue(service.getAllRooms().isEmpty());
        assertNull(service.getSettings(ROOM).getSummaryTime());
    }
}
