package me.golemcore.mscbot.auto;

import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.domain.model.ScheduleEntry;
import me.golemcore.mscbot.domain.service.RoomSettingsService;
import me.golemcore.mscbot.domain.service.SummaryScheduleService;
import me.golemcore.mscbot.domain.service.SummaryService;
import me.golemcore.mscbot.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SummarySchedulerTest {

    private static final String ROOM_A = "!a:example.org";
    private static final String ROOM_B = "!b:example.org";

    private SummaryScheduleService summaryScheduleService;
    private SummaryService summaryService;
    private RoomSettingsService roomSettingsService;
    private ChannelPort channel;
    private SummaryScheduler scheduler;

    @BeforeEach
    void setUp() {
        summaryScheduleService = mock(SummaryScheduleService.class);
        summaryService = mock(SummaryService.class);
        roomSettingsService = mock(RoomSettingsService.class);
        channel = mock(ChannelPort.class);
        when(channel.isRunning()).thenReturn(true);
        when(channel.getChannelType()).thenReturn("matrix");
        when(roomSettingsService.getSettings(anyString())).thenReturn(new RoomSettings());
        scheduler = new SummaryScheduler(summaryScheduleService, summaryService, roomSettingsService,
                List.of(channel));
    }

    private static ScheduleEntry entry(String roomId) {
        return ScheduleEntry.builder().roomId(roomId).build();
    }

    @Test
    void shouldArmTriggersFromStoredSettings() {
        Map<String, RoomSettings> rooms = Map.of(ROOM_A, new RoomSettings());
        when(roomSettingsService.getAllRooms()).thenReturn(rooms);

        scheduler.init();

        verify(summaryScheduleService).armAtStartup(rooms);
    }

    @Test
    void shouldDoNothingWhenNothingIsDue() {
        when(summaryScheduleService.getDueEntries()).thenReturn(List.of());

        assertEquals(0, scheduler.runPending());

        verify(summaryService, never()).buildSummary(anyString());
    }

    @Test
    void shouldSendDueSummariesAndRecordExecution() {
        when(summaryScheduleService.getDueEntries()).thenReturn(List.of(entry(ROOM_A)));
        when(summaryService.buildSummary(ROOM_A)).thenReturn("summary");

        assertEquals(1, scheduler.runPending());

        verify(channel).sendMessage(ROOM_A, "summary");
        verify(summaryScheduleService).recordExecution(ROOM_A);
    }

    @Test
    void shouldSkipFailedSummaryAndContinue() {
        when(summaryScheduleService.getDueEntries()).thenReturn(List.of(entry(ROOM_A), entry(ROOM_B)));
        when(summaryService.buildSummary(ROOM_A)).thenThrow(new IllegalStateException("tracker down"));
        when(summaryService.buildSummary(ROOM_B)).thenReturn("summary");

        assertEquals(1, scheduler.runPending());

        verify(channel, never()).sendMessage(ROOM_A, "summary");
        verify(channel).sendMessage(ROOM_B, "summary");
        verify(summaryScheduleService).recordExecution(ROOM_A);
        verify(summaryScheduleService).recordExecution(ROOM_B);
    }

    @Test
    void shouldSkipRoomWithSummariesDisabled() {
        when(summaryScheduleService.getDueEntries()).thenReturn(List.of(entry(ROOM_A)));
        when(roomSettingsService.getSettings(ROOM_A))
                .thenReturn(RoomSettings.builder().summaryEnabled(false).build());

        assertEquals(0, scheduler.runPending());

        verify(summaryService, never()).buildSummary(ROOM_A);
        verify(summaryScheduleService).recordExecution(ROOM_A);
    }

    @Test
    void shouldNotSendWithoutRunningChannel() {
        when(channel.isRunning()).thenReturn(false);
        when(summaryScheduleService.getDueEntries()).thenReturn(List.of(entry(ROOM_A)));
        when(summaryService.buildSummary(ROOM_A)).thenReturn("summary");

        assertEquals(0, scheduler.runPending());

        verify(channel, never()).sendMessage(anyString(), anyString());
    }
}
