package prayer.devotions_be.reminders;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import prayer.devotions_be.reminders.notification.NotificationChannel;
import prayer.devotions_be.web.ApiException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T14:00:00Z");

    @Mock
    private ReminderRepository repository;

    private ReminderService service;

    @BeforeEach
    void setUp() {
        service = new ReminderService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addNormalizesAndSchedules() {
        ReminderRequest request = new ReminderRequest("9:00", "morning", List.of("push", "EMAIL", "push"), "America/New_York", null);

        ReminderResponse response = service.add("user-1", request);

        ArgumentCaptor<Reminder> captor = ArgumentCaptor.forClass(Reminder.class);
        verify(repository).insert(captor.capture());
        Reminder stored = captor.getValue();
        assertEquals("user-1", stored.userId());
        assertEquals("09:00", stored.timeOfDay());
        assertEquals("America/New_York", stored.timezone());
        assertEquals(Devotion.MORNING, stored.devotion());
        assertEquals(List.of(NotificationChannel.PUSH, NotificationChannel.EMAIL), stored.methods());
        assertEquals(OffsetDateTime.parse("2025-06-01T14:00:00Z"), stored.createdAt());
        assertEquals(Instant.parse("2025-06-02T13:00:00Z"), stored.nextRunUtc());
        assertNull(stored.readingType());

        assertEquals(stored.id(), response.id());
        assertEquals("Morning Prayer", response.devotionName());
    }

    @Test
    void blankZoneDefaultsToUtcAndReadingTypeIsNormalized() {
        ReminderRequest request = new ReminderRequest("18:30", "evening", List.of("sms"), "", "Lectionary");

        ReminderResponse response = service.add("user-1", request);

        assertEquals("UTC", response.timezone());
        assertEquals("lectionary", response.readingType());
        assertEquals(Instant.parse("2025-06-01T18:30:00Z"), response.nextRunUtc());
    }

    @Test
    void addRejectsInvalidInput() {
        assertValidation("fields_required", new ReminderRequest("09:00", "morning", List.of(), "UTC", null));
        assertValidation("fields_required", new ReminderRequest(null, "morning", List.of("push"), "UTC", null));
        assertValidation("time_not_quarter_hour", new ReminderRequest("09:07", "morning", List.of("push"), "UTC", null));
        assertValidation("time_format_invalid", new ReminderRequest("25:00", "morning", List.of("push"), "UTC", null));
        assertValidation("timezone_invalid", new ReminderRequest("09:00", "morning", List.of("push"), "Nowhere/City", null));
        assertValidation("devotion_unknown", new ReminderRequest("09:00", "vespers", List.of("push"), "UTC", null));
        assertValidation("method_unknown", new ReminderRequest("09:00", "morning", List.of("pigeon"), "UTC", null));
        assertValidation("reading_type_unknown", new ReminderRequest("09:00", "morning", List.of("push"), "UTC", "audio"));
        verify(repository, never()).insert(any());
    }

    @Test
    void deleteMissingReminderIsNotFound() {
        when(repository.delete("user-1", "r-9")).thenReturn(false);

        ApiException ex = assertThrows(ApiException.class, () -> service.delete("user-1", "r-9"));
        assertEquals("NOT_FOUND", ex.getCode());
    }

    @Test
    void timezoneUpdateRecomputesEveryReminderAndContinuesAfterFailures() {
        Reminder morning = reminder("r-1", "09:00");
        Reminder evening = reminder("r-2", "18:00");
        Reminder night = reminder("r-3", "22:00");
        when(repository.findByUser("user-1")).thenReturn(List.of(morning, evening, night));
        when(repository.updateSchedule(eq("r-1"), anyString(), any())).thenReturn(true);
        when(repository.updateSchedule(eq("r-2"), anyString(), any())).thenThrow(new IllegalStateException("db down"));
        when(repository.updateSchedule(eq("r-3"), anyString(), any())).thenReturn(true);

        TimezoneUpdateResponse response = service.updateTimezone("user-1", "Europe/Prague");

        assertEquals("Europe/Prague", response.timezone());
        assertEquals(2, response.updated());
        assertEquals(1, response.failed());
        // 14:00Z is 16:00 in Prague, so 09:00 is tomorrow and 22:00 is today
        verify(repository).updateSchedule("r-1", "Europe/Prague", Instant.parse("2025-06-02T07:00:00Z"));
        verify(repository).updateSchedule("r-3", "Europe/Prague", Instant.parse("2025-06-01T20:00:00Z"));
    }

    @Test
    void timezoneUpdateRejectsUnknownZone() {
        ApiException ex = assertThrows(ApiException.class, () -> service.updateTimezone("user-1", "Moon/Base"));

        assertEquals("timezone_invalid", ex.getDetails());
        verify(repository, never()).findByUser(anyString());
    }

    private void assertValidation(String details, ReminderRequest request) {
        ApiException ex = assertThrows(ApiException.class, () -> service.add("user-1", request));
        assertEquals("VALIDATION", ex.getCode());
        assertEquals(details, ex.getDetails());
    }

    private static Reminder reminder(String id, String time) {
        return new Reminder(id, "user-1", time, "UTC", Devotion.EVENING, List.of(NotificationChannel.PUSH), null,
                OffsetDateTime.parse("2025-05-01T10:00:00Z"), Instant.parse("2025-06-02T00:00:00Z"));
    }
}
