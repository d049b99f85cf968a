package prayer.devotions_be.reminders;

import prayer.devotions_be.reminders.notification.NotificationChannel;
import prayer.devotions_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Reminder management for a single user: validation, persistence and rescheduling on zone changes.
 */
@Service
public class ReminderService {
    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    public static final String READING_TYPE_LECTIONARY = "lectionary";
    public static final String READING_TYPE_BIBLE_IN_A_YEAR = "bible_in_a_year";
    private static final Set<String> READING_TYPES = Set.of(READING_TYPE_LECTIONARY, READING_TYPE_BIBLE_IN_A_YEAR);

    private final ReminderRepository repository;
    private final Clock clock;

    public ReminderService(ReminderRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public ReminderResponse add(String userId, ReminderRequest request) {
        requireUser(userId);
        if (request == null) {
            throw ApiException.validation("Request body is required.", "body_required");
        }
        if (request.time() == null || request.time().isBlank()
                || request.devotion() == null || request.devotion().isBlank()
                || request.methods() == null || request.methods().isEmpty()) {
            throw ApiException.validation("Time, devotion and at least one method are required.", "fields_required");
        }
        LocalTime time = ReminderTimeValidator.requireQuarterHour(request.time());
        ZoneId zone = ReminderTimeValidator.requireZone(request.timezone());
        Devotion devotion = Devotion.fromCode(request.devotion())
                .orElseThrow(() -> ApiException.validation("Unknown devotion '" + request.devotion() + "'.", "devotion_unknown"));
        List<NotificationChannel> methods = parseMethods(request.methods());
        String readingType = normalizeReadingType(request.readingType());

        Instant now = clock.instant();
        Reminder reminder = new Reminder(
                UUID.randomUUID().toString(),
                userId,
                ReminderTimeValidator.format(time),
                zone.getId(),
                devotion,
                methods,
                readingType,
                OffsetDateTime.ofInstant(now, ZoneOffset.UTC),
                ReminderScheduler.calculateNextRun(time, zone, now));
        repository.insert(reminder);
        log.info("Reminder created id={} user={} devotion={} time={} zone={} nextRun={}",
                reminder.id(), userId, devotion.code(), reminder.timeOfDay(), reminder.timezone(), reminder.nextRunUtc());
        return ReminderResponse.from(reminder);
    }

    public List<ReminderResponse> list(String userId) {
        requireUser(userId);
        return repository.findByUser(userId).stream()
                .map(ReminderResponse::from)
                .toList();
    }

    @Transactional
    public void delete(String userId, String reminderId) {
        requireUser(userId);
        if (!repository.delete(userId, reminderId)) {
            throw ApiException.notFound("Reminder not found.", "reminder");
        }
        log.info("Reminder deleted id={} user={}", reminderId, userId);
    }

    /**
     * Moves every reminder of the user to {@code timezone}, keeping the wall-clock time.
     * A reminder that cannot be rescheduled is counted as failed and the rest continue.
     */
    public TimezoneUpdateResponse updateTimezone(String userId, String timezone) {
        requireUser(userId);
        ZoneId zone = ReminderTimeValidator.requireZone(timezone);
        List<Reminder> reminders = repository.findByUser(userId);
        Instant now = clock.instant();
        int updated = 0;
        int failed = 0;
        for (Reminder reminder : reminders) {
            try {
                Instant nextRun = ReminderScheduler.calculateNextRun(
                        ReminderTimeValidator.parse(reminder.timeOfDay()), zone, now);
                if (repository.updateSchedule(reminder.id(), zone.getId(), nextRun)) {
                    updated++;
                } else {
                    failed++;
                    log.warn("Reminder {} disappeared during time zone update for user {}", reminder.id(), userId);
                }
            } catch (RuntimeException ex) {
                failed++;
                log.error("Failed to move reminder {} of user {} to {}", reminder.id(), userId, zone.getId(), ex);
            }
        }
        log.info("Time zone of user {} set to {}: {} reminders updated, {} failed", userId, zone.getId(), updated, failed);
        return new TimezoneUpdateResponse(zone.getId(), updated, failed);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw ApiException.validation("User id is required.", "user_required");
        }
    }

    private static List<NotificationChannel> parseMethods(List<String> raw) {
        Set<NotificationChannel> methods = new LinkedHashSet<>();
        for (String code : raw) {
            methods.add(NotificationChannel.fromCode(code)
                    .orElseThrow(() -> ApiException.validation("Unknown notification method '" + code + "'.", "method_unknown")));
        }
        return List.copyOf(methods);
    }

    private static String normalizeReadingType(String readingType) {
        if (readingType == null || readingType.isBlank()) {
            return null;
        }
        String normalized = readingType.trim().toLowerCase(Locale.ROOT);
        if (!READING_TYPES.contains(normalized)) {
            throw ApiException.validation("Unknown reading type '" + readingType + "'.", "reading_type_unknown");
        }
        return normalized;
    }
}
