package prayer.devotions_be.reminders;

import jakarta.annotation.PreDestroy;
import prayer.devotions_be.config.DevotionsProperties;
import prayer.devotions_be.config.ReminderProperties;
import prayer.devotions_be.liturgy.ChurchYearCalendar;
import prayer.devotions_be.reminders.notification.NotificationChannel;
import prayer.devotions_be.reminders.notification.NotificationSink;
import prayer.devotions_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends due reminders through the {@link NotificationSink} and moves them to their next run.
 *
 * <p>Delivery is at-least-once: a reminder is rescheduled only after its sends were attempted,
 * so a crash in between sends it again on the next sweep.
 */
@Service
public class ReminderDispatchService {
    private static final Logger log = LoggerFactory.getLogger(ReminderDispatchService.class);

    static final String LECTIONARY_QUERY = "?reading_type=lectionary";

    private final ReminderRepository repository;
    private final NotificationSink sink;
    private final ChurchYearCalendar calendar;
    private final DevotionsProperties devotionsProperties;
    private final ReminderProperties reminderProperties;
    private final Clock clock;
    private final ExecutorService executor;

    public ReminderDispatchService(ReminderRepository repository,
                                   NotificationSink sink,
                                   ChurchYearCalendar calendar,
                                   DevotionsProperties devotionsProperties,
                                   ReminderProperties reminderProperties,
                                   Clock clock) {
        this.repository = repository;
        this.sink = sink;
        this.calendar = calendar;
        this.devotionsProperties = devotionsProperties;
        this.reminderProperties = reminderProperties;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(reminderProperties.getSenderThreads());
    }

    public DispatchSummary sendDueReminders() {
        Instant now = clock.instant();
        List<Reminder> due = repository.findDue(now);
        log.info("Reminder sweep at {} found {} due reminders", now, due.size());
        if (due.isEmpty()) {
            return DispatchSummary.EMPTY;
        }
        boolean lent = isLentToday();
        int sent = 0;
        int failed = 0;
        int skipped = 0;
        int rescheduled = 0;
        for (Reminder reminder : due) {
            if (reminder.devotion().isLentOnly() && !lent) {
                skipped++;
                log.info("Skipping Lenten reminder {} outside Lent", reminder.id());
            } else {
                SendResult result = deliver(reminder);
                sent += result.sent();
                failed += result.failed();
            }
            if (reschedule(reminder)) {
                rescheduled++;
            }
        }
        DispatchSummary summary = new DispatchSummary(due.size(), sent, failed, skipped, rescheduled);
        log.info("Reminder sweep finished: {}", summary);
        return summary;
    }

    /**
     * Sends every reminder of the user right away without touching their schedule.
     */
    public DispatchSummary forceSendForUser(String userId) {
        List<Reminder> reminders = repository.findByUser(userId);
        if (reminders.isEmpty()) {
            throw ApiException.notFound("No reminders found for user.", "reminders");
        }
        log.info("Force sending {} reminders for user {}", reminders.size(), userId);
        boolean lent = isLentToday();
        int sent = 0;
        int failed = 0;
        int skipped = 0;
        for (Reminder reminder : reminders) {
            if (reminder.devotion().isLentOnly() && !lent) {
                skipped++;
                continue;
            }
            SendResult result = deliver(reminder);
            sent += result.sent();
            failed += result.failed();
        }
        DispatchSummary summary = new DispatchSummary(reminders.size(), sent, failed, skipped, 0);
        log.info("Force send for user {} finished: {}", userId, summary);
        return summary;
    }

    private SendResult deliver(Reminder reminder) {
        int sent = 0;
        int failed = 0;
        for (NotificationChannel channel : reminder.methods()) {
            String message = messageFor(reminder.devotion(), linkFor(reminder, channel, devotionsProperties.getBaseUrl()));
            if (sendWithTimeout(reminder, channel, message)) {
                sent++;
            } else {
                failed++;
            }
        }
        return new SendResult(sent, failed);
    }

    private boolean sendWithTimeout(Reminder reminder, NotificationChannel channel, String message) {
        Future<Boolean> future = executor.submit(() -> sink.send(channel, reminder.userId(), message));
        try {
            boolean delivered = Boolean.TRUE.equals(future.get(reminderProperties.getSendTimeoutMs(), TimeUnit.MILLISECONDS));
            if (!delivered) {
                log.warn("Sink rejected {} notification for reminder {}", channel.code(), reminder.id());
            }
            return delivered;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("Timed out sending {} notification for reminder {} after {} ms",
                    channel.code(), reminder.id(), reminderProperties.getSendTimeoutMs());
            return false;
        } catch (ExecutionException ex) {
            log.error("Error sending {} notification for reminder {}", channel.code(), reminder.id(), ex.getCause());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.error("Interrupted while sending {} notification for reminder {}", channel.code(), reminder.id());
            return false;
        }
    }

    private boolean reschedule(Reminder reminder) {
        try {
            Instant nextRun = ReminderScheduler.calculateNextRun(reminder.timeOfDay(), reminder.timezone(), clock.instant());
            log.info("Rescheduling reminder {} to {}", reminder.id(), nextRun);
            return repository.updateNextRun(reminder.id(), nextRun);
        } catch (RuntimeException ex) {
            log.error("Error rescheduling reminder {}", reminder.id(), ex);
            return false;
        }
    }

    private boolean isLentToday() {
        ZoneId home = ReminderScheduler.resolveZone(devotionsProperties.getHomeTimezone());
        LocalDate today = clock.instant().atZone(home).toLocalDate();
        return calendar.isLent(today);
    }

    /** Push gets the site-relative link, email and SMS the absolute one. */
    static String linkFor(Reminder reminder, NotificationChannel channel, String baseUrl) {
        String path = reminder.devotion().path();
        if (ReminderService.READING_TYPE_LECTIONARY.equals(reminder.readingType())) {
            path += LECTIONARY_QUERY;
        }
        return channel.usesRelativeLinks() ? path : baseUrl + path;
    }

    static String messageFor(Devotion devotion, String url) {
        return "Time for " + devotion.displayName() + "! Read here: " + url;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private record SendResult(int sent, int failed) {
    }
}
