package prayer.devotions_be.reminders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger of {@link ReminderDispatchService#sendDueReminders()}.
 * Runs on the single scheduler thread, so sweeps of one instance never overlap.
 */
@Component
@ConditionalOnProperty(prefix = "devotions.reminders", name = "dispatch-enabled", havingValue = "true", matchIfMissing = true)
public class ReminderSweepJob {
    private static final Logger log = LoggerFactory.getLogger(ReminderSweepJob.class);

    private final ReminderDispatchService dispatchService;

    public ReminderSweepJob(ReminderDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @Scheduled(fixedDelayString = "${devotions.reminders.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            dispatchService.sendDueReminders();
        } catch (Exception ex) {
            log.warn("Reminder sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
