package prayer.devotions_be.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "devotions.reminders")
public class ReminderProperties {
    /** Whether this instance runs the periodic dispatch sweep */
    private boolean dispatchEnabled = true;
    /** Delay between the end of one sweep and the start of the next, ms */
    @Min(1000)
    private long sweepIntervalMs = 60_000;
    /** Upper bound for a single notification send, ms */
    @Min(1)
    private long sendTimeoutMs = 10_000;
    /** Threads available for outstanding sends */
    @Min(1)
    private int senderThreads = 4;

    public boolean isDispatchEnabled() { return dispatchEnabled; }
    public void setDispatchEnabled(boolean dispatchEnabled) { this.dispatchEnabled = dispatchEnabled; }
    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    public long getSendTimeoutMs() { return sendTimeoutMs; }
    public void setSendTimeoutMs(long sendTimeoutMs) { this.sendTimeoutMs = sendTimeoutMs; }
    public int getSenderThreads() { return senderThreads; }
    public void setSenderThreads(int senderThreads) { this.senderThreads = senderThreads; }
}
