package prayer.devotions_be.reminders;

import prayer.devotions_be.reminders.notification.NotificationChannel;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC access to the {@code reminder} table. Channels are stored as a comma separated list.
 */
@Repository
public class ReminderRepository {

    private static final String SQL_INSERT =
            """
            INSERT INTO reminder (id, user_id, time_of_day, timezone, devotion, methods, reading_type, created_at, next_run_utc)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT_COLUMNS =
            """
            SELECT id, user_id, time_of_day, timezone, devotion, methods, reading_type, created_at, next_run_utc
            FROM reminder
            """;

    private static final String SQL_FIND_BY_USER = SQL_SELECT_COLUMNS +
            """
            WHERE user_id = ?
            ORDER BY time_of_day ASC, created_at ASC
            """;

    private static final String SQL_FIND_ONE = SQL_SELECT_COLUMNS +
            """
            WHERE user_id = ?
              AND id = ?
            """;

    private static final String SQL_FIND_DUE = SQL_SELECT_COLUMNS +
            """
            WHERE next_run_utc <= ?
            ORDER BY next_run_utc ASC
            """;

    private static final String SQL_DELETE =
            """
            DELETE FROM reminder
            WHERE user_id = ?
              AND id = ?
            """;

    private static final String SQL_UPDATE_NEXT_RUN =
            """
            UPDATE reminder
            SET next_run_utc = ?
            WHERE id = ?
            """;

    private static final String SQL_UPDATE_SCHEDULE =
            """
            UPDATE reminder
            SET timezone = ?,
                next_run_utc = ?
            WHERE id = ?
            """;

    private static final RowMapper<Reminder> REMINDER_MAPPER = new RowMapper<>() {
        @Override
        public Reminder mapRow(ResultSet rs, int rowNum) throws SQLException {
            String devotionCode = rs.getString("devotion");
            Devotion devotion = Devotion.fromCode(devotionCode)
                    .orElseThrow(() -> new SQLException("Unknown devotion '" + devotionCode + "' in reminder row"));
            OffsetDateTime nextRun = rs.getObject("next_run_utc", OffsetDateTime.class);
            return new Reminder(
                    rs.getString("id"),
                    rs.getString("user_id"),
                    rs.getString("time_of_day"),
                    rs.getString("timezone"),
                    devotion,
                    parseMethods(rs.getString("methods")),
                    rs.getString("reading_type"),
                    rs.getObject("created_at", OffsetDateTime.class),
                    nextRun.toInstant());
        }
    };

    private final JdbcTemplate jdbcTemplate;

    public ReminderRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Reminder reminder) {
        jdbcTemplate.update(SQL_INSERT,
                reminder.id(),
                reminder.userId(),
                reminder.timeOfDay(),
                reminder.timezone(),
                reminder.devotion().code(),
                formatMethods(reminder.methods()),
                reminder.readingType(),
                reminder.createdAt(),
                toUtc(reminder.nextRunUtc()));
    }

    public List<Reminder> findByUser(String userId) {
        return jdbcTemplate.query(SQL_FIND_BY_USER, REMINDER_MAPPER, userId);
    }

    public Optional<Reminder> findById(String userId, String reminderId) {
        return Optional.ofNullable(DataAccessUtils.singleResult(
                jdbcTemplate.query(SQL_FIND_ONE, REMINDER_MAPPER, userId, reminderId)));
    }

    /** Reminders whose next run is at or before {@code now}, oldest first. */
    public List<Reminder> findDue(Instant now) {
        return jdbcTemplate.query(SQL_FIND_DUE, REMINDER_MAPPER, toUtc(now));
    }

    public boolean delete(String userId, String reminderId) {
        return jdbcTemplate.update(SQL_DELETE, userId, reminderId) > 0;
    }

    public boolean updateNextRun(String reminderId, Instant nextRunUtc) {
        return jdbcTemplate.update(SQL_UPDATE_NEXT_RUN, toUtc(nextRunUtc), reminderId) > 0;
    }

    public boolean updateSchedule(String reminderId, String timezone, Instant nextRunUtc) {
        return jdbcTemplate.update(SQL_UPDATE_SCHEDULE, timezone, toUtc(nextRunUtc), reminderId) > 0;
    }

    static String formatMethods(List<NotificationChannel> methods) {
        return methods.stream().map(NotificationChannel::code).collect(Collectors.joining(","));
    }

    static List<NotificationChannel> parseMethods(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(NotificationChannel::fromCode)
                .flatMap(Optional::stream)
                .toList();
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
