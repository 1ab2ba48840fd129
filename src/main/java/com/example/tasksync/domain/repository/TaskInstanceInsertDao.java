package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.TaskInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Inserts materialized instances one at a time, each inside its own savepoint.
 * <p>
 * Must be called within a transaction. A unique violation on
 * (task_id, occurrence_date) rolls back to the savepoint only, so instances
 * already inserted in the same transaction are kept.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TaskInstanceInsertDao {

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String INSERT_SQL = """
            INSERT INTO task_instances
                (id, task_id, user_id, occurrence_date, scheduled_datetime, status, version, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, 0, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * @return true if the row was inserted, false if the date already existed for the task
     */
    public boolean insertIfAbsent(TaskInstance instance) {
        var inserted = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            var savepoint = connection.setSavepoint();
            try (var statement = connection.prepareStatement(INSERT_SQL)) {
                var now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
                statement.setObject(1, instance.getId());
                statement.setObject(2, instance.getTaskId());
                statement.setLong(3, instance.getUserId());
                statement.setObject(4, instance.getOccurrenceDate());
                statement.setObject(5, instance.getScheduledDatetime() != null
                        ? OffsetDateTime.ofInstant(instance.getScheduledDatetime(), ZoneOffset.UTC)
                        : null);
                statement.setString(6, instance.getStatus().name());
                statement.setObject(7, now);
                statement.setObject(8, now);
                statement.executeUpdate();
                connection.releaseSavepoint(savepoint);
                return true;
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    connection.rollback(savepoint);
                    log.debug("Instance for task {} on {} already exists", instance.getTaskId(), instance.getOccurrenceDate());
                    return false;
                }
                throw e;
            }
        });
        return Boolean.TRUE.equals(inserted);
    }
}
