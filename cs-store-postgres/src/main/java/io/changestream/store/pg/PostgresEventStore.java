package io.changestream.store.pg;

import io.changestream.core.ChangeEvent;
import io.changestream.core.EventId;
import io.changestream.store.AbstractEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Event store on a {@code cs_event} table keyed by offset.
 * <p>
 * Offsets are assigned in-process, so one instance must be the only writer of the table.
 * A duplicate key means another writer got there first: the counter is reloaded and the append fails.
 */
public final class PostgresEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventStore.class);

    static final String SELECT_NEXT_OFFSET = "SELECT COALESCE(MAX(log_offset) + 1, 0) FROM cs_event";

    static final String INSERT_EVENT = """
      INSERT INTO cs_event (log_offset, event_id, event_type, before_state, after_state, source, recorded_at)
      VALUES (?, ?, ?, ?, ?, ?, ?)
      """;

    static final String SELECT_ONE = """
      SELECT log_offset, event_id, event_type, before_state, after_state, source, recorded_at
      FROM cs_event
      WHERE log_offset = ?
      """;

    static final String SELECT_RANGE = """
      SELECT log_offset, event_id, event_type, before_state, after_state, source, recorded_at
      FROM cs_event
      WHERE log_offset BETWEEN ? AND ?
      ORDER BY log_offset ASC
      """;

    private final JdbcTemplate jdbcTemplate;

    public PostgresEventStore(JdbcTemplate jdbc, Clock clock) {
        super(clock, loadNextOffset(jdbc));
        this.jdbcTemplate = jdbc;
        log.info("Event store opened at next offset {}", nextOffset());
    }

    @Override
    protected void persist(ChangeEvent e) {
        int rows;
        try {
            rows = jdbcTemplate.update(INSERT_EVENT, ps -> {
                ps.setLong(1, e.offset());
                ps.setString(2, e.eventId().value());
                ps.setString(3, e.eventType());
                ps.setBytes(4, e.before());
                ps.setBytes(5, e.after());
                ps.setString(6, e.source());
                ps.setTimestamp(7, Timestamp.from(e.timestamp()));
            });
        } catch (DuplicateKeyException ex) {
            long actual = loadNextOffset(jdbcTemplate);
            log.warn("Offset {} already taken by another writer, next offset is {}", e.offset(), actual);
            resetNextOffset(actual);
            throw ex;
        }
        if (rows != 1) {
            throw new IllegalStateException("Unable to insert event at offset " + e.offset());
        }
    }

    @Override
    protected ChangeEvent load(long offset) {
        var rows = jdbcTemplate.query(SELECT_ONE, ps -> ps.setLong(1, offset), mapper());
        if (rows.isEmpty()) {
            throw new IllegalStateException("Event at assigned offset " + offset + " is missing from cs_event");
        }
        return rows.get(0);
    }

    @Override
    protected List<ChangeEvent> loadRange(long fromOffset, long toOffset) {
        return jdbcTemplate.query(SELECT_RANGE, ps -> {
            ps.setLong(1, fromOffset);
            ps.setLong(2, toOffset);
        }, mapper());
    }

    static long loadNextOffset(JdbcTemplate jdbc) {
        Long next = Objects.requireNonNull(jdbc).queryForObject(SELECT_NEXT_OFFSET, Long.class);
        return next == null ? 0L : next;
    }

    static RowMapper<ChangeEvent> mapper() {
        return (ResultSet rs, int rowNum) -> new ChangeEvent(
                rs.getLong("log_offset"),
                new EventId(rs.getString("event_id")),
                rs.getString("event_type"),
                rs.getBytes("before_state"),
                rs.getBytes("after_state"),
                rs.getString("source"),
                rs.getTimestamp("recorded_at").toInstant()
        );
    }
}
