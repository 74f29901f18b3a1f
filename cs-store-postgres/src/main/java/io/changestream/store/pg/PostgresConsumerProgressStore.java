package io.changestream.store.pg;

import io.changestream.core.ConsumerProgress;
import io.changestream.store.ConsumerProgressStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Consumer progress on {@code cs_consumer_progress}; the upsert keeps the greater offset. */
public final class PostgresConsumerProgressStore implements ConsumerProgressStore {

    static final String UPSERT = """
      INSERT INTO cs_consumer_progress (consumer_id, acknowledged_offset, updated_at)
      VALUES (?, ?, ?)
      ON CONFLICT (consumer_id)
      DO UPDATE SET
        acknowledged_offset = GREATEST(cs_consumer_progress.acknowledged_offset, EXCLUDED.acknowledged_offset),
        updated_at = CASE
          WHEN EXCLUDED.acknowledged_offset > cs_consumer_progress.acknowledged_offset THEN EXCLUDED.updated_at
          ELSE cs_consumer_progress.updated_at
        END
      RETURNING consumer_id, acknowledged_offset, updated_at
      """;

    static final String SELECT_ONE =
            "SELECT consumer_id, acknowledged_offset, updated_at FROM cs_consumer_progress WHERE consumer_id = ?";

    static final String SELECT_ALL =
            "SELECT consumer_id, acknowledged_offset, updated_at FROM cs_consumer_progress ORDER BY consumer_id ASC";

    static final String DELETE = "DELETE FROM cs_consumer_progress WHERE consumer_id = ?";

    private final JdbcTemplate jdbc;

    public PostgresConsumerProgressStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public ConsumerProgress acknowledge(String consumerId, long offset, Instant at) {
        var rows = jdbc.query(UPSERT, ps -> {
            ps.setString(1, consumerId);
            ps.setLong(2, offset);
            ps.setTimestamp(3, Timestamp.from(at));
        }, mapper());
        if (rows.size() != 1) {
            throw new IllegalStateException("Unable to record progress of " + consumerId);
        }
        return rows.get(0);
    }

    @Override
    public Optional<ConsumerProgress> find(String consumerId) {
        return jdbc.query(SELECT_ONE, ps -> ps.setString(1, consumerId), mapper()).stream().findFirst();
    }

    @Override
    public boolean delete(String consumerId) {
        return jdbc.update(DELETE, ps -> ps.setString(1, consumerId)) > 0;
    }

    @Override
    public List<ConsumerProgress> findAll() {
        return jdbc.query(SELECT_ALL, mapper());
    }

    private static RowMapper<ConsumerProgress> mapper() {
        return (rs, rn) -> new ConsumerProgress(
                rs.getString("consumer_id"),
                rs.getLong("acknowledged_offset"),
                rs.getTimestamp("updated_at").toInstant()
        );
    }
}
