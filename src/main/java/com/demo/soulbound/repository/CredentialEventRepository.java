package com.demo.soulbound.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class CredentialEventRepository {

    private final JdbcTemplate jdbc;

    public void append(String eventName, String payloadJson, Instant recordedAt) {
        jdbc.update("INSERT INTO credential_event (event_name, payload, recorded_at) VALUES (?, ?, ?)",
                eventName, payloadJson, Timestamp.from(recordedAt));
    }

    /** Events with a sequence number above {@code afterSeq}, oldest first. */
    public List<EventRow> list(String eventName, long afterSeq, int limit) {
        if (eventName == null || eventName.isBlank()) {
            return jdbc.query("""
                    SELECT seq, event_name, payload, recorded_at FROM credential_event
                    WHERE seq > ? ORDER BY seq LIMIT ?
                    """, rm(), afterSeq, limit);
        }
        return jdbc.query("""
                SELECT seq, event_name, payload, recorded_at FROM credential_event
                WHERE seq > ? AND event_name = ? ORDER BY seq LIMIT ?
                """, rm(), afterSeq, eventName, limit);
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM credential_event", Long.class);
        return n == null ? 0 : n;
    }

    private RowMapper<EventRow> rm() {
        return (rs, i) -> new EventRow(
                rs.getLong("seq"),
                rs.getString("event_name"),
                rs.getString("payload"),
                rs.getTimestamp("recorded_at").toInstant()
        );
    }

    public record EventRow(long seq, String eventName, String payloadJson, Instant recordedAt) {}
}
