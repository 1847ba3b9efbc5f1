package com.ryuqq.provisioner.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.core.event.DomainEvent;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.core.spi.StoredSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 관계형 DB 기반 {@link EventStore} 구현 (plain JDBC).
 *
 * <p><strong>테이블:</strong></p>
 * <ul>
 *   <li>{@code provisioner_stream}: Aggregate별 버전, 스냅샷(JSON), 보관 여부, 최초 기록 순서</li>
 *   <li>{@code provisioner_event}: (aggregate_id, seq) 기준 append-only 이벤트(JSON),
 *       (aggregate_id, event_id) unique</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 스트림 행은 {@code UPDATE ... WHERE version = ?} 조건부 갱신으로
 * 전진하며, 갱신된 행이 없거나 키 제약을 위반하면 트랜잭션을 롤백하고
 * {@link ConcurrencyConflictException}을 던집니다. 이벤트와 스냅샷은 한 트랜잭션에서 기록됩니다.</p>
 *
 * <p>이벤트와 스냅샷 직렬화는 {@code provisioner-adapter-json}의 ObjectMapper 설정을 그대로 사용합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <E> 이벤트 타입
 * @param <S> 스냅샷 타입
 */
public class JdbcEventStore<E extends DomainEvent, S> implements EventStore<E, S> {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String SCHEMA_RESOURCE = "/db/provisioner-event-store.sql";

    private static final String SELECT_STREAM =
        "SELECT version, snapshot FROM provisioner_stream WHERE aggregate_id = ?";
    private static final String SELECT_EVENT_IDS =
        "SELECT event_id FROM provisioner_event WHERE aggregate_id = ?";
    private static final String SELECT_EVENTS =
        "SELECT payload FROM provisioner_event WHERE aggregate_id = ? ORDER BY seq";
    private static final String INSERT_STREAM =
        "INSERT INTO provisioner_stream (aggregate_id, version, snapshot, archived) VALUES (?, ?, ?, FALSE)";
    private static final String UPDATE_STREAM =
        "UPDATE provisioner_stream SET version = ?, snapshot = ? WHERE aggregate_id = ? AND version = ?";
    private static final String INSERT_EVENT =
        "INSERT INTO provisioner_event (aggregate_id, seq, event_id, event_type, payload) VALUES (?, ?, ?, ?, ?)";
    private static final String SELECT_ACTIVE_IDS =
        "SELECT aggregate_id FROM provisioner_stream WHERE archived = FALSE ORDER BY stream_order";
    private static final String ARCHIVE_STREAM =
        "UPDATE provisioner_stream SET archived = TRUE WHERE aggregate_id = ? AND archived = FALSE";

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final Class<E> eventType;
    private final Class<S> snapshotType;

    public JdbcEventStore(DataSource dataSource, ObjectMapper mapper, Class<E> eventType, Class<S> snapshotType) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (snapshotType == null) {
            throw new IllegalArgumentException("snapshotType cannot be null");
        }
        this.dataSource = dataSource;
        this.mapper = mapper;
        this.eventType = eventType;
        this.snapshotType = snapshotType;
    }

    /**
     * 테이블이 없으면 생성.
     */
    public void initializeSchema() {
        String ddl;
        try (InputStream in = JdbcEventStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JdbcEventStoreException("Failed to read " + SCHEMA_RESOURCE, e);
        }
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : ddl.split(";")) {
                if (!sql.isBlank()) {
                    statement.execute(sql.trim());
                }
            }
        } catch (SQLException e) {
            throw new JdbcEventStoreException("Failed to initialize event store schema", e);
        }
        log.info("Event store schema initialized");
    }

    @Override
    public long append(String aggregateId, long expectedVersion, List<? extends E> events, S snapshot) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                long result = appendInTransaction(connection, aggregateId, expectedVersion, events, snapshot);
                connection.commit();
                return result;
            } catch (ConcurrencyConflictException e) {
                connection.rollback();
                throw e;
            } catch (SQLException e) {
                connection.rollback();
                long actual = currentVersion(connection, aggregateId);
                if (actual != expectedVersion) {
                    log.debug("Write on {} lost the race (expected {}, actual {})", aggregateId, expectedVersion, actual);
                    throw new ConcurrencyConflictException(aggregateId, expectedVersion, actual);
                }
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new JdbcEventStoreException("Failed to append to " + aggregateId, e);
        }
    }

    private long appendInTransaction(Connection connection, String aggregateId, long expectedVersion,
                                     List<? extends E> events, S snapshot) throws SQLException {
        Set<String> storedIds = new HashSet<>();
        try (PreparedStatement ps = connection.prepareStatement(SELECT_EVENT_IDS)) {
            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    storedIds.add(rs.getString(1));
                }
            }
        }
        long current = currentVersion(connection, aggregateId);

        List<E> fresh = new ArrayList<>();
        for (E event : events) {
            if (!storedIds.contains(event.eventId())) {
                fresh.add(event);
            }
        }
        if (fresh.isEmpty()) {
            log.debug("All {} events already stored for {}, append is a no-op", events.size(), aggregateId);
            return current;
        }
        long duplicates = events.size() - fresh.size();
        if (current != expectedVersion + duplicates) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
        }

        long next = current + fresh.size();
        String snapshotJson = toJson(snapshot);
        if (current == 0) {
            try (PreparedStatement ps = connection.prepareStatement(INSERT_STREAM)) {
                ps.setString(1, aggregateId);
                ps.setLong(2, next);
                ps.setString(3, snapshotJson);
                ps.executeUpdate();
            }
        } else {
            try (PreparedStatement ps = connection.prepareStatement(UPDATE_STREAM)) {
                ps.setLong(1, next);
                ps.setString(2, snapshotJson);
                ps.setString(3, aggregateId);
                ps.setLong(4, current);
                if (ps.executeUpdate() != 1) {
                    throw new ConcurrencyConflictException(aggregateId, expectedVersion,
                        currentVersion(connection, aggregateId));
                }
            }
        }

        try (PreparedStatement ps = connection.prepareStatement(INSERT_EVENT)) {
            long seq = current;
            for (E event : fresh) {
                ps.setString(1, aggregateId);
                ps.setLong(2, ++seq);
                ps.setString(3, event.eventId());
                ps.setString(4, event.getClass().getSimpleName());
                ps.setString(5, mapper.writerFor(eventType).writeValueAsString(event));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (JsonProcessingException e) {
            throw new JdbcEventStoreException("Failed to serialize events for " + aggregateId, e);
        }
        return next;
    }

    private long currentVersion(Connection connection, String aggregateId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(SELECT_STREAM)) {
            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    @Override
    public List<E> loadEvents(String aggregateId) {
        List<E> events = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SELECT_EVENTS)) {
            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapper.readValue(rs.getString(1), eventType));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new JdbcEventStoreException("Failed to load events of " + aggregateId, e);
        }
        return events;
    }

    @Override
    public Optional<StoredSnapshot<S>> loadSnapshot(String aggregateId) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SELECT_STREAM)) {
            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long version = rs.getLong(1);
                return Optional.of(new StoredSnapshot<>(mapper.readValue(rs.getString(2), snapshotType), version));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new JdbcEventStoreException("Failed to load snapshot of " + aggregateId, e);
        }
    }

    @Override
    public List<String> aggregateIds() {
        List<String> ids = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SELECT_ACTIVE_IDS);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new JdbcEventStoreException("Failed to list aggregate ids", e);
        }
        return ids;
    }

    @Override
    public boolean archive(String aggregateId) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(ARCHIVE_STREAM)) {
            ps.setString(1, aggregateId);
            boolean archived = ps.executeUpdate() == 1;
            if (archived) {
                log.info("Archived stream {}", aggregateId);
            }
            return archived;
        } catch (SQLException e) {
            throw new JdbcEventStoreException("Failed to archive " + aggregateId, e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JdbcEventStoreException("Failed to serialize snapshot", e);
        }
    }
}
