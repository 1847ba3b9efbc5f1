package com.ryuqq.provisioner.adapter.json.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.provisioner.core.event.DomainEvent;
import com.ryuqq.provisioner.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.core.spi.StoredSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Aggregate마다 JSON 파일 하나를 쓰는 {@link EventStore} 구현.
 *
 * <p><strong>파일 구조:</strong> {@code <directory>/<aggregateId>.json}</p>
 * <pre>
 * {
 *   "aggregateId": "req-...",
 *   "sequence": 3,
 *   "archived": false,
 *   "version": 4,
 *   "events": [ { "eventType": "RequestCreated", ... }, ... ],
 *   "snapshot": { ... }
 * }
 * </pre>
 *
 * <p>이벤트와 스냅샷은 같은 문서에 있으므로 임시 파일 작성 후 원자적 rename 한 번으로
 * 함께 기록됩니다. {@code sequence}는 최초 기록 순서이며 {@link #aggregateIds()} 정렬에 쓰입니다.</p>
 *
 * <p><strong>Concurrency:</strong> 같은 프로세스 안에서 Aggregate별 lock으로 직렬화합니다.
 * 여러 프로세스가 같은 디렉토리를 공유하는 구성은 지원하지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param <E> 이벤트 타입
 * @param <S> 스냅샷 타입
 */
public class JsonFileEventStore<E extends DomainEvent, S> implements EventStore<E, S> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileEventStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final JavaType eventListType;
    private final Class<S> snapshotType;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Map<String, IndexEntry> index = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public JsonFileEventStore(Path directory, ObjectMapper mapper, Class<E> eventType, Class<S> snapshotType) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
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
        this.directory = directory;
        this.mapper = mapper;
        this.eventListType = mapper.getTypeFactory().constructCollectionType(List.class, eventType);
        this.snapshotType = snapshotType;
        loadIndex();
    }

    private void loadIndex() {
        try {
            Files.createDirectories(directory);
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : files) {
                    JsonNode doc = mapper.readTree(file.toFile());
                    String aggregateId = doc.path("aggregateId").asText();
                    long seq = doc.path("sequence").asLong();
                    index.put(aggregateId, new IndexEntry(seq, doc.path("archived").asBoolean()));
                    sequence.accumulateAndGet(seq, Math::max);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load event store index from " + directory, e);
        }
        log.info("Loaded {} streams from {}", index.size(), directory);
    }

    @Override
    public long append(String aggregateId, long expectedVersion, List<? extends E> events, S snapshot) {
        Path file = fileFor(aggregateId);
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        synchronized (lockFor(aggregateId)) {
            Optional<ObjectNode> existing = read(file);
            List<E> stored = existing.map(this::eventsOf).orElseGet(List::of);
            Set<String> storedIds = stored.stream().map(DomainEvent::eventId).collect(Collectors.toCollection(HashSet::new));

            List<E> fresh = new ArrayList<>();
            for (E event : events) {
                if (!storedIds.contains(event.eventId())) {
                    fresh.add(event);
                }
            }
            long current = stored.size();
            if (fresh.isEmpty()) {
                log.debug("All {} events already stored for {}, append is a no-op", events.size(), aggregateId);
                return current;
            }
            long duplicates = events.size() - fresh.size();
            if (current != expectedVersion + duplicates) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
            }

            List<E> all = new ArrayList<>(stored);
            all.addAll(fresh);
            IndexEntry entry = index.get(aggregateId);
            long seq = entry != null ? entry.sequence() : sequence.incrementAndGet();
            boolean archived = entry != null && entry.archived();

            ObjectNode doc = mapper.createObjectNode();
            doc.put("aggregateId", aggregateId);
            doc.put("sequence", seq);
            doc.put("archived", archived);
            doc.put("version", all.size());
            doc.set("events", toTree(all));
            doc.set("snapshot", mapper.valueToTree(snapshot));
            write(file, doc);

            index.put(aggregateId, new IndexEntry(seq, archived));
            return all.size();
        }
    }

    @Override
    public List<E> loadEvents(String aggregateId) {
        Path file = fileFor(aggregateId);
        synchronized (lockFor(aggregateId)) {
            return read(file).map(this::eventsOf).orElseGet(List::of);
        }
    }

    @Override
    public Optional<StoredSnapshot<S>> loadSnapshot(String aggregateId) {
        Path file = fileFor(aggregateId);
        synchronized (lockFor(aggregateId)) {
            return read(file).map(doc -> new StoredSnapshot<>(
                convert(doc.get("snapshot")), doc.path("version").asLong()));
        }
    }

    @Override
    public List<String> aggregateIds() {
        return index.entrySet().stream()
            .filter(e -> !e.getValue().archived())
            .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    @Override
    public boolean archive(String aggregateId) {
        Path file = fileFor(aggregateId);
        synchronized (lockFor(aggregateId)) {
            IndexEntry entry = index.get(aggregateId);
            if (entry == null || entry.archived()) {
                return false;
            }
            ObjectNode doc = read(file).orElseThrow(() ->
                new IllegalStateException("Stream file missing for indexed aggregate " + aggregateId));
            doc.put("archived", true);
            write(file, doc);
            index.put(aggregateId, new IndexEntry(entry.sequence(), true));
            log.info("Archived stream {}", aggregateId);
            return true;
        }
    }

    private Path fileFor(String aggregateId) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (!SAFE_ID.matcher(aggregateId).matches() || aggregateId.startsWith(".")) {
            throw new IllegalArgumentException("aggregateId is not a safe file name: " + aggregateId);
        }
        return directory.resolve(aggregateId + SUFFIX);
    }

    private Object lockFor(String aggregateId) {
        return locks.computeIfAbsent(aggregateId, id -> new Object());
    }

    private Optional<ObjectNode> read(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of((ObjectNode) mapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private void write(Path file, ObjectNode doc) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), doc);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private JsonNode toTree(List<E> events) {
        try {
            return mapper.readTree(mapper.writerFor(eventListType).writeValueAsBytes(events));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize events", e);
        }
    }

    private List<E> eventsOf(ObjectNode doc) {
        try {
            return mapper.readerFor(eventListType).readValue(doc.get("events"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize events", e);
        }
    }

    private S convert(JsonNode node) {
        try {
            return mapper.treeToValue(node, snapshotType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize snapshot", e);
        }
    }

    private record IndexEntry(long sequence, boolean archived) {
    }
}
