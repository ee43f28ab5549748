package de.jwiegmann.redistribution.control.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.redistribution.control.exception.StoreUnavailableException;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-Memory Implementierung des {@link AtomicStore}.
 * Jeder Record liegt als versioniertes JSON-Dokument vor; Leser bekommen immer eine eigene Kopie,
 * Commits erfolgen per Compare-and-Set auf den gelesenen Eintrag.
 * Map Struktur: Map&lt;key, VersionedRecord&gt;.
 */
public class InMemoryAtomicStore<V> implements AtomicStore<V> {

    private final Map<String, VersionedRecord> store = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Class<V> type;

    public InMemoryAtomicStore(ObjectMapper objectMapper, Class<V> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(store.get(key)).map(r -> read(key, r));
    }

    @Override
    public void put(String key, V value) {
        String json = write(key, value);
        store.compute(key, (k, old) -> new VersionedRecord(old == null ? 1 : old.getVersion() + 1, json));
    }

    @Override
    public StoreResult<V> transact(String key, Function<Optional<V>, Optional<V>> mutation) {

        // 1. Snapshot lesen (eigene Kopie)
        VersionedRecord before = store.get(key);
        Optional<V> current = before == null ? Optional.empty() : Optional.of(read(key, before));

        // 2. Neuen Wert berechnen, leer = Abbruch
        Optional<V> next = mutation.apply(current);
        if (next.isEmpty()) {
            return StoreResult.aborted();
        }

        // 3. Nur committen, wenn der Eintrag seit dem Lesen unverändert ist
        VersionedRecord after = new VersionedRecord(before == null ? 1 : before.getVersion() + 1, write(key, next.get()));
        boolean committed = before == null
                ? store.putIfAbsent(key, after) == null
                : store.replace(key, before, after);

        if (!committed) {
            return StoreResult.conflict();
        }
        return StoreResult.committed(read(key, after));
    }

    @Override
    public List<V> findAll() {
        List<V> result = new ArrayList<>();
        store.forEach((key, value) -> result.add(read(key, value)));
        return result;
    }

    /**
     * Aktuelle Version eines Keys, 0 wenn nicht vorhanden.
     */
    public long version(String key) {
        VersionedRecord r = store.get(key);
        return r == null ? 0 : r.getVersion();
    }

    /**
     * Roher JSON-Record, so wie er persistiert ist.
     */
    public Optional<String> rawRecord(String key) {
        return Optional.ofNullable(store.get(key)).map(VersionedRecord::getJson);
    }

    private V read(String key, VersionedRecord record) {
        try {
            return objectMapper.readValue(record.getJson(), type);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException(key, "stored record is not readable", e);
        }
    }

    private String write(String key, V value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException(key, "record is not serializable", e);
        }
    }

    @Value
    private static class VersionedRecord {
        long version;
        String json;
    }
}
