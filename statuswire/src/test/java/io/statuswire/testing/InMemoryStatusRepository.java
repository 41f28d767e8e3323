package io.statuswire.testing;

import io.statuswire.application.port.output.StatusRepository;
import io.statuswire.domain.model.StatusRecord;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryStatusRepository implements StatusRepository {

    private final Map<String, StatusRecord> rows = new ConcurrentHashMap<>();

    @Override
    public void upsert(StatusRecord record) {
        rows.put(record.uri(), record);
    }

    @Override
    public boolean deleteByUri(String uri) {
        return rows.remove(uri) != null;
    }

    @Override
    public Optional<StatusRecord> findByUri(String uri) {
        return Optional.ofNullable(rows.get(uri));
    }

    @Override
    public Optional<StatusRecord> findCurrentByAuthor(String authorDid) {
        return rows.values().stream()
            .filter(r -> r.authorDid().equals(authorDid) && !r.hidden())
            .max(Comparator.comparing(StatusRecord::startedAt));
    }

    public int size() {
        return rows.size();
    }
}
