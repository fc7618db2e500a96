package com.entity.linkage.store;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.model.Record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe in-process record collection ordered by identifier.
 */
public class InMemoryRecordStore implements RecordStore {

    private final String collectionName;
    private final NavigableMap<String, Record> records = new ConcurrentSkipListMap<>();
    private final String engineVersion;

    public InMemoryRecordStore(String collectionName) {
        this(collectionName, null);
    }

    public InMemoryRecordStore(String collectionName, String engineVersion) {
        InputSanitizer.validateCollectionName(collectionName);
        this.collectionName = collectionName;
        this.engineVersion = engineVersion;
    }

    public InMemoryRecordStore add(Record record) {
        records.put(record.id(), record);
        return this;
    }

    public InMemoryRecordStore addAll(Collection<Record> toAdd) {
        toAdd.forEach(this::add);
        return this;
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    @Override
    public Optional<Record> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(records.get(id));
    }

    @Override
    public List<Record> findByIds(Collection<String> ids) {
        List<Record> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Record record = records.get(id);
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public CursorPage<Record> fetchPage(String afterId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        Collection<Record> tail = afterId == null ? records.values() : records.tailMap(afterId, false).values();
        List<Record> content = new ArrayList<>(Math.min(limit, records.size()));
        boolean hasMore = false;
        for (Record record : tail) {
            if (content.size() == limit) {
                hasMore = true;
                break;
            }
            content.add(record);
        }
        String next = content.isEmpty() ? null : content.get(content.size() - 1).id();
        return new CursorPage<>(content, hasMore ? next : null, hasMore);
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public int updateFields(Map<String, Map<String, Object>> updatesById) {
        int updated = 0;
        for (Map.Entry<String, Map<String, Object>> entry : updatesById.entrySet()) {
            Record existing = records.get(entry.getKey());
            if (existing == null) {
                continue;
            }
            Map<String, Object> merged = new LinkedHashMap<>(existing.fields());
            merged.putAll(entry.getValue());
            records.put(existing.id(), new Record(existing.id(), merged));
            updated++;
        }
        return updated;
    }

    @Override
    public Optional<String> getEngineVersion() {
        return Optional.ofNullable(engineVersion);
    }
}
