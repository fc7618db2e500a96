package com.entity.linkage.store;

import com.entity.linkage.core.model.Record;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read and attribute-write access to the record collection being resolved.
 * Implementations report failures as {@link com.entity.linkage.core.exception.StorageException}.
 */
public interface RecordStore {

    int DEFAULT_PAGE_SIZE = 1000;

    /**
     * Name of the collection (or graph label) holding the records.
     */
    String getCollectionName();

    Optional<Record> findById(String id);

    /**
     * Fetches several records; identifiers with no record are left out.
     */
    List<Record> findByIds(Collection<String> ids);

    /**
     * Fetches the next page of records ordered by identifier.
     *
     * @param afterId cursor returned by the previous page, or null for the first page
     * @param limit   maximum records on the page
     */
    CursorPage<Record> fetchPage(String afterId, int limit);

    long count();

    /**
     * Merges the given attributes into existing records, keyed by record id.
     * Unknown identifiers are ignored.
     *
     * @return number of records updated
     */
    int updateFields(Map<String, Map<String, Object>> updatesById);

    /**
     * Engine version reported by the backing store, if it reports one.
     */
    default Optional<String> getEngineVersion() {
        return Optional.empty();
    }

    /**
     * Fetches the vector stored in a record field.
     *
     * @return the vector, or empty when the record or vector is missing
     */
    default Optional<double[]> fetchVector(String id, String field) {
        return findById(id).map(r -> r.getVector(field));
    }

    /**
     * Visits every record page by page, never holding more than one page.
     */
    default void forEachRecord(int pageSize, Consumer<Record> consumer) {
        String cursor = null;
        CursorPage<Record> page;
        do {
            page = fetchPage(cursor, pageSize);
            page.content().forEach(consumer);
            cursor = page.nextCursor();
        } while (page.hasMore());
    }
}
