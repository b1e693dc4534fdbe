package com.source.deblend.catalog;

import com.source.deblend.core.model.Footprint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, append-only collection of {@link SourceRecord}s sharing one {@link Schema}.
 *
 * Records are never removed or reordered. Ids are assigned on append and increase
 * strictly, so every record's id is greater than the id of any record appended
 * before it. Appends and reads are synchronized, so workers may append children
 * concurrently.
 */
public class SourceCatalog {

    private final Schema schema;
    private final List<SourceRecord> records = new ArrayList<>();
    private final Map<Long, SourceRecord> byId = new HashMap<>();
    private long nextId;

    public SourceCatalog(Schema schema) {
        this(schema, 1L);
    }

    /**
     * @param schema  field registry for the records
     * @param firstId id given to the first appended record; must be positive
     */
    public SourceCatalog(Schema schema, long firstId) {
        this.schema = Objects.requireNonNull(schema, "schema is required");
        if (firstId <= 0) {
            throw new IllegalArgumentException("firstId must be positive");
        }
        this.nextId = firstId;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Appends an empty record and returns it.
     */
    public synchronized SourceRecord addNew() {
        SourceRecord record = new SourceRecord(this, nextId++);
        records.add(record);
        byId.put(record.getId(), record);
        return record;
    }

    /**
     * Appends a top-level record carrying {@code footprint}.
     */
    public SourceRecord addNew(Footprint footprint) {
        SourceRecord record = addNew();
        record.setFootprint(footprint);
        return record;
    }

    public synchronized SourceRecord get(int index) {
        return records.get(index);
    }

    public synchronized Optional<SourceRecord> findById(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Returns a snapshot of the current records in append order.
     */
    public synchronized List<SourceRecord> getRecords() {
        return List.copyOf(records);
    }

    /**
     * Returns the records whose parent is {@code parentId}, in append order.
     */
    public synchronized List<SourceRecord> getChildren(long parentId) {
        List<SourceRecord> children = new ArrayList<>();
        for (SourceRecord record : records) {
            if (record.getParent() == parentId) {
                children.add(record);
            }
        }
        return children;
    }
}
