package com.source.deblend.catalog;

import com.source.deblend.core.model.Footprint;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One detection in a {@link SourceCatalog}.
 *
 * The id is assigned by the catalog and never changes. Field values are read and
 * written through {@link Key}s of the owning catalog's schema; reads of unset
 * fields return the field type's default.
 */
public class SourceRecord {

    /** Parent id of a top-level record. */
    public static final long NO_PARENT = 0L;

    private final SourceCatalog catalog;
    private final long id;
    private volatile long parent = NO_PARENT;
    private volatile Footprint footprint;
    private final Map<Key<?>, Object> values = new ConcurrentHashMap<>();

    SourceRecord(SourceCatalog catalog, long id) {
        this.catalog = catalog;
        this.id = id;
    }

    public long getId() {
        return id;
    }

    public long getParent() {
        return parent;
    }

    public void setParent(long parent) {
        this.parent = parent;
    }

    public boolean hasParent() {
        return parent != NO_PARENT;
    }

    public Footprint getFootprint() {
        return footprint;
    }

    public void setFootprint(Footprint footprint) {
        this.footprint = footprint;
    }

    /**
     * Peak count of the footprint, 0 when no footprint is attached.
     */
    public int getPeakCount() {
        Footprint fp = footprint;
        return fp == null ? 0 : fp.getPeakCount();
    }

    @SuppressWarnings("unchecked")
    public <T> T get(Key<T> key) {
        checkKey(key);
        Object value = values.get(key);
        return value != null ? (T) value : key.defaultValue();
    }

    public <T> void set(Key<T> key, T value) {
        checkKey(key);
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    /**
     * Returns true if the field has been written on this record.
     */
    public boolean isSet(Key<?> key) {
        checkKey(key);
        return values.containsKey(key);
    }

    private void checkKey(Key<?> key) {
        Objects.requireNonNull(key, "key is required");
        if (!catalog.getSchema().contains(key)) {
            throw new IllegalArgumentException("Key " + key.getName() + " does not belong to this catalog's schema");
        }
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "id=" + id +
                ", parent=" + parent +
                ", footprint=" + footprint +
                '}';
    }
}
