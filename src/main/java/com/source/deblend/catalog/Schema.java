package com.source.deblend.catalog;

import com.source.deblend.core.model.Point2D;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of the measurement fields a {@link SourceCatalog} stores per record.
 *
 * Fields are registered with a name, a {@link FieldType} and a description.
 * Registering an existing name again with the same type returns the existing key,
 * so independent components may declare the fields they share.
 */
public class Schema {

    private final Map<String, Key<?>> fields = new LinkedHashMap<>();

    public Key<Boolean> addFlag(String name, String doc) {
        return addField(name, FieldType.FLAG, doc);
    }

    public Key<Integer> addInt(String name, String doc) {
        return addField(name, FieldType.INT, doc);
    }

    public Key<Double> addDouble(String name, String doc) {
        return addField(name, FieldType.DOUBLE, doc);
    }

    public Key<Point2D> addPoint(String name, String doc) {
        return addField(name, FieldType.POINT, doc);
    }

    @SuppressWarnings("unchecked")
    private synchronized <T> Key<T> addField(String name, FieldType type, String doc) {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        Key<?> existing = fields.get(name);
        if (existing != null) {
            if (existing.getType() != type) {
                throw new IllegalArgumentException("Field '" + name + "' already registered as "
                        + existing.getType() + ", cannot re-register as " + type);
            }
            return (Key<T>) existing;
        }
        Key<T> key = new Key<>(this, name, type, doc != null ? doc : "");
        fields.put(name, key);
        return key;
    }

    public synchronized Optional<Key<?>> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public synchronized boolean contains(Key<?> key) {
        return key != null && key.getSchema() == this && fields.get(key.getName()) == key;
    }

    public synchronized List<Key<?>> getFields() {
        return new ArrayList<>(fields.values());
    }

    public synchronized int size() {
        return fields.size();
    }
}
