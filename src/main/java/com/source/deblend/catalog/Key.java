package com.source.deblend.catalog;

import java.util.Objects;

/**
 * Typed handle to a field registered in a {@link Schema}.
 * Keys are only created by the schema and compare by identity of schema and name.
 *
 * @param <T> Java type of the field value
 */
public final class Key<T> {

    private final Schema schema;
    private final String name;
    private final FieldType type;
    private final String doc;

    Key(Schema schema, String name, FieldType type, String doc) {
        this.schema = schema;
        this.name = name;
        this.type = type;
        this.doc = doc;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public String getDoc() {
        return doc;
    }

    Schema getSchema() {
        return schema;
    }

    @SuppressWarnings("unchecked")
    T defaultValue() {
        return (T) type.getDefaultValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Key<?> key = (Key<?>) o;
        return schema == key.schema && name.equals(key.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(schema), name);
    }

    @Override
    public String toString() {
        return "Key{" + name + ":" + type + '}';
    }
}
