package com.source.deblend.catalog;

import com.source.deblend.core.model.Point2D;

/**
 * Value types a catalog field can hold, with the value an unset field reads as.
 */
public enum FieldType {
    FLAG(Boolean.class, Boolean.FALSE),
    INT(Integer.class, 0),
    DOUBLE(Double.class, Double.NaN),
    POINT(Point2D.class, null);

    private final Class<?> valueType;
    private final Object defaultValue;

    FieldType(Class<?> valueType, Object defaultValue) {
        this.valueType = valueType;
        this.defaultValue = defaultValue;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }
}
