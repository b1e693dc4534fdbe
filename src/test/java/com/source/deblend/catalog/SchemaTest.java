package com.source.deblend.catalog;

import com.source.deblend.core.model.Point2D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Schema Tests")
class SchemaTest {

    @Test
    @DisplayName("Fields keep name, type and doc")
    void fieldsKeepMetadata() {
        Schema schema = new Schema();
        Key<Integer> key = schema.addInt("deblend.nchild", "Number of children");

        assertEquals("deblend.nchild", key.getName());
        assertEquals(FieldType.INT, key.getType());
        assertEquals("Number of children", key.getDoc());
        assertTrue(schema.contains(key));
        assertEquals(1, schema.size());
    }

    @Test
    @DisplayName("Re-registering with the same type returns the existing key")
    void reRegisterSameType() {
        Schema schema = new Schema();
        Key<Boolean> first = schema.addFlag("flag", "a flag");
        Key<Boolean> second = schema.addFlag("flag", "another doc");

        assertSame(first, second);
        assertEquals(1, schema.size());
    }

    @Test
    @DisplayName("Re-registering with a different type is rejected")
    void reRegisterDifferentType() {
        Schema schema = new Schema();
        schema.addFlag("field", "a flag");

        assertThrows(IllegalArgumentException.class, () -> schema.addDouble("field", "a double"));
    }

    @Test
    @DisplayName("Keys from another schema are not contained")
    void foreignKeyNotContained() {
        Schema a = new Schema();
        Schema b = new Schema();
        Key<Point2D> key = a.addPoint("center", "centroid");
        b.addPoint("center", "centroid");

        assertFalse(b.contains(key));
        assertTrue(b.find("center").isPresent());
        assertTrue(b.find("missing").isEmpty());
    }

    @Test
    @DisplayName("Blank names are rejected")
    void blankNameRejected() {
        Schema schema = new Schema();
        assertThrows(IllegalArgumentException.class, () -> schema.addFlag(" ", "doc"));
        assertThrows(NullPointerException.class, () -> schema.addFlag(null, "doc"));
    }
}
