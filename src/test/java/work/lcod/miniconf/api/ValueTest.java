package work.lcod.miniconf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ValueTest {
    @Test
    void constructorsFixTheTagAndGettersReturnThePayload() {
        assertEquals(DataType.INT, Value.of(122).type());
        assertEquals(122, Value.of(122).getInt());
        assertEquals(DataType.NUMBER, Value.of(3.14).type());
        assertEquals(3.14, Value.of(3.14).getNumber());
        assertEquals(DataType.BOOL, Value.of(true).type());
        assertTrue(Value.of(true).getBoolean());
        assertEquals(DataType.TEXT, Value.of("string").type());
        assertEquals("string", Value.of("string").getText());
    }

    @Test
    void unknownIsEmptyAndDistinctFromZeroValues() {
        assertTrue(Value.unknown().isEmpty());
        assertTrue(Value.of((String) null).isEmpty());
        assertFalse(Value.of(0).isEmpty());
        assertFalse(Value.of(false).isEmpty());
        assertFalse(Value.of("").isEmpty());
    }

    @Test
    void mismatchedGetterFailsLoudly() {
        var ex = assertThrows(ValueTypeException.class, () -> Value.of("text").getInt());
        assertEquals(DataType.INT, ex.expected());
        assertEquals(DataType.TEXT, ex.actual());
        assertThrows(ValueTypeException.class, () -> Value.unknown().getBoolean());
        assertThrows(ValueTypeException.class, () -> Value.of(1).getNumber());
    }

    @Test
    void copyIsIndependentOfTheSource() {
        var source = Value.of(7);
        var copy = source.copy();
        source.set("changed");
        assertEquals(DataType.INT, copy.type());
        assertEquals(7, copy.getInt());
        assertEquals("changed", source.getText());
    }

    @Test
    void takeLeavesTheSourceEmpty() {
        var source = Value.of("payload");
        var moved = source.take();
        assertEquals("payload", moved.getText());
        assertTrue(source.isEmpty());
        assertEquals(DataType.UNKNOWN, source.type());
    }

    @Test
    void assignmentReplacesPayloadAndTag() {
        var value = Value.of(1.5);
        value.set(true);
        assertEquals(DataType.BOOL, value.type());
        value.set(Value.of(42));
        assertEquals(42, value.getInt());
        value.clear();
        assertTrue(value.isEmpty());
    }

    @Test
    void printRendersCanonicalScalars() {
        assertEquals("122", Value.of(122).print());
        assertEquals("3.140000", Value.of(3.14).print());
        assertEquals("true", Value.of(true).print());
        assertEquals("false", Value.of(false).print());
        assertEquals("\"hello\"", Value.of("hello").print());
        assertEquals("hello", Value.of("hello").asText());
        assertEquals("", Value.unknown().print());
    }

    @Test
    void printTypeNamesTheTag() {
        assertEquals("int", Value.of(1).printType());
        assertEquals("number", Value.of(1.0).printType());
        assertEquals("bool", Value.of(true).printType());
        assertEquals("text", Value.of("x").printType());
        assertEquals("unknown", Value.unknown().printType());
    }

    @Test
    void ofObjectWrapsBoxedScalars() {
        assertEquals(5, Value.ofObject(5).getInt());
        assertEquals(2.5, Value.ofObject(2.5).getNumber());
        assertTrue(Value.ofObject(Boolean.TRUE).getBoolean());
        assertEquals("a", Value.ofObject("a").getText());
        assertTrue(Value.ofObject(5L).isEmpty());
    }
}
