package dev.fumaz.graft.introspect;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypesTest {

    @Test
    void classifiesBuiltinTypes() {
        assertTrue(Types.isBuiltin(int.class));
        assertTrue(Types.isBuiltin(Integer.class));
        assertTrue(Types.isBuiltin(String.class));
        assertTrue(Types.isBuiltin(int[].class));
        assertTrue(Types.isBuiltin(List.class));
        assertTrue(Types.isBuiltin(Map.class));
        assertTrue(Types.isBuiltin(TimeUnit.class));
        assertFalse(Types.isBuiltin(Runnable.class));
        assertFalse(Types.isBuiltin(Object.class));
    }

    @Test
    void convertsDefaultValues() {
        assertEquals(42, Types.convert("42", int.class));
        assertEquals(42L, Types.convert(" 42 ", Long.class));
        assertEquals(true, Types.convert("TRUE", boolean.class));
        assertEquals('x', Types.convert("x", char.class));
        assertEquals(1.5, Types.convert("1.5", double.class));
        assertEquals(TimeUnit.SECONDS, Types.convert("SECONDS", TimeUnit.class));
        assertEquals("text", Types.convert("text", String.class));
    }

    @Test
    void rejectsUnconvertibleValues() {
        assertThrows(IllegalArgumentException.class, () -> Types.convert("maybe", boolean.class));
        assertThrows(IllegalArgumentException.class, () -> Types.convert("xy", char.class));
        assertThrows(NumberFormatException.class, () -> Types.convert("eighty", int.class));
        assertThrows(IllegalArgumentException.class, () -> Types.convert("[]", List.class));
    }

}
