package habitkit.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void acceptsPlainIdentifiers() {
        assertEquals("habit_integration", TableNames.validate("habit_integration"));
        assertEquals("_t1", TableNames.validate("_t1"));
    }

    @Test
    void rejectsNamesThatCouldInjectSql() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }
}
