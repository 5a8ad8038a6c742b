package habitkit.jdbc;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void nestedDocumentSurvivesEncoding() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("currentStreak", 3);
        document.put("ratio", 0.5);
        document.put("history", List.of("2024-03-01", "2024-03-02"));
        document.put("stats", Map.of("total", 12));
        document.put("note", null);

        Map<String, Object> parsed = codec.parseObject(codec.toJson(document));

        assertEquals(document, parsed);
        assertInstanceOf(Double.class, parsed.get("ratio"));
        assertTrue(parsed.containsKey("note"));
    }

    @Test
    void nullDocumentEncodesAsEmptyObject() {
        assertEquals("{}", codec.toJson(null));
    }

    @Test
    void blankInputParsesToEmptyMutableMap() {
        Map<String, Object> parsed = codec.parseObject("  ");
        assertTrue(parsed.isEmpty());
        parsed.put("k", 1);
    }

    @Test
    void arrayInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":"));
    }
}
