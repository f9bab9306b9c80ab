package com.strollie.planner.explain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExplanationParser")
class ExplanationParserTest {

    private static final String JSON = """
            {"summary": "Прогулка по центру", "stops": [{"order": 1, "why": "Вид на Волгу", "tip": "Возьмите камеру"}],
             "notes": ["Удобная обувь"], "extra": true}
            """;

    private final ExplanationParser parser = new ExplanationParser(new ObjectMapper());

    @Test
    @DisplayName("Plain JSON reply is read directly")
    void testStrictJson() {
        RouteExplanation explanation = parser.parse(JSON).orElseThrow();
        assertEquals("Прогулка по центру", explanation.getSummary());
        assertEquals(1, explanation.getStops().size());
        assertEquals("Вид на Волгу", explanation.getStops().get(0).getWhy());
        assertEquals("Удобная обувь", explanation.getNotes().get(0));
    }

    @Test
    @DisplayName("Fenced block is extracted")
    void testFenced() {
        String reply = "Вот маршрут:\n```json\n" + JSON + "\n```\nХорошей прогулки!";
        assertEquals("Прогулка по центру", parser.parse(reply).orElseThrow().getSummary());
    }

    @Test
    @DisplayName("Object embedded in prose is extracted")
    void testEmbeddedObject() {
        String reply = "Конечно! " + JSON + " Если нужно, уточню.";
        assertEquals("Прогулка по центру", parser.parse(reply).orElseThrow().getSummary());
    }

    @Test
    @DisplayName("Braces inside strings do not end the object")
    void testBracesInStrings() {
        String reply = "ответ: {\"summary\": \"скобка } внутри\", \"stops\": []} конец";
        assertEquals(Optional.of("{\"summary\": \"скобка } внутри\", \"stops\": []}"),
                ExplanationParser.firstObject(reply));
    }

    @Test
    @DisplayName("Garbage and replies without summary are rejected")
    void testRejected() {
        assertTrue(parser.parse("не могу помочь").isEmpty());
        assertTrue(parser.parse("{\"stops\": []}").isEmpty());
        assertTrue(parser.parse("{\"summary\": \"обрыв").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
