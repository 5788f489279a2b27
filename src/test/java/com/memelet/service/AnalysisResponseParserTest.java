package com.memelet.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memelet.model.MediaAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser();

    @Test
    void testParse_PlainObject() throws Exception {
        MediaAnalysis analysis = parser.parse("""
                {"references": "Shrek", "template": "Pepe the Frog", "caption": "when the code compiles",
                 "description": "A frog smiling", "meaning": "Relief", "tags": "pepe, programming"}""");

        assertEquals("Shrek", analysis.getReferences());
        assertEquals("Pepe the Frog", analysis.getTemplate());
        assertEquals("when the code compiles", analysis.getCaption());
        assertEquals("A frog smiling", analysis.getDescription());
        assertEquals("Relief", analysis.getMeaning());
        assertEquals(List.of("pepe", "programming"), analysis.getTags());
    }

    @Test
    void testParse_FencedWithLanguageTag() throws Exception {
        MediaAnalysis analysis = parser.parse("```json\n{\"description\": \"x\"}\n```");

        assertEquals("x", analysis.getDescription());
        assertNull(analysis.getReferences(), "omitted fields stay null");
        assertTrue(analysis.getTags().isEmpty());
    }

    @Test
    void testParse_FencedWithoutLanguageTag() throws Exception {
        MediaAnalysis analysis = parser.parse("  ```\n{\"meaning\": \"irony\"}```  ");

        assertEquals("irony", analysis.getMeaning());
    }

    @Test
    void testParse_ListAndNonStringValuesAreNormalized() throws Exception {
        MediaAnalysis analysis = parser.parse("""
                {"caption": ["top text", "bottom text"], "references": {"movie": "Shrek"},
                 "meaning": 42, "template": null, "extra": "ignored"}""");

        assertEquals("top text\nbottom text", analysis.getCaption());
        assertEquals(new ObjectMapper().readTree("{\"movie\":\"Shrek\"}"),
                new ObjectMapper().readTree(analysis.getReferences()));
        assertEquals("42", analysis.getMeaning());
        assertNull(analysis.getTemplate());
    }

    @Test
    void testParse_TagsAreTrimmedAndDeduplicatedCaseInsensitively() throws Exception {
        MediaAnalysis fromString = parser.parse("{\"tags\": \" Pepe ,pepe\\nCats,, \"}");
        MediaAnalysis fromArray = parser.parse("{\"tags\": [\"Cats\", \" cats \", 7, \"Dogs\"]}");

        assertEquals(List.of("Pepe", "Cats"), fromString.getTags());
        assertEquals(List.of("Cats", "Dogs"), fromArray.getTags());
    }

    @Test
    void testParse_UnsupportedTagsValueIsIgnored() throws Exception {
        MediaAnalysis analysis = parser.parse("{\"description\": \"x\", \"tags\": {\"a\": 1}}");

        assertTrue(analysis.getTags().isEmpty());
        assertEquals("x", analysis.getDescription());
    }

    @Test
    void testParse_Failures() {
        assertThrows(ResponseParseException.class, () -> parser.parse(null));
        assertThrows(ResponseParseException.class, () -> parser.parse("   "));
        assertThrows(ResponseParseException.class, () -> parser.parse("```json\n```"));
        assertThrows(ResponseParseException.class, () -> parser.parse("I cannot analyze this image."));
        assertThrows(ResponseParseException.class, () -> parser.parse("[\"not\", \"an object\"]"));
    }

    @Test
    void testStripFences() {
        assertEquals("{}", parser.stripFences("```json {} ```"));
        assertEquals("{}", parser.stripFences("{}"));
        assertEquals("", parser.stripFences(null));
    }
}
