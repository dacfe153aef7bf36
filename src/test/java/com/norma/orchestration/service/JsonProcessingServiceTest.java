package com.norma.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.norma.orchestration.model.EvidenceReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    static record TestBean(String name, int age) {}

    @Test
    void testParseJsonResponse() {
        String raw = "Here is the result: {\"name\":\"John\", \"age\":30} and some extra text.";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals("John", bean.name());
        assertEquals(30, bean.age());
    }

    @Test
    void testParseCodeFencedResponse() {
        String raw = "```json\n{\"status\": \"success\", \"document_name\": \"SP 63.13330.2018\", "
                + "\"structured_output\": {\"cover_mm\": 20}, \"confidence\": 0.9}\n```";
        EvidenceReport report = service.parseJsonResponse("evidence-analysis", raw, EvidenceReport.class);
        assertNotNull(report);
        assertEquals("SP 63.13330.2018", report.documentName());
        assertEquals(20, report.structuredOutput().get("cover_mm"));
    }

    @Test
    void testParseEmptyResponse() {
        TestBean bean = service.parseJsonResponse("test", "", TestBean.class);
        assertNull(bean);
    }

    @Test
    void testParseInvalidJson() {
        String raw = "{invalid-json}";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNull(bean);
    }

    @Test
    void testTruncateFlattensLongText() {
        String truncated = JsonProcessingService.truncate("line\n".repeat(100));
        assertFalse(truncated.contains("\n"));
        assertTrue(truncated.endsWith("..."));
    }

    @Test
    void testToJson() {
        TestBean bean = new TestBean("Alice", 20);
        String json = service.toJson(bean);
        assertTrue(json.contains("\"name\" : \"Alice\""));
        assertTrue(json.contains("\"age\" : 20"));
    }
}
