package me.golemcore.browser.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.browser.capture.BrowserEventCapture;
import me.golemcore.browser.domain.model.PageRequest;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.infrastructure.event.SpringEventBus;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class BrowserGetLogsToolTest {

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private BrowserEventCapture capture;
    private BrowserGetLogsTool tool;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        capture = new BrowserEventCapture(new BrowserProperties(), clock, mock(SpringEventBus.class));
        tool = new BrowserGetLogsTool(capture, objectMapper);
    }

    @Test
    void shouldReturnBothStreamsByDefault() throws Exception {
        capture.onConsoleMessage("warning", "deprecated API");
        PageRequest request = new PageRequest("https://example.com/app.js", "GET", "script");
        capture.onRequest(request);
        clock.advance(Duration.ofMillis(12));
        capture.onResponse(request, 200, "OK");

        ToolResult result = tool.execute(Map.of());

        assertTrue(result.isSuccess());
        JsonNode json = objectMapper.readTree(result.getOutput());
        assertEquals(1, json.path("console").path("total").asInt());
        assertEquals("deprecated API", json.path("console").path("entries").get(0).path("text").asText());
        assertEquals("2026-03-01T12:00:00Z", json.path("console").path("entries").get(0).path("timestamp").asText());
        JsonNode response = json.path("network").path("entries").get(0);
        assertEquals("response", response.path("phase").asText());
        assertEquals(12, response.path("durationMs").asInt());
        assertFalse(json.path("network").path("entries").get(1).has("status"));
    }

    @Test
    void shouldApplyFiltersAndLimit() throws Exception {
        for (int i = 0; i < 3; i++) {
            PageRequest request = new PageRequest("https://api.example.com/items/" + i, "GET", "fetch");
            capture.onRequest(request);
            capture.onResponse(request, 500 + i, "error");
        }

        ToolResult result = tool.execute(Map.of(
                "logTypes", List.of("network"),
                "limit", 1,
                "filter", Map.of("statusRange", Map.of("min", 500, "max", 599), "urlPattern", "items/\\d")));

        JsonNode json = objectMapper.readTree(result.getOutput());
        assertFalse(json.has("console"));
        assertEquals(3, json.path("network").path("filtered").asInt());
        assertEquals(1, json.path("network").path("entries").size());
        assertEquals(502, json.path("network").path("entries").get(0).path("status").asInt());
    }

    @Test
    void shouldClearAfterReading() throws Exception {
        capture.onConsoleMessage("log", "once");

        tool.execute(Map.of("clear", true));
        ToolResult second = tool.execute(Map.of("logTypes", List.of("console")));

        assertEquals(0, objectMapper.readTree(second.getOutput()).path("console").path("total").asInt());
    }

    @Test
    void shouldRejectUnknownLogType() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("logTypes", List.of("dom"))));

        assertTrue(error.getMessage().startsWith("Unknown log type: dom"));
    }

    @Test
    void shouldRejectInvalidUrlPattern() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("filter", Map.of("urlPattern", "(unclosed"))));

        assertTrue(error.getMessage().startsWith("Invalid urlPattern"));
    }

    @Test
    void shouldRejectInvertedStatusRange() {
        assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("filter", Map.of("statusRange", Map.of("min", 500, "max", 400)))));
    }

    @Test
    void shouldRejectZeroLimit() {
        assertThrows(IllegalArgumentException.class, () -> tool.execute(Map.of("limit", 0)));
    }
}
