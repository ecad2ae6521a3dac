package me.golemcore.browser.capture;

import me.golemcore.browser.domain.model.ConsoleLogEntry;
import me.golemcore.browser.domain.model.ConsoleLogFilter;
import me.golemcore.browser.domain.model.LogKind;
import me.golemcore.browser.domain.model.LogQuery;
import me.golemcore.browser.domain.model.LogQueryResult;
import me.golemcore.browser.domain.model.NetworkLogEntry;
import me.golemcore.browser.domain.model.NetworkLogFilter;
import me.golemcore.browser.domain.model.NetworkPhase;
import me.golemcore.browser.domain.model.PageRequest;
import me.golemcore.browser.domain.model.ResourceUpdatedEvent;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.infrastructure.event.SpringEventBus;
import me.golemcore.browser.port.outbound.PageEventListener;
import me.golemcore.browser.port.outbound.PageHandle;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class BrowserEventCaptureTest {

    private static final PageRequest GET_API = new PageRequest("https://example.com/api", "GET", "fetch");
    private static final PageRequest POST_API = new PageRequest("https://example.com/api", "POST", "xhr");

    private BrowserProperties properties;
    private MutableClock clock;
    private SpringEventBus eventBus;
    private BrowserEventCapture capture;

    @BeforeEach
    void setUp() {
        properties = new BrowserProperties();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        eventBus = mock(SpringEventBus.class);
        capture = new BrowserEventCapture(properties, clock, eventBus);
    }

    // ===== console =====

    @Test
    void shouldRecordConsoleMessagesAndPublishUpdate() {
        capture.onConsoleMessage("log", "hello");

        List<ConsoleLogEntry> entries = capture.getConsoleEntries();
        assertEquals(1, entries.size());
        assertEquals("log", entries.get(0).getType());
        assertEquals("hello", entries.get(0).getText());
        assertEquals(clock.instant(), entries.get(0).getTimestamp());
        verify(eventBus).publish(new ResourceUpdatedEvent(BrowserEventCapture.CONSOLE_RESOURCE_URI));
    }

    @Test
    void shouldKeepOnlyConfiguredNumberOfConsoleEntries() {
        properties.getLogs().setConsoleMaxEntries(3);
        capture = new BrowserEventCapture(properties, clock, eventBus);

        for (int i = 1; i <= 5; i++) {
            capture.onConsoleMessage("log", "m" + i);
        }

        assertEquals(List.of("m3", "m4", "m5"), capture.getConsoleEntries().stream()
                .map(ConsoleLogEntry::getText).toList());
    }

    @Test
    void shouldRetainLastEntriesOfConsoleStreamByDefault() {
        for (int i = 1; i <= 600; i++) {
            capture.onConsoleMessage("log", "m" + i);
        }

        List<ConsoleLogEntry> entries = capture.getConsoleEntries();
        assertEquals(500, entries.size());
        assertEquals("m101", entries.get(0).getText());
        assertEquals("m600", entries.get(499).getText());
    }

    // ===== network correlation =====

    @Test
    void shouldCorrelateResponseWithRequest() {
        capture.onRequest(GET_API);
        assertTrue(capture.hasPendingRequest(GET_API.url(), "GET"));
        clock.advance(Duration.ofMillis(250));
        capture.onResponse(GET_API, 200, "OK");

        List<NetworkLogEntry> entries = networkEntries(LogQuery.builder().build());
        assertEquals(2, entries.size());
        NetworkLogEntry response = entries.get(0);
        NetworkLogEntry request = entries.get(1);
        assertEquals(NetworkPhase.RESPONSE, response.getPhase());
        assertEquals(NetworkPhase.REQUEST, request.getPhase());
        assertEquals(request.getId(), response.getId());
        assertEquals(200, response.getStatus());
        assertEquals("OK", response.getStatusText());
        assertEquals(250L, response.getDurationMs());
        assertNull(request.getDurationMs());
        assertFalse(capture.hasPendingRequest(GET_API.url(), "GET"));
    }

    @Test
    void shouldCorrelateFailureWithRequest() {
        capture.onRequest(POST_API);
        clock.advance(Duration.ofMillis(40));
        capture.onRequestFailed(POST_API, "net::ERR_CONNECTION_REFUSED");

        NetworkLogEntry failed = networkEntries(LogQuery.builder().build()).get(0);
        assertEquals(NetworkPhase.FAILED, failed.getPhase());
        assertEquals("net::ERR_CONNECTION_REFUSED", failed.getError());
        assertEquals(40L, failed.getDurationMs());
        assertEquals(0, capture.pendingRequestCount());
    }

    @Test
    void shouldTrackMethodsOfSameUrlSeparately() {
        capture.onRequest(GET_API);
        capture.onRequest(POST_API);
        capture.onResponse(POST_API, 201, "Created");

        assertTrue(capture.hasPendingRequest(GET_API.url(), "GET"));
        assertFalse(capture.hasPendingRequest(POST_API.url(), "POST"));
    }

    @Test
    void shouldRecordUncorrelatedResponseWithoutDuration() {
        capture.onResponse(GET_API, 304, "Not Modified");

        NetworkLogEntry response = networkEntries(LogQuery.builder().build()).get(0);
        assertNull(response.getDurationMs());
        assertEquals(304, response.getStatus());
        assertTrue(response.getId() != null && !response.getId().isEmpty());
    }

    @Test
    void shouldGiveDistinctIdsToDistinctRequests() {
        capture.onRequest(GET_API);
        capture.onRequest(POST_API);

        List<NetworkLogEntry> entries = networkEntries(LogQuery.builder().build());
        assertNotEquals(entries.get(0).getId(), entries.get(1).getId());
    }

    // ===== queries =====

    @Test
    void shouldReturnNewestFirstAndRespectLimit() {
        for (int i = 1; i <= 5; i++) {
            capture.onConsoleMessage("log", "m" + i);
        }

        LogQueryResult result = capture.getLogs(LogQuery.builder().limit(2).build());

        assertEquals(5, result.getConsole().total());
        assertEquals(5, result.getConsole().filtered());
        assertEquals(List.of("m5", "m4"), result.getConsole().entries().stream()
                .map(ConsoleLogEntry::getText).toList());
    }

    @Test
    void shouldUseDefaultLimitWhenNoneGiven() {
        for (int i = 1; i <= 150; i++) {
            capture.onConsoleMessage("log", "m" + i);
        }

        LogQueryResult result = capture.getLogs(LogQuery.builder().build());

        assertEquals(100, result.getConsole().entries().size());
        assertEquals("m150", result.getConsole().entries().get(0).getText());
    }

    @Test
    void shouldFilterConsoleByTypeAndCaseInsensitiveSearch() {
        capture.onConsoleMessage("log", "Loaded page");
        capture.onConsoleMessage("error", "Failed to LOAD resource");
        capture.onConsoleMessage("error", "Uncaught TypeError");

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .kinds(EnumSet.of(LogKind.CONSOLE))
                .consoleFilter(ConsoleLogFilter.builder().types(List.of("error")).search("load").build())
                .build());

        assertEquals(3, result.getConsole().total());
        assertEquals(1, result.getConsole().filtered());
        assertEquals("Failed to LOAD resource", result.getConsole().entries().get(0).getText());
        assertNull(result.getNetwork());
    }

    @Test
    void shouldReturnOnlyErrorEntryForErrorTypeFilter() {
        capture.onConsoleMessage("info", "a");
        capture.onConsoleMessage("error", "b");
        capture.onConsoleMessage("info", "c");

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .kinds(EnumSet.of(LogKind.CONSOLE))
                .consoleFilter(ConsoleLogFilter.builder().types(List.of("error")).build())
                .build());

        assertEquals(List.of("b"), result.getConsole().entries().stream().map(ConsoleLogEntry::getText).toList());
    }

    @Test
    void shouldFilterNetworkByStatusRangeAndUrlPattern() {
        PageRequest image = new PageRequest("https://cdn.example.com/logo.png", "GET", "image");
        capture.onRequest(GET_API);
        capture.onResponse(GET_API, 500, "Server Error");
        capture.onRequest(image);
        capture.onResponse(image, 404, "Not Found");

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .kinds(EnumSet.of(LogKind.NETWORK))
                .networkFilter(NetworkLogFilter.builder()
                        .statusMin(400)
                        .statusMax(499)
                        .urlPattern(Pattern.compile("\\.png$"))
                        .build())
                .build());

        assertEquals(4, result.getNetwork().total());
        assertEquals(1, result.getNetwork().filtered());
        assertEquals(404, result.getNetwork().entries().get(0).getStatus());
        assertNull(result.getConsole());
    }

    @Test
    void statusFilterShouldExcludeEntriesWithoutStatus() {
        capture.onRequest(GET_API);
        capture.onRequestFailed(GET_API, "aborted");

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .networkFilter(NetworkLogFilter.builder().statusCodes(List.of(200)).build())
                .build());

        assertEquals(0, result.getNetwork().filtered());
    }

    @Test
    void shouldFilterFailedOnlyAndByMethodIgnoringCase() {
        capture.onRequest(GET_API);
        capture.onRequest(POST_API);
        capture.onRequestFailed(POST_API, "aborted");
        capture.onRequestFailed(GET_API, "aborted");

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .networkFilter(NetworkLogFilter.builder().failedOnly(true).methods(List.of("post")).build())
                .build());

        assertEquals(1, result.getNetwork().filtered());
        assertEquals("POST", result.getNetwork().entries().get(0).getMethod());
    }

    @Test
    void shouldClearOnlySelectedStreamsAfterReading() {
        capture.onConsoleMessage("log", "hello");
        capture.onRequest(GET_API);

        LogQueryResult result = capture.getLogs(LogQuery.builder()
                .kinds(EnumSet.of(LogKind.NETWORK))
                .clear(true)
                .build());

        assertEquals(1, result.getNetwork().total());
        assertEquals(1, result.getNetwork().entries().size());
        assertEquals(0, capture.pendingRequestCount());
        LogQueryResult after = capture.getLogs(LogQuery.builder().build());
        assertEquals(0, after.getNetwork().total());
        assertEquals(1, after.getConsole().total());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        LogQuery query = LogQuery.builder().limit(0).build();
        assertThrows(IllegalArgumentException.class, () -> capture.getLogs(query));
    }

    // ===== lifecycle =====

    @Test
    void shouldRecordEventsOfAttachedPage() {
        PageHandle page = mock(PageHandle.class);
        capture.attach(page);

        PageEventListener listener = listenerOf(page);
        listener.onConsoleMessage("log", "hello");
        listener.onRequest(GET_API);
        listener.onResponse(GET_API, 200, "OK");

        LogQueryResult result = capture.getLogs(LogQuery.builder().build());
        assertEquals(1, result.getConsole().total());
        assertEquals(2, result.getNetwork().total());
    }

    @Test
    void shouldIgnoreEventsOfReplacedPage() {
        PageHandle oldPage = mock(PageHandle.class);
        PageHandle newPage = mock(PageHandle.class);
        capture.attach(oldPage);
        PageEventListener oldListener = listenerOf(oldPage);

        capture.attach(newPage);
        oldListener.onConsoleMessage("error", "unload");
        oldListener.onRequest(GET_API);
        oldListener.onRequestFailed(GET_API, "net::ERR_ABORTED");
        listenerOf(newPage).onConsoleMessage("log", "fresh");

        LogQueryResult result = capture.getLogs(LogQuery.builder().build());
        assertEquals(1, result.getConsole().total());
        assertEquals("fresh", result.getConsole().entries().get(0).getText());
        assertEquals(0, result.getNetwork().total());
        assertEquals(0, capture.pendingRequestCount());
    }

    @Test
    void shouldIgnoreEventsAfterDetach() {
        PageHandle page = mock(PageHandle.class);
        capture.attach(page);
        PageEventListener listener = listenerOf(page);

        capture.detach();
        listener.onConsoleMessage("warning", "late");
        listener.onRequestFailed(GET_API, "net::ERR_ABORTED");

        LogQueryResult result = capture.getLogs(LogQuery.builder().build());
        assertEquals(0, result.getConsole().total());
        assertEquals(0, result.getNetwork().total());
    }

    @Test
    void resetShouldDropEverything() {
        capture.onConsoleMessage("log", "hello");
        capture.onRequest(GET_API);

        capture.reset();

        LogQueryResult result = capture.getLogs(LogQuery.builder().build());
        assertEquals(0, result.getConsole().total());
        assertEquals(0, result.getNetwork().total());
        assertEquals(0, capture.pendingRequestCount());
    }

    private static PageEventListener listenerOf(PageHandle page) {
        ArgumentCaptor<PageEventListener> captor = ArgumentCaptor.forClass(PageEventListener.class);
        verify(page).addEventListener(captor.capture());
        return captor.getValue();
    }

    private List<NetworkLogEntry> networkEntries(LogQuery query) {
        return capture.getLogs(query).getNetwork().entries();
    }
}
