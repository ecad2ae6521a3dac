/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.browser.capture;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ConsoleLogEntry;
import me.golemcore.browser.domain.model.ConsoleLogFilter;
import me.golemcore.browser.domain.model.LogKind;
import me.golemcore.browser.domain.model.LogQuery;
import me.golemcore.browser.domain.model.LogQueryResult;
import me.golemcore.browser.domain.model.LogSlice;
import me.golemcore.browser.domain.model.NetworkLogEntry;
import me.golemcore.browser.domain.model.NetworkLogFilter;
import me.golemcore.browser.domain.model.NetworkPhase;
import me.golemcore.browser.domain.model.PageRequest;
import me.golemcore.browser.domain.model.ResourceUpdatedEvent;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.infrastructure.event.SpringEventBus;
import me.golemcore.browser.port.outbound.PageEventListener;
import me.golemcore.browser.port.outbound.PageHandle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Captures console messages and network traffic of the session page into two
 * bounded ring buffers and answers filtered queries over them.
 *
 * <p>
 * Request starts are remembered by {@code (url, method)} until the matching
 * response or failure arrives, which yields the exchange duration. A second
 * request to the same key started before the first completes replaces the
 * pending record, so durations of concurrent duplicates are best-effort.
 *
 * <p>
 * Capacities:
 * <ul>
 * <li>{@code browser.logs.console-max-entries} - console buffer (500)</li>
 * <li>{@code browser.logs.network-max-entries} - network buffer (1000)</li>
 * <li>{@code browser.logs.default-limit} - entries returned per stream
 * (100)</li>
 * </ul>
 */
@Component
@Slf4j
public class BrowserEventCapture implements PageEventListener {

    public static final String CONSOLE_RESOURCE_URI = "console://logs";

    private final Clock clock;
    private final SpringEventBus eventBus;
    private final RingBuffer<ConsoleLogEntry> consoleLogs;
    private final RingBuffer<NetworkLogEntry> networkLogs;
    private final int defaultLimit;

    private final Object pendingLock = new Object();
    private final Map<CorrelationKey, PendingRequest> pendingRequests = new HashMap<>();

    private volatile PageHandle activePage;

    public BrowserEventCapture(BrowserProperties properties, Clock clock, SpringEventBus eventBus) {
        BrowserProperties.LogsProperties logs = properties.getLogs();
        this.clock = clock;
        this.eventBus = eventBus;
        this.consoleLogs = new RingBuffer<>(normalizePositive(logs.getConsoleMaxEntries(), 500));
        this.networkLogs = new RingBuffer<>(normalizePositive(logs.getNetworkMaxEntries(), 1000));
        this.defaultLimit = normalizePositive(logs.getDefaultLimit(), 100);
    }

    /**
     * Subscribe this capture to the events of a freshly created page. Only the
     * most recently attached page is recorded; events of earlier pages are
     * dropped.
     */
    public void attach(PageHandle page) {
        activePage = page;
        page.addEventListener(new PageScopedListener(page));
        log.debug("Event capture attached to page");
    }

    /**
     * Stop recording events of the attached page.
     */
    public void detach() {
        activePage = null;
    }

    @Override
    public void onConsoleMessage(String type, String text) {
        consoleLogs.append(ConsoleLogEntry.builder()
                .timestamp(clock.instant())
                .type(type)
                .text(text)
                .build());
        eventBus.publish(new ResourceUpdatedEvent(CONSOLE_RESOURCE_URI));
    }

    @Override
    public void onRequest(PageRequest request) {
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();
        synchronized (pendingLock) {
            pendingRequests.put(CorrelationKey.of(request), new PendingRequest(id, now));
        }
        networkLogs.append(NetworkLogEntry.builder()
                .id(id)
                .timestamp(now)
                .phase(NetworkPhase.REQUEST)
                .url(request.url())
                .method(request.method())
                .resourceType(request.resourceType())
                .build());
    }

    @Override
    public void onResponse(PageRequest request, int status, String statusText) {
        Instant now = clock.instant();
        PendingRequest pending = takePending(request);
        networkLogs.append(NetworkLogEntry.builder()
                .id(pending != null ? pending.id() : UUID.randomUUID().toString())
                .timestamp(now)
                .phase(NetworkPhase.RESPONSE)
                .url(request.url())
                .method(request.method())
                .resourceType(request.resourceType())
                .status(status)
                .statusText(statusText)
                .durationMs(durationSince(pending, now))
                .build());
    }

    @Override
    public void onRequestFailed(PageRequest request, String errorText) {
        Instant now = clock.instant();
        PendingRequest pending = takePending(request);
        networkLogs.append(NetworkLogEntry.builder()
                .id(pending != null ? pending.id() : UUID.randomUUID().toString())
                .timestamp(now)
                .phase(NetworkPhase.FAILED)
                .url(request.url())
                .method(request.method())
                .resourceType(request.resourceType())
                .durationMs(durationSince(pending, now))
                .error(errorText)
                .build());
    }

    /**
     * Run a query over the selected streams. With {@code clear} set, the
     * selected buffers are emptied after the result was taken; clearing the
     * network stream also forgets pending request starts.
     */
    public LogQueryResult getLogs(LogQuery query) {
        int limit = query.getLimit() != null ? query.getLimit() : defaultLimit;
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }

        LogQueryResult.LogQueryResultBuilder result = LogQueryResult.builder();
        if (query.includes(LogKind.CONSOLE)) {
            List<ConsoleLogEntry> entries = query.isClear() ? consoleLogs.snapshotAndClear() : consoleLogs.snapshot();
            ConsoleLogFilter filter = query.getConsoleFilter() != null ? query.getConsoleFilter()
                    : ConsoleLogFilter.none();
            result.console(slice(entries, filter::matches, limit));
        }
        if (query.includes(LogKind.NETWORK)) {
            List<NetworkLogEntry> entries;
            if (query.isClear()) {
                entries = networkLogs.snapshotAndClear();
                clearPending();
            } else {
                entries = networkLogs.snapshot();
            }
            NetworkLogFilter filter = query.getNetworkFilter() != null ? query.getNetworkFilter()
                    : NetworkLogFilter.none();
            result.network(slice(entries, filter::matches, limit));
        }
        return result.build();
    }

    /**
     * Console entries, oldest first.
     */
    public List<ConsoleLogEntry> getConsoleEntries() {
        return consoleLogs.snapshot();
    }

    /**
     * Drop everything captured so far, including pending request starts.
     */
    public void reset() {
        consoleLogs.clear();
        networkLogs.clear();
        clearPending();
        log.debug("Event capture reset");
    }

    public boolean hasPendingRequest(String url, String method) {
        synchronized (pendingLock) {
            return pendingRequests.containsKey(new CorrelationKey(url, method));
        }
    }

    public int pendingRequestCount() {
        synchronized (pendingLock) {
            return pendingRequests.size();
        }
    }

    private PendingRequest takePending(PageRequest request) {
        synchronized (pendingLock) {
            return pendingRequests.remove(CorrelationKey.of(request));
        }
    }

    private void clearPending() {
        synchronized (pendingLock) {
            pendingRequests.clear();
        }
    }

    private Long durationSince(PendingRequest pending, Instant now) {
        if (pending == null) {
            return null;
        }
        return Math.max(0L, Duration.between(pending.startedAt(), now).toMillis());
    }

    private static <T> LogSlice<T> slice(List<T> entries, Predicate<T> filter, int limit) {
        List<T> matching = new ArrayList<>();
        for (T entry : entries) {
            if (filter.test(entry)) {
                matching.add(entry);
            }
        }
        List<T> newest = new ArrayList<>(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
        Collections.reverse(newest);
        return new LogSlice<>(entries.size(), matching.size(), List.copyOf(newest));
    }

    private static int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private record CorrelationKey(String url, String method) {

        static CorrelationKey of(PageRequest request) {
            return new CorrelationKey(request.url(), request.method());
        }
    }

    private record PendingRequest(String id, Instant startedAt) {
    }

    private final class PageScopedListener implements PageEventListener {

        private final PageHandle page;

        PageScopedListener(PageHandle page) {
            this.page = page;
        }

        @Override
        public void onConsoleMessage(String type, String text) {
            if (activePage == page) {
                BrowserEventCapture.this.onConsoleMessage(type, text);
            }
        }

        @Override
        public void onRequest(PageRequest request) {
            if (activePage == page) {
                BrowserEventCapture.this.onRequest(request);
            }
        }

        @Override
        public void onResponse(PageRequest request, int status, String statusText) {
            if (activePage == page) {
                BrowserEventCapture.this.onResponse(request, status, statusText);
            }
        }

        @Override
        public void onRequestFailed(PageRequest request, String errorText) {
            if (activePage == page) {
                BrowserEventCapture.this.onRequestFailed(request, errorText);
            }
        }
    }
}
