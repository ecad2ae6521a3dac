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

package me.golemcore.browser.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.capture.BrowserEventCapture;
import me.golemcore.browser.domain.model.BrowserKind;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.ConnectionMode;
import me.golemcore.browser.domain.model.LaunchOutcome;
import me.golemcore.browser.domain.model.LaunchRequest;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.BrowserConnection;
import me.golemcore.browser.port.outbound.BrowserContextHandle;
import me.golemcore.browser.port.outbound.BrowserPort;
import me.golemcore.browser.port.outbound.PageHandle;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the single browser session of the process.
 *
 * <p>
 * The session is either absent or active. It becomes active through an
 * explicit {@link #launch(LaunchRequest)} or implicitly through
 * {@link #ensureActive()}, and becomes absent again through {@link #close()},
 * which every launch performs first. Event capture is attached to each page
 * the manager creates, and reset whenever a session ends.
 *
 * <p>
 * Not thread-safe: callers serialize session mutations (see
 * {@link ToolDispatcher}).
 *
 * @see BrowserEventCapture
 */
@Service
@Slf4j
public class BrowserSessionManager {

    private static final int MAX_PORT = 65_535;

    private final BrowserPort browserPort;
    private final BrowserEventCapture eventCapture;
    private final BrowserProperties properties;

    private BrowserSession session;

    public BrowserSessionManager(BrowserPort browserPort, BrowserEventCapture eventCapture,
            BrowserProperties properties) {
        this.browserPort = browserPort;
        this.eventCapture = eventCapture;
        this.properties = properties;
    }

    /**
     * Replace the current session with a newly launched or attached browser.
     * The request is validated before the current session is touched.
     *
     * @throws IllegalArgumentException
     *             if the request combines incompatible options
     * @throws BrowserLaunchException
     *             if the browser could not be started; no session remains
     */
    public LaunchOutcome launch(LaunchRequest request) {
        validate(request);
        close();

        BrowserSession created = open(request);
        this.session = created;

        String description;
        if (created.getMode() == ConnectionMode.CDP) {
            description = "Connected to browser via CDP at " + request.getCdpEndpoint();
        } else if (request.getDebugPort() != null) {
            description = String.format("Launched %s (headless: %s) with remote debugging on port %d",
                    request.getBrowserType().getValue(), request.isHeadless(), request.getDebugPort());
        } else {
            description = String.format("Launched %s (headless: %s)",
                    request.getBrowserType().getValue(), request.isHeadless());
        }
        log.info("[Session] {}", description);
        return new LaunchOutcome(description, created.getBrowserType(), created.getMode());
    }

    /**
     * Close page, context and browser, in that order. A failing step does not
     * prevent the next one. Captured logs and pending request correlations are
     * discarded once the browser is gone, so events delivered during teardown
     * do not leak into the next session.
     *
     * @return {@code true} if a session was open
     */
    public boolean close() {
        BrowserSession current = this.session;
        this.session = null;
        eventCapture.detach();
        try {
            if (current == null) {
                return false;
            }
            release(current);
            log.info("[Session] Browser closed");
            return true;
        } finally {
            eventCapture.reset();
        }
    }

    /**
     * Return a usable page, launching the default browser when no session
     * exists and recreating the page when it was closed from outside.
     *
     * @throws BrowserLaunchException
     *             if an implicit launch fails
     */
    public PageHandle ensureActive() {
        if (session != null && !isConnected(session)) {
            log.warn("[Session] Browser disconnected, starting a new session");
            close();
        }

        if (session == null) {
            launch(defaultLaunchRequest());
            return session.getPage();
        }

        PageHandle page = session.getPage();
        if (page == null || page.isClosed()) {
            PageHandle recreated = session.getContext().newPage();
            eventCapture.attach(recreated);
            session.setPage(recreated);
            log.info("[Session] Page was closed, opened a new one");
            return recreated;
        }
        return page;
    }

    public boolean isActive() {
        return session != null;
    }

    public BrowserSession getSession() {
        return session;
    }

    /**
     * Close the session and release the browser engine. Called once, on the
     * browser thread, when the application stops.
     */
    public void shutdown() {
        close();
        browserPort.shutdown();
    }

    LaunchRequest defaultLaunchRequest() {
        BrowserProperties.DefaultsProperties defaults = properties.getDefaults();
        BrowserKind kind;
        try {
            kind = BrowserKind.fromValue(defaults.getBrowserType());
        } catch (IllegalArgumentException e) {
            log.warn("[Session] {}, falling back to chromium", e.getMessage());
            kind = BrowserKind.CHROMIUM;
        }
        return LaunchRequest.builder()
                .browserType(kind)
                .headless(defaults.isHeadless())
                .build();
    }

    private void validate(LaunchRequest request) {
        BrowserKind kind = request.getBrowserType();
        if (kind == null) {
            throw new IllegalArgumentException("browserType is required");
        }
        if (request.isCdp() && kind != BrowserKind.CHROMIUM) {
            throw new IllegalArgumentException("CDP connection only works with chromium");
        }
        Integer debugPort = request.getDebugPort();
        if (debugPort != null) {
            if (request.isCdp()) {
                throw new IllegalArgumentException("debugPort cannot be combined with cdpEndpoint");
            }
            if (kind != BrowserKind.CHROMIUM) {
                throw new IllegalArgumentException("debugPort only works with chromium");
            }
            if (debugPort < 1 || debugPort > MAX_PORT) {
                throw new IllegalArgumentException("debugPort must be between 1 and " + MAX_PORT);
            }
        }
        LaunchRequest.Viewport viewport = request.getViewport();
        if (viewport != null && (viewport.width() <= 0 || viewport.height() <= 0)) {
            throw new IllegalArgumentException("viewport width and height must be positive");
        }
    }

    private BrowserSession open(LaunchRequest request) {
        BrowserConnection connection = null;
        try {
            BrowserContextHandle context;
            if (request.isCdp()) {
                connection = browserPort.connectOverCdp(request.getCdpEndpoint());
                List<BrowserContextHandle> contexts = connection.contexts();
                context = contexts.isEmpty() ? connection.newContext(null) : contexts.get(0);
            } else {
                connection = browserPort.launch(request);
                context = connection.newContext(request.getViewport());
            }

            PageHandle page = context.newPage();
            eventCapture.attach(page);

            return BrowserSession.builder()
                    .connection(connection)
                    .context(context)
                    .page(page)
                    .browserType(request.getBrowserType())
                    .mode(request.isCdp() ? ConnectionMode.CDP : ConnectionMode.LAUNCHED)
                    .headless(request.isHeadless())
                    .cdpEndpoint(request.getCdpEndpoint())
                    .build();
        } catch (RuntimeException e) {
            log.warn("[Session] Failed to launch browser: {}", e.getMessage());
            if (connection != null) {
                try {
                    connection.close();
                } catch (RuntimeException ex) {
                    log.trace("Error closing browser resource: {}", ex.getMessage());
                }
            }
            throw new BrowserLaunchException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    private void release(BrowserSession current) {
        if (current.getPage() != null) {
            try {
                current.getPage().close();
            } catch (RuntimeException e) {
                log.debug("[Session] Error closing page: {}", e.getMessage());
            }
        }
        try {
            current.getContext().close();
        } catch (RuntimeException e) {
            log.debug("[Session] Error closing context: {}", e.getMessage());
        }
        try {
            current.getConnection().close();
        } catch (RuntimeException e) {
            log.debug("[Session] Error closing browser: {}", e.getMessage());
        }
    }

    private boolean isConnected(BrowserSession current) {
        try {
            return current.getConnection().isConnected();
        } catch (RuntimeException e) {
            log.debug("[Session] Connection check failed: {}", e.getMessage());
            return false;
        }
    }
}
