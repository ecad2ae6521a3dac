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

package me.golemcore.browser.adapter.outbound.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.BrowserKind;
import me.golemcore.browser.domain.model.LaunchRequest;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.BrowserConnection;
import me.golemcore.browser.port.outbound.BrowserPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Playwright implementation of {@link BrowserPort}.
 *
 * <p>
 * One {@link Playwright} driver is created on first use and shared by every
 * browser the server launches or attaches to; it is closed by
 * {@link #shutdown()} when the application stops. Playwright objects are not
 * thread-safe, so callers use them from a single thread.
 *
 * <p>
 * Launch arguments:
 * <ul>
 * <li>{@code --window-position=x,y} - headed Chromium with a window position
 * <li>{@code --remote-debugging-port=N} - Chromium with a debug port
 * </ul>
 *
 * @see me.golemcore.browser.domain.service.BrowserSessionManager
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightAdapter implements BrowserPort {

    private final BrowserProperties properties;

    private Playwright playwright;

    @Override
    public BrowserConnection launch(LaunchRequest request) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(request.isHeadless());
        List<String> args = launchArguments(request);
        if (!args.isEmpty()) {
            options.setArgs(args);
        }

        Browser browser = browserType(request.getBrowserType()).launch(options);
        log.debug("Launched {} with args {}", request.getBrowserType().getValue(), args);
        return new PlaywrightConnection(browser, properties.getPage().getDefaultTimeoutMs());
    }

    @Override
    public BrowserConnection connectOverCdp(String endpoint) {
        Browser browser = driver().chromium().connectOverCDP(endpoint);
        log.debug("Attached to {} over CDP", endpoint);
        return new PlaywrightConnection(browser, properties.getPage().getDefaultTimeoutMs());
    }

    @Override
    public synchronized void shutdown() {
        if (playwright == null) {
            return;
        }
        try {
            playwright.close();
            log.info("Playwright driver closed");
        } catch (RuntimeException e) {
            log.warn("Error closing Playwright driver: {}", e.getMessage());
        } finally {
            playwright = null;
        }
    }

    static List<String> launchArguments(LaunchRequest request) {
        List<String> args = new ArrayList<>();
        if (request.getBrowserType() != BrowserKind.CHROMIUM) {
            return args;
        }
        LaunchRequest.WindowPosition position = request.getWindowPosition();
        if (!request.isHeadless() && position != null) {
            args.add("--window-position=" + position.x() + "," + position.y());
        }
        if (request.getDebugPort() != null) {
            args.add("--remote-debugging-port=" + request.getDebugPort());
        }
        return args;
    }

    private BrowserType browserType(BrowserKind kind) {
        Playwright pw = driver();
        return switch (kind) {
        case CHROMIUM -> pw.chromium();
        case FIREFOX -> pw.firefox();
        case WEBKIT -> pw.webkit();
        };
    }

    private synchronized Playwright driver() {
        if (playwright == null) {
            playwright = Playwright.create();
            log.info("Playwright driver started");
        }
        return playwright;
    }
}
