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
import me.golemcore.browser.domain.model.LaunchRequest;
import me.golemcore.browser.port.outbound.BrowserConnection;
import me.golemcore.browser.port.outbound.BrowserContextHandle;

import java.util.List;

class PlaywrightConnection implements BrowserConnection {

    private final Browser browser;
    private final int defaultTimeoutMs;

    PlaywrightConnection(Browser browser, int defaultTimeoutMs) {
        this.browser = browser;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    @Override
    public List<BrowserContextHandle> contexts() {
        return browser.contexts().stream()
                .<BrowserContextHandle>map(context -> new PlaywrightContextHandle(context, defaultTimeoutMs))
                .toList();
    }

    @Override
    public BrowserContextHandle newContext(LaunchRequest.Viewport viewport) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        if (viewport != null) {
            options.setViewportSize(viewport.width(), viewport.height());
        }
        return new PlaywrightContextHandle(browser.newContext(options), defaultTimeoutMs);
    }

    @Override
    public boolean isConnected() {
        return browser.isConnected();
    }

    @Override
    public void close() {
        browser.close();
    }
}
