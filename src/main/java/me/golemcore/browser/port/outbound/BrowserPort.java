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

package me.golemcore.browser.port.outbound;

import me.golemcore.browser.domain.model.LaunchRequest;

/**
 * Port for the browser engine that backs the automation session. Implemented by
 * {@link me.golemcore.browser.adapter.outbound.browser.PlaywrightAdapter}.
 */
public interface BrowserPort {

    /**
     * Launch a fresh browser process with the requested engine, mode and window
     * placement.
     */
    BrowserConnection launch(LaunchRequest request);

    /**
     * Attach to an already running Chromium-based browser over the Chrome
     * DevTools Protocol.
     */
    BrowserConnection connectOverCdp(String endpoint);

    /**
     * Release the engine driver. A later launch starts a new one.
     */
    void shutdown();
}
