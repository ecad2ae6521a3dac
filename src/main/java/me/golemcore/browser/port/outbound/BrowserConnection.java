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

import java.util.List;

/**
 * A launched or attached browser.
 */
public interface BrowserConnection {

    /**
     * Contexts that already exist in the browser (non-empty only for attached
     * browsers).
     */
    List<BrowserContextHandle> contexts();

    /**
     * Create an isolated browser context.
     *
     * @param viewport
     *            requested viewport, or {@code null} for the engine default
     */
    BrowserContextHandle newContext(LaunchRequest.Viewport viewport);

    boolean isConnected();

    void close();
}
