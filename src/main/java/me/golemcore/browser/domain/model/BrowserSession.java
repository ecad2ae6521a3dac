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

package me.golemcore.browser.domain.model;

import lombok.Builder;
import lombok.Data;
import me.golemcore.browser.port.outbound.BrowserConnection;
import me.golemcore.browser.port.outbound.BrowserContextHandle;
import me.golemcore.browser.port.outbound.PageHandle;

/**
 * The browser, context and page triple under management. Only the page is
 * replaced during the lifetime of a session (after an external close).
 */
@Data
@Builder
public class BrowserSession {

    private final BrowserConnection connection;
    private final BrowserContextHandle context;
    private PageHandle page;
    private final BrowserKind browserType;
    private final ConnectionMode mode;
    private final boolean headless;
    private final String cdpEndpoint;
}
