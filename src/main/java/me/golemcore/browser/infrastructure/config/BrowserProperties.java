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

package me.golemcore.browser.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the browser MCP server, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code browser.*} prefix:
 * <ul>
 * <li>{@link McpProperties} - stdio transport and server identity</li>
 * <li>{@link DefaultsProperties} - engine used by implicit launches</li>
 * <li>{@link PageProperties} - per-page engine settings</li>
 * <li>{@link ActionsProperties} - action pacing</li>
 * <li>{@link LogsProperties} - capture buffer sizes and query defaults</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "browser")
@Data
public class BrowserProperties {

    private McpProperties mcp = new McpProperties();
    private DefaultsProperties defaults = new DefaultsProperties();
    private PageProperties page = new PageProperties();
    private ActionsProperties actions = new ActionsProperties();
    private LogsProperties logs = new LogsProperties();

    @Data
    public static class McpProperties {
        private boolean stdioEnabled = true;
        private String serverName = "golemcore/browser-mcp";
        private String serverVersion = "0.1.0";
    }

    @Data
    public static class DefaultsProperties {
        private String browserType = "chromium";
        private boolean headless = false;
    }

    @Data
    public static class PageProperties {
        private int defaultTimeoutMs = 30000;
    }

    @Data
    public static class ActionsProperties {
        private int typingDelayMs = 100;
    }

    @Data
    public static class LogsProperties {
        private int consoleMaxEntries = 500;
        private int networkMaxEntries = 1000;
        private int defaultLimit = 100;
    }
}
