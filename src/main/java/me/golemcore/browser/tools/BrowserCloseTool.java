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

package me.golemcore.browser.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionManager;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Closes the current browser. Closing when nothing is open is not an error.
 */
@Component
@RequiredArgsConstructor
public class BrowserCloseTool implements ToolComponent {

    private final BrowserSessionManager sessionManager;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("browser_close", "Close the current browser instance");
    }

    @Override
    public boolean requiresActiveSession() {
        return false;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        return sessionManager.close()
                ? ToolResult.success("Browser closed")
                : ToolResult.success("No browser is currently open");
    }
}
