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
import me.golemcore.browser.domain.service.BrowserActionService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class BrowserNavigateTool implements ToolComponent {

    private static final String PARAM_URL = "url";

    private final BrowserActionService actionService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_navigate")
                .description("Navigate to a URL")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of("type", "string")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String url = ToolArguments.requireString(parameters, PARAM_URL);
        return ToolResult.from(actionService.navigate(url));
    }
}
