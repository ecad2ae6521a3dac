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
public class BrowserEvaluateTool implements ToolComponent {

    private static final String PARAM_SCRIPT = "script";

    private final BrowserActionService actionService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_evaluate")
                .description("Execute JavaScript in the browser console")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_SCRIPT, Map.of(
                                        "type", "string",
                                        "description", "JavaScript code to execute")),
                        "required", List.of(PARAM_SCRIPT)))
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String script = ToolArguments.requireString(parameters, PARAM_SCRIPT);
        return ToolResult.from(actionService.evaluate(script));
    }
}
