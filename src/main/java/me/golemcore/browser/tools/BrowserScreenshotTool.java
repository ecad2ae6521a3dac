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
import me.golemcore.browser.domain.model.ActionResult;
import me.golemcore.browser.domain.model.Attachment;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserActionService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Captures the page or one element, stores it as {@code screenshot://<name>}
 * and returns it inline as a PNG image.
 */
@Component
@RequiredArgsConstructor
public class BrowserScreenshotTool implements ToolComponent {

    private static final String PARAM_NAME = "name";
    private static final String PARAM_SELECTOR = "selector";
    private static final String PARAM_FULL_PAGE = "fullPage";

    private final BrowserActionService actionService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_screenshot")
                .description("Take a screenshot of the current page or a specific element")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_NAME, Map.of(
                                        "type", "string",
                                        "description", "Name for the screenshot"),
                                PARAM_SELECTOR, Map.of(
                                        "type", "string",
                                        "description", "CSS selector for element to screenshot"),
                                PARAM_FULL_PAGE, Map.of(
                                        "type", "boolean",
                                        "description", "Take a full page screenshot (default: false)",
                                        "default", false)),
                        "required", List.of(PARAM_NAME)))
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String name = ToolArguments.requireString(parameters, PARAM_NAME);
        String selector = ToolArguments.optionalString(parameters, PARAM_SELECTOR);
        boolean fullPage = ToolArguments.optionalBoolean(parameters, PARAM_FULL_PAGE, false);

        ActionResult result = actionService.screenshot(name, selector, fullPage);
        if (!result.isSuccess()) {
            return ToolResult.failure(result.getMessage());
        }
        return ToolResult.success(result.getMessage(), Attachment.png(name, result.getImage()));
    }
}
