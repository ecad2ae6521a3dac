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
import me.golemcore.browser.domain.model.BrowserKind;
import me.golemcore.browser.domain.model.LaunchOutcome;
import me.golemcore.browser.domain.model.LaunchRequest;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserLaunchException;
import me.golemcore.browser.domain.service.BrowserSessionManager;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Launches a browser or attaches to one over CDP, replacing any open session.
 *
 * <p>
 * Options:
 * <ul>
 * <li>{@code browserType} - chromium (default), firefox or webkit
 * <li>{@code headless} - default false
 * <li>{@code cdpEndpoint} - attach instead of launching (chromium only)
 * <li>{@code debugPort} - expose remote debugging on the launched browser
 * (chromium only, not with {@code cdpEndpoint})
 * <li>{@code viewport} - {@code {width, height}}
 * <li>{@code windowPosition} - {@code {x, y}}, ignored when headless
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class BrowserLaunchTool implements ToolComponent {

    private static final String TYPE = "type";
    private static final String TYPE_NUMBER = "number";
    private static final String DESCRIPTION = "description";
    private static final String PROPERTIES = "properties";

    private final BrowserSessionManager sessionManager;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_launch")
                .description("Launch a new browser or connect to existing via CDP. Auto-closes any existing browser.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        PROPERTIES, Map.of(
                                "browserType", Map.of(
                                        TYPE, "string",
                                        "enum", List.of("chromium", "firefox", "webkit"),
                                        DESCRIPTION, "Browser to launch (default: chromium)"),
                                "headless", Map.of(
                                        TYPE, "boolean",
                                        DESCRIPTION, "Run in headless mode (default: false)"),
                                "cdpEndpoint", Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "CDP endpoint URL for existing browser "
                                                + "(chromium only, e.g., http://localhost:9222)"),
                                "debugPort", Map.of(
                                        TYPE, TYPE_NUMBER,
                                        DESCRIPTION, "Remote debugging port to open on the launched browser "
                                                + "(chromium only, not with cdpEndpoint)"),
                                "viewport", Map.of(
                                        TYPE, "object",
                                        PROPERTIES, Map.of(
                                                "width", Map.of(TYPE, TYPE_NUMBER),
                                                "height", Map.of(TYPE, TYPE_NUMBER)),
                                        DESCRIPTION, "Viewport size"),
                                "windowPosition", Map.of(
                                        TYPE, "object",
                                        PROPERTIES, Map.of(
                                                "x", Map.of(TYPE, TYPE_NUMBER),
                                                "y", Map.of(TYPE, TYPE_NUMBER)),
                                        DESCRIPTION, "Window position on screen (non-headless only)")),
                        "required", List.of()))
                .build();
    }

    @Override
    public boolean requiresActiveSession() {
        return false;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String browserType = ToolArguments.optionalString(parameters, "browserType");
        LaunchRequest request = LaunchRequest.builder()
                .browserType(browserType != null ? BrowserKind.fromValue(browserType) : BrowserKind.CHROMIUM)
                .headless(ToolArguments.optionalBoolean(parameters, "headless", false))
                .cdpEndpoint(ToolArguments.optionalString(parameters, "cdpEndpoint"))
                .debugPort(ToolArguments.optionalInteger(parameters, "debugPort"))
                .viewport(parseViewport(ToolArguments.optionalObject(parameters, "viewport")))
                .windowPosition(parseWindowPosition(ToolArguments.optionalObject(parameters, "windowPosition")))
                .build();

        try {
            LaunchOutcome outcome = sessionManager.launch(request);
            return ToolResult.success(outcome.description());
        } catch (BrowserLaunchException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private LaunchRequest.Viewport parseViewport(Map<String, Object> viewport) {
        if (viewport == null) {
            return null;
        }
        return new LaunchRequest.Viewport(requireInt(viewport, "width", "viewport"),
                requireInt(viewport, "height", "viewport"));
    }

    private LaunchRequest.WindowPosition parseWindowPosition(Map<String, Object> position) {
        if (position == null) {
            return null;
        }
        return new LaunchRequest.WindowPosition(requireInt(position, "x", "windowPosition"),
                requireInt(position, "y", "windowPosition"));
    }

    private int requireInt(Map<String, Object> object, String key, String owner) {
        Integer value = ToolArguments.optionalInteger(object, key);
        if (value == null) {
            throw new IllegalArgumentException(owner + "." + key + " is required");
        }
        return value;
    }
}
