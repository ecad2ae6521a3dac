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

import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.model.ElementAction;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserActionService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for tools that act on one element addressed by CSS selector or by text.
 * Subclasses only describe themselves; resolution and the fallback to the
 * first match live in {@link BrowserActionService#perform}.
 */
abstract class AbstractElementActionTool implements ToolComponent {

    static final String PARAM_SELECTOR = "selector";
    static final String PARAM_TEXT = "text";
    static final String PARAM_VALUE = "value";

    private final BrowserActionService actionService;
    private final ElementAction action;
    private final ElementLocator.Kind locatorKind;

    AbstractElementActionTool(BrowserActionService actionService, ElementAction action,
            ElementLocator.Kind locatorKind) {
        this.actionService = actionService;
        this.action = action;
        this.locatorKind = locatorKind;
    }

    protected abstract String name();

    protected abstract String description();

    protected abstract String locatorDescription();

    /**
     * Description of the {@code value} argument, or {@code null} if the action
     * takes none.
     */
    protected String valueDescription() {
        return null;
    }

    @Override
    public ToolDefinition getDefinition() {
        String locatorParam = locatorParam();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(locatorParam, Map.of("type", "string", "description", locatorDescription()));
        List<String> required = new ArrayList<>(List.of(locatorParam));
        if (valueDescription() != null) {
            properties.put(PARAM_VALUE, Map.of("type", "string", "description", valueDescription()));
            required.add(PARAM_VALUE);
        }

        return ToolDefinition.builder()
                .name(name())
                .description(description())
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", required))
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String target = ToolArguments.requireString(parameters, locatorParam());
        String value = null;
        if (valueDescription() != null) {
            value = ToolArguments.optionalString(parameters, PARAM_VALUE);
            if (value == null) {
                throw new IllegalArgumentException(PARAM_VALUE + " is required");
            }
        }

        ElementLocator locator = locatorKind == ElementLocator.Kind.TEXT
                ? ElementLocator.byText(target)
                : ElementLocator.bySelector(target);
        return ToolResult.from(actionService.perform(action, locator, value));
    }

    private String locatorParam() {
        return locatorKind == ElementLocator.Kind.TEXT ? PARAM_TEXT : PARAM_SELECTOR;
    }
}
