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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.browser.capture.BrowserEventCapture;
import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.model.ConsoleLogFilter;
import me.golemcore.browser.domain.model.LogKind;
import me.golemcore.browser.domain.model.LogQuery;
import me.golemcore.browser.domain.model.LogQueryResult;
import me.golemcore.browser.domain.model.NetworkLogFilter;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Returns captured console and network logs as JSON.
 *
 * <p>
 * The {@code filter} object holds the clauses of both streams; console entries
 * use {@code types} and {@code search}, network entries use {@code methods},
 * {@code statusCodes}, {@code statusRange}, {@code urlPattern},
 * {@code resourceTypes} and {@code failedOnly}.
 */
@Component
@RequiredArgsConstructor
public class BrowserGetLogsTool implements ToolComponent {

    private static final String TYPE = "type";
    private static final String TYPE_ARRAY = "array";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_NUMBER = "number";
    private static final String ITEMS = "items";
    private static final String DESCRIPTION = "description";
    private static final String PROPERTIES = "properties";

    private final BrowserEventCapture eventCapture;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> filterProperties = Map.of(
                "types", Map.of(TYPE, TYPE_ARRAY, ITEMS, Map.of(TYPE, TYPE_STRING),
                        DESCRIPTION, "Console message types to include (e.g. log, error, warning)"),
                "search", Map.of(TYPE, TYPE_STRING,
                        DESCRIPTION, "Case-insensitive text to search for in console messages"),
                "methods", Map.of(TYPE, TYPE_ARRAY, ITEMS, Map.of(TYPE, TYPE_STRING),
                        DESCRIPTION, "HTTP methods to include"),
                "statusCodes", Map.of(TYPE, TYPE_ARRAY, ITEMS, Map.of(TYPE, TYPE_NUMBER),
                        DESCRIPTION, "HTTP status codes to include"),
                "statusRange", Map.of(TYPE, "object",
                        PROPERTIES, Map.of("min", Map.of(TYPE, TYPE_NUMBER), "max", Map.of(TYPE, TYPE_NUMBER)),
                        DESCRIPTION, "Inclusive HTTP status range"),
                "urlPattern", Map.of(TYPE, TYPE_STRING,
                        DESCRIPTION, "Regular expression matched against request URLs"),
                "resourceTypes", Map.of(TYPE, TYPE_ARRAY, ITEMS, Map.of(TYPE, TYPE_STRING),
                        DESCRIPTION, "Resource types to include (document, script, xhr, fetch, ...)"),
                "failedOnly", Map.of(TYPE, "boolean",
                        DESCRIPTION, "Only include failed requests"));

        return ToolDefinition.builder()
                .name("browser_get_logs")
                .description("Get captured console and network logs of the current page, newest first")
                .inputSchema(Map.of(
                        TYPE, "object",
                        PROPERTIES, Map.of(
                                "logTypes", Map.of(
                                        TYPE, TYPE_ARRAY,
                                        ITEMS, Map.of(TYPE, TYPE_STRING, "enum", List.of("console", "network")),
                                        DESCRIPTION, "Logs to return (default: both)"),
                                "clear", Map.of(
                                        TYPE, "boolean",
                                        DESCRIPTION, "Clear the returned logs after reading (default: false)"),
                                "filter", Map.of(
                                        TYPE, "object",
                                        PROPERTIES, filterProperties),
                                "limit", Map.of(
                                        TYPE, TYPE_NUMBER,
                                        DESCRIPTION, "Maximum entries per log type (default: 100)")),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        Map<String, Object> filter = ToolArguments.optionalObject(parameters, "filter");
        if (filter == null) {
            filter = Map.of();
        }

        LogQuery query = LogQuery.builder()
                .kinds(parseKinds(ToolArguments.optionalStringList(parameters, "logTypes")))
                .consoleFilter(ConsoleLogFilter.builder()
                        .types(ToolArguments.optionalStringList(filter, "types"))
                        .search(ToolArguments.optionalString(filter, "search"))
                        .build())
                .networkFilter(parseNetworkFilter(filter))
                .limit(ToolArguments.optionalInteger(parameters, "limit"))
                .clear(ToolArguments.optionalBoolean(parameters, "clear", false))
                .build();

        LogQueryResult result = eventCapture.getLogs(query);
        try {
            return ToolResult.success(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Failed to serialize logs: " + e.getMessage());
        }
    }

    private Set<LogKind> parseKinds(List<String> logTypes) {
        if (logTypes == null) {
            return EnumSet.allOf(LogKind.class);
        }
        if (logTypes.isEmpty()) {
            throw new IllegalArgumentException("logTypes must not be empty");
        }
        Set<LogKind> kinds = EnumSet.noneOf(LogKind.class);
        for (String logType : logTypes) {
            kinds.add(LogKind.fromValue(logType));
        }
        return kinds;
    }

    private NetworkLogFilter parseNetworkFilter(Map<String, Object> filter) {
        NetworkLogFilter.NetworkLogFilterBuilder builder = NetworkLogFilter.builder()
                .methods(ToolArguments.optionalStringList(filter, "methods"))
                .statusCodes(ToolArguments.optionalIntegerList(filter, "statusCodes"))
                .resourceTypes(ToolArguments.optionalStringList(filter, "resourceTypes"))
                .failedOnly(ToolArguments.optionalBoolean(filter, "failedOnly", false));

        Map<String, Object> statusRange = ToolArguments.optionalObject(filter, "statusRange");
        if (statusRange != null) {
            Integer min = ToolArguments.optionalInteger(statusRange, "min");
            Integer max = ToolArguments.optionalInteger(statusRange, "max");
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("statusRange.min must not exceed statusRange.max");
            }
            builder.statusMin(min).statusMax(max);
        }

        String urlPattern = ToolArguments.optionalString(filter, "urlPattern");
        if (urlPattern != null) {
            try {
                builder.urlPattern(Pattern.compile(urlPattern));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid urlPattern: " + e.getDescription(), e);
            }
        }
        return builder.build();
    }
}
