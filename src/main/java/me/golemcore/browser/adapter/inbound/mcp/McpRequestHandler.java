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

package me.golemcore.browser.adapter.inbound.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ResourceContent;
import me.golemcore.browser.domain.service.BrowserResourceService;
import me.golemcore.browser.domain.service.ResourceNotFoundException;
import me.golemcore.browser.domain.service.ToolDispatcher;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Maps MCP methods onto the tool dispatcher and the resource catalog.
 *
 * <p>
 * Supported methods:
 * <ul>
 * <li>{@code initialize}, {@code ping}
 * <li>{@code tools/list}, {@code tools/call}
 * <li>{@code resources/list}, {@code resources/read}
 * </ul>
 * Tool failures are results with {@code isError: true}; only malformed
 * requests, unknown methods and unknown resources become JSON-RPC errors.
 */
@Component
@Slf4j
public class McpRequestHandler {

    static final String PROTOCOL_VERSION = "2024-11-05";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolDispatcher toolDispatcher;
    private final BrowserResourceService resourceService;
    private final ObjectMapper objectMapper;
    private final BrowserProperties properties;

    public McpRequestHandler(ToolDispatcher toolDispatcher, BrowserResourceService resourceService,
            ObjectMapper objectMapper, BrowserProperties properties) {
        this.toolDispatcher = toolDispatcher;
        this.resourceService = resourceService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Handle a request and produce its {@code result} member.
     *
     * @throws McpProtocolException
     *             for unknown methods and invalid parameters
     */
    public CompletableFuture<Object> handle(String method, JsonNode params) {
        switch (method) {
        case "initialize":
            return CompletableFuture.completedFuture(initializeResult(params));
        case "ping":
            return CompletableFuture.completedFuture(Map.of());
        case "tools/list":
            return CompletableFuture.completedFuture(Map.of("tools", toolDispatcher.listTools()));
        case "tools/call":
            return callTool(params);
        case "resources/list":
            return CompletableFuture.completedFuture(Map.of("resources", resourceService.listResources()));
        case "resources/read":
            return CompletableFuture.completedFuture(readResource(params));
        default:
            throw new McpProtocolException(McpProtocolException.METHOD_NOT_FOUND, "Method not found: " + method);
        }
    }

    private Map<String, Object> initializeResult(JsonNode params) {
        if (params != null && params.has("clientInfo")) {
            JsonNode clientInfo = params.get("clientInfo");
            log.info("[MCP] Client connected: {} {}", clientInfo.path("name").asText("unknown"),
                    clientInfo.path("version").asText(""));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of(), "resources", Map.of()));
        result.put("serverInfo", Map.of(
                "name", properties.getMcp().getServerName(),
                "version", properties.getMcp().getServerVersion()));
        return result;
    }

    private CompletableFuture<Object> callTool(JsonNode params) {
        String name = requireText(params, "name");
        JsonNode argumentsNode = params.get("arguments");
        Map<String, Object> arguments;
        if (argumentsNode == null || argumentsNode.isNull()) {
            arguments = Map.of();
        } else if (argumentsNode.isObject()) {
            arguments = objectMapper.convertValue(argumentsNode, ARGUMENTS_TYPE);
        } else {
            throw new McpProtocolException(McpProtocolException.INVALID_PARAMS, "arguments must be an object");
        }
        log.debug("[MCP] tools/call {}", name);
        return toolDispatcher.dispatch(name, arguments).thenApply(Object.class::cast);
    }

    private Map<String, Object> readResource(JsonNode params) {
        String uri = requireText(params, "uri");
        try {
            ResourceContent content = resourceService.readResource(uri);
            return Map.of("contents", List.of(content));
        } catch (ResourceNotFoundException e) {
            throw new McpProtocolException(McpProtocolException.RESOURCE_NOT_FOUND, e.getMessage());
        }
    }

    private static String requireText(JsonNode params, String field) {
        JsonNode value = params != null ? params.get(field) : null;
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new McpProtocolException(McpProtocolException.INVALID_PARAMS, "Missing required parameter: " + field);
        }
        return value.asText();
    }
}
