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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ResourceListChangedEvent;
import me.golemcore.browser.domain.model.ResourceUpdatedEvent;
import me.golemcore.browser.domain.service.ToolDispatcher;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MCP server over standard input and output.
 *
 * <p>
 * Messages are newline-delimited JSON-RPC 2.0. Requests are answered in
 * completion order, so a {@code ping} is not held up by a running tool call.
 * Resource notifications are sent once the client has initialized. When stdin
 * reaches end of stream, in-flight calls are awaited, the browser session is
 * closed and the application exits.
 */
@Component
@Slf4j
public class McpStdioServer {

    private static final String JSONRPC_VERSION = "2.0";

    private final McpRequestHandler requestHandler;
    private final ToolDispatcher toolDispatcher;
    private final ObjectMapper objectMapper;
    private final BrowserProperties properties;
    private final ApplicationContext applicationContext;

    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile BufferedWriter writer;
    private volatile boolean initialized;

    public McpStdioServer(McpRequestHandler requestHandler, ToolDispatcher toolDispatcher,
            ObjectMapper objectMapper, BrowserProperties properties, ApplicationContext applicationContext) {
        this.requestHandler = requestHandler;
        this.toolDispatcher = toolDispatcher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.applicationContext = applicationContext;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getMcp().isStdioEnabled()) {
            log.info("[MCP] Stdio transport disabled");
            return;
        }
        Thread reader = new Thread(() -> {
            serve(System.in, System.out);
            shutdown();
        }, "mcp-stdio");
        reader.start();
        log.info("[MCP] {} {} listening on stdio", properties.getMcp().getServerName(),
                properties.getMcp().getServerVersion());
    }

    /**
     * Read and answer messages until {@code in} ends. Returns after every
     * response has been written.
     */
    public void serve(InputStream in, OutputStream out) {
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[MCP] <- {}", line);
                onMessage(line);
            }
        } catch (IOException e) {
            log.warn("[MCP] Error reading stdin: {}", e.getMessage());
        }
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0])).join();
        log.info("[MCP] Input closed");
    }

    @EventListener
    public void onResourceUpdated(ResourceUpdatedEvent event) {
        if (initialized) {
            sendNotification("notifications/resources/updated", Map.of("uri", event.uri()));
        }
    }

    @EventListener
    public void onResourceListChanged(ResourceListChangedEvent event) {
        if (initialized) {
            sendNotification("notifications/resources/list_changed", null);
        }
    }

    void onMessage(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            sendError(null, McpProtocolException.PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
            return;
        }

        JsonNode id = message.get("id");
        JsonNode methodNode = message.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            if (id != null) {
                sendError(id, McpProtocolException.INVALID_REQUEST, "Invalid request: method is required");
            }
            return;
        }
        String method = methodNode.asText();

        if (id == null || id.isNull()) {
            onNotification(method);
            return;
        }

        CompletableFuture<Object> result;
        try {
            result = requestHandler.handle(method, message.get("params"));
        } catch (McpProtocolException e) {
            sendError(id, e.getCode(), e.getMessage());
            return;
        }
        if ("initialize".equals(method)) {
            initialized = true;
        }

        CompletableFuture<Void> reply = result.handle((value, error) -> {
            if (error == null) {
                sendResult(id, value);
            } else {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                if (cause instanceof McpProtocolException protocolError) {
                    sendError(id, protocolError.getCode(), protocolError.getMessage());
                } else {
                    log.error("[MCP] Request {} failed", method, cause);
                    sendError(id, McpProtocolException.INTERNAL_ERROR, "Internal error: " + cause.getMessage());
                }
            }
            return null;
        });
        inFlight.add(reply);
        reply.whenComplete((ignored, error) -> inFlight.remove(reply));
    }

    private void onNotification(String method) {
        if ("notifications/initialized".equals(method)) {
            initialized = true;
            log.debug("[MCP] Client initialized");
        } else {
            log.debug("[MCP] Ignoring notification {}", method);
        }
    }

    private void shutdown() {
        try {
            toolDispatcher.closeSession().join();
        } catch (CompletionException e) {
            log.warn("[MCP] Error closing browser session: {}", e.getMessage());
        }
        int exitCode = SpringApplication.exit(applicationContext);
        log.debug("[MCP] Application context closed with exit code {}", exitCode);
    }

    private void sendResult(JsonNode id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("result", result);
        write(response);
    }

    private void sendError(JsonNode id, int code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("error", Map.of("code", code, "message", message));
        write(response);
    }

    private void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        write(notification);
    }

    private void write(Map<String, Object> message) {
        BufferedWriter out = this.writer;
        if (out == null) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(message);
            log.debug("[MCP] -> {}", json);
            synchronized (out) {
                out.write(json);
                out.newLine();
                out.flush();
            }
        } catch (IOException e) {
            log.warn("[MCP] Failed to write message: {}", e.getMessage());
        }
    }
}
