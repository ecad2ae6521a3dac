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

package me.golemcore.browser.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResponse;
import me.golemcore.browser.domain.model.ToolResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes tool calls by name and normalizes every outcome into a
 * {@link ToolResponse}.
 *
 * <p>
 * Calls run one at a time on the single browser thread, which is also the only
 * thread that touches browser handles. Before a tool other than
 * {@code browser_launch} or {@code browser_close} runs, the session is made
 * active. Unknown tools, invalid arguments, launch failures and unexpected
 * exceptions all come back as error responses; nothing escapes the dispatcher.
 */
@Service
@Slf4j
public class ToolDispatcher {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final BrowserSessionManager sessionManager;
    private final ExecutorService browserExecutor;

    public ToolDispatcher(List<ToolComponent> toolComponents, BrowserSessionManager sessionManager,
            @Qualifier("browserExecutor") ExecutorService browserExecutor) {
        this.sessionManager = sessionManager;
        this.browserExecutor = browserExecutor;
        for (ToolComponent tool : toolComponents) {
            if (!tool.isEnabled()) {
                continue;
            }
            ToolComponent previous = tools.put(tool.getToolName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getToolName());
            }
        }
        log.info("Registered {} browser tools: {}", tools.size(), tools.keySet());
    }

    public List<ToolDefinition> listTools() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public CompletableFuture<ToolResponse> dispatch(String name, Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> invoke(name, arguments), browserExecutor);
    }

    /**
     * Close the browser session on the browser thread, after any queued call.
     */
    public CompletableFuture<Boolean> closeSession() {
        return CompletableFuture.supplyAsync(sessionManager::close, browserExecutor);
    }

    /**
     * Close the session and the browser engine on the browser thread before
     * the executor itself is shut down.
     */
    @PreDestroy
    public void destroy() {
        try {
            CompletableFuture.runAsync(sessionManager::shutdown, browserExecutor)
                    .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Browser thread already stopped, skipping browser shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down the browser");
        } catch (ExecutionException e) {
            log.warn("Browser shutdown failed: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            log.warn("Browser shutdown did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
        }
    }

    ToolResponse invoke(String name, Map<String, Object> arguments) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            log.warn("Unknown tool requested: {}", name);
            return ToolResponse.error("Unknown tool: " + name);
        }

        Map<String, Object> parameters = arguments != null ? arguments : Map.of();
        try {
            if (tool.requiresActiveSession()) {
                sessionManager.ensureActive();
            }
            ToolResult result = tool.execute(parameters);
            if (!result.isSuccess()) {
                log.debug("Tool {} failed: {}", name, result.getError());
            }
            return ToolResponse.from(result);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid arguments for {}: {}", name, e.getMessage());
            return ToolResponse.error(e.getMessage());
        } catch (BrowserLaunchException e) {
            return ToolResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed unexpectedly", name, e);
            return ToolResponse.error("Tool " + name + " failed: " + e.getMessage());
        }
    }
}
