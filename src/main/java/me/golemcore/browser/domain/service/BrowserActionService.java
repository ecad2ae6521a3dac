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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ActionResult;
import me.golemcore.browser.domain.model.ElementAction;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.LocatorResolution;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.ElementTarget;
import me.golemcore.browser.port.outbound.PageHandle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes actions against the session page.
 *
 * <p>
 * Element actions (click, fill, select, hover) share one policy:
 * <ol>
 * <li>resolve the selector or text locator;
 * <li>no match fails the action;
 * <li>a single match is acted on directly;
 * <li>several matches fall back to the first match in document order;
 * <li>any failure becomes a failure {@link ActionResult} naming the action,
 * the locator and the cause.
 * </ol>
 *
 * <p>
 * Nothing here throws for an action that went wrong on the page; only a
 * failed implicit browser launch propagates as {@link BrowserLaunchException}.
 */
@Service
@Slf4j
public class BrowserActionService {

    /**
     * Runs the user script via {@code eval} while recording what it writes to
     * the console.
     */
    static final String EVALUATE_HARNESS = """
            (script) => {
              const logs = [];
              const originalConsole = { ...console };
              ['log', 'info', 'warn', 'error'].forEach(method => {
                console[method] = (...args) => {
                  logs.push(`[${method}] ${args.join(' ')}`);
                  originalConsole[method](...args);
                };
              });
              try {
                const result = eval(script);
                Object.assign(console, originalConsole);
                return { result, logs };
              } catch (error) {
                Object.assign(console, originalConsole);
                throw error;
              }
            }
            """;

    private final BrowserSessionManager sessionManager;
    private final ScreenshotStore screenshotStore;
    private final ObjectMapper objectMapper;
    private final double typingDelayMs;

    public BrowserActionService(BrowserSessionManager sessionManager, ScreenshotStore screenshotStore,
            ObjectMapper objectMapper, BrowserProperties properties) {
        this.sessionManager = sessionManager;
        this.screenshotStore = screenshotStore;
        this.objectMapper = objectMapper;
        int delay = properties.getActions().getTypingDelayMs();
        this.typingDelayMs = delay >= 0 ? delay : 100;
    }

    public ActionResult navigate(String url) {
        PageHandle page = sessionManager.ensureActive();
        try {
            page.navigate(url);
            return ActionResult.success("Navigated to " + url);
        } catch (RuntimeException e) {
            log.debug("Navigation to {} failed: {}", url, e.getMessage());
            return ActionResult.failure("Failed to navigate to " + url + ": " + e.getMessage());
        }
    }

    /**
     * Perform an element action.
     *
     * @param value
     *            text to type for {@link ElementAction#FILL}, option value for
     *            {@link ElementAction#SELECT}; ignored otherwise
     */
    public ActionResult perform(ElementAction action, ElementLocator locator, String value) {
        PageHandle page = sessionManager.ensureActive();

        LocatorResolution resolution;
        try {
            resolution = page.resolve(locator);
        } catch (RuntimeException e) {
            return failure(action, locator, e, 1);
        }

        switch (resolution.getStatus()) {
        case NOT_FOUND:
            return ActionResult.failure(String.format("Failed to %s %s: no matching element",
                    action.getVerb(), locator.describe()));
        case SINGLE_MATCH:
            return attempt(action, locator, value, resolution.getTarget(), 1);
        case MULTIPLE_MATCHES:
            log.info("{} matched {} elements, performing {} on the first one",
                    locator.describe(), resolution.getMatchCount(), action.getVerb());
            return attempt(action, locator, value, resolution.getFirst(), resolution.getMatchCount());
        default:
            throw new IllegalStateException("Unexpected resolution: " + resolution.getStatus());
        }
    }

    /**
     * Capture the page (or one element) and store it under {@code name}.
     *
     * @param selector
     *            element to capture, or {@code null} for the page
     */
    public ActionResult screenshot(String name, String selector, boolean fullPage) {
        PageHandle page = sessionManager.ensureActive();

        byte[] png;
        try {
            if (selector != null) {
                LocatorResolution resolution = page.resolve(ElementLocator.bySelector(selector));
                if (resolution.getStatus() == LocatorResolution.Status.NOT_FOUND) {
                    return ActionResult.failure("Element not found: " + selector);
                }
                ElementTarget target = resolution.getStatus() == LocatorResolution.Status.MULTIPLE_MATCHES
                        ? resolution.getFirst()
                        : resolution.getTarget();
                png = target.screenshot();
            } else {
                png = page.screenshot(fullPage);
            }
        } catch (RuntimeException e) {
            log.debug("Screenshot '{}' failed: {}", name, e.getMessage());
            return ActionResult.failure("Failed to take screenshot '" + name + "': " + e.getMessage());
        }

        if (png == null || png.length == 0) {
            return ActionResult.failure(selector != null ? "Element not found: " + selector : "Screenshot failed");
        }

        screenshotStore.save(name, png);
        return ActionResult.success("Screenshot '" + name + "' taken", png);
    }

    /**
     * Evaluate a script in the page and report its result together with the
     * console output it produced.
     */
    public ActionResult evaluate(String script) {
        PageHandle page = sessionManager.ensureActive();
        try {
            Object raw = page.evaluate(EVALUATE_HARNESS, script);
            Object result = null;
            List<?> logs = List.of();
            if (raw instanceof Map<?, ?> map) {
                result = map.get("result");
                if (map.get("logs") instanceof List<?> captured) {
                    logs = captured;
                }
            }
            String output = logs.stream().map(String::valueOf).collect(Collectors.joining("\n"));
            return ActionResult.success("Execution result:\n" + toJson(result) + "\n\nConsole output:\n" + output);
        } catch (RuntimeException e) {
            log.debug("Script execution failed: {}", e.getMessage());
            return ActionResult.failure("Script execution failed: " + e.getMessage());
        }
    }

    private ActionResult attempt(ElementAction action, ElementLocator locator, String value, ElementTarget target,
            int matchCount) {
        try {
            switch (action) {
            case CLICK -> target.click();
            case FILL -> target.pressSequentially(value, typingDelayMs);
            case SELECT -> target.selectOption(value);
            case HOVER -> target.hover();
            default -> throw new IllegalStateException("Unexpected action: " + action);
            }
            return ActionResult.success(successMessage(action, locator, value));
        } catch (RuntimeException e) {
            return failure(action, locator, e, matchCount);
        }
    }

    /**
     * @param matchCount
     *            number of matched elements; above one the action ran on the
     *            first of them
     */
    private ActionResult failure(ElementAction action, ElementLocator locator, RuntimeException cause,
            int matchCount) {
        log.debug("Failed to {} {}: {}", action.getVerb(), locator.describe(), cause.getMessage());
        String scope = matchCount > 1 ? " (first of " + matchCount + " matches)" : "";
        return ActionResult.failure(String.format("Failed to %s %s%s: %s",
                action.getVerb(), locator.describe(), scope, cause.getMessage()));
    }

    private String successMessage(ElementAction action, ElementLocator locator, String value) {
        String subject = locator.value();
        return switch (action) {
        case CLICK -> locator.isText() ? "Clicked element with text: " + subject : "Clicked: " + subject;
        case FILL -> "Filled " + locator.describe() + " with: " + value;
        case SELECT -> locator.isText()
                ? "Selected element with text " + subject + " with value: " + value
                : "Selected " + subject + " with: " + value;
        case HOVER -> locator.isText() ? "Hovered element with text: " + subject : "Hovered " + subject;
        };
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Result is not JSON-serializable: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
