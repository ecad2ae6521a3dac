package me.golemcore.browser.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.browser.domain.model.ActionResult;
import me.golemcore.browser.domain.model.ElementAction;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.LocatorResolution;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.infrastructure.event.SpringEventBus;
import me.golemcore.browser.port.outbound.ElementTarget;
import me.golemcore.browser.port.outbound.PageHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserActionServiceTest {

    private static final byte[] PNG = { (byte) 0x89, 'P', 'N', 'G' };

    private BrowserSessionManager sessionManager;
    private PageHandle page;
    private ScreenshotStore screenshotStore;
    private BrowserProperties properties;
    private BrowserActionService service;

    @BeforeEach
    void setUp() {
        sessionManager = mock(BrowserSessionManager.class);
        page = mock(PageHandle.class);
        when(sessionManager.ensureActive()).thenReturn(page);
        screenshotStore = new ScreenshotStore(mock(SpringEventBus.class));
        properties = new BrowserProperties();
        service = new BrowserActionService(sessionManager, screenshotStore, new ObjectMapper(), properties);
    }

    // ===== navigate =====

    @Test
    void shouldNavigate() {
        ActionResult result = service.navigate("https://example.com");

        assertTrue(result.isSuccess());
        assertEquals("Navigated to https://example.com", result.getMessage());
        verify(page).navigate("https://example.com");
    }

    @Test
    void shouldReportNavigationFailure() {
        doThrow(new IllegalStateException("net::ERR_NAME_NOT_RESOLVED")).when(page).navigate("https://nope.invalid");

        ActionResult result = service.navigate("https://nope.invalid");

        assertFalse(result.isSuccess());
        assertEquals("Failed to navigate to https://nope.invalid: net::ERR_NAME_NOT_RESOLVED", result.getMessage());
    }

    // ===== element actions =====

    @Test
    void shouldClickSingleMatch() {
        ElementTarget target = mock(ElementTarget.class);
        when(page.resolve(ElementLocator.bySelector("#submit"))).thenReturn(LocatorResolution.single(target));

        ActionResult result = service.perform(ElementAction.CLICK, ElementLocator.bySelector("#submit"), null);

        assertTrue(result.isSuccess());
        assertEquals("Clicked: #submit", result.getMessage());
        verify(target).click();
    }

    @Test
    void shouldFallBackToFirstOfSeveralMatches() {
        ElementTarget all = mock(ElementTarget.class);
        ElementTarget first = mock(ElementTarget.class);
        when(page.resolve(ElementLocator.bySelector("button.primary")))
                .thenReturn(LocatorResolution.multiple(3, all, first));

        ActionResult result = service.perform(ElementAction.CLICK, ElementLocator.bySelector("button.primary"), null);

        assertTrue(result.isSuccess());
        assertEquals("Clicked: button.primary", result.getMessage());
        verify(first).click();
        verify(all, never()).click();
    }

    @Test
    void shouldNameFirstMatchWhenFallbackFails() {
        ElementTarget all = mock(ElementTarget.class);
        ElementTarget first = mock(ElementTarget.class);
        doThrow(new IllegalStateException("element is not visible")).when(first).hover();
        when(page.resolve(any())).thenReturn(LocatorResolution.multiple(2, all, first));

        ActionResult result = service.perform(ElementAction.HOVER, ElementLocator.byText("Menu"), null);

        assertFalse(result.isSuccess());
        assertEquals("Failed to hover element with text Menu (first of 2 matches): element is not visible",
                result.getMessage());
        verify(first).hover();
        verify(all, never()).hover();
    }

    @Test
    void shouldFailWhenNothingMatches() {
        when(page.resolve(any())).thenReturn(LocatorResolution.notFound());

        ActionResult result = service.perform(ElementAction.CLICK, ElementLocator.bySelector("#missing"), null);

        assertFalse(result.isSuccess());
        assertEquals("Failed to click #missing: no matching element", result.getMessage());
    }

    @Test
    void shouldReportActionFailureOnSingleMatch() {
        ElementTarget target = mock(ElementTarget.class);
        doThrow(new IllegalStateException("Timeout 30000ms exceeded")).when(target).click();
        when(page.resolve(any())).thenReturn(LocatorResolution.single(target));

        ActionResult result = service.perform(ElementAction.CLICK, ElementLocator.bySelector("#slow"), null);

        assertEquals("Failed to click #slow: Timeout 30000ms exceeded", result.getMessage());
    }

    @Test
    void shouldFillWithConfiguredTypingDelay() {
        properties.getActions().setTypingDelayMs(25);
        service = new BrowserActionService(sessionManager, screenshotStore, new ObjectMapper(), properties);
        ElementTarget target = mock(ElementTarget.class);
        when(page.resolve(any())).thenReturn(LocatorResolution.single(target));

        ActionResult result = service.perform(ElementAction.FILL, ElementLocator.bySelector("#email"), "a@b.c");

        assertEquals("Filled #email with: a@b.c", result.getMessage());
        verify(target).pressSequentially("a@b.c", 25.0);
    }

    @Test
    void shouldDescribeSelectByText() {
        ElementTarget target = mock(ElementTarget.class);
        when(page.resolve(any())).thenReturn(LocatorResolution.single(target));

        ActionResult result = service.perform(ElementAction.SELECT, ElementLocator.byText("Country"), "de");

        assertEquals("Selected element with text Country with value: de", result.getMessage());
        verify(target).selectOption("de");
    }

    // ===== screenshot =====

    @Test
    void shouldStorePageScreenshot() {
        when(page.screenshot(true)).thenReturn(PNG);

        ActionResult result = service.screenshot("home", null, true);

        assertTrue(result.isSuccess());
        assertEquals("Screenshot 'home' taken", result.getMessage());
        assertArrayEquals(PNG, result.getImage());
        Optional<byte[]> stored = screenshotStore.find("home");
        assertTrue(stored.isPresent());
        assertArrayEquals(PNG, stored.get());
    }

    @Test
    void shouldCaptureFirstOfSeveralElements() {
        ElementTarget first = mock(ElementTarget.class);
        when(first.screenshot()).thenReturn(PNG);
        when(page.resolve(ElementLocator.bySelector(".card")))
                .thenReturn(LocatorResolution.multiple(4, mock(ElementTarget.class), first));

        ActionResult result = service.screenshot("card", ".card", false);

        assertTrue(result.isSuccess());
        assertEquals(List.of("card"), screenshotStore.names());
    }

    @Test
    void shouldFailScreenshotOfMissingElement() {
        when(page.resolve(any())).thenReturn(LocatorResolution.notFound());

        ActionResult result = service.screenshot("x", "#gone", false);

        assertFalse(result.isSuccess());
        assertEquals("Element not found: #gone", result.getMessage());
        assertTrue(screenshotStore.names().isEmpty());
    }

    @Test
    void shouldReportScreenshotException() {
        when(page.screenshot(false)).thenThrow(new IllegalStateException("Target closed"));

        ActionResult result = service.screenshot("x", null, false);

        assertEquals("Failed to take screenshot 'x': Target closed", result.getMessage());
    }

    // ===== evaluate =====

    @Test
    void shouldReportResultAndConsoleOutput() {
        when(page.evaluate(eq(BrowserActionService.EVALUATE_HARNESS), eq("1 + 1")))
                .thenReturn(Map.of("result", 2, "logs", List.of("[log] computing", "[warn] careful")));

        ActionResult result = service.evaluate("1 + 1");

        assertTrue(result.isSuccess());
        assertEquals("Execution result:\n2\n\nConsole output:\n[log] computing\n[warn] careful", result.getMessage());
    }

    @Test
    void shouldRenderStructuredResultAsJson() {
        when(page.evaluate(any(), any())).thenReturn(Map.of("result", Map.of("a", 1), "logs", List.of()));

        ActionResult result = service.evaluate("({a: 1})");

        assertTrue(result.getMessage().startsWith("Execution result:\n{"));
        assertTrue(result.getMessage().contains("\"a\" : 1"));
        assertTrue(result.getMessage().endsWith("Console output:\n"));
    }

    @Test
    void shouldReportScriptFailure() {
        when(page.evaluate(any(), any())).thenThrow(new IllegalStateException("ReferenceError: foo is not defined"));

        ActionResult result = service.evaluate("foo()");

        assertFalse(result.isSuccess());
        assertEquals("Script execution failed: ReferenceError: foo is not defined", result.getMessage());
    }
}
