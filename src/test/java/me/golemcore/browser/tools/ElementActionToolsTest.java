package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.ActionResult;
import me.golemcore.browser.domain.model.ElementAction;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserActionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ElementActionToolsTest {

    private BrowserActionService actionService;

    @BeforeEach
    void setUp() {
        actionService = mock(BrowserActionService.class);
        when(actionService.perform(any(), any(), any())).thenReturn(ActionResult.success("done"));
    }

    // ===== definitions =====

    @Test
    void shouldAdvertiseSelectorToolsWithRequiredSelector() {
        ToolDefinition click = new BrowserClickTool(actionService).getDefinition();

        assertEquals("browser_click", click.getName());
        assertEquals(List.of("selector"), click.getInputSchema().get("required"));
    }

    @Test
    void shouldAdvertiseValueForFillAndSelect() {
        ToolDefinition fill = new BrowserFillTool(actionService).getDefinition();
        ToolDefinition selectText = new BrowserSelectTextTool(actionService).getDefinition();

        assertEquals(List.of("selector", "value"), fill.getInputSchema().get("required"));
        assertEquals(List.of("text", "value"), selectText.getInputSchema().get("required"));
    }

    @Test
    void shouldUseDistinctToolNames() {
        List<String> names = List.of(
                new BrowserClickTool(actionService), new BrowserClickTextTool(actionService),
                new BrowserFillTool(actionService), new BrowserSelectTool(actionService),
                new BrowserSelectTextTool(actionService), new BrowserHoverTool(actionService),
                new BrowserHoverTextTool(actionService))
                .stream().map(AbstractElementActionTool::getToolName).toList();

        assertEquals(List.of("browser_click", "browser_click_text", "browser_fill", "browser_select",
                "browser_select_text", "browser_hover", "browser_hover_text"), names);
    }

    // ===== execution =====

    @Test
    void clickTextShouldResolveByText() {
        ToolResult result = new BrowserClickTextTool(actionService).execute(Map.of("text", "Sign in"));

        assertTrue(result.isSuccess());
        verify(actionService).perform(eq(ElementAction.CLICK), eq(ElementLocator.byText("Sign in")), isNull());
    }

    @Test
    void fillShouldPassValue() {
        new BrowserFillTool(actionService).execute(Map.of("selector", "#q", "value", "playwright"));

        verify(actionService).perform(ElementAction.FILL, ElementLocator.bySelector("#q"), "playwright");
    }

    @Test
    void fillShouldAcceptEmptyValue() {
        new BrowserFillTool(actionService).execute(Map.of("selector", "#q", "value", ""));

        verify(actionService).perform(ElementAction.FILL, ElementLocator.bySelector("#q"), "");
    }

    @Test
    void hoverShouldMapFailure() {
        when(actionService.perform(any(), any(), any()))
                .thenReturn(ActionResult.failure("Failed to hover #menu: no matching element"));

        ToolResult result = new BrowserHoverTool(actionService).execute(Map.of("selector", "#menu"));

        assertFalse(result.isSuccess());
        assertEquals("Failed to hover #menu: no matching element", result.getError());
    }

    @Test
    void shouldRejectMissingLocator() {
        BrowserSelectTool tool = new BrowserSelectTool(actionService);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("value", "x")));

        assertEquals("selector is required", error.getMessage());
    }

    @Test
    void shouldRejectMissingValue() {
        BrowserSelectTool tool = new BrowserSelectTool(actionService);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("selector", "#country")));

        assertEquals("value is required", error.getMessage());
    }
}
