package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.BrowserKind;
import me.golemcore.browser.domain.model.ConnectionMode;
import me.golemcore.browser.domain.model.LaunchOutcome;
import me.golemcore.browser.domain.model.LaunchRequest;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserLaunchException;
import me.golemcore.browser.domain.service.BrowserSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserLaunchToolTest {

    private BrowserSessionManager sessionManager;
    private BrowserLaunchTool tool;

    @BeforeEach
    void setUp() {
        sessionManager = mock(BrowserSessionManager.class);
        when(sessionManager.launch(any())).thenReturn(
                new LaunchOutcome("Launched chromium (headless: false)", BrowserKind.CHROMIUM, ConnectionMode.LAUNCHED));
        tool = new BrowserLaunchTool(sessionManager);
    }

    @Test
    void shouldNotRequireActiveSession() {
        assertFalse(tool.requiresActiveSession());
        assertEquals("browser_launch", tool.getToolName());
    }

    @Test
    void shouldLaunchChromiumHeadedByDefault() {
        ToolResult result = tool.execute(Map.of());

        assertTrue(result.isSuccess());
        assertEquals("Launched chromium (headless: false)", result.getOutput());
        LaunchRequest request = captureRequest();
        assertEquals(BrowserKind.CHROMIUM, request.getBrowserType());
        assertFalse(request.isHeadless());
        assertNull(request.getViewport());
    }

    @Test
    void shouldParseAllOptions() {
        tool.execute(Map.of(
                "browserType", "webkit",
                "headless", true,
                "viewport", Map.of("width", 1024, "height", 768),
                "windowPosition", Map.of("x", 10, "y", 20)));

        LaunchRequest request = captureRequest();
        assertEquals(BrowserKind.WEBKIT, request.getBrowserType());
        assertTrue(request.isHeadless());
        assertEquals(new LaunchRequest.Viewport(1024, 768), request.getViewport());
        assertEquals(new LaunchRequest.WindowPosition(10, 20), request.getWindowPosition());
    }

    @Test
    void shouldPassCdpEndpointAndDebugPort() {
        tool.execute(Map.of("cdpEndpoint", "http://localhost:9222", "debugPort", 9333));

        LaunchRequest request = captureRequest();
        assertEquals("http://localhost:9222", request.getCdpEndpoint());
        assertEquals(9333, request.getDebugPort());
    }

    @Test
    void shouldRejectUnknownBrowserType() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("browserType", "opera")));

        assertTrue(error.getMessage().startsWith("Unsupported browser type: opera"));
        verify(sessionManager, never()).launch(any());
    }

    @Test
    void shouldRejectIncompleteViewport() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> tool.execute(Map.of("viewport", Map.of("width", 800))));

        assertEquals("viewport.height is required", error.getMessage());
    }

    @Test
    void shouldReturnFailureWhenLaunchFails() {
        when(sessionManager.launch(any())).thenThrow(
                new BrowserLaunchException("Failed to launch browser: Executable doesn't exist", null));

        ToolResult result = tool.execute(Map.of());

        assertFalse(result.isSuccess());
        assertEquals("Failed to launch browser: Executable doesn't exist", result.getError());
    }

    private LaunchRequest captureRequest() {
        ArgumentCaptor<LaunchRequest> captor = ArgumentCaptor.forClass(LaunchRequest.class);
        verify(sessionManager).launch(captor.capture());
        return captor.getValue();
    }
}
