package com.redprompt.util;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;

import static org.mockito.ArgumentMatchers.any;

public class PlayWrightUtilTest {

    private Playwright playwright;
    private BrowserType chromium;
    private Browser browser;
    private BrowserContext context;

    @BeforeEach
    public void setUp() {
        playwright = Mockito.mock(Playwright.class);
        chromium = Mockito.mock(BrowserType.class);
        browser = Mockito.mock(Browser.class);
        context = Mockito.mock(BrowserContext.class);
        Mockito.when(playwright.chromium()).thenReturn(chromium);
        Mockito.when(chromium.launch(any(BrowserType.LaunchOptions.class))).thenReturn(browser);
        Mockito.when(browser.newContext()).thenReturn(context);
    }

    @Test
    public void launch_usesHeadlessChromiumWithSandboxFlags() {
        PlayWrightUtil.Connection connection = PlayWrightUtil.launch(() -> playwright, true);

        ArgumentCaptor<BrowserType.LaunchOptions> options = ArgumentCaptor.forClass(BrowserType.LaunchOptions.class);
        Mockito.verify(chromium).launch(options.capture());
        Assertions.assertTrue(options.getValue().headless);
        Assertions.assertEquals(PlayWrightUtil.LAUNCH_ARGS, options.getValue().args);
        Assertions.assertSame(context, connection.context);
        Assertions.assertFalse(connection.isClosed());
    }

    @Test
    public void close_releasesContextThenBrowserThenRuntime() {
        PlayWrightUtil.Connection connection = PlayWrightUtil.launch(() -> playwright, true);

        connection.close();
        connection.close();

        InOrder order = Mockito.inOrder(context, browser, playwright);
        order.verify(context).close();
        order.verify(browser).close();
        order.verify(playwright).close();
        Mockito.verify(playwright, Mockito.times(1)).close();
        Assertions.assertTrue(connection.isClosed());
    }

    @Test
    public void close_continuesWhenOneStepFails() {
        Mockito.doThrow(new PlaywrightException("context already closed")).when(context).close();
        PlayWrightUtil.Connection connection = new PlayWrightUtil.Connection(playwright, browser, context);

        connection.close();

        Mockito.verify(browser).close();
        Mockito.verify(playwright).close();
    }

    @Test
    public void launch_failureCleansUpAndRaisesSessionException() {
        Mockito.when(chromium.launch(any(BrowserType.LaunchOptions.class)))
                .thenThrow(new PlaywrightException("Executable doesn't exist"));

        SessionException e = Assertions.assertThrows(SessionException.class,
                () -> PlayWrightUtil.launch(() -> playwright, true));

        Assertions.assertTrue(e.getMessage().startsWith("Failed to start browser session"));
        Mockito.verify(playwright).close();
    }

    @Test
    public void newPage_delegatesToContext() {
        Page page = Mockito.mock(Page.class);
        Mockito.when(context.newPage()).thenReturn(page);

        try (PlayWrightUtil.Connection connection = new PlayWrightUtil.Connection(playwright, browser, context)) {
            Assertions.assertSame(page, connection.newPage());
        }
    }
}
