package com.redprompt.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Properties;

public class AppConfigTest {

    @Test
    public void missingKeysFallBackToDefaults() {
        AppConfig cfg = new AppConfig(new Properties());
        Assertions.assertEquals(AppConfig.DEFAULT_MAX_TIMEOUT_SECONDS, cfg.getMaxTimeoutSeconds());
        Assertions.assertEquals(AppConfig.DEFAULT_CAPTURE_STABILIZE_MS, cfg.getCaptureStabilizeMs());
        Assertions.assertEquals(AppConfig.DEFAULT_RESULTS_DIR, cfg.getResultsDir());
        Assertions.assertTrue(cfg.isBrowserHeadless());
    }

    @Test
    public void invalidNumbersFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty(AppConfig.KEY_RESPONSE_WAIT_SECONDS, "fifteen");
        p.setProperty(AppConfig.KEY_TYPING_DELAY_MS, " 80 ");
        AppConfig cfg = new AppConfig(p);

        Assertions.assertEquals(AppConfig.DEFAULT_RESPONSE_WAIT_SECONDS, cfg.getResponseWaitSeconds());
        Assertions.assertEquals(80, cfg.getTypingDelayMs());
    }

    @Test
    public void booleansAcceptCommonSpellings() {
        Properties p = new Properties();
        p.setProperty(AppConfig.KEY_BROWSER_HEADLESS, "no");
        p.setProperty(AppConfig.KEY_SCREENSHOT_ON_FAILURE, "YES");
        AppConfig cfg = new AppConfig(p);

        Assertions.assertFalse(cfg.isBrowserHeadless());
        Assertions.assertTrue(cfg.isScreenshotOnFailure());
    }

    @Test
    public void vendorHintsAreSplitAndTrimmed() {
        Properties p = new Properties();
        p.setProperty(AppConfig.KEY_WIDGET_VENDOR_HINTS, "chat.pega.digital, intercom ,,drift.com");
        Assertions.assertEquals(Arrays.asList("chat.pega.digital", "intercom", "drift.com"),
                new AppConfig(p).getWidgetVendorHints());
    }

    @Test
    public void bundledConfigIsLoaded() {
        AppConfig cfg = AppConfig.getInstance();
        Assertions.assertEquals("results", cfg.getResultsDir());
        Assertions.assertEquals(Arrays.asList("chat.pega.digital"), cfg.getWidgetVendorHints());
    }
}
