package com.redprompt.config;

import com.redprompt.util.AppLog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * 全局配置，来源于 classpath 下的 redprompt.cfg。
 *
 * <p>所有 getter 均带默认值；配置缺失或格式错误时回退到默认值并记录告警，不会抛出异常。</p>
 */
public class AppConfig {
    private static final String CONFIG_FILE = "redprompt.cfg";
    private static final AppConfig INSTANCE = new AppConfig();

    private final Properties properties = new Properties();

    // Run defaults
    public static final String KEY_MAX_TIMEOUT_SECONDS = "probe.max.timeout.seconds";
    public static final String KEY_SCREENSHOT_ON_FAILURE = "probe.screenshot.on.failure";
    public static final String KEY_DELAY_BETWEEN_PROMPTS_SECONDS = "probe.delay.between.prompts.seconds";
    public static final String KEY_RESPONSE_WAIT_SECONDS = "probe.response.wait.seconds";
    public static final String KEY_BROWSER_HEADLESS = "probe.browser.headless";

    // Discovery / interaction tuning
    public static final String KEY_WIDGET_CANDIDATE_TIMEOUT_MS = "probe.widget.candidate.timeout.ms";
    public static final String KEY_INPUT_CANDIDATE_TIMEOUT_MS = "probe.input.candidate.timeout.ms";
    public static final String KEY_SEND_CANDIDATE_TIMEOUT_MS = "probe.send.candidate.timeout.ms";
    public static final String KEY_TYPING_DELAY_MS = "probe.typing.delay.ms";
    public static final String KEY_WIDGET_VENDOR_HINTS = "probe.widget.vendor.hints";

    // Capture timing
    public static final String KEY_CAPTURE_SETTLE_MS = "probe.capture.settle.ms";
    public static final String KEY_CAPTURE_POLL_MS = "probe.capture.poll.ms";
    public static final String KEY_CAPTURE_STABILIZE_MS = "probe.capture.stabilize.ms";
    public static final String KEY_NAVIGATION_SETTLE_MS = "probe.navigation.settle.ms";

    // Storage
    public static final String KEY_RESULTS_DIR = "storage.results.dir";
    public static final String KEY_SCREENSHOTS_DIR = "storage.screenshots.dir";

    // Default Values
    public static final int DEFAULT_MAX_TIMEOUT_SECONDS = 30;
    public static final boolean DEFAULT_SCREENSHOT_ON_FAILURE = true;
    public static final int DEFAULT_DELAY_BETWEEN_PROMPTS_SECONDS = 2;
    public static final int DEFAULT_RESPONSE_WAIT_SECONDS = 15;
    public static final boolean DEFAULT_BROWSER_HEADLESS = true;
    public static final int DEFAULT_WIDGET_CANDIDATE_TIMEOUT_MS = 5000;
    public static final int DEFAULT_INPUT_CANDIDATE_TIMEOUT_MS = 3000;
    public static final int DEFAULT_SEND_CANDIDATE_TIMEOUT_MS = 2000;
    public static final int DEFAULT_TYPING_DELAY_MS = 50;
    public static final String DEFAULT_WIDGET_VENDOR_HINTS = "chat.pega.digital";
    public static final int DEFAULT_CAPTURE_SETTLE_MS = 2000;
    public static final int DEFAULT_CAPTURE_POLL_MS = 500;
    public static final int DEFAULT_CAPTURE_STABILIZE_MS = 1000;
    public static final int DEFAULT_NAVIGATION_SETTLE_MS = 2000;
    public static final String DEFAULT_RESULTS_DIR = "results";
    public static final String DEFAULT_SCREENSHOTS_DIR = "screenshots";

    private AppConfig() {
        loadProperties();
    }

    AppConfig(Properties properties) {
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public static AppConfig getInstance() {
        return INSTANCE;
    }

    private void loadProperties() {
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                AppLog.warn("[config] " + CONFIG_FILE + " not found on classpath, using defaults");
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            AppLog.error("[config] error loading " + CONFIG_FILE, ex);
        }
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getInt(String key, int defaultValue) {
        String raw = getProperty(key);
        if (raw != null && !raw.trim().isEmpty()) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                AppLog.warn("[config] invalid number for " + key + ": " + raw + ", using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String raw = getProperty(key);
        if (raw == null || raw.trim().isEmpty()) return defaultValue;
        String v = raw.trim();
        return "true".equalsIgnoreCase(v) || "1".equals(v) || "yes".equalsIgnoreCase(v);
    }

    public int getMaxTimeoutSeconds() {
        return getInt(KEY_MAX_TIMEOUT_SECONDS, DEFAULT_MAX_TIMEOUT_SECONDS);
    }

    public boolean isScreenshotOnFailure() {
        return getBoolean(KEY_SCREENSHOT_ON_FAILURE, DEFAULT_SCREENSHOT_ON_FAILURE);
    }

    public int getDelayBetweenPromptsSeconds() {
        return getInt(KEY_DELAY_BETWEEN_PROMPTS_SECONDS, DEFAULT_DELAY_BETWEEN_PROMPTS_SECONDS);
    }

    public int getResponseWaitSeconds() {
        return getInt(KEY_RESPONSE_WAIT_SECONDS, DEFAULT_RESPONSE_WAIT_SECONDS);
    }

    public boolean isBrowserHeadless() {
        return getBoolean(KEY_BROWSER_HEADLESS, DEFAULT_BROWSER_HEADLESS);
    }

    public int getWidgetCandidateTimeoutMs() {
        return getInt(KEY_WIDGET_CANDIDATE_TIMEOUT_MS, DEFAULT_WIDGET_CANDIDATE_TIMEOUT_MS);
    }

    public int getInputCandidateTimeoutMs() {
        return getInt(KEY_INPUT_CANDIDATE_TIMEOUT_MS, DEFAULT_INPUT_CANDIDATE_TIMEOUT_MS);
    }

    public int getSendCandidateTimeoutMs() {
        return getInt(KEY_SEND_CANDIDATE_TIMEOUT_MS, DEFAULT_SEND_CANDIDATE_TIMEOUT_MS);
    }

    public int getTypingDelayMs() {
        return getInt(KEY_TYPING_DELAY_MS, DEFAULT_TYPING_DELAY_MS);
    }

    /**
     * 已知聊天组件厂商的 iframe src 片段，逗号分隔。
     */
    public List<String> getWidgetVendorHints() {
        String raw = getProperty(KEY_WIDGET_VENDOR_HINTS, DEFAULT_WIDGET_VENDOR_HINTS);
        List<String> hints = new ArrayList<>();
        for (String part : raw.split(",")) {
            String h = part.trim();
            if (!h.isEmpty()) hints.add(h);
        }
        return Collections.unmodifiableList(hints);
    }

    public int getCaptureSettleMs() {
        return getInt(KEY_CAPTURE_SETTLE_MS, DEFAULT_CAPTURE_SETTLE_MS);
    }

    public int getCapturePollMs() {
        return getInt(KEY_CAPTURE_POLL_MS, DEFAULT_CAPTURE_POLL_MS);
    }

    public int getCaptureStabilizeMs() {
        return getInt(KEY_CAPTURE_STABILIZE_MS, DEFAULT_CAPTURE_STABILIZE_MS);
    }

    public int getNavigationSettleMs() {
        return getInt(KEY_NAVIGATION_SETTLE_MS, DEFAULT_NAVIGATION_SETTLE_MS);
    }

    public String getResultsDir() {
        return getProperty(KEY_RESULTS_DIR, DEFAULT_RESULTS_DIR);
    }

    public String getScreenshotsDir() {
        return getProperty(KEY_SCREENSHOTS_DIR, DEFAULT_SCREENSHOTS_DIR);
    }
}
