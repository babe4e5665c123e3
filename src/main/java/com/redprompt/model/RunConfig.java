package com.redprompt.model;

import com.redprompt.config.AppConfig;

/**
 * 一次运行的参数。
 */
public final class RunConfig {
    private final int maxTimeoutSeconds;
    private final boolean screenshotOnFailure;
    private final int delayBetweenPromptsSeconds;
    private final int responseWaitSeconds;
    private final boolean headless;

    public RunConfig(int maxTimeoutSeconds, boolean screenshotOnFailure, int delayBetweenPromptsSeconds,
                     int responseWaitSeconds, boolean headless) {
        if (maxTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("maxTimeoutSeconds must be positive: " + maxTimeoutSeconds);
        }
        if (delayBetweenPromptsSeconds < 0) {
            throw new IllegalArgumentException("delayBetweenPromptsSeconds must not be negative: " + delayBetweenPromptsSeconds);
        }
        if (responseWaitSeconds <= 0) {
            throw new IllegalArgumentException("responseWaitSeconds must be positive: " + responseWaitSeconds);
        }
        this.maxTimeoutSeconds = maxTimeoutSeconds;
        this.screenshotOnFailure = screenshotOnFailure;
        this.delayBetweenPromptsSeconds = delayBetweenPromptsSeconds;
        this.responseWaitSeconds = responseWaitSeconds;
        this.headless = headless;
    }

    public static RunConfig defaults() {
        return fromConfig(AppConfig.getInstance());
    }

    public static RunConfig fromConfig(AppConfig cfg) {
        return new RunConfig(
                cfg.getMaxTimeoutSeconds(),
                cfg.isScreenshotOnFailure(),
                cfg.getDelayBetweenPromptsSeconds(),
                cfg.getResponseWaitSeconds(),
                cfg.isBrowserHeadless()
        );
    }

    public RunConfig withMaxTimeoutSeconds(int seconds) {
        return new RunConfig(seconds, screenshotOnFailure, delayBetweenPromptsSeconds, responseWaitSeconds, headless);
    }

    public RunConfig withDelayBetweenPromptsSeconds(int seconds) {
        return new RunConfig(maxTimeoutSeconds, screenshotOnFailure, seconds, responseWaitSeconds, headless);
    }

    public RunConfig withScreenshotOnFailure(boolean enabled) {
        return new RunConfig(maxTimeoutSeconds, enabled, delayBetweenPromptsSeconds, responseWaitSeconds, headless);
    }

    public int getMaxTimeoutSeconds() {
        return maxTimeoutSeconds;
    }

    public boolean isScreenshotOnFailure() {
        return screenshotOnFailure;
    }

    public int getDelayBetweenPromptsSeconds() {
        return delayBetweenPromptsSeconds;
    }

    public int getResponseWaitSeconds() {
        return responseWaitSeconds;
    }

    public boolean isHeadless() {
        return headless;
    }

    @Override
    public String toString() {
        return "RunConfig{maxTimeout=" + maxTimeoutSeconds + "s, screenshotOnFailure=" + screenshotOnFailure
                + ", delay=" + delayBetweenPromptsSeconds + "s, responseWait=" + responseWaitSeconds
                + "s, headless=" + headless + "}";
    }
}
