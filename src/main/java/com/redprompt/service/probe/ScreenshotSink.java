package com.redprompt.service.probe;

import com.microsoft.playwright.Page;
import com.redprompt.config.AppConfig;
import com.redprompt.util.PlayWrightUtil;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 失败截图落盘：{dir}/{promptId}_{yyyyMMdd_HHmmss}.png。尽力而为，失败返回 null。
 */
public class ScreenshotSink {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;

    public ScreenshotSink(Path directory) {
        this.directory = directory;
    }

    public static ScreenshotSink fromConfig(AppConfig cfg) {
        return new ScreenshotSink(Paths.get(cfg.getScreenshotsDir()));
    }

    public Path pathFor(String promptId, LocalDateTime at) {
        return directory.resolve(promptId + "_" + STAMP.format(at) + ".png");
    }

    public String capture(Page page, String promptId) {
        Path path = pathFor(promptId, LocalDateTime.now());
        return PlayWrightUtil.screenshot(page, path) ? path.toString() : null;
    }
}
