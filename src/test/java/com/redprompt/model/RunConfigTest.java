package com.redprompt.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RunConfigTest {

    @Test
    public void defaultsComeFromBundledConfig() {
        RunConfig cfg = RunConfig.defaults();
        Assertions.assertEquals(30, cfg.getMaxTimeoutSeconds());
        Assertions.assertTrue(cfg.isScreenshotOnFailure());
        Assertions.assertEquals(2, cfg.getDelayBetweenPromptsSeconds());
        Assertions.assertEquals(15, cfg.getResponseWaitSeconds());
    }

    @Test
    public void withersReturnAdjustedCopies() {
        RunConfig base = new RunConfig(30, true, 2, 15, true);
        RunConfig changed = base.withMaxTimeoutSeconds(60).withDelayBetweenPromptsSeconds(0).withScreenshotOnFailure(false);

        Assertions.assertEquals(30, base.getMaxTimeoutSeconds());
        Assertions.assertEquals(60, changed.getMaxTimeoutSeconds());
        Assertions.assertEquals(0, changed.getDelayBetweenPromptsSeconds());
        Assertions.assertFalse(changed.isScreenshotOnFailure());
    }

    @Test
    public void rejectsOutOfRangeValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunConfig(0, true, 2, 15, true));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunConfig(30, true, -1, 15, true));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RunConfig(30, true, 2, 0, true));
    }

    @Test
    public void statusParsing() {
        Assertions.assertEquals(PromptStatus.TIMEOUT, PromptStatus.fromString("timeout"));
        Assertions.assertEquals(PromptStatus.COMPLETED, PromptStatus.fromString("COMPLETED"));
        Assertions.assertNull(PromptStatus.fromString("unknown"));
        Assertions.assertFalse(PromptStatus.RUNNING.isTerminal());
    }
}
