package com.redprompt.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AppLog {
    private static final Logger LOG = LoggerFactory.getLogger("redprompt");

    private AppLog() {
    }

    public static void debug(Object msg) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}", msg);
        }
    }

    public static void info(Object msg) {
        LOG.info("{}", msg);
    }

    public static void warn(Object msg) {
        LOG.warn("{}", msg);
    }

    public static void warn(String msg, Throwable t) {
        LOG.warn(msg, t);
    }

    public static void error(Object msg) {
        if (msg instanceof Throwable) {
            Throwable t = (Throwable) msg;
            LOG.error("{}", t.getMessage(), t);
            return;
        }
        LOG.error("{}", msg);
    }

    public static void error(String msg, Throwable t) {
        LOG.error(msg, t);
    }
}
