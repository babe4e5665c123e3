package com.redprompt.service.probe;

/**
 * 时间源与等待。生产用系统时钟，测试里替换为虚拟时钟。
 */
public interface ProbeClock {

    long currentTimeMillis();

    void sleep(long millis);

    ProbeClock SYSTEM = new ProbeClock() {
        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long millis) {
            if (millis <= 0) return;
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProbeException(ProbeException.Kind.INTERACTION, "Interrupted while waiting", e);
            }
        }
    };
}
