package com.rchttp.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 데드라인/백오프용 공용 타이머(데몬 스레드 1개).
 * 취소된 작업은 큐에서 바로 빠진다. 작업은 짧게: 신호 전파나 future 완료 정도만.
 */
public final class Timers {

    private static final ScheduledThreadPoolExecutor EXEC = create();

    private Timers() {}

    private static ScheduledThreadPoolExecutor create() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "rchttp-timer");
            t.setDaemon(true);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        return ex;
    }

    /** delay가 0 이하이면 바로 실행 대기열로. */
    public static ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        return EXEC.schedule(task, toMillisSaturated(delay), TimeUnit.MILLISECONDS);
    }

    static long toMillisSaturated(Duration d) {
        if (d.isNegative()) return 0;
        try {
            return d.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /** 대기 중인 작업 수 */
    static int pending() { return EXEC.getQueue().size(); }
}
