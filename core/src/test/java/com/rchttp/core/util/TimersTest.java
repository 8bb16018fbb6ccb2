package com.rchttp.core.util;

import com.rchttp.core.context.RequestCancelledException;
import com.rchttp.core.context.RequestContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimersTest {

    @Test
    void runs_scheduled_task() throws Exception {
        CompletableFuture<String> fired = new CompletableFuture<>();
        Timers.schedule(() -> fired.complete("ok"), Duration.ofMillis(10));
        assertThat(fired.get(2, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    void cancelled_task_leaves_the_queue() {
        int before = Timers.pending();
        ScheduledFuture<?> task = Timers.schedule(() -> { }, Duration.ofMinutes(5));

        task.cancel(false);

        assertThat(task.isCancelled()).isTrue();
        assertThat(Timers.pending()).isLessThanOrEqualTo(before);
    }

    @Test
    void cancelled_deadline_contexts_do_not_keep_timers() {
        int before = Timers.pending();
        RequestContext app = RequestContext.background().withCancel();

        for (int i = 0; i < 1_000; i++) {
            app.withTimeout(Duration.ofMinutes(5)).cancel();
        }

        assertThat(Timers.pending()).isLessThanOrEqualTo(before);
    }

    @Test
    void sleeper_woken_by_cancellation_drops_its_timer() throws Exception {
        int before = Timers.pending();
        RequestContext ctx = RequestContext.background().withCancel();
        Timers.schedule(ctx::cancel, Duration.ofMillis(30));

        Instant start = Instant.now();
        assertThatThrownBy(() -> new DefaultSleeper().sleep(Duration.ofMinutes(5), ctx))
                .isInstanceOf(RequestCancelledException.class);

        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(5));
        assertThat(Timers.pending()).isLessThanOrEqualTo(before);
    }

    @Test
    void huge_delays_saturate_instead_of_overflowing() {
        assertThat(Timers.toMillisSaturated(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThat(Timers.toMillisSaturated(Duration.ofMillis(-5))).isZero();
        assertThat(Timers.toMillisSaturated(Duration.ofMillis(250))).isEqualTo(250);
    }
}
