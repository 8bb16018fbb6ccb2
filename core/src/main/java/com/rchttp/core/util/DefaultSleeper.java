package com.rchttp.core.util;

import com.rchttp.core.context.RequestCancelledException;
import com.rchttp.core.context.RequestContext;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;

/** 타이머 future와 컨텍스트 done() 중 먼저 끝나는 쪽을 기다린다. 일찍 깨면 타이머는 취소. */
public final class DefaultSleeper implements Sleeper {
    @Override public void sleep(Duration d, RequestContext ctx) throws RequestCancelledException, InterruptedException {
        if (ctx.isDone()) throw ctx.cause();
        if (d.isNegative() || d.isZero()) return;

        CompletableFuture<Void> timer = new CompletableFuture<>();
        ScheduledFuture<?> task = Timers.schedule(() -> timer.complete(null), d);
        try {
            CompletableFuture.anyOf(timer, ctx.done()).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("timer failed", e.getCause());
        } finally {
            task.cancel(false);
        }
        if (ctx.isDone()) throw ctx.cause();
    }
}
