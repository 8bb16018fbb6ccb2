package com.rchttp.core.http;

import com.rchttp.core.context.RequestCancelledException;
import com.rchttp.core.context.RequestContext;
import com.rchttp.core.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 테스트용 Sleeper: 실제로 자지 않고 호출만 기록. 취소된 컨텍스트면 cause를 던진다. */
final class RecordingSleeper implements Sleeper {
    final List<Duration> sleeps = new ArrayList<>();

    @Override public void sleep(Duration d, RequestContext ctx) throws RequestCancelledException {
        sleeps.add(d);
        if (ctx.isDone()) throw ctx.cause();
    }
}
