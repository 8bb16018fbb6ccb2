package com.rchttp.core.util;

import com.rchttp.core.context.RequestContext;
import com.rchttp.core.context.RequestCancelledException;

import java.time.Duration;

/** 백오프 대기. 컨텍스트 취소가 먼저 오면 즉시 깨어나 cause를 던진다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d, RequestContext ctx) throws RequestCancelledException, InterruptedException;
}
