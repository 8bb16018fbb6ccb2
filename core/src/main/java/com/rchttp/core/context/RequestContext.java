package com.rchttp.core.context;

import com.rchttp.core.util.Timers;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 요청 단위 취소 신호 + 값(요청 ID 체인, 사용자) 운반체.
 *
 * - 취소는 1회성/단조: 처음 기록된 cause가 끝까지 유지된다.
 * - 자식 컨텍스트는 부모가 취소되면 같은 cause로 함께 취소된다.
 * - 자식이 먼저 끝나면 부모 등록에서 빠진다. 요청이 끝나면 cancel()로 정리할 것
 *   (데드라인 타이머도 함께 해제).
 * - 값 파생(withRequestId/withUser)은 취소 상태를 그대로 공유한다.
 */
public final class RequestContext {

    private static final RequestContext BACKGROUND =
            new RequestContext(new Signal(true), null, null, null);

    private final Signal signal;
    private final Instant deadline;
    private final String requestId;
    private final String user;

    private RequestContext(Signal signal, Instant deadline, String requestId, String user) {
        this.signal = signal;
        this.deadline = deadline;
        this.requestId = requestId;
        this.user = user;
    }

    /** 취소되지 않는 루트 컨텍스트 */
    public static RequestContext background() { return BACKGROUND; }

    // ---------- 파생 ----------

    /** cancel()로 직접 취소 가능한 자식 */
    public RequestContext withCancel() {
        return new RequestContext(signal.child(), deadline, requestId, user);
    }

    public RequestContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return withDeadline(Instant.now().plus(timeout));
    }

    /** 부모 데드라인이 더 이르면 그쪽이 먼저 발화한다. */
    public RequestContext withDeadline(Instant at) {
        Objects.requireNonNull(at, "at");
        Signal child = signal.child();
        Instant effective = (deadline != null && deadline.isBefore(at)) ? deadline : at;

        Duration remaining = Duration.between(Instant.now(), at);
        if (remaining.isNegative() || remaining.isZero()) {
            child.fire(deadlineExceeded());
        } else {
            child.armDeadline(Timers.schedule(() -> child.fire(deadlineExceeded()), remaining));
        }
        return new RequestContext(child, effective, requestId, user);
    }

    private static RequestCancelledException deadlineExceeded() {
        return new RequestCancelledException(RequestCancelledException.Reason.DEADLINE_EXCEEDED);
    }

    /** 상류에서 받은 X-Request-Id 값(예: "id1,id2") */
    public RequestContext withRequestId(String requestId) {
        return new RequestContext(signal, deadline, requestId, user);
    }

    /** 프록시된 사용자 식별자(User-Identity) */
    public RequestContext withUser(String user) {
        return new RequestContext(signal, deadline, requestId, user);
    }

    // ---------- 취소 ----------

    /** 이미 취소됐으면 무시. background()에서는 no-op. */
    public void cancel() {
        if (this == BACKGROUND) return;
        signal.fire(new RequestCancelledException(RequestCancelledException.Reason.CANCELED));
    }

    public boolean isDone() { return signal.cause.get() != null; }

    /** 취소 원인. 아직 살아있으면 null. */
    public RequestCancelledException cause() { return signal.cause.get(); }

    /** 취소 시 정상 완료되는 future. wait-any 조합용. */
    public CompletableFuture<Void> done() { return signal.done; }

    // ---------- 값 ----------

    public String getRequestId() { return requestId; }
    public boolean hasRequestId() { return requestId != null && !requestId.isEmpty(); }

    public String getUser() { return user; }
    public boolean isUserPresent() { return user != null && !user.isEmpty(); }

    public Instant getDeadline() { return deadline; }

    /** 아직 살아있는 직속 자식 수 */
    int liveChildren() { return signal.children.size(); }

    /** 취소 상태 공유 단위 */
    private static final class Signal {
        final AtomicReference<RequestCancelledException> cause = new AtomicReference<>();
        final CompletableFuture<Void> done = new CompletableFuture<>();
        final Set<Signal> children = ConcurrentHashMap.newKeySet();
        final Signal parent;  // null: 루트이거나 background 직속
        final boolean root;   // 발화하지 않음: 자식 등록 생략
        volatile ScheduledFuture<?> deadlineTask;

        Signal(boolean root) { this(root, null); }

        private Signal(boolean root, Signal parent) {
            this.root = root;
            this.parent = parent;
        }

        void fire(RequestCancelledException why) {
            if (!cause.compareAndSet(null, why)) return;
            if (parent != null) parent.children.remove(this);
            ScheduledFuture<?> task = deadlineTask;
            if (task != null) task.cancel(false);
            for (Signal c : children) c.fire(why);
            children.clear();
            done.complete(null);
        }

        Signal child() {
            if (root) return new Signal(false, null);
            Signal c = new Signal(false, this);
            children.add(c);
            // 등록과 부모 발화가 겹친 경우
            RequestCancelledException why = cause.get();
            if (why != null) c.fire(why);
            return c;
        }

        void armDeadline(ScheduledFuture<?> task) {
            deadlineTask = task;
            // 예약 전에 이미 취소됐으면 타이머가 남지 않게
            if (cause.get() != null) task.cancel(false);
        }
    }
}
