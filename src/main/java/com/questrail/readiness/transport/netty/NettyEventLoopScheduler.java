package com.questrail.readiness.transport.netty;

import com.questrail.readiness.internal.time.Cancellable;
import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoopScheduler
 * =============================================================================
 * {@link MonotonicScheduler} that runs handshake steps on a channel's own
 * event executor.
 *
 * <p>Every step of a connection's handshake then runs on the same thread as
 * the channel's I/O callbacks, so the coordinator never contends with the
 * pipeline. Deadlines are converted to relative delays with the given clock,
 * as in {@link com.questrail.readiness.internal.time.ScheduledExecutorScheduler}.</p>
 *
 * <p>This class does not own the executor.</p>
 */
final class NettyEventLoopScheduler implements MonotonicScheduler
{
    private final EventExecutor executor;
    private final MonotonicClock clock;

    NettyEventLoopScheduler(EventExecutor executor, MonotonicClock clock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
