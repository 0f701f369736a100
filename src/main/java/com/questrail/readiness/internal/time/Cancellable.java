package com.questrail.readiness.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a scheduled handshake step.
 *
 * <p>
 * Implemented by the deterministic test scheduler, the
 * {@code ScheduledExecutorService}-backed scheduler and the Netty event-loop
 * scheduler.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
