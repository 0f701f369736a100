package com.questrail.readiness.api;

/**
 * ReadinessGate
 * -----------------------------------------------------------------------------
 * The single authorization check a message dispatcher must honor before
 * delivering application events on a connection.
 *
 * <p>
 * Polling cadence and what happens to events while the gate is closed
 * (queueing, dropping) are the dispatcher's concern.
 * </p>
 */
public interface ReadinessGate
{
    /**
     * @return {@code true} iff the connection is in
     *         {@link ConnectionState#READY_FOR_MESSAGES}
     */
    boolean isReadyForMessages();

    ConnectionState getCurrentState();
}
