package com.questrail.readiness.transport.netty;

/**
 * User event fired down the pipeline once a channel's handshake reaches
 * {@code READY_FOR_MESSAGES}. Handlers that deliver application events can
 * start on this signal instead of polling the gate.
 */
public final class ConnectionReadyEvent
{
    public static final ConnectionReadyEvent INSTANCE = new ConnectionReadyEvent();

    private ConnectionReadyEvent()
    {
    }

    @Override
    public String toString()
    {
        return "ConnectionReadyEvent";
    }
}
