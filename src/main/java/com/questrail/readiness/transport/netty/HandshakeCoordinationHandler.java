package com.questrail.readiness.transport.netty;

import com.questrail.readiness.api.ReadinessGate;
import com.questrail.readiness.handshake.HandshakeCoordinator;
import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import com.questrail.readiness.runtime.ReadinessRuntime;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * HandshakeCoordinationHandler
 * =============================================================================
 * Netty adapter that treats {@code channelActive} as the "transport accepted"
 * signal and runs one {@link HandshakeCoordinator} for the channel.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>On {@code channelActive}: build a coordinator whose suspensions run on
 *       the channel's event loop, attach it to the channel, start the handshake.</li>
 *   <li>On success: fire {@link ConnectionReadyEvent} down the pipeline.</li>
 *   <li>On failure: close the channel. Retrying is the client's concern.</li>
 *   <li>On {@code channelInactive}: cancel a handshake still in flight, which
 *       drives the coordinator to {@code ERROR}.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types stay in this package. Dispatchers obtain the channel's gate via
 * {@link #readinessOf(Channel)} as a plain {@link ReadinessGate}.
 *
 * <p>Not sharable: one instance per channel.</p>
 */
public final class HandshakeCoordinationHandler extends ChannelInboundHandlerAdapter
{
    private static final Logger log = LoggerFactory.getLogger(HandshakeCoordinationHandler.class);

    static final AttributeKey<HandshakeCoordinator> COORDINATOR_KEY =
            AttributeKey.valueOf(HandshakeCoordinationHandler.class, "coordinator");

    private final BiFunction<String, MonotonicScheduler, HandshakeCoordinator> coordinatorFactory;
    private final MonotonicClock clock;

    private HandshakeCoordinator coordinator;

    /**
     * @param coordinatorFactory builds a coordinator from a connection id and the
     *                           channel's event-loop scheduler
     * @param clock              clock used for the event-loop scheduler deadlines;
     *                           must be the coordinator's clock
     */
    public HandshakeCoordinationHandler(BiFunction<String, MonotonicScheduler, HandshakeCoordinator> coordinatorFactory,
                                        MonotonicClock clock)
    {
        this.coordinatorFactory = Objects.requireNonNull(coordinatorFactory, "coordinatorFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Handler wired to a runtime's environment, detector and sink.
     */
    public static HandshakeCoordinationHandler forRuntime(ReadinessRuntime runtime)
    {
        Objects.requireNonNull(runtime, "runtime");
        return new HandshakeCoordinationHandler(runtime::newCoordinator, runtime.config().monotonicClock());
    }

    /**
     * The readiness gate of a channel, or {@code null} if the channel has not
     * become active under this handler.
     */
    public static ReadinessGate readinessOf(Channel channel)
    {
        return channel.attr(COORDINATOR_KEY).get();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        String connectionId = ctx.channel().id().asShortText();
        MonotonicScheduler scheduler = new NettyEventLoopScheduler(ctx.executor(), clock);

        HandshakeCoordinator c = coordinatorFactory.apply(connectionId, scheduler);
        coordinator = c;
        ctx.channel().attr(COORDINATOR_KEY).set(c);

        c.coordinateHandshake().whenComplete((ready, error) -> {
            if (error == null && Boolean.TRUE.equals(ready)) {
                ctx.fireUserEventTriggered(ConnectionReadyEvent.INSTANCE);
            } else {
                log.warn("Connection {}: handshake ended in {}; closing channel",
                        connectionId, c.getCurrentState());
                ctx.close();
            }
        });

        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        HandshakeCoordinator c = coordinator;
        if (c != null && c.cancel("channel inactive")) {
            log.debug("Connection {}: channel closed before handshake completed", c.connectionId());
        }
        super.channelInactive(ctx);
    }
}
