/**
 * Readiness Transport Adapters
 * =============================================================================
 *
 * <p>Adapters that connect a concrete networking stack to connection-readiness
 * coordination. The transport itself (accept, send, receive, framing) stays
 * outside this library; an adapter only turns the stack's "connection accepted"
 * signal into a coordinated handshake and exposes the resulting
 * {@link com.questrail.readiness.api.ReadinessGate}.</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Adapters MUST:
 * <ul>
 *   <li>Not deliver application messages or queue them while the gate is closed</li>
 *   <li>Not retry a failed handshake on their own</li>
 *   <li>Keep framework types (Netty {@code Channel}, {@code EventLoop}, ...)
 *       inside their own package</li>
 * </ul>
 */
package com.questrail.readiness.transport;
