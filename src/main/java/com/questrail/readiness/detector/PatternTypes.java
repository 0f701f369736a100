package com.questrail.readiness.detector;

/**
 * Pattern type names recorded by the readiness layer itself. Callers may record
 * patterns under their own names as well.
 */
public final class PatternTypes
{
    /** A measured duration exceeded its expected maximum. */
    public static final String TIMING_VIOLATION = "timing_violation";

    /** A message was about to be handled while the handshake was still in setup. */
    public static final String PREMATURE_MESSAGE_HANDLING = "premature_message_handling";

    /** A dispatcher found a connection's readiness gate closed. */
    public static final String CONNECTION_VALIDATION_FAILED = "connection_validation_failed";

    /** A coordinated handshake ended in ERROR. */
    public static final String HANDSHAKE_FAILURE = "handshake_failure";

    private PatternTypes() {
    }
}
