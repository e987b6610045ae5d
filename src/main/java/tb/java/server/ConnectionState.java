package tb.java.server;

/**
 * Lifecycle of one client connection on the server.
 *
 * <pre>
 * IDLE -> AWAITING_FRAME -> PROCESSING -> RESPONDING -> AWAITING_FRAME ... -> CLOSED
 * </pre>
 *
 * RESPONDING lasts past the write call only while the outbound buffer is
 * full; reading stays paused until it drains.
 */
public enum ConnectionState {
    IDLE,
    AWAITING_FRAME,
    PROCESSING,
    RESPONDING,
    CLOSED
}
