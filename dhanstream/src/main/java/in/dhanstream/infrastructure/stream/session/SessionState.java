package in.dhanstream.infrastructure.stream.session;

/**
 * Lifecycle of one channel session. STOPPED is terminal.
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    OPEN,
    COOLING_OFF,
    STOPPED
}
