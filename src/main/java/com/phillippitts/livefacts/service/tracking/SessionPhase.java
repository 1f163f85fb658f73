package com.phillippitts.livefacts.service.tracking;

/**
 * Lifecycle phase of a tracking session, shared by its delivery loop and health monitor.
 *
 * <pre>
 * ACTIVE → EXPIRED            (tracking duration elapsed; destination notified)
 * ACTIVE → SILENT             (no position update within the silence threshold; destination notified)
 * ACTIVE → STOPPED_EXPLICITLY (stop call; caller sends its own confirmation)
 * ACTIVE → FAILED             (task spawn failure or a delivery loop that died; not notified)
 * </pre>
 *
 * <p>All non-ACTIVE phases are terminal.
 */
public enum SessionPhase {
    ACTIVE,
    EXPIRED,
    SILENT,
    STOPPED_EXPLICITLY,
    FAILED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
