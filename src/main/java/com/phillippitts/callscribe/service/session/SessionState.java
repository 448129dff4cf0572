package com.phillippitts.callscribe.service.session;

/**
 * States of the single voice session managed by {@link SessionCoordinator}.
 */
public enum SessionState {
    /** No session and no candidate channel. */
    IDLE,
    /** A channel is occupied; waiting for the debounce window to elapse. */
    CANDIDATE,
    /** Join requested, waiting for the gateway. */
    JOINING,
    /** Recording a channel chosen automatically. */
    ACTIVE,
    /** Recording a channel chosen by the manual join command. */
    MANUAL_ACTIVE,
    /** Channel emptied or manual leave; draining captures, summarizing and delivering. */
    FINALIZING;

    public boolean isRecording() {
        return this == ACTIVE || this == MANUAL_ACTIVE;
    }
}
