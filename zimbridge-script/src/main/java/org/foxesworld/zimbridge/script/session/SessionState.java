package org.foxesworld.zimbridge.script.session;

public enum SessionState {
    UNCONFIGURED,
    STARTED,
    FINALIZED
}
