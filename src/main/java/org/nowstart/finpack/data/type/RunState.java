package org.nowstart.finpack.data.type;

public enum RunState {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    FAILED
}
