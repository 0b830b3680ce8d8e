package com.object.spatial.walker;

public enum WalkerState {
    CREATED,
    RUNNING,
    DONE
}
