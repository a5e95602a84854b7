package io.procmon.core;

public enum KillResult {
    TERMINATED,
    NOT_FOUND,
    FAILED
}
