package io.procmon.core;

public record ProcessInfo(
        long pid,
        String name
) {
}
