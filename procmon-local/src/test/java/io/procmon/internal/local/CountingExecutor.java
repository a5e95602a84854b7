package io.procmon.internal.local;

import io.procmon.CommandExecutor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records applied invocations; validation calls are counted separately.
 */
class CountingExecutor implements CommandExecutor {

    final List<List<String>> applied = new CopyOnWriteArrayList<>();
    final AtomicInteger validations = new AtomicInteger();
    final List<Long> appliedAtNanos = new CopyOnWriteArrayList<>();

    volatile boolean schedulable = true;
    volatile boolean recognized = true;
    volatile RuntimeException failure;

    @Override
    public boolean execute(List<String> tokens, boolean outputEnabled, boolean apply) {
        if (!apply) {
            validations.incrementAndGet();
            return recognized;
        }
        applied.add(List.copyOf(tokens));
        appliedAtNanos.add(System.nanoTime());
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
        return recognized;
    }

    @Override
    public boolean isSchedulable(List<String> tokens) {
        return schedulable;
    }

    int count() {
        return applied.size();
    }
}
