package io.procmon;

import io.procmon.core.KillResult;
import io.procmon.core.ProcessInfo;

import java.util.List;

/**
 * Operating-system process enumeration and termination.
 */
public interface ProcessControl {

    List<ProcessInfo> list();

    List<ProcessInfo> findByName(String name);

    KillResult kill(long pid);

    /**
     * Terminate every process named {@code name}.
     *
     * @return number of processes terminated
     */
    int killByName(String name);
}
