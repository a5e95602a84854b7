package io.procmon.internal.process;

import io.procmon.core.KillResult;
import io.procmon.core.ProcessInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OsProcessControlTest {

    private final OsProcessControl processes = new OsProcessControl();

    @Test
    void baseNameShouldStripDirectoryAndExeSuffix() {
        assertThat(OsProcessControl.baseName("/usr/bin/java")).isEqualTo("java");
        assertThat(OsProcessControl.baseName("notepad.EXE")).isEqualTo("notepad");
        assertThat(OsProcessControl.baseName("tool.exe.bak")).isEqualTo("tool.exe.bak");
    }

    @Test
    void listShouldContainCurrentProcess() {
        long self = ProcessHandle.current().pid();

        List<ProcessInfo> running = processes.list();

        assertThat(running).extracting(ProcessInfo::pid).contains(self);
    }

    @Test
    void killShouldRefuseOwnProcess() {
        assertThat(processes.kill(ProcessHandle.current().pid())).isEqualTo(KillResult.FAILED);
    }

    @Test
    void killOfUnknownPidShouldReportNotFound() {
        assertThat(processes.kill(Long.MAX_VALUE)).isEqualTo(KillResult.NOT_FOUND);
    }

    @Test
    void unknownNameShouldKillNothing() {
        assertThat(processes.killByName("no-such-process-" + System.nanoTime())).isZero();
    }
}
