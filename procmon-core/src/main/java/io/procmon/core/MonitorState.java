package io.procmon.core;

public enum MonitorState {
    STOPPED {
        @Override
        public boolean isArmed() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isArmed() {
            return true;
        }
    };

    public abstract boolean isArmed();
}
