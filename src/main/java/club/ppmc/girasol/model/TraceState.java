package club.ppmc.girasol.model;

/**
 * TraceExecution 的生命周期状态。COMPLETED 和 FAILED 是终态。
 */
public enum TraceState {
    STARTING,
    RUNNING,
    STOPPING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
