/**
 * TraceResult.java
 *
 * 一次 TraceExecution 结束时的结果记录。
 * 由 TraceExecution 在进入终态时生成，本地等待者通过它获知结果，
 * 远程发起的执行则由 TraceSupervisor 把它作为 TraceFinished 通知推送回原连接。
 */
package club.ppmc.girasol.model;

import club.ppmc.girasol.exception.ErrorKind;

/**
 * @param name 任务名称。
 * @param state 终态，COMPLETED 或 FAILED。
 * @param exitCode 子进程退出码；子进程未能启动时为 null。
 * @param errorKind 失败类别，成功时为 null。
 * @param message 附加说明。
 */
public record TraceResult(String name, TraceState state, Integer exitCode, ErrorKind errorKind, String message) {

    public static TraceResult completed(String name, Integer exitCode) {
        return new TraceResult(name, TraceState.COMPLETED, exitCode, null, "completed");
    }

    public static TraceResult failed(String name, Integer exitCode, ErrorKind kind, String message) {
        return new TraceResult(name, TraceState.FAILED, exitCode, kind, message);
    }

    public boolean isSuccess() {
        return state == TraceState.COMPLETED;
    }
}
