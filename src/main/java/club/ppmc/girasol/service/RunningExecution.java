package club.ppmc.girasol.service;

/**
 * TraceSupervisor 注册表中的一项：一个正在运行的执行。
 *
 * @param name 来源任务定义的名称。
 * @param handle 执行本身。
 */
public record RunningExecution(String name, TraceExecution handle) {

    /**
     * @return 剩余的迭代次数，降到零表示执行已完成全部迭代。
     */
    public long remaining() {
        return handle.getRemaining();
    }
}
