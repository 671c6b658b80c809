package club.ppmc.girasol.service;

import java.util.List;

/**
 * 接收 TraceExecution 每个迭代周期内通过过滤的 tracer 输出。
 * 远程发起的执行把它转成 TraceOutput 通知，本地执行则写入日志。
 */
@FunctionalInterface
public interface TraceOutputSink {

    void report(String name, long iteration, List<String> lines);
}
