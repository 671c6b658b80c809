package club.ppmc.girasol.service;

import club.ppmc.girasol.model.TraceResult;
import java.util.concurrent.CompletionStage;

/**
 * TraceExecution 进入终态时的回调。
 * TraceExecution 会等返回的 CompletionStage 完成后才唤醒本地等待者，
 * 因此 TraceSupervisor 可以保证等待者醒来时注册表中已经没有这个执行。
 */
@FunctionalInterface
public interface TraceExecutionListener {

    CompletionStage<Void> onTerminated(TraceExecution execution, TraceResult result);
}
