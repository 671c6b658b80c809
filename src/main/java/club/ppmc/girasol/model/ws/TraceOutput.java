package club.ppmc.girasol.model.ws;

import java.util.List;

/**
 * 一次迭代内通过过滤的 tracer 输出，作为 TraceOutput 通知的数据。
 *
 * @param name 任务名称。
 * @param iteration 迭代序号，从 1 开始；进程退出时补发的输出沿用最后一次的序号。
 * @param lines 输出行。
 */
public record TraceOutput(String name, long iteration, List<String> lines) {}
