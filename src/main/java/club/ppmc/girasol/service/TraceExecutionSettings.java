/**
 * TraceExecutionSettings.java
 *
 * 所有 TraceExecution 共享的运行参数，由 AppConfig 根据 application.properties 组装。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.util.TracerCommandBuilder;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * @param commandBuilder 把任务定义解析为子进程命令行。
 * @param intervalUnit TraceModel.interval 的时间单位。
 * @param stopGrace 发送终止信号后等待子进程退出的时间，超时则强制杀死。
 * @param outputReaders 读取 tracer 输出流的线程池。
 */
public record TraceExecutionSettings(
        TracerCommandBuilder commandBuilder,
        TimeUnit intervalUnit,
        Duration stopGrace,
        ExecutorService outputReaders) {}
