/**
 * AppConfig.java
 *
 * 应用级别的 Bean 定义。
 * 主要用于组装所有 TraceExecution 共享的运行参数，以及读取 tracer 输出的线程池。
 */
package club.ppmc.girasol.config;

import club.ppmc.girasol.service.TraceExecutionSettings;
import club.ppmc.girasol.util.TracerCommandBuilder;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 读取 tracer 子进程输出的线程池。
     * 每个运行中的执行占用一个线程，直到子进程关闭输出流为止，因此使用可伸缩的缓存线程池。
     *
     * @return 一个由守护线程组成的线程池。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService traceOutputReaders() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "trace-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 定义所有 TraceExecution 共享的运行参数。
     *
     * @param commandBuilder 把任务定义解析为子进程命令行。
     * @param intervalUnit TraceModel.interval 的时间单位。
     * @param stopGrace 终止信号发出后等待子进程退出的时间。
     */
    @Bean
    public TraceExecutionSettings traceExecutionSettings(
            TracerCommandBuilder commandBuilder,
            ExecutorService traceOutputReaders,
            @Value("${girasol.trace.interval-unit:SECONDS}") TimeUnit intervalUnit,
            @Value("${girasol.trace.stop-grace:3s}") Duration stopGrace) {
        return new TraceExecutionSettings(commandBuilder, intervalUnit, stopGrace, traceOutputReaders);
    }
}
