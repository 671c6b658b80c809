/**
 * TracerCommandBuilder.java
 *
 * 这是一个帮助类，负责把 TraceModel 中的 content 解析为具体的 tracer 子进程调用。
 * SystemTap 任务生成 stap 脚本并通过 -c 启动目标进程；PerfBranch 任务生成 perf record -b 命令行，
 * 其中 Frequency 决定是否以及如何传递 -F 参数。
 * 它是无状态的组件，可以被 TraceSupervisor 和本地命令处理器共享。
 */
package club.ppmc.girasol.util;

import club.ppmc.girasol.model.Frequency;
import club.ppmc.girasol.model.TraceContent;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.TracerInvocation;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class TracerCommandBuilder {

    static final String OUTPUT_DIR = "output";

    private final String stapBinary;
    private final String perfBinary;
    private final Path outputDirectory;

    @Autowired
    public TracerCommandBuilder(
            @Value("${girasol.tracer.stap-binary:stap}") String stapBinary,
            @Value("${girasol.tracer.perf-binary:perf}") String perfBinary,
            @Value("${girasol.home}") String home) {
        this(stapBinary, perfBinary, Paths.get(home).toAbsolutePath().normalize().resolve(OUTPUT_DIR));
    }

    public TracerCommandBuilder(String stapBinary, String perfBinary, Path outputDirectory) {
        this.stapBinary = stapBinary;
        this.perfBinary = perfBinary;
        this.outputDirectory = outputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * 为一次执行生成子进程调用。
     *
     * @param model 任务定义。
     * @param runId 本次执行的标识，用于区分同名任务多次执行产生的数据文件。
     */
    public TracerInvocation build(TraceModel model, String runId) {
        if (model.content() instanceof TraceContent.SystemTap systemTap) {
            return buildSystemTap(systemTap);
        }
        if (model.content() instanceof TraceContent.PerfBranch perfBranch) {
            return buildPerfBranch(perfBranch, outputDirectory.resolve(model.name() + "-" + runId + ".perf.data"));
        }
        throw new IllegalArgumentException("未知的追踪类型: " + model.content());
    }

    private TracerInvocation buildSystemTap(TraceContent.SystemTap systemTap) {
        if (systemTap.process().isBlank()) {
            throw new IllegalArgumentException("SystemTap 任务必须指定目标进程");
        }
        if (systemTap.functionList().isEmpty()) {
            throw new IllegalArgumentException("SystemTap 任务至少需要一个探测函数");
        }
        var command = new ArrayList<String>();
        command.add(stapBinary);
        command.add("-e");
        command.add(systemTapScript(systemTap.process(), systemTap.functionList()));
        command.add("-c");
        var target = new ArrayList<String>();
        target.add(systemTap.process());
        target.addAll(systemTap.args());
        command.add(String.join(" ", target));

        Map<String, String> environment = new LinkedHashMap<>();
        systemTap.envs().forEach(env -> environment.put(env.key(), env.value()));
        return new TracerInvocation(command, environment, null);
    }

    static String systemTapScript(String process, List<String> functions) {
        var script = new StringBuilder();
        for (String function : functions) {
            script.append("probe process(\"")
                    .append(escape(process))
                    .append("\").function(\"")
                    .append(escape(function))
                    .append("\") { printf(\"%s %d\\n\", ppfunc(), gettimeofday_us()) }\n");
        }
        return script.toString();
    }

    private TracerInvocation buildPerfBranch(TraceContent.PerfBranch perfBranch, Path dataFile) {
        if (perfBranch.absolutePath().isBlank()) {
            throw new IllegalArgumentException("PerfBranch 任务必须指定目标程序的绝对路径");
        }
        var command = new ArrayList<String>();
        command.add(perfBinary);
        command.add("record");
        command.add("-b");
        command.addAll(frequencyArguments(perfBranch.frequency()));
        command.add("-o");
        command.add(dataFile.toString());
        command.addAll(perfBranch.additionalArgs());
        command.add("--");
        command.add(perfBranch.absolutePath());
        return new TracerInvocation(command, Map.of(), dataFile);
    }

    static List<String> frequencyArguments(Frequency frequency) {
        if (frequency instanceof Frequency.Max) {
            return List.of("-F", "max");
        }
        if (frequency instanceof Frequency.Specific specific) {
            return List.of("-F", Long.toString(specific.value()));
        }
        return List.of();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
