/**
 * TracerInvocation.java
 *
 * 一次 tracer 子进程调用的完整描述：命令行、附加环境变量以及 perf 等工具的输出文件位置。
 * 由 TracerCommandBuilder 根据 TraceContent 生成，由 TraceExecution 在 STARTING 状态下启动。
 */
package club.ppmc.girasol.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * @param command 命令及其参数列表 (e.g., ["perf", "record", "-b", ...])。
 * @param environment 追加到子进程环境中的变量。
 * @param dataFile tracer 自身写出的数据文件，没有时为 null。
 */
public record TracerInvocation(List<String> command, Map<String, String> environment, Path dataFile) {

    public TracerInvocation {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }

    public String commandLine() {
        return String.join(" ", command);
    }
}
