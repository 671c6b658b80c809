/**
 * TraceContent.java
 *
 * 描述一个追踪任务“追踪什么”：要么是一组 SystemTap 探针，要么是一次 perf 分支采样。
 * 它是 TraceModel 的一部分，由 TracerCommandBuilder 解析为具体的子进程命令行。
 * 持久化时通过 "method" 字段区分变体。
 */
package club.ppmc.girasol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Objects;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "method")
@JsonSubTypes({
        @JsonSubTypes.Type(TraceContent.SystemTap.class),
        @JsonSubTypes.Type(TraceContent.PerfBranch.class)
})
public sealed interface TraceContent permits TraceContent.SystemTap, TraceContent.PerfBranch {

    /**
     * 使用 stap 在目标进程的一组函数上挂载探针。
     *
     * @param functionList 要探测的函数名。
     * @param process 目标可执行文件，同时也是 stap -c 启动的命令。
     * @param args 传给目标进程的参数。
     * @param envs 追加到子进程环境中的变量。
     */
    @JsonTypeName("SystemTap")
    record SystemTap(
            @JsonProperty("function_list") List<String> functionList,
            String process,
            List<String> args,
            List<EnvVar> envs)
            implements TraceContent {

        public SystemTap {
            functionList = functionList == null ? List.of() : List.copyOf(functionList);
            process = process == null ? "" : process;
            args = args == null ? List.of() : List.copyOf(args);
            envs = envs == null ? List.of() : List.copyOf(envs);
        }
    }

    /**
     * 使用 perf record -b 对目标程序做分支采样。
     *
     * @param frequency 采样频率。
     * @param absolutePath 目标程序的绝对路径。
     * @param additionalArgs 原样追加到 perf record 的参数。
     */
    @JsonTypeName("PerfBranch")
    record PerfBranch(
            Frequency frequency,
            @JsonProperty("absolute_path") String absolutePath,
            @JsonProperty("additional_args") List<String> additionalArgs)
            implements TraceContent {

        public PerfBranch {
            frequency = frequency == null ? Frequency.defaultFrequency() : frequency;
            absolutePath = absolutePath == null ? "" : absolutePath;
            additionalArgs = additionalArgs == null ? List.of() : List.copyOf(additionalArgs);
        }
    }

    /**
     * 环境变量键值对，序列化为 ["KEY", "VALUE"] 形式的数组。
     */
    record EnvVar(String key, String value) {

        public EnvVar {
            Objects.requireNonNull(key, "环境变量名不能为空");
            value = value == null ? "" : value;
        }

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static EnvVar fromPair(List<String> pair) {
            if (pair == null || pair.size() != 2) {
                throw new IllegalArgumentException("环境变量必须是 [key, value] 形式: " + pair);
            }
            return new EnvVar(pair.get(0), pair.get(1));
        }

        @JsonValue
        public List<String> toPair() {
            return List.of(key, value);
        }
    }

    static TraceContent defaultContent() {
        return new PerfBranch(Frequency.defaultFrequency(), "", List.of());
    }
}
