/**
 * TraceModel.java
 *
 * 持久化在 catalog 中的追踪任务定义，以 name 作为唯一主键。
 * 它是一个不可变的记录(record)，由 ModelStore 负责存取，由 TraceSupervisor 启动为 TraceExecution。
 */
package club.ppmc.girasol.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 一个命名的追踪任务定义。
 *
 * @param name 任务名称，创建后不可修改。
 * @param lasting 执行预算：总共要完成的迭代次数。
 * @param interval 两次迭代之间的间隔，单位由 girasol.trace.interval-unit 决定。
 * @param content 要追踪的内容。
 */
public record TraceModel(
        @NotBlank String name,
        @PositiveOrZero long lasting,
        @PositiveOrZero long interval,
        @NotNull @Valid TraceContent content) {

    public TraceModel {
        name = name == null ? "" : name;
        content = content == null ? TraceContent.defaultContent() : content;
    }

    /**
     * 名称会成为输出文件名的一部分，因此不能为空，也不能包含路径分隔符、".." 或 NUL 字符。
     */
    public static boolean isValidName(String name) {
        return name != null
                && !name.isBlank()
                && name.indexOf('/') < 0
                && name.indexOf('\\') < 0
                && name.indexOf('\0') < 0
                && !name.contains("..");
    }

    /**
     * 交互式添加时使用的模板。
     */
    public static TraceModel template() {
        return new TraceModel("", 0, 0, TraceContent.defaultContent());
    }
}
