/**
 * GirasolCommand.java
 *
 * 命令行子命令解析后的结果，由 GirasolOptions 生成，由 GirasolApplication 和 CommandLineService 执行。
 */
package club.ppmc.girasol.model;

public sealed interface GirasolCommand {

    /** 以守护进程方式运行，监听 host:port。 */
    record Endpoint(String host, int port) implements GirasolCommand {}

    /** 列出所有任务；detail 为 true 时输出完整定义。 */
    record ListTraces(boolean detail) implements GirasolCommand {}

    /** 用编辑器交互式添加一个任务。 */
    record Add(String editor) implements GirasolCommand {}

    record Check(String name) implements GirasolCommand {}

    record Remove(String name) implements GirasolCommand {}

    /**
     * 在本进程内运行一个已保存的任务，直到它结束。
     *
     * @param round 迭代次数，不大于零时使用任务定义中的 lasting。
     * @param pattern 输出过滤的正则表达式，空串表示不过滤。
     */
    record Local(String name, long round, String pattern) implements GirasolCommand {}

    record Help() implements GirasolCommand {}
}
