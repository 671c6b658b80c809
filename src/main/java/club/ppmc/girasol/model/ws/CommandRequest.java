/**
 * CommandRequest.java
 *
 * 客户端通过 WebSocket 发送的命令。每个文本帧是一个 JSON 文档，用 "type" 字段区分命令，
 * "id" 由客户端选择，会原样出现在对应的回复中。由 CommandDispatcher 解码和分发。
 */
package club.ppmc.girasol.model.ws;

import club.ppmc.girasol.model.TraceModel;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(CommandRequest.QueryAll.class),
        @JsonSubTypes.Type(CommandRequest.Get.class),
        @JsonSubTypes.Type(CommandRequest.Add.class),
        @JsonSubTypes.Type(CommandRequest.Remove.class),
        @JsonSubTypes.Type(CommandRequest.Start.class),
        @JsonSubTypes.Type(CommandRequest.Stop.class),
        @JsonSubTypes.Type(CommandRequest.Kill.class)
})
public sealed interface CommandRequest
        permits CommandRequest.QueryAll,
                CommandRequest.Get,
                CommandRequest.Add,
                CommandRequest.Remove,
                CommandRequest.Start,
                CommandRequest.Stop,
                CommandRequest.Kill {

    String id();

    @JsonTypeName("QueryAll")
    record QueryAll(String id) implements CommandRequest {}

    @JsonTypeName("Get")
    record Get(String id, String name) implements CommandRequest {}

    @JsonTypeName("Add")
    record Add(String id, TraceModel model) implements CommandRequest {}

    @JsonTypeName("Remove")
    record Remove(String id, String name) implements CommandRequest {}

    /**
     * 启动一个执行。给出 model 时直接使用这个临时定义，否则按 name 从 catalog 中读取。
     *
     * @param round 迭代次数，不大于零时使用定义中的 lasting。
     * @param pattern tracer 输出过滤的正则表达式，可以为空。
     */
    @JsonTypeName("Start")
    record Start(String id, String name, TraceModel model, long round, String pattern) implements CommandRequest {}

    @JsonTypeName("Stop")
    record Stop(String id, String name) implements CommandRequest {}

    @JsonTypeName("Kill")
    record Kill(String id) implements CommandRequest {}
}
