/**
 * OutboundFrame.java
 *
 * 守护进程通过 WebSocket 发给客户端的帧，用 "kind" 字段区分：
 * reply 是对某个请求的唯一回复，notification 是执行过程中异步产生的通知（输出报告或完成通知）。
 * 所有帧都经由该连接的 OutboundNotifier 按入队顺序写出。
 */
package club.ppmc.girasol.model.ws;

import club.ppmc.girasol.exception.TraceException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Map;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(OutboundFrame.Reply.class),
        @JsonSubTypes.Type(OutboundFrame.Notification.class)
})
public sealed interface OutboundFrame permits OutboundFrame.Reply, OutboundFrame.Notification {

    /**
     * @param id 对应请求的 id；请求无法解码时为 null。
     * @param ok 请求是否成功。
     * @param data 成功时的结果。
     * @param error 失败时的 {type, message}。
     */
    @JsonTypeName("reply")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Reply(String id, boolean ok, Object data, Map<String, Object> error) implements OutboundFrame {

        public static Reply success(String id, Object data) {
            return new Reply(id, true, data, null);
        }

        public static Reply failure(String id, TraceException error) {
            return new Reply(id, false, null, error.toErrorData());
        }
    }

    /**
     * @param event 事件类型，"TraceOutput" 或 "TraceFinished"。
     * @param data 事件数据，TraceOutput 或 TraceResult。
     */
    @JsonTypeName("notification")
    record Notification(String event, Object data) implements OutboundFrame {}
}
