/**
 * CommandDispatcher.java
 *
 * 这是守护进程的 WebSocket 处理器，负责远程命令通道。
 * 它为每个连接创建一个 OutboundNotifier，把收到的每个文本帧解码为一个 CommandRequest，
 * 转发给 ModelStore 或 TraceSupervisor，并为每个请求写回恰好一个回复。
 * Start 请求的完成结果稍后由 TraceSupervisor 通过同一个 OutboundNotifier 以通知的形式送达。
 * 任何内部错误都只会变成一个失败回复并记录日志，不会中断连接或进程。
 */
package club.ppmc.girasol.controller;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.ws.CommandRequest;
import club.ppmc.girasol.model.ws.OutboundFrame;
import club.ppmc.girasol.service.ModelStore;
import club.ppmc.girasol.service.OutboundNotifier;
import club.ppmc.girasol.service.ShutdownCoordinator;
import club.ppmc.girasol.service.TraceSupervisor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class CommandDispatcher extends TextWebSocketHandler {

    private final ModelStore modelStore;
    private final TraceSupervisor traceSupervisor;
    private final ShutdownCoordinator shutdownCoordinator;
    private final ObjectMapper objectMapper;
    private final Map<String, OutboundNotifier> notifiers = new ConcurrentHashMap<>();

    public CommandDispatcher(
            ModelStore modelStore,
            TraceSupervisor traceSupervisor,
            ShutdownCoordinator shutdownCoordinator,
            ObjectMapper objectMapper) {
        this.modelStore = modelStore;
        this.traceSupervisor = traceSupervisor;
        this.shutdownCoordinator = shutdownCoordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var notifier = new OutboundNotifier(
                session.getId(), payload -> session.sendMessage(new TextMessage(payload)), objectMapper);
        notifiers.put(session.getId(), notifier);
        log.info("接收到新的连接，会话 ID: {}，远端: {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        OutboundNotifier notifier = notifiers.remove(session.getId());
        if (notifier != null) {
            notifier.close();
        }
        log.info("连接断开，会话 ID: {}，状态: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[{}] 会话 {} 传输出错: {}", ErrorKind.TRANSPORT, session.getId(), exception.getMessage());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        OutboundNotifier notifier = notifiers.get(session.getId());
        if (notifier == null) {
            log.warn("会话 {} 没有对应的通知器，忽略消息", session.getId());
            return;
        }
        CommandRequest request;
        try {
            request = objectMapper.readValue(message.getPayload(), CommandRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("无法解码来自会话 {} 的请求: {}", session.getId(), e.getOriginalMessage());
            notifier.enqueue(OutboundFrame.Reply.failure(
                    null, new TraceException(ErrorKind.SERIALIZATION, "malformed request: " + e.getOriginalMessage())));
            return;
        }
        dispatch(request, notifier);
    }

    /**
     * 路由一个已解码的请求，并通过 notifier 写回唯一的回复。
     */
    public void dispatch(CommandRequest request, OutboundNotifier notifier) {
        log.debug("会话 {} 的请求: {}", notifier.getConnectionId(), request);
        CompletableFuture<?> result;
        try {
            result = route(request, notifier);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete((data, error) -> {
            if (error != null) {
                TraceException failure = TraceException.unwrap(error, ErrorKind.STORAGE_IO);
                log.warn("请求 {} 失败 [{}]: {}", request.id(), failure.getKind(), failure.getMessage());
                notifier.enqueue(OutboundFrame.Reply.failure(request.id(), failure));
                return;
            }
            CompletableFuture<Void> written = notifier.enqueue(OutboundFrame.Reply.success(request.id(), data));
            if (request instanceof CommandRequest.Kill) {
                // 回复写出之后再关闭，避免客户端收不到确认
                written.whenComplete((v, e) -> shutdownCoordinator.requestShutdown());
            }
        });
    }

    private CompletableFuture<?> route(CommandRequest request, OutboundNotifier notifier) {
        if (request instanceof CommandRequest.QueryAll) {
            return modelStore.queryAll();
        }
        if (request instanceof CommandRequest.Get get) {
            return modelStore.get(get.name());
        }
        if (request instanceof CommandRequest.Add add) {
            if (add.model() == null) {
                throw new TraceException(ErrorKind.SERIALIZATION, "Add request must carry a model");
            }
            return modelStore.add(add.model()).thenApply(v -> Map.of("name", add.model().name()));
        }
        if (request instanceof CommandRequest.Remove remove) {
            return modelStore.remove(remove.name()).thenApply(v -> Map.of("name", remove.name()));
        }
        if (request instanceof CommandRequest.Start start) {
            return startTrace(start, notifier);
        }
        if (request instanceof CommandRequest.Stop stop) {
            return traceSupervisor.stop(stop.name()).thenApply(v -> Map.of("name", stop.name()));
        }
        if (request instanceof CommandRequest.Kill) {
            return CompletableFuture.completedFuture(Map.of("message", "shutting down"));
        }
        throw new TraceException(ErrorKind.SERIALIZATION, "unsupported request: " + request);
    }

    private CompletableFuture<?> startTrace(CommandRequest.Start start, OutboundNotifier notifier) {
        CompletableFuture<TraceModel> definition;
        if (start.model() != null) {
            definition = CompletableFuture.completedFuture(start.model());
        } else if (StringUtils.hasText(start.name())) {
            definition = modelStore.get(start.name());
        } else {
            throw new TraceException(ErrorKind.SERIALIZATION, "Start request must carry a name or a model");
        }
        return definition
                .thenCompose(model -> traceSupervisor.start(model, start.round(), start.pattern(), notifier))
                .thenApply(entry -> Map.of("name", entry.name(), "remaining", entry.remaining()));
    }
}
