/**
 * OutboundNotifier.java
 *
 * 每个 WebSocket 连接独享的出站写入器。
 * CommandDispatcher 的回复、TraceExecution 的输出报告和完成通知都可能来自不同线程，
 * 它们只负责入队；唯一的写线程按入队顺序逐个序列化并写出，这是系统跨并发生产者唯一的顺序保证。
 * 写入失败视为连接已断开：记录 TRANSPORT 错误并关闭，之后的帧直接丢弃。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.model.TraceResult;
import club.ppmc.girasol.model.ws.OutboundFrame;
import club.ppmc.girasol.model.ws.TraceOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutboundNotifier implements AutoCloseable {

    public static final String EVENT_TRACE_OUTPUT = "TraceOutput";
    public static final String EVENT_TRACE_FINISHED = "TraceFinished";

    /**
     * 实际写出一个文本帧的底层通道，例如 WebSocketSession。只会被写线程调用。
     */
    @FunctionalInterface
    public interface FrameSink {
        void send(String payload) throws IOException;
    }

    private final String connectionId;
    private final FrameSink sink;
    private final ObjectWriter frameWriter;
    private final ExecutorService writer;
    private volatile boolean closed;

    public OutboundNotifier(String connectionId, FrameSink sink, ObjectMapper objectMapper) {
        this.connectionId = connectionId;
        this.sink = sink;
        this.frameWriter = objectMapper.writerFor(OutboundFrame.class);
        this.writer = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "notifier-" + connectionId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 把一个帧加入发送队列。
     *
     * @return 在该帧被写出（或被丢弃）后完成的 Future。
     */
    public CompletableFuture<Void> enqueue(OutboundFrame frame) {
        var written = new CompletableFuture<Void>();
        if (closed) {
            log.debug("连接 {} 已关闭，丢弃帧: {}", connectionId, frame);
            written.complete(null);
            return written;
        }
        try {
            writer.execute(() -> {
                write(frame);
                written.complete(null);
            });
        } catch (RejectedExecutionException e) {
            log.debug("连接 {} 的写线程已停止，丢弃帧", connectionId);
            written.complete(null);
        }
        return written;
    }

    public CompletableFuture<Void> sendTraceOutput(String name, long iteration, List<String> lines) {
        return enqueue(new OutboundFrame.Notification(EVENT_TRACE_OUTPUT, new TraceOutput(name, iteration, lines)));
    }

    public CompletableFuture<Void> sendTraceFinished(TraceResult result) {
        return enqueue(new OutboundFrame.Notification(EVENT_TRACE_FINISHED, result));
    }

    public String getConnectionId() {
        return connectionId;
    }

    public boolean isClosed() {
        return closed;
    }

    private void write(OutboundFrame frame) {
        if (closed) {
            return;
        }
        String payload;
        try {
            payload = frameWriter.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("无法序列化发往连接 {} 的帧: {}", connectionId, frame, e);
            return;
        }
        try {
            sink.send(payload);
        } catch (IOException e) {
            log.warn("[{}] 向连接 {} 写出失败，关闭通知器: {}", ErrorKind.TRANSPORT, connectionId, e.getMessage());
            closed = true;
            writer.shutdown();
        }
    }

    /**
     * 连接关闭时调用。之后入队的帧和尚未写出的帧都会被丢弃。
     */
    @Override
    public void close() {
        closed = true;
        writer.shutdown();
    }
}
