/**
 * TraceException.java
 *
 * 守护进程内部统一使用的运行时异常。
 * 每个异常都带有一个 ErrorKind，Controller 和 CommandDispatcher 据此把它转换为
 * HTTP 状态码或 WebSocket 错误回复，而不会让异常终止进程。
 */
package club.ppmc.girasol.exception;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.Getter;

@Getter
public class TraceException extends RuntimeException {

    /** 错误类别。 */
    private final ErrorKind kind;

    public TraceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TraceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TraceException notFound(String name) {
        return new TraceException(ErrorKind.NOT_FOUND, name + " does not exist");
    }

    public static TraceException exists(String name) {
        return new TraceException(ErrorKind.CONFLICT, name + " exists");
    }

    public static TraceException invalidName(String name) {
        return new TraceException(ErrorKind.SERIALIZATION,
                "invalid trace name '" + name.replace("\0", "\\0") + "': must not contain '/', '\\', '..' or NUL");
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含错误类别和消息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of("type", kind.name(), "message", getMessage() != null ? getMessage() : "");
    }

    /**
     * 从 CompletableFuture 抛出的包装异常中取出真正的 TraceException。
     *
     * @param error 任意异常，可能被 CompletionException 或 ExecutionException 包装。
     * @param fallback 底层异常不是 TraceException 时使用的错误类别。
     */
    public static TraceException unwrap(Throwable error, ErrorKind fallback) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TraceException traceException) {
            return traceException;
        }
        return new TraceException(fallback, String.valueOf(cause.getMessage()), cause);
    }
}
