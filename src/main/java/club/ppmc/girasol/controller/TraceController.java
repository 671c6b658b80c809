/**
 * TraceController.java
 *
 * 追踪任务的 REST 接口，是 WebSocket 命令通道之外的第二个入口。
 * 所有操作都转发给 ModelStore 和 TraceSupervisor，并同步等待它们的结果。
 * 通过 REST 启动的执行没有回传连接，tracer 输出写入守护进程日志。
 */
package club.ppmc.girasol.controller;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.service.ModelStore;
import club.ppmc.girasol.service.TraceSupervisor;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/traces")
@Slf4j
public class TraceController {

    private final ModelStore modelStore;
    private final TraceSupervisor traceSupervisor;

    public TraceController(ModelStore modelStore, TraceSupervisor traceSupervisor) {
        this.modelStore = modelStore;
        this.traceSupervisor = traceSupervisor;
    }

    @GetMapping
    public ResponseEntity<List<TraceModel>> listTraces() {
        return ResponseEntity.ok(await(modelStore.queryAll()));
    }

    @GetMapping("/running")
    public ResponseEntity<List<String>> listRunning() {
        return ResponseEntity.ok(await(traceSupervisor.running()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<TraceModel> getTrace(@PathVariable String name) {
        return ResponseEntity.ok(await(modelStore.get(name)));
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> addTrace(@Valid @RequestBody TraceModel model) {
        await(modelStore.add(model));
        log.info("通过 REST 接口添加了追踪任务 {}", model.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("name", model.name()));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, String>> removeTrace(@PathVariable String name) {
        await(modelStore.remove(name));
        return ResponseEntity.ok(Map.of("name", name));
    }

    /**
     * 启动一个已保存的追踪任务。round 不大于零时使用任务定义中的 lasting。
     */
    @PostMapping("/{name}/start")
    public ResponseEntity<Map<String, Object>> startTrace(
            @PathVariable String name,
            @RequestParam(defaultValue = "0") long round,
            @RequestParam(defaultValue = "") String pattern) {
        var entry = await(modelStore.get(name)
                .thenCompose(model -> traceSupervisor.start(model, round, pattern, null)));
        return ResponseEntity.ok(Map.of("name", entry.name(), "remaining", entry.remaining()));
    }

    @PostMapping("/{name}/stop")
    public ResponseEntity<Map<String, String>> stopTrace(@PathVariable String name) {
        await(traceSupervisor.stop(name));
        return ResponseEntity.ok(Map.of("name", name));
    }

    @ExceptionHandler(TraceException.class)
    public ResponseEntity<Map<String, Object>> handleTraceException(TraceException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case SERIALIZATION -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("处理 REST 请求失败 [{}]", e.getKind(), e);
        } else {
            log.debug("REST 请求被拒绝 [{}]: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(e.toErrorData());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw TraceException.unwrap(e, ErrorKind.STORAGE_IO);
        }
    }
}
