/**
 * ModelStore.java
 *
 * 该服务是 catalog 的唯一所有者，负责追踪任务定义的增删查。
 * 所有操作都被投递到同一个单线程邮箱中依次执行，因此 catalog 总是以线性化的顺序被观察和修改，无需显式加锁。
 * 每次成功的修改都会触发一次尽力而为的异步刷盘；shutdown() 则会同步刷盘后关闭存储，之后拒绝所有请求。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.util.CatalogLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ModelStore {

    static final String DATABASE_DIR = "database";
    private static final long FLUSH_DRAIN_SECONDS = 5;

    private final CatalogLog catalog;
    private final ObjectMapper objectMapper;
    private final ExecutorService mailbox = Executors.newSingleThreadExecutor(r -> daemonThread(r, "model-store"));
    private final ExecutorService flusher = Executors.newSingleThreadExecutor(r -> daemonThread(r, "model-store-flush"));

    // 只在邮箱线程中读写
    private boolean closed;

    @Autowired
    public ModelStore(
            @Value("${girasol.home}") String home,
            @Value("${girasol.catalog.compaction-min-dead:64}") int compactionMinDead)
            throws IOException {
        this(openCatalog(Paths.get(home), compactionMinDead), new ObjectMapper());
    }

    public ModelStore(CatalogLog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        log.info("database actor started");
    }

    private static CatalogLog openCatalog(Path home, int compactionMinDead) throws IOException {
        Path databaseDir = home.toAbsolutePath().normalize().resolve(DATABASE_DIR);
        try {
            return CatalogLog.open(databaseDir, new ObjectMapper(), compactionMinDead);
        } catch (IOException e) {
            log.error("无法打开 catalog: {}", databaseDir, e);
            throw e;
        }
    }

    /**
     * 查询所有任务定义，顺序为存储键的顺序。
     * 任意一条记录无法解码都会使整个查询失败（SERIALIZATION），不返回部分结果。
     */
    public CompletableFuture<List<TraceModel>> queryAll() {
        return submit(() -> {
            var result = new ArrayList<TraceModel>(catalog.size());
            for (var entry : catalog.entries()) {
                result.add(decode(entry.getKey(), entry.getValue()));
            }
            return result;
        });
    }

    public CompletableFuture<TraceModel> get(String name) {
        return submit(() -> {
            JsonNode value = catalog.get(name).orElseThrow(() -> TraceException.notFound(name));
            return decode(name, value);
        });
    }

    /**
     * 新增一个任务定义。名称已存在时失败（CONFLICT）。
     */
    public CompletableFuture<Void> add(TraceModel model) {
        return submit(() -> {
            if (model == null || !StringUtils.hasText(model.name())) {
                throw new TraceException(ErrorKind.SERIALIZATION, "trace definition must have a name");
            }
            if (!TraceModel.isValidName(model.name())) {
                throw TraceException.invalidName(model.name());
            }
            if (catalog.containsKey(model.name())) {
                throw TraceException.exists(model.name());
            }
            catalog.put(model.name(), objectMapper.valueToTree(model));
            log.info("已添加追踪任务定义: {}", model.name());
            flushAsync();
            return null;
        });
    }

    /**
     * 删除一个任务定义。名称不存在时失败（NOT_FOUND）。已在运行的执行不受影响。
     */
    public CompletableFuture<Void> remove(String name) {
        return submit(() -> {
            if (!catalog.remove(name)) {
                throw TraceException.notFound(name);
            }
            log.info("已删除追踪任务定义: {}", name);
            flushAsync();
            return null;
        });
    }

    /**
     * 同步刷盘并关闭存储。完成后所有新请求都会失败。可重复调用。
     */
    public CompletableFuture<Void> shutdown() {
        var future = new CompletableFuture<Void>();
        try {
            mailbox.execute(() -> {
                try {
                    if (!closed) {
                        closed = true;
                        drainFlusher();
                        catalog.flush();
                        catalog.close();
                        log.info("database finalized, catalog flushed");
                    }
                    future.complete(null);
                } catch (IOException e) {
                    log.error("关闭 catalog 时刷盘失败", e);
                    future.completeExceptionally(
                            new TraceException(ErrorKind.STORAGE_IO, "final flush failed: " + e.getMessage(), e));
                } finally {
                    mailbox.shutdown();
                }
            });
        } catch (RejectedExecutionException e) {
            // 邮箱已关闭，说明之前的 shutdown 已经执行过
            future.complete(null);
        }
        return future;
    }

    @PreDestroy
    public void destroy() {
        try {
            shutdown().get(FLUSH_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("关闭 ModelStore 时出错", e);
        }
    }

    private <T> CompletableFuture<T> submit(Callable<T> task) {
        var future = new CompletableFuture<T>();
        try {
            mailbox.execute(() -> {
                if (closed) {
                    future.completeExceptionally(storeClosed());
                    return;
                }
                try {
                    future.complete(task.call());
                } catch (TraceException e) {
                    future.completeExceptionally(e);
                } catch (JsonProcessingException e) {
                    future.completeExceptionally(
                            new TraceException(ErrorKind.SERIALIZATION, e.getOriginalMessage(), e));
                } catch (IOException e) {
                    log.error("catalog 读写失败", e);
                    future.completeExceptionally(new TraceException(ErrorKind.STORAGE_IO, e.getMessage(), e));
                } catch (Exception e) {
                    log.error("处理 catalog 请求时出现意外错误", e);
                    future.completeExceptionally(new TraceException(ErrorKind.STORAGE_IO, e.getMessage(), e));
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(storeClosed());
        }
        return future;
    }

    private TraceModel decode(String key, JsonNode value) {
        try {
            return objectMapper.treeToValue(value, TraceModel.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("catalog 记录 {} 无法解码", key, e);
            throw new TraceException(ErrorKind.SERIALIZATION, "record " + key + " is corrupt: " + e.getMessage(), e);
        }
    }

    private void flushAsync() {
        try {
            flusher.execute(() -> {
                try {
                    catalog.flush();
                    log.trace("catalog 异步刷盘完成");
                } catch (IOException e) {
                    log.error("catalog 异步刷盘失败", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("刷盘线程已关闭，跳过本次异步刷盘");
        }
    }

    private void drainFlusher() {
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(FLUSH_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("等待异步刷盘超时，放弃剩余的刷盘任务");
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static TraceException storeClosed() {
        return new TraceException(ErrorKind.STORAGE_IO, "model store is shut down");
    }

    private static Thread daemonThread(Runnable runnable, String name) {
        var thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
