/**
 * CommandLineService.java
 *
 * 命令行子命令（list / add / check / remove / local）的执行者。
 * 每个处理方法都同步等待 ModelStore 或 TraceSupervisor 的结果，把结果打印到标准输出，
 * 并返回进程退出码：0 表示成功，1 表示操作失败。
 * 无论成功与否，execute() 返回前都会让 ModelStore 同步刷盘并关闭。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.GirasolCommand;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.TraceResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class CommandLineService {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    private static final String DEFAULT_EDITOR = "vi";
    private static final long STORE_SHUTDOWN_SECONDS = 10;

    private final ModelStore modelStore;
    private final TraceSupervisor traceSupervisor;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final PrintStream out;

    @Autowired
    public CommandLineService(
            ModelStore modelStore, TraceSupervisor traceSupervisor, ObjectMapper objectMapper, Validator validator) {
        this(modelStore, traceSupervisor, objectMapper, validator, System.out);
    }

    public CommandLineService(
            ModelStore modelStore,
            TraceSupervisor traceSupervisor,
            ObjectMapper objectMapper,
            Validator validator,
            PrintStream out) {
        this.modelStore = modelStore;
        this.traceSupervisor = traceSupervisor;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.out = out;
    }

    /**
     * 执行一个非 endpoint 子命令。
     *
     * @return 进程退出码。
     */
    public int execute(GirasolCommand command) {
        try {
            if (command instanceof GirasolCommand.ListTraces list) {
                return handleList(list.detail());
            }
            if (command instanceof GirasolCommand.Add add) {
                return handleAdd(add.editor());
            }
            if (command instanceof GirasolCommand.Check check) {
                return handleCheck(check.name());
            }
            if (command instanceof GirasolCommand.Remove remove) {
                return handleRemove(remove.name());
            }
            if (command instanceof GirasolCommand.Local local) {
                return handleLocal(local.name(), local.round(), local.pattern());
            }
            throw new IllegalArgumentException("not a command-line subcommand: " + command);
        } catch (TraceException e) {
            log.debug("子命令 {} 失败", command, e);
            System.err.println("error [" + e.getKind() + "]: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            shutdownStore();
        }
    }

    public int handleList(boolean detail) {
        List<TraceModel> models = await(modelStore.queryAll());
        if (detail) {
            for (TraceModel model : models) {
                out.println(toJson(model));
            }
        } else {
            models.forEach(model -> out.println(model.name()));
        }
        return EXIT_OK;
    }

    /**
     * 把模板写入临时文件，打开编辑器让用户填写，然后保存编辑结果。
     *
     * @param editor 编辑器命令，可以带参数；为空时依次尝试 $EDITOR 和 vi。
     */
    public int handleAdd(String editor) {
        Path draft;
        try {
            draft = Files.createTempFile("girasol-", ".json");
        } catch (IOException e) {
            throw new TraceException(ErrorKind.STORAGE_IO, "failed to create draft file: " + e.getMessage(), e);
        }
        try {
            Files.writeString(draft, toJson(TraceModel.template()), StandardCharsets.UTF_8);
            openEditor(resolveEditor(editor), draft);
            TraceModel model = parseDraft(Files.readString(draft, StandardCharsets.UTF_8));
            await(modelStore.add(model));
            out.println("added " + model.name());
            return EXIT_OK;
        } catch (IOException e) {
            throw new TraceException(ErrorKind.STORAGE_IO, "failed to edit draft: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(draft);
            } catch (IOException e) {
                log.warn("无法删除临时文件 {}: {}", draft, e.getMessage());
            }
        }
    }

    public int handleCheck(String name) {
        out.println(toJson(await(modelStore.get(name))));
        return EXIT_OK;
    }

    public int handleRemove(String name) {
        await(modelStore.remove(name));
        out.println("removed " + name);
        return EXIT_OK;
    }

    /**
     * 在本进程内运行一个已保存的任务并等待它结束。tracer 输出写入日志。
     *
     * @return 执行以 COMPLETED 结束时为 0，FAILED 时为 1。
     */
    public int handleLocal(String name, long round, String pattern) {
        TraceModel model = await(modelStore.get(name));
        RunningExecution entry = await(traceSupervisor.start(model, round, pattern, null));
        log.info("本地运行追踪任务 {}，剩余迭代: {}", entry.name(), entry.remaining());
        TraceResult result;
        try {
            result = entry.handle().awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            entry.handle().stop();
            throw new TraceException(ErrorKind.PROCESS_EXIT, "interrupted while waiting for " + name, e);
        }
        out.println(name + " " + result.state() + (result.exitCode() != null ? " (exit " + result.exitCode() + ")" : "")
                + (result.isSuccess() ? "" : ": " + result.message()));
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    TraceModel parseDraft(String json) {
        TraceModel model;
        try {
            model = objectMapper.readValue(json, TraceModel.class);
        } catch (JsonProcessingException e) {
            throw new TraceException(ErrorKind.SERIALIZATION, "invalid trace definition: " + e.getOriginalMessage(), e);
        }
        Set<ConstraintViolation<TraceModel>> violations = validator.validate(model);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new TraceException(ErrorKind.SERIALIZATION, "invalid trace definition: " + detail);
        }
        return model;
    }

    static List<String> resolveEditor(String editor) {
        String command = editor;
        if (!StringUtils.hasText(command)) {
            command = System.getenv("EDITOR");
        }
        if (!StringUtils.hasText(command)) {
            command = DEFAULT_EDITOR;
        }
        return new ArrayList<>(Arrays.asList(command.trim().split("\\s+")));
    }

    private void openEditor(List<String> editorCommand, Path draft) {
        var command = new ArrayList<>(editorCommand);
        command.add(draft.toString());
        log.debug("打开编辑器: {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command).inheritIO().start();
        } catch (IOException e) {
            throw new TraceException(ErrorKind.PROCESS_SPAWN,
                    "failed to launch editor " + editorCommand.get(0) + ": " + e.getMessage(), e);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new TraceException(ErrorKind.PROCESS_EXIT, "interrupted while editing", e);
        }
        if (exitCode != 0) {
            throw new TraceException(ErrorKind.PROCESS_EXIT, "editor exited with code " + exitCode);
        }
    }

    private String toJson(TraceModel model) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new TraceException(ErrorKind.SERIALIZATION, "failed to encode " + model.name(), e);
        }
    }

    private void shutdownStore() {
        try {
            modelStore.shutdown().get(STORE_SHUTDOWN_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("关闭 catalog 失败", e);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw TraceException.unwrap(e, ErrorKind.STORAGE_IO);
        }
    }
}
