/**
 * CatalogLog.java
 *
 * 一个极简的嵌入式键值日志，作为 catalog 的持久化存储。
 * 每次写入都是追加到 catalog.log 末尾的一行 JSON（PUT 或 DEL），打开时按顺序重放得到内存索引。
 * 写入后数据立即可读，flush() 再把通道强制刷到磁盘。
 * 该类不是线程安全的，只允许 ModelStore 的邮箱线程持有和调用（flush 除外，FileChannel.force 本身可并发调用）。
 */
package club.ppmc.girasol.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

public final class CatalogLog implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogLog.class);

    public static final String LOG_FILE_NAME = "catalog.log";
    private static final String COMPACT_FILE_NAME = "catalog.log.compact";
    private static final byte NEWLINE = '\n';

    /** 与键的 UTF-8 原始字节顺序一致。 */
    private static final Comparator<String> KEY_ORDER =
            (a, b) -> Arrays.compareUnsigned(
                    a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    enum Op {
        PUT,
        DEL
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Entry(Op op, String key, JsonNode value) {}

    private final Path logFile;
    private final ObjectMapper objectMapper;
    private final TreeMap<String, JsonNode> index = new TreeMap<>(KEY_ORDER);
    private FileChannel channel;
    private long deadEntries;

    private CatalogLog(Path logFile, ObjectMapper objectMapper) {
        this.logFile = logFile;
        this.objectMapper = objectMapper;
    }

    /**
     * 打开（必要时创建）目录下的 catalog 日志并重放。
     *
     * @param directory 日志所在目录。
     * @param objectMapper 用于读写日志行的 ObjectMapper。
     * @param compactionMinDead 死条目至少达到该数量且多于存活条目时，打开时重写日志。
     * @throws IOException 目录无法创建、文件无法读写，或日志中间出现无法解析的行。
     */
    public static CatalogLog open(Path directory, ObjectMapper objectMapper, int compactionMinDead)
            throws IOException {
        Files.createDirectories(directory);
        var log = new CatalogLog(directory.resolve(LOG_FILE_NAME), objectMapper);
        long validLength = log.replay();
        log.channel = FileChannel.open(log.logFile, CREATE, READ, WRITE);
        if (log.channel.size() > validLength) {
            log.channel.truncate(validLength);
        }
        log.channel.position(validLength);

        if (log.deadEntries >= compactionMinDead && log.deadEntries > log.index.size()) {
            log.compact();
        }
        LOGGER.info("catalog 日志已打开: {}，共 {} 条记录", log.logFile, log.index.size());
        return log;
    }

    /**
     * 重放日志文件，返回有效内容的字节长度。
     * 最后一行如果没有换行符且无法解析，视为写入中断，截断并忽略。
     */
    private long replay() throws IOException {
        if (Files.notExists(logFile)) {
            return 0;
        }
        byte[] data = Files.readAllBytes(logFile);
        int lineStart = 0;
        int lineNumber = 0;
        while (lineStart < data.length) {
            lineNumber++;
            int lineEnd = indexOf(data, NEWLINE, lineStart);
            boolean terminated = lineEnd >= 0;
            int end = terminated ? lineEnd : data.length;

            if (end > lineStart) {
                try {
                    apply(objectMapper.readValue(data, lineStart, end - lineStart, Entry.class));
                } catch (IOException e) {
                    if (terminated) {
                        throw new IOException(
                                String.format("catalog 日志 %s 第 %d 行已损坏", logFile, lineNumber), e);
                    }
                    LOGGER.warn("catalog 日志末尾存在不完整的写入（第 {} 行），已截断。", lineNumber);
                    return lineStart;
                }
            }
            if (!terminated) {
                // 最后一行完整但缺少换行符：补上，保证之后的追加从新行开始
                try (var fixer = FileChannel.open(logFile, WRITE)) {
                    fixer.position(data.length);
                    fixer.write(ByteBuffer.wrap(new byte[] {NEWLINE}));
                }
                return data.length + 1L;
            }
            lineStart = lineEnd + 1;
        }
        return data.length;
    }

    private void apply(Entry entry) throws IOException {
        if (entry.op() == null || entry.key() == null) {
            throw new IOException("catalog 日志条目缺少 op 或 key");
        }
        switch (entry.op()) {
            case PUT -> {
                if (entry.value() == null) {
                    throw new IOException("PUT 条目缺少 value: " + entry.key());
                }
                if (index.put(entry.key(), entry.value()) != null) {
                    deadEntries++;
                }
            }
            case DEL -> {
                deadEntries += index.remove(entry.key()) != null ? 2 : 1;
            }
        }
    }

    private static int indexOf(byte[] data, byte target, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == target) {
                return i;
            }
        }
        return -1;
    }

    public boolean containsKey(String key) {
        return index.containsKey(key);
    }

    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(index.get(key));
    }

    /**
     * @return 按键的字节顺序排列的所有记录快照。
     */
    public List<Map.Entry<String, JsonNode>> entries() {
        return new ArrayList<>(index.entrySet());
    }

    public int size() {
        return index.size();
    }

    public void put(String key, JsonNode value) throws IOException {
        append(new Entry(Op.PUT, key, value));
        index.put(key, value);
    }

    /**
     * @return 键存在并被删除时返回 true。
     */
    public boolean remove(String key) throws IOException {
        if (!index.containsKey(key)) {
            return false;
        }
        append(new Entry(Op.DEL, key, null));
        index.remove(key);
        deadEntries += 2;
        return true;
    }

    /**
     * 把已写入的数据强制刷到磁盘。
     */
    public void flush() throws IOException {
        ensureOpen();
        channel.force(false);
    }

    public boolean isOpen() {
        return channel != null && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (isOpen()) {
            channel.force(true);
            channel.close();
            LOGGER.debug("catalog 日志已关闭: {}", logFile);
        }
    }

    private void append(Entry entry) throws IOException {
        ensureOpen();
        writeFully(channel, encode(entry));
    }

    private byte[] encode(Entry entry) throws IOException {
        var out = new ByteArrayOutputStream();
        objectMapper.writeValue(out, entry);
        out.write(NEWLINE);
        return out.toByteArray();
    }

    private static void writeFully(FileChannel target, byte[] bytes) throws IOException {
        var buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            target.write(buffer);
        }
    }

    private void ensureOpen() throws IOException {
        if (!isOpen()) {
            throw new IOException("catalog 日志已关闭: " + logFile);
        }
    }

    /**
     * 只保留存活记录，通过临时文件加原子替换重写日志。
     */
    private void compact() throws IOException {
        Path compactFile = logFile.resolveSibling(COMPACT_FILE_NAME);
        try (var out = FileChannel.open(compactFile, CREATE, WRITE, TRUNCATE_EXISTING)) {
            for (var e : index.entrySet()) {
                writeFully(out, encode(new Entry(Op.PUT, e.getKey(), e.getValue())));
            }
            out.force(true);
        }
        channel.close();
        Files.move(compactFile, logFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        channel = FileChannel.open(logFile, READ, WRITE);
        channel.position(channel.size());
        LOGGER.info("catalog 日志已压缩：清理了 {} 条失效记录", deadEntries);
        deadEntries = 0;
    }
}
