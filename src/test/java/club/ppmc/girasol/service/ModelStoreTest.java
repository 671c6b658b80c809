package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.Frequency;
import club.ppmc.girasol.model.TraceContent;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.util.CatalogLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    private ModelStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = open();
    }

    @AfterEach
    void tearDown() throws Exception {
        store.shutdown().get(5, TimeUnit.SECONDS);
    }

    @Test
    void add_thenGet_returnsEqualModel() {
        TraceModel model = perfModel("branches");

        store.add(model).join();

        assertEquals(model, store.get("branches").join());
    }

    @Test
    void add_systemTapModel_keepsEveryField() {
        var content = new TraceContent.SystemTap(
                List.of("main", "compute"),
                "/usr/bin/app",
                List.of("--fast"),
                List.of(new TraceContent.EnvVar("LANG", "C")));
        var model = new TraceModel("stap", 3, 2, content);

        store.add(model).join();

        assertEquals(model, store.get("stap").join());
    }

    @Test
    void add_duplicateName_failsWithConflict() {
        store.add(perfModel("dup")).join();

        TraceException error = failure(store.add(perfModel("dup")));

        assertEquals(ErrorKind.CONFLICT, error.getKind());
        assertEquals("dup exists", error.getMessage());
    }

    @Test
    void add_blankName_failsWithSerialization() {
        TraceException error = failure(store.add(perfModel("  ")));

        assertEquals(ErrorKind.SERIALIZATION, error.getKind());
    }

    @Test
    void add_nameThatWouldEscapeOutputDirectory_failsWithSerialization() {
        for (String name : List.of("../../x", "dir/name", "back\\slash", "nul\u0000name")) {
            TraceException error = failure(store.add(perfModel(name)));

            assertEquals(ErrorKind.SERIALIZATION, error.getKind(), name);
        }
        assertTrue(store.queryAll().join().isEmpty());
    }

    @Test
    void get_missingName_failsWithNotFound() {
        TraceException error = failure(store.get("nothing"));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("nothing does not exist", error.getMessage());
    }

    @Test
    void remove_deletesModel() {
        store.add(perfModel("gone")).join();

        store.remove("gone").join();

        assertEquals(ErrorKind.NOT_FOUND, failure(store.get("gone")).getKind());
        assertEquals(ErrorKind.NOT_FOUND, failure(store.remove("gone")).getKind());
    }

    @Test
    void queryAll_sizeTracksSuccessfulAddsMinusRemoves() {
        for (int i = 0; i < 5; i++) {
            store.add(perfModel("m" + i)).join();
        }
        store.add(perfModel("m0")).exceptionally(e -> null).join();
        store.remove("m1").join();
        store.remove("missing").exceptionally(e -> null).join();

        List<TraceModel> all = store.queryAll().join();

        assertEquals(4, all.size());
        assertEquals(List.of("m0", "m2", "m3", "m4"), all.stream().map(TraceModel::name).toList());
    }

    @Test
    void concurrentAddsOfSameName_admitExactlyOne() {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (int i = 0; i < 16; i++) {
            futures.add(store.add(perfModel("race")));
        }

        long succeeded = futures.stream()
                .filter(f -> {
                    try {
                        f.join();
                        return true;
                    } catch (CompletionException e) {
                        return false;
                    }
                })
                .count();

        assertEquals(1, succeeded);
        assertEquals(1, store.queryAll().join().size());
    }

    @Test
    void queryAll_corruptRecord_failsWholeQuery() throws Exception {
        store.shutdown().get(5, TimeUnit.SECONDS);
        try (CatalogLog log = CatalogLog.open(dir.resolve("database"), objectMapper, 64)) {
            log.put("good", objectMapper.valueToTree(perfModel("good")));
            log.put("bad", objectMapper.readTree("{\"name\":\"bad\",\"content\":{\"method\":\"Unknown\"}}"));
        }
        store = open();

        TraceException error = failure(store.queryAll());

        assertEquals(ErrorKind.SERIALIZATION, error.getKind());
        assertTrue(error.getMessage().startsWith("record bad is corrupt"));
        assertEquals("good", store.get("good").join().name());
    }

    @Test
    void shutdown_persistsAcrossReopen() throws Exception {
        store.add(perfModel("durable")).join();
        store.shutdown().get(5, TimeUnit.SECONDS);

        store = open();

        assertEquals(perfModel("durable"), store.get("durable").join());
    }

    @Test
    void shutdown_rejectsLaterRequestsAndIsIdempotent() throws Exception {
        store.shutdown().get(5, TimeUnit.SECONDS);
        store.shutdown().get(5, TimeUnit.SECONDS);

        TraceException error = failure(store.get("anything"));

        assertEquals(ErrorKind.STORAGE_IO, error.getKind());
    }

    private ModelStore open() throws IOException {
        return new ModelStore(CatalogLog.open(dir.resolve("database"), objectMapper, 64), objectMapper);
    }

    private static TraceModel perfModel(String name) {
        return new TraceModel(name, 5, 1,
                new TraceContent.PerfBranch(new Frequency.Specific(4000), "/usr/bin/true", List.of("-g")));
    }

    private static TraceException failure(CompletableFuture<?> future) {
        CompletionException error = assertThrows(CompletionException.class, future::join);
        return assertInstanceOf(TraceException.class, error.getCause());
    }
}
