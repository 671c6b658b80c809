package club.ppmc.girasol.controller;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.Frequency;
import club.ppmc.girasol.model.TraceContent;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.ws.CommandRequest;
import club.ppmc.girasol.service.ModelStore;
import club.ppmc.girasol.service.OutboundNotifier;
import club.ppmc.girasol.service.RunningExecution;
import club.ppmc.girasol.service.ShutdownCoordinator;
import club.ppmc.girasol.service.TraceExecution;
import club.ppmc.girasol.service.TraceSupervisor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    @Mock
    private ModelStore modelStore;
    @Mock
    private TraceSupervisor traceSupervisor;
    @Mock
    private ShutdownCoordinator shutdownCoordinator;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private CommandDispatcher dispatcher;
    private OutboundNotifier notifier;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(modelStore, traceSupervisor, shutdownCoordinator, objectMapper);
        notifier = new OutboundNotifier("test", frames::add, objectMapper);
    }

    @AfterEach
    void tearDown() {
        notifier.close();
    }

    @Test
    void queryAll_repliesWithEveryModel() throws Exception {
        when(modelStore.queryAll()).thenReturn(CompletableFuture.completedFuture(List.of(model("a"), model("b"))));

        dispatcher.dispatch(new CommandRequest.QueryAll("1"), notifier);

        JsonNode reply = nextFrame();
        assertEquals("reply", reply.get("kind").asText());
        assertEquals("1", reply.get("id").asText());
        assertTrue(reply.get("ok").asBoolean());
        assertEquals(2, reply.get("data").size());
        assertEquals("PerfBranch", reply.get("data").get(0).get("content").get("method").asText());
    }

    @Test
    void add_repliesWithName() throws Exception {
        when(modelStore.add(any())).thenReturn(CompletableFuture.completedFuture(null));

        dispatcher.dispatch(new CommandRequest.Add("2", model("new")), notifier);

        JsonNode reply = nextFrame();
        assertTrue(reply.get("ok").asBoolean());
        assertEquals("new", reply.get("data").get("name").asText());
    }

    @Test
    void add_withoutModel_repliesWithSerializationError() throws Exception {
        dispatcher.dispatch(new CommandRequest.Add("3", null), notifier);

        JsonNode reply = nextFrame();
        assertFalse(reply.get("ok").asBoolean());
        assertEquals("SERIALIZATION", reply.get("error").get("type").asText());
    }

    @Test
    void get_missingModel_repliesWithNotFound() throws Exception {
        when(modelStore.get("nope")).thenReturn(CompletableFuture.failedFuture(TraceException.notFound("nope")));

        dispatcher.dispatch(new CommandRequest.Get("4", "nope"), notifier);

        JsonNode reply = nextFrame();
        assertFalse(reply.get("ok").asBoolean());
        assertEquals("NOT_FOUND", reply.get("error").get("type").asText());
        assertEquals("nope does not exist", reply.get("error").get("message").asText());
    }

    @Test
    void remove_unexpectedError_repliesWithStorageIo() throws Exception {
        when(modelStore.remove("x")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));

        dispatcher.dispatch(new CommandRequest.Remove("5", "x"), notifier);

        JsonNode reply = nextFrame();
        assertEquals("STORAGE_IO", reply.get("error").get("type").asText());
        assertEquals("disk gone", reply.get("error").get("message").asText());
    }

    @Test
    void start_byName_loadsModelAndRepliesWithRemaining() throws Exception {
        TraceModel stored = model("perf");
        TraceExecution execution = mock(TraceExecution.class);
        when(execution.getRemaining()).thenReturn(5L);
        when(modelStore.get("perf")).thenReturn(CompletableFuture.completedFuture(stored));
        when(traceSupervisor.start(eq(stored), eq(0L), eq(""), eq(notifier)))
                .thenReturn(CompletableFuture.completedFuture(new RunningExecution("perf", execution)));

        dispatcher.dispatch(new CommandRequest.Start("6", "perf", null, 0, ""), notifier);

        JsonNode reply = nextFrame();
        assertTrue(reply.get("ok").asBoolean());
        assertEquals("perf", reply.get("data").get("name").asText());
        assertEquals(5, reply.get("data").get("remaining").asLong());
    }

    @Test
    void start_withInlineModel_skipsCatalog() throws Exception {
        TraceModel inline = model("adhoc");
        TraceExecution execution = mock(TraceExecution.class);
        when(traceSupervisor.start(eq(inline), anyLong(), anyString(), eq(notifier)))
                .thenReturn(CompletableFuture.completedFuture(new RunningExecution("adhoc", execution)));

        dispatcher.dispatch(new CommandRequest.Start("7", null, inline, 3, "x"), notifier);

        assertTrue(nextFrame().get("ok").asBoolean());
        verify(modelStore, never()).get(anyString());
    }

    @Test
    void start_withoutNameOrModel_repliesWithSerializationError() throws Exception {
        dispatcher.dispatch(new CommandRequest.Start("8", null, null, 0, null), notifier);

        assertEquals("SERIALIZATION", nextFrame().get("error").get("type").asText());
    }

    @Test
    void start_alreadyRunning_repliesWithConflict() throws Exception {
        when(modelStore.get("dup")).thenReturn(CompletableFuture.completedFuture(model("dup")));
        when(traceSupervisor.start(any(), anyLong(), any(), any())).thenReturn(CompletableFuture.failedFuture(
                new TraceException(ErrorKind.CONFLICT, "dup is already running")));

        dispatcher.dispatch(new CommandRequest.Start("9", "dup", null, 0, ""), notifier);

        assertEquals("CONFLICT", nextFrame().get("error").get("type").asText());
    }

    @Test
    void stop_repliesAfterSignal() throws Exception {
        when(traceSupervisor.stop("perf")).thenReturn(CompletableFuture.completedFuture(null));

        dispatcher.dispatch(new CommandRequest.Stop("10", "perf"), notifier);

        assertEquals("perf", nextFrame().get("data").get("name").asText());
    }

    @Test
    void kill_repliesThenRequestsShutdown() throws Exception {
        dispatcher.dispatch(new CommandRequest.Kill("11"), notifier);

        JsonNode reply = nextFrame();
        assertTrue(reply.get("ok").asBoolean());
        verify(shutdownCoordinator, timeout(5000)).requestShutdown();
    }

    @Test
    void textFrame_isDecodedAndRouted() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(traceSupervisor.stop("perf")).thenReturn(CompletableFuture.completedFuture(null));
        dispatcher.afterConnectionEstablished(session);

        dispatcher.handleTextMessage(session, new TextMessage("{\"type\":\"Stop\",\"id\":\"12\",\"name\":\"perf\"}"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, timeout(5000)).sendMessage(captor.capture());
        JsonNode reply = objectMapper.readTree(captor.getValue().getPayload());
        assertEquals("12", reply.get("id").asText());
        assertTrue(reply.get("ok").asBoolean());
        dispatcher.afterConnectionClosed(session, CloseStatus.NORMAL);
    }

    @Test
    void malformedFrame_repliesWithSerializationErrorAndKeepsConnection() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s2");
        dispatcher.afterConnectionEstablished(session);

        dispatcher.handleTextMessage(session, new TextMessage("{\"type\":\"Explode\"}"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, timeout(5000)).sendMessage(captor.capture());
        JsonNode reply = objectMapper.readTree(captor.getValue().getPayload());
        assertFalse(reply.get("ok").asBoolean());
        assertFalse(reply.has("id"));
        assertEquals("SERIALIZATION", reply.get("error").get("type").asText());
        verify(session, never()).close();
        dispatcher.afterConnectionClosed(session, CloseStatus.NORMAL);
    }

    private JsonNode nextFrame() throws Exception {
        String payload = frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(payload, "no frame was written");
        return objectMapper.readTree(payload);
    }

    private static TraceModel model(String name) {
        return new TraceModel(name, 3, 1, new TraceContent.PerfBranch(new Frequency.Max(), "/bin/true", List.of()));
    }
}
