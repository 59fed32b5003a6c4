package org.cadsync.console.queue;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.cadsync.console.BrokenCredentials;
import org.cadsync.console.api.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class MutationQueueTest {

    private static final String JSON = "application/json; charset=utf-8";

    private MockWebServer server;
    private OkHttpClient client;
    private InMemoryQueueStore store;
    private MutationQueue queue;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient.Builder().readTimeout(2, TimeUnit.SECONDS).build();
        store = new InMemoryQueueStore();
        queue = new MutationQueue(store, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void enqueuePersistsBeforeReturning() throws IOException {
        MutationQueueEntry entry = enqueue("m-1", "C1");

        assertThat(entry.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(store.getSaved()).extracting(MutationQueueEntry::getId).containsExactly("m-1");
        assertThat(queue.hasPending()).isTrue();
    }

    @Test
    void authorizationIsNeverStored() throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer secret");
        headers.put("X-Console", "desk-4");

        queue.enqueue("m-1", "POST", server.url("/api/cad/dispatch").toString(), headers, "{}", JSON);

        assertThat(store.getSaved().get(0).getHeaders()).containsOnlyKeys("X-Console");
    }

    @Test
    void failedWriteLeavesQueueUnchanged() {
        store.setFailWrites(true);

        assertThatThrownBy(() -> enqueue("m-1", "C1")).isInstanceOf(IOException.class);
        assertThat(queue.size()).isZero();
    }

    @Test
    void replaysThreeEntriesInCreationOrder() throws Exception {
        enqueue("m-1", "C1");
        enqueue("m-2", "C2");
        enqueue("m-3", "C3");
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(204));

        ReplayResult result = queue.replay(client);

        assertThat(result.getDelivered()).isEqualTo(3);
        assertThat(result.isInterrupted()).isFalse();
        assertThat(queue.size()).isZero();
        assertThat(store.getSaved()).isEmpty();

        List<String> bodies = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            RecordedRequest request = server.takeRequest();
            bodies.add(request.getBody().readUtf8());
            keys.add(request.getHeader(OfflineQueueInterceptor.IDEMPOTENCY_HEADER));
        }
        assertThat(bodies).containsExactly(body("C1"), body("C2"), body("C3"));
        assertThat(keys).containsExactly("m-1", "m-2", "m-3");
    }

    @Test
    void serverFailureStopsReplayAndKeepsTheRest() throws Exception {
        enqueue("m-1", "C1");
        enqueue("m-2", "C2");
        enqueue("m-3", "C3");
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(503));

        ReplayResult result = queue.replay(client);

        assertThat(result.getDelivered()).isEqualTo(1);
        assertThat(result.getStopReason()).isEqualTo(ReplayResult.StopReason.SERVER);
        assertThat(result.getRemaining()).isEqualTo(2);
        assertThat(queue.pending()).extracting(MutationQueueEntry::getId).containsExactly("m-2", "m-3");
        assertThat(queue.pending().get(0).getAttempts()).isEqualTo(1);
        assertThat(queue.pending().get(0).getLastError()).isEqualTo("HTTP 503");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void authFailureStopsReplay() throws IOException {
        enqueue("m-1", "C1");
        server.enqueue(new MockResponse().setResponseCode(401));

        ReplayResult result = queue.replay(client);

        assertThat(result.getStopReason()).isEqualTo(ReplayResult.StopReason.AUTH);
        assertThat(queue.pending()).hasSize(1);
    }

    @Test
    void missingCredentialStopsReplayAsAuth() throws IOException {
        enqueue("m-1", "C1");

        ReplayResult result = queue.replay(HttpClients.authenticated(new BrokenCredentials(), 2, 2));

        assertThat(result.getStopReason()).isEqualTo(ReplayResult.StopReason.AUTH);
        assertThat(queue.pending()).hasSize(1);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void unreachableServerStopsWithNetworkReason() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/api/cad/dispatch").toString();
        closed.shutdown();
        queue.enqueue("m-1", "POST", url, Collections.emptyMap(), body("C1"), JSON);

        ReplayResult result = queue.replay(client);

        assertThat(result.getStopReason()).isEqualTo(ReplayResult.StopReason.NETWORK);
        assertThat(queue.pending()).hasSize(1);
    }

    @Test
    void rejectedEntryIsMarkedFailedAndReplayContinues() throws Exception {
        List<MutationQueueEntry> failures = new ArrayList<>();
        queue.addListener(new MutationQueueListener() {
            @Override
            public void onFailed(MutationQueueEntry entry) {
                failures.add(entry);
            }
        });
        enqueue("m-1", "C1");
        enqueue("m-2", "C2");
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"detail\":\"unit busy\"}"));
        server.enqueue(new MockResponse().setResponseCode(200));

        ReplayResult result = queue.replay(client);

        assertThat(result.getDelivered()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.isInterrupted()).isFalse();
        assertThat(queue.pending()).isEmpty();
        assertThat(queue.failed()).extracting(MutationQueueEntry::getId).containsExactly("m-1");
        assertThat(failures).extracting(MutationQueueEntry::getId).containsExactly("m-1");
        assertThat(store.getSaved()).extracting(MutationQueueEntry::getStatus).containsExactly(DeliveryStatus.FAILED);
    }

    @Test
    void entryThatKeepsDrawingServerErrorsIsGivenUp() throws Exception {
        MutationQueue capped = new MutationQueue(store, Clock.systemUTC(), 3);
        List<MutationQueueEntry> failures = new ArrayList<>();
        capped.addListener(new MutationQueueListener() {
            @Override
            public void onFailed(MutationQueueEntry entry) {
                failures.add(entry);
            }
        });
        String url = server.url("/api/cad/dispatch").toString();
        capped.enqueue("m-1", "POST", url, Collections.emptyMap(), body("C1"), JSON);
        capped.enqueue("m-2", "POST", url, Collections.emptyMap(), body("C2"), JSON);
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThat(capped.replay(client).getStopReason()).isEqualTo(ReplayResult.StopReason.SERVER);
        assertThat(capped.replay(client).getStopReason()).isEqualTo(ReplayResult.StopReason.SERVER);
        ReplayResult third = capped.replay(client);

        assertThat(third.isInterrupted()).isFalse();
        assertThat(third.getFailed()).isEqualTo(1);
        assertThat(third.getDelivered()).isEqualTo(1);
        assertThat(capped.hasPending()).isFalse();
        assertThat(capped.failed()).singleElement().satisfies(entry -> {
            assertThat(entry.getId()).isEqualTo("m-1");
            assertThat(entry.getAttempts()).isEqualTo(3);
            assertThat(entry.getLastError()).contains("HTTP 500").contains("giving up after 3 attempts");
        });
        assertThat(failures).extracting(MutationQueueEntry::getId).containsExactly("m-1");
        assertThat(capped.discard("m-1")).isTrue();
        assertThat(capped.size()).isZero();
    }

    @Test
    void networkFailuresDoNotCountTowardsGivingUp() throws IOException {
        MutationQueue capped = new MutationQueue(store, Clock.systemUTC(), 1);
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/api/cad/dispatch").toString();
        closed.shutdown();
        capped.enqueue("m-1", "POST", url, Collections.emptyMap(), body("C1"), JSON);

        capped.replay(client);
        capped.replay(client);

        assertThat(capped.pending()).hasSize(1);
        assertThat(capped.failed()).isEmpty();
    }

    @Test
    void onlyFailedEntriesCanBeDiscarded() throws IOException {
        enqueue("m-1", "C1");
        enqueue("m-2", "C2");
        server.enqueue(new MockResponse().setResponseCode(400));
        server.enqueue(new MockResponse().setResponseCode(500));
        queue.replay(client);

        assertThat(queue.discard("m-2")).isFalse();
        assertThat(queue.discard("m-1")).isTrue();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(store.getSaved()).extracting(MutationQueueEntry::getId).containsExactly("m-2");
    }

    @Test
    void entriesSurviveRestart(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("queue").resolve("mutations.json");
        MutationQueue first = new MutationQueue(new FileMutationQueueStore(file));
        first.enqueue("m-1", "POST", server.url("/api/cad/dispatch").toString(), Collections.emptyMap(), body("C1"), JSON);
        first.enqueue("m-2", "POST", server.url("/api/cad/calls/C1/status").toString(), Collections.emptyMap(),
                "{\"status\":\"OnScene\"}", JSON);

        assertThat(Files.exists(file)).isTrue();
        assertThat(Files.exists(file.resolveSibling("mutations.json.tmp"))).isFalse();

        MutationQueue restored = new MutationQueue(new FileMutationQueueStore(file));
        assertThat(restored.pending()).extracting(MutationQueueEntry::getId).containsExactly("m-1", "m-2");

        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(200));
        assertThat(restored.replay(client).getDelivered()).isEqualTo(2);
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/cad/dispatch");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/cad/calls/C1/status");

        assertThat(new MutationQueue(new FileMutationQueueStore(file)).size()).isZero();
    }

    @Test
    void restoreKeepsEnqueueOrderWhenTheClockSteppedBack() throws IOException {
        MutationQueue before = new MutationQueue(store, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        before.enqueue("m-1", "POST", server.url("/x").toString(), null, body("C1"), JSON);
        MutationQueue afterStep = new MutationQueue(store, Clock.fixed(Instant.parse("2024-05-01T09:00:00Z"), ZoneOffset.UTC));
        afterStep.enqueue("m-2", "POST", server.url("/x").toString(), null, body("C2"), JSON);

        MutationQueue restored = new MutationQueue(store);

        assertThat(restored.pending()).extracting(MutationQueueEntry::getId).containsExactly("m-1", "m-2");
    }

    @Test
    void restoredQueueContinuesSequence() throws IOException {
        enqueue("m-1", "C1");
        enqueue("m-2", "C2");

        MutationQueue restored = new MutationQueue(store, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        MutationQueueEntry third = restored.enqueue("m-3", "POST", server.url("/x").toString(), null, body("C3"), JSON);

        assertThat(third.getSequence()).isEqualTo(3);
        assertThat(restored.pending()).extracting(MutationQueueEntry::getId).containsExactly("m-1", "m-2", "m-3");
    }

    private MutationQueueEntry enqueue(String id, String callId) throws IOException {
        return queue.enqueue(id, "POST", server.url("/api/cad/dispatch").toString(),
                Collections.emptyMap(), body(callId), JSON);
    }

    private static String body(String callId) {
        return "{\"call_id\":\"" + callId + "\",\"unit_identifier\":\"U1\"}";
    }
}
