package org.cadsync.console;

import okhttp3.mockwebserver.MockWebServer;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.api.ErrorKind;
import org.cadsync.console.config.ConsoleConfig;
import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.service.AssignmentSource;
import org.cadsync.console.ui.TimelineLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * End-to-end runs of the console against an in-memory dispatch service.
 */
final class DispatchConsoleScenarioTest {

    @TempDir
    Path dir;

    private FakeCadServer cad;
    private MockWebServer server;
    private DispatchConsole console;

    @BeforeEach
    void setUp() throws IOException {
        cad = new FakeCadServer()
                .addCall("C1", "Dispatched", "High")
                .addCall("C2", "Dispatched", "Routine")
                .addUnit("U1", "Available")
                .addUnit("U2", "Available");
        server = new MockWebServer();
        server.setDispatcher(cad);
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (console != null) {
            console.stop();
        }
        server.shutdown();
    }

    @Test
    void callRunsThroughItsLifecycle() throws Exception {
        console = startConsole();
        assertThat(console.getStore().getSnapshot().getCalls()).hasSize(2);

        console.assign("C1", "U1", AssignmentSource.MANUAL_SELECTION).get(10, TimeUnit.SECONDS);

        assertThat(call("C1").getStatus()).isEqualTo(CallStatus.ENROUTE);
        assertThat(call("C1").getAssignedUnitIds()).containsExactly("U1");

        console.getSelection().selectCall("C1");
        assertThat(console.handleShortcut('2').get(10, TimeUnit.SECONDS)).isTrue();
        assertThat(console.handleShortcut('3').get(10, TimeUnit.SECONDS)).isTrue();
        assertThat(console.handleShortcut('4').get(10, TimeUnit.SECONDS)).isTrue();

        assertThat(cad.callStatus("C1")).isEqualTo("Available");
        assertThat(call("C1").getStatus()).isEqualTo(CallStatus.AVAILABLE);
        assertThat(call("C1").getAssignedUnitIds()).isEmpty();
        assertThat(console.getStore().findUnit("U1").get().getStatusText()).isEqualTo("Available");
        assertThat(console.getPendingMutations()).isEmpty();
    }

    @Test
    void illegalTransitionIsRejectedAndNotQueued() throws Exception {
        console = startConsole();

        ExecutionException error = catchThrowableOfType(
                () -> console.transition("C2", CallStatus.TRANSPORT, null).get(10, TimeUnit.SECONDS),
                ExecutionException.class);

        assertThat(error.getCause()).isInstanceOf(DispatchException.class);
        assertThat(((DispatchException) error.getCause()).getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(console.getPendingMutations()).isEmpty();
        assertThat(cad.callStatus("C2")).isEqualTo("Dispatched");
    }

    @Test
    void realtimeNotificationRefreshesTheBoard() throws Exception {
        console = startConsole();
        Await.until(console::isLiveUpdatesConnected, 5000, "live updates");
        Await.until(() -> cad.openSockets() == 1, 5000, "server socket");

        cad.addCall("C3", "Dispatched", "Critical");
        cad.broadcast("{\"type\":\"call_created\"}");

        Await.until(() -> console.getStore().findCall("C3").isPresent(), 5000, "C3 on the board");
    }

    @Test
    void assignmentMadeOfflineIsDeliveredWhenBackOnline() throws Exception {
        console = startConsole();
        cad.setOffline(true);

        ExecutionException error = catchThrowableOfType(
                () -> console.assign("C2", "U2", AssignmentSource.DRAG_AND_DROP).get(20, TimeUnit.SECONDS),
                ExecutionException.class);

        DispatchException cause = (DispatchException) error.getCause();
        assertThat(cause.getKind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(cause.isQueued()).isTrue();
        assertThat(console.getPendingMutations()).hasSize(1);
        assertThat(console.isOnline()).isFalse();
        assertThat(cad.assignedUnits("C2")).isEmpty();

        cad.setOffline(false);

        Await.until(() -> cad.assignedUnits("C2").contains("U2"), 10000, "queued assignment delivered");
        Await.until(() -> console.getPendingMutations().isEmpty(), 5000, "queue drained");
        Await.until(() -> call("C2").getStatus() == CallStatus.ENROUTE, 5000, "board shows C2 en route");
        assertThat(cad.requestCount("POST", "/api/cad/dispatch")).isEqualTo(1);
        assertThat(console.isOnline()).isTrue();
    }

    @Test
    void queuedMutationSurvivesRestart() throws Exception {
        console = startConsole();
        cad.setOffline(true);
        catchThrowableOfType(
                () -> console.assign("C1", "U1", AssignmentSource.MANUAL_SELECTION).get(20, TimeUnit.SECONDS),
                ExecutionException.class);
        console.stop();
        assertThat(cad.assignedUnits("C1")).isEmpty();

        cad.setOffline(false);
        console = startConsole();

        Await.until(() -> cad.assignedUnits("C1").contains("U1"), 10000, "restored mutation replayed");
        Await.until(() -> console.getPendingMutations().isEmpty(), 5000, "queue drained");
    }

    @Test
    void timelineShowsEventsOfSelectedCall() throws Exception {
        console = startConsole();
        console.assign("C1", "U1", AssignmentSource.MANUAL_SELECTION).get(10, TimeUnit.SECONDS);
        RecordingView view = new RecordingView();

        List<AuditEvent> events = console.newTimelineLoader(view).show("C1").get(10, TimeUnit.SECONDS);

        assertThat(events).extracting(AuditEvent::getAction).containsExactly("unit_assigned");
        assertThat(view.lastShown).isEqualTo("C1");
    }

    private DispatchConsole startConsole() throws IOException {
        ConsoleConfig config = ConsoleConfig.builder()
                .apiBaseUrl(server.url("/").toString())
                .queueFile(dir.resolve("queue.json"))
                .pollingEnabled(false)
                .probeIntervalSeconds(1)
                .reconnectDelayMillis(100)
                .maxReconnectDelayMillis(1000)
                .readTimeoutSeconds(5)
                .connectTimeoutSeconds(2)
                .build();
        DispatchConsole c = new DispatchConsole(config, TestCredentials.fixed("token-1"));
        c.start();
        return c;
    }

    private Call call(String id) {
        return console.getStore().findCall(id).orElseThrow(() -> new AssertionError(id + " not on the board"));
    }

    private static final class RecordingView implements TimelineLoader.View {
        private volatile String lastShown;

        @Override
        public void showPrompt() {
        }

        @Override
        public void showLoading(String callId) {
        }

        @Override
        public void showTimeline(String callId, List<AuditEvent> events) {
            lastShown = callId;
        }

        @Override
        public void showError(String callId, DispatchException error) {
        }
    }
}
