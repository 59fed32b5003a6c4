package org.cadsync.console.realtime;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockWebServer;
import org.cadsync.console.Await;
import org.cadsync.console.FakeCadServer;
import org.cadsync.console.domain.model.ChangeSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

final class InvalidationChannelTest {

    private final List<ChangeSignal.Source> signals = new CopyOnWriteArrayList<>();
    private final List<String> connection = new CopyOnWriteArrayList<>();
    private FakeCadServer cad;
    private MockWebServer server;
    private OkHttpClient client;
    private InvalidationChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        cad = new FakeCadServer();
        server = new MockWebServer();
        server.setDispatcher(cad);
        server.start();
        client = new OkHttpClient.Builder().readTimeout(0, TimeUnit.MILLISECONDS).build();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (channel != null) {
            channel.stop();
        }
        server.shutdown();
    }

    @Test
    void subscribesToUnitScopeAndSignalsEveryFrame() throws Exception {
        channel = open("U7");

        Await.until(() -> cad.openSockets() == 1 && !cad.getInboundFrames().isEmpty(), 5000, "subscription");
        assertThat(cad.getInboundFrames()).containsExactly("{\"action\":\"subscribe\",\"channel\":\"unit:U7\"}");
        assertThat(channel.isConnected()).isTrue();
        assertThat(connection).containsExactly("up");

        cad.broadcast("{\"type\":\"call_updated\"}");
        cad.broadcast("not even json");

        Await.until(() -> signals.size() == 2, 5000, "two signals");
        assertThat(signals).containsOnly(ChangeSignal.Source.REMOTE_MESSAGE);
    }

    @Test
    void unscopedChannelSendsNothing() throws Exception {
        channel = open(null);

        Await.until(channel::isConnected, 5000, "connected");
        Thread.sleep(100);
        assertThat(cad.getInboundFrames()).isEmpty();
        assertThat(signals).isEmpty();
    }

    @Test
    void reconnectsResubscribesAndSignalsCatchUp() throws Exception {
        channel = open("U7");
        Await.until(() -> cad.getInboundFrames().size() == 1, 5000, "first subscription");

        cad.setOffline(true);
        Await.until(() -> connection.size() == 2, 5000, "disconnect noticed");
        assertThat(connection).containsExactly("up", "down");

        cad.setOffline(false);
        Await.until(() -> signals.contains(ChangeSignal.Source.RECONNECT), 5000, "reconnect signal");
        Await.until(() -> cad.getInboundFrames().size() == 2, 5000, "second subscription");

        assertThat(channel.isConnected()).isTrue();
        assertThat(cad.getInboundFrames()).containsOnly("{\"action\":\"subscribe\",\"channel\":\"unit:U7\"}");
    }

    @Test
    void stoppedChannelDoesNotReconnect() throws Exception {
        channel = open(null);
        Await.until(channel::isConnected, 5000, "connected");

        channel.stop();
        Thread.sleep(200);

        assertThat(channel.isConnected()).isFalse();
        assertThat(cad.openSockets()).isZero();
        assertThat(signals).isEmpty();
    }

    @Test
    void backoffDoublesUpToTheCap() {
        InvalidationChannel c = new InvalidationChannel(client, "ws://localhost/api/cad/live", null, 1000, 30000);

        assertThat(c.backoffDelay(1)).isEqualTo(1000);
        assertThat(c.backoffDelay(2)).isEqualTo(2000);
        assertThat(c.backoffDelay(5)).isEqualTo(16000);
        assertThat(c.backoffDelay(6)).isEqualTo(30000);
        assertThat(c.backoffDelay(60)).isEqualTo(30000);
        c.stop();
    }

    private InvalidationChannel open(String unitScope) {
        String url = server.url("/api/cad/live").toString();
        InvalidationChannel c = new InvalidationChannel(client, url, unitScope, 50, 200);
        c.addListener(new InvalidationListener() {
            @Override
            public void onInvalidation(ChangeSignal signal) {
                signals.add(signal.getSource());
            }

            @Override
            public void onConnected() {
                connection.add("up");
            }

            @Override
            public void onDisconnected() {
                connection.add("down");
            }
        });
        c.start();
        return c;
    }
}
