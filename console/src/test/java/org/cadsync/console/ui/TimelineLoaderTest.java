package org.cadsync.console.ui;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.service.AuditTimelineReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class TimelineLoaderTest {

    private final List<Runnable> tasks = new ArrayList<>();
    private final List<String> rendered = new ArrayList<>();
    private AuditTimelineReader reader;
    private TimelineLoader loader;

    @BeforeEach
    void setUp() {
        reader = mock(AuditTimelineReader.class);
        loader = new TimelineLoader(reader, tasks::add, new TimelineLoader.View() {
            @Override
            public void showPrompt() {
                rendered.add("prompt");
            }

            @Override
            public void showLoading(String callId) {
                rendered.add("loading " + callId);
            }

            @Override
            public void showTimeline(String callId, List<AuditEvent> events) {
                rendered.add("timeline " + callId + " " + events.size());
            }

            @Override
            public void showError(String callId, DispatchException error) {
                rendered.add("error " + callId + " " + error.getKind());
            }
        });
    }

    @Test
    void showsTimelineOfSelectedCall() throws Exception {
        when(reader.timelineFor("C1")).thenReturn(Collections.singletonList(event("E1")));

        CompletableFuture<List<AuditEvent>> future = loader.show("C1");
        runTasks();

        assertThat(future).isCompletedWithValueMatching(events -> events.size() == 1);
        assertThat(rendered).containsExactly("loading C1", "timeline C1 1");
    }

    @Test
    void noSelectionShowsPrompt() {
        assertThat(loader.clear()).isCompletedWithValue(Collections.emptyList());
        assertThat(rendered).containsExactly("prompt");
        assertThat(tasks).isEmpty();
    }

    @Test
    void switchingCallsDropsTheEarlierResult() throws Exception {
        when(reader.timelineFor("C2")).thenReturn(Collections.singletonList(event("E2")));

        CompletableFuture<List<AuditEvent>> first = loader.show("C1");
        loader.show("C2");
        runTasks();

        assertThat(first).isCancelled();
        assertThat(rendered).containsExactly("loading C1", "loading C2", "timeline C2 1");
    }

    @Test
    void resultArrivingAfterClearIsDropped() throws Exception {
        when(reader.timelineFor("C1")).thenReturn(Collections.singletonList(event("E1")));

        loader.show("C1");
        tasks.remove(0).run();
        loader.clear();

        assertThat(rendered).containsExactly("loading C1", "timeline C1 1", "prompt");

        loader.show("C1");
        loader.clear();
        runTasks();

        assertThat(rendered).endsWith("loading C1", "prompt");
    }

    @Test
    void failureIsRenderedForCurrentCall() throws Exception {
        when(reader.timelineFor("C1")).thenThrow(DispatchException.network("offline", null));

        CompletableFuture<List<AuditEvent>> future = loader.show("C1");
        runTasks();

        assertThat(future).isCompletedExceptionally();
        assertThat(rendered).containsExactly("loading C1", "error C1 NETWORK");
    }

    private void runTasks() {
        List<Runnable> pending = new ArrayList<>(tasks);
        tasks.clear();
        pending.forEach(Runnable::run);
    }

    private static AuditEvent event(String id) {
        return new AuditEvent(id, "updated", "call", "C1", null, null);
    }
}
