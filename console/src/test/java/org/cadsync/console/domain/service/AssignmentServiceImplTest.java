package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.api.ErrorKind;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.store.DispatchStateStoreImpl;
import org.cadsync.console.store.RefreshCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.cadsync.console.Fixtures.call;
import static org.cadsync.console.Fixtures.unit;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
final class AssignmentServiceImplTest {

    @Mock
    private DispatchApiClient apiClient;

    private DispatchStateStoreImpl store;
    private RefreshCoordinator refreshes;
    private AssignmentServiceImpl service;

    @BeforeEach
    void setUp() throws Exception {
        when(apiClient.fetchCalls()).thenReturn(Arrays.asList(
                call("C1", CallStatus.DISPATCHED),
                call("C2", CallStatus.ON_SCENE, "U2")));
        when(apiClient.fetchUnits()).thenReturn(Arrays.asList(
                unit("U1", "Available"),
                unit("U2", "Available"),
                unit("U3", "Out of Service")));
        store = new DispatchStateStoreImpl(apiClient);
        store.refresh();
        refreshes = new RefreshCoordinator(store);
        service = new AssignmentServiceImpl(apiClient, store, refreshes, 5_000);
    }

    @AfterEach
    void tearDown() {
        refreshes.stop();
    }

    @Test
    void unknownCallIsRejectedWithoutRequest() throws Exception {
        DispatchException e = catchThrowableOfType(
                () -> service.assign("C404", "U1", AssignmentSource.DRAG_AND_DROP), DispatchException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION);
        verify(apiClient, never()).assignUnit(anyString(), anyString());
    }

    @Test
    void unknownUnitIsRejectedWithoutRequest() throws Exception {
        DispatchException e = catchThrowableOfType(
                () -> service.assign("C1", "U404", AssignmentSource.MANUAL_SELECTION), DispatchException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION);
        verify(apiClient, never()).assignUnit(anyString(), anyString());
    }

    @Test
    void unitsThatCannotTakeACallAreRejected() throws Exception {
        assertThat(catchThrowableOfType(() -> service.assign("C1", "U2", AssignmentSource.DRAG_AND_DROP),
                DispatchException.class).getMessage()).contains("not available");
        assertThat(catchThrowableOfType(() -> service.assign("C1", "U3", AssignmentSource.DRAG_AND_DROP),
                DispatchException.class).getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(catchThrowableOfType(() -> service.assign(null, "U1", AssignmentSource.DRAG_AND_DROP),
                DispatchException.class).getKind()).isEqualTo(ErrorKind.VALIDATION);

        verify(apiClient, never()).assignUnit(anyString(), anyString());
    }

    @Test
    void successfulAssignmentRefreshesWithoutLocalChange() throws Exception {
        AtomicBoolean assigningDuringRequest = new AtomicBoolean();
        doAnswer(invocation -> {
            assigningDuringRequest.set(service.isAssigning("C1"));
            return null;
        }).when(apiClient).assignUnit("C1", "U1");
        when(apiClient.fetchCalls()).thenReturn(Collections.singletonList(call("C1", CallStatus.ENROUTE, "U1")));

        service.assign("C1", "U1", AssignmentSource.DRAG_AND_DROP);

        assertThat(assigningDuringRequest.get()).isTrue();
        assertThat(service.isAssigning("C1")).isFalse();
        assertThat(store.findCall("C1").get().getStatus()).isEqualTo(CallStatus.ENROUTE);
        assertThat(store.findCall("C1").get().getAssignedUnitIds()).containsExactly("U1");
        verify(apiClient, times(2)).fetchCalls();
    }

    @Test
    void queuedAssignmentIsReportedAndStillRefreshes() throws Exception {
        doThrow(DispatchException.queued("queued for replay", "m-1", null)).when(apiClient).assignUnit("C1", "U1");

        DispatchException e = catchThrowableOfType(
                () -> service.assign("C1", "U1", AssignmentSource.MANUAL_SELECTION), DispatchException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(e.getQueuedEntryId()).isEqualTo("m-1");
        assertThat(store.findCall("C1").get().getStatus()).isEqualTo(CallStatus.DISPATCHED);
        verify(apiClient, times(2)).fetchCalls();
    }

    @Test
    void serverRejectionIsNotQueued() throws Exception {
        doThrow(DispatchException.fromStatus(409, "unit busy")).when(apiClient).assignUnit("C1", "U1");

        DispatchException e = catchThrowableOfType(
                () -> service.assign("C1", "U1", AssignmentSource.DRAG_AND_DROP), DispatchException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(e.isQueued()).isFalse();
        assertThat(service.isAssigning("C1")).isFalse();
    }
}
