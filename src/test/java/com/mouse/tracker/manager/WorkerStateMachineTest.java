package com.mouse.tracker.manager;

import com.mouse.tracker.enums.WorkerEvent;
import com.mouse.tracker.enums.WorkerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.mouse.tracker.enums.WorkerEvent.*;
import static com.mouse.tracker.enums.WorkerStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class WorkerStateMachineTest {

    @Test
    @DisplayName("happy path: loading, injecting, ready, tracking, completed")
    void happyPath() {
        WorkerStatus status = LOADING;
        status = WorkerStateMachine.next(status, LOAD_STARTED);
        assertThat(status).isEqualTo(INJECTING);
        status = WorkerStateMachine.next(status, HOOKS_READY);
        assertThat(status).isEqualTo(READY);
        status = WorkerStateMachine.next(status, EXCHANGE_CAPTURED);
        assertThat(status).isEqualTo(TRACKING);
        status = WorkerStateMachine.next(status, CAPTURE_WINDOW_ELAPSED);
        assertThat(status).isEqualTo(COMPLETED);
    }

    @ParameterizedTest
    @EnumSource(value = WorkerStatus.class, names = {"LOADING", "INJECTING", "READY", "TRACKING"})
    void timeoutAlwaysEndsAsTimedOut(WorkerStatus from) {
        assertThat(WorkerStateMachine.next(from, TIMEOUT)).isEqualTo(TIMED_OUT);
    }

    @ParameterizedTest
    @EnumSource(value = WorkerStatus.class, names = {"COMPLETED", "ERROR", "TIMED_OUT"})
    void terminalStatusesAbsorbEveryEvent(WorkerStatus terminal) {
        for (WorkerEvent event : WorkerEvent.values()) {
            assertThat(WorkerStateMachine.next(terminal, event)).isEqualTo(terminal);
        }
    }

    @Test
    void captureWindowDoesNotCompleteContextsThatNeverGotReady() {
        assertThat(WorkerStateMachine.next(LOADING, CAPTURE_WINDOW_ELAPSED)).isEqualTo(LOADING);
        assertThat(WorkerStateMachine.next(INJECTING, CAPTURE_WINDOW_ELAPSED)).isEqualTo(INJECTING);
    }

    @Test
    void captureBeforeHandshakeStillTracks() {
        assertThat(WorkerStateMachine.next(INJECTING, EXCHANGE_CAPTURED)).isEqualTo(TRACKING);
        assertThat(WorkerStateMachine.next(TRACKING, HOOKS_READY)).isEqualTo(TRACKING);
    }

    @Test
    @DisplayName("external removal keeps what a tracking context captured")
    void removal() {
        assertThat(WorkerStateMachine.next(TRACKING, SANDBOX_REMOVED)).isEqualTo(COMPLETED);
        assertThat(WorkerStateMachine.next(READY, SANDBOX_REMOVED)).isEqualTo(ERROR);
        assertThat(WorkerStateMachine.next(LOADING, SANDBOX_REMOVED)).isEqualTo(ERROR);
    }

    @Test
    void failureIsAnError() {
        assertThat(WorkerStateMachine.next(INJECTING, FAILURE)).isEqualTo(ERROR);
    }
}
