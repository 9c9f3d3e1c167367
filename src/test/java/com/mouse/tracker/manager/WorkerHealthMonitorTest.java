package com.mouse.tracker.manager;

import com.mouse.tracker.enums.WorkerStatus;
import com.mouse.tracker.interfaces.WorkerLauncher;
import com.mouse.tracker.model.WorkerContextView;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerHealthMonitorTest {

    @Mock
    WorkerLauncher launcher;

    @InjectMocks
    WorkerHealthMonitor monitor;

    @Test
    void checkHealth_reportsOnlyStalledContexts() {
        WorkerContextView healthy = view("sbx_a", false);
        WorkerContextView stalled = view("sbx_b", true);
        when(launcher.activeContexts()).thenReturn(List.of(healthy, stalled));

        assertThat(monitor.checkHealth()).containsExactly(stalled);
    }

    @Test
    void scheduledCheck_survivesLauncherFailure() {
        when(launcher.activeContexts()).thenThrow(new IllegalStateException("registry unavailable"));

        assertThatCode(() -> monitor.scheduledCheck()).doesNotThrowAnyException();
    }

    private static WorkerContextView view(String sandboxId, boolean stalled) {
        return WorkerContextView.builder()
                .sandboxId(sandboxId)
                .scheduleId("s1")
                .status(WorkerStatus.TRACKING)
                .stalled(stalled)
                .build();
    }
}
