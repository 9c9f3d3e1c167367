package com.mouse.tracker.manager;

import com.mouse.tracker.enums.WorkerEvent;
import com.mouse.tracker.enums.WorkerStatus;

/**
 * Transition table for worker contexts. Unknown combinations leave the status unchanged;
 * terminal statuses absorb every event.
 */
public final class WorkerStateMachine {

    private WorkerStateMachine() {
    }

    public static WorkerStatus next(WorkerStatus current, WorkerEvent event) {
        if (current == null || current.isTerminal() || event == null) {
            return current;
        }

        switch (event) {
            case TIMEOUT:
                return WorkerStatus.TIMED_OUT;
            case FAILURE:
                return WorkerStatus.ERROR;
            case SANDBOX_REMOVED:
                // whatever was captured so far still counts
                return current == WorkerStatus.TRACKING ? WorkerStatus.COMPLETED : WorkerStatus.ERROR;
            default:
                break;
        }

        switch (current) {
            case LOADING:
                return event == WorkerEvent.LOAD_STARTED ? WorkerStatus.INJECTING
                        : event == WorkerEvent.EXCHANGE_CAPTURED ? WorkerStatus.TRACKING
                        : current;
            case INJECTING:
                return event == WorkerEvent.HOOKS_READY ? WorkerStatus.READY
                        : event == WorkerEvent.EXCHANGE_CAPTURED ? WorkerStatus.TRACKING
                        : current;
            case READY:
                return event == WorkerEvent.EXCHANGE_CAPTURED ? WorkerStatus.TRACKING
                        : event == WorkerEvent.CAPTURE_WINDOW_ELAPSED ? WorkerStatus.COMPLETED
                        : current;
            case TRACKING:
                return event == WorkerEvent.CAPTURE_WINDOW_ELAPSED ? WorkerStatus.COMPLETED : current;
            default:
                return current;
        }
    }
}
