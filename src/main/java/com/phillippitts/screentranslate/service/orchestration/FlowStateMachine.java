package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.domain.FlowError;
import com.phillippitts.screentranslate.domain.FlowPhase;
import com.phillippitts.screentranslate.domain.FlowResult;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of the current flow's phase, token and result.
 *
 * <p>Only one flow is current. Starting a flow cancels the token of the previous one, so
 * updates from a superseded flow are rejected: every mutator takes the flow id it acts for and
 * returns {@code false} if that flow is no longer current or has already ended.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE / COMPLETED / FAILED → ANALYZING (via begin)
 * ANALYZING → TRANSLATING → RENDERING (via transition)
 * RENDERING → COMPLETED (via complete)
 * any processing phase → FAILED (via fail or cancel)
 * any → IDLE (via reset)
 * </pre>
 */
public final class FlowStateMachine {

    private final Lock lock = new ReentrantLock();
    private UUID flowId;
    private CancellationToken token;
    private FlowPhase phase = FlowPhase.IDLE;
    private FlowResult result;

    /**
     * Makes {@code newFlowId} current, in {@link FlowPhase#ANALYZING}.
     *
     * @return the id of a flow that was still processing and has now been cancelled, if any
     */
    public Optional<UUID> begin(UUID newFlowId, CancellationToken newToken) {
        Objects.requireNonNull(newFlowId, "flowId cannot be null");
        Objects.requireNonNull(newToken, "token cannot be null");
        lock.lock();
        try {
            UUID superseded = null;
            if (token != null) {
                token.cancel();
            }
            if (phase.isProcessing()) {
                superseded = flowId;
            }
            flowId = newFlowId;
            token = newToken;
            phase = FlowPhase.ANALYZING;
            result = null;
            return Optional.ofNullable(superseded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a processing flow to the next processing phase.
     *
     * @return {@code false} if the flow was superseded, cancelled or has ended
     */
    public boolean transition(UUID expectedFlowId, FlowPhase next) {
        if (!next.isProcessing()) {
            throw new IllegalArgumentException("Not a processing phase: " + next);
        }
        lock.lock();
        try {
            if (!isCurrentAndRunning(expectedFlowId)) {
                return false;
            }
            phase = next;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean complete(UUID expectedFlowId, FlowResult flowResult) {
        Objects.requireNonNull(flowResult, "result cannot be null");
        lock.lock();
        try {
            if (!isCurrentAndRunning(expectedFlowId)) {
                return false;
            }
            phase = FlowPhase.COMPLETED;
            result = flowResult;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails a flow that is still current and processing. A superseded or finished flow is left alone.
     */
    public boolean fail(UUID expectedFlowId, FlowError error) {
        lock.lock();
        try {
            if (expectedFlowId == null || !expectedFlowId.equals(flowId) || !phase.isProcessing()) {
                return false;
            }
            phase = FlowPhase.failed(error);
            result = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the current flow if it is processing.
     *
     * @return the cancelled flow id, or empty if nothing was running
     */
    public Optional<UUID> cancel() {
        lock.lock();
        try {
            if (!phase.isProcessing()) {
                return Optional.empty();
            }
            token.cancel();
            phase = FlowPhase.failed(FlowError.cancelled());
            result = null;
            return Optional.of(flowId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns to {@link FlowPhase#IDLE}, cancelling anything still running.
     */
    public void reset() {
        lock.lock();
        try {
            if (token != null) {
                token.cancel();
            }
            flowId = null;
            token = null;
            phase = FlowPhase.IDLE;
            result = null;
        } finally {
            lock.unlock();
        }
    }

    public FlowPhase phase() {
        lock.lock();
        try {
            return phase;
        } finally {
            lock.unlock();
        }
    }

    public Optional<FlowResult> result() {
        lock.lock();
        try {
            return Optional.ofNullable(result);
        } finally {
            lock.unlock();
        }
    }

    public Optional<UUID> flowId() {
        lock.lock();
        try {
            return Optional.ofNullable(flowId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isCurrent(UUID candidate) {
        lock.lock();
        try {
            return candidate != null && candidate.equals(flowId);
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrentAndRunning(UUID expectedFlowId) {
        return expectedFlowId != null && expectedFlowId.equals(flowId)
                && phase.isProcessing() && !token.isCancelled();
    }
}
