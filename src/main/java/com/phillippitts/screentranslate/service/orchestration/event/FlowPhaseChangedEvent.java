package com.phillippitts.screentranslate.service.orchestration.event;

import com.phillippitts.screentranslate.domain.FlowPhase;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted after the current flow moves to a new phase. Presentation code observes these to
 * drive progress indicators.
 *
 * @param flowId flow that changed phase
 * @param phase the new phase
 * @param at when the transition happened
 */
public record FlowPhaseChangedEvent(UUID flowId, FlowPhase phase, Instant at) {
    public FlowPhaseChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public double progress() {
        return phase.progress();
    }
}
