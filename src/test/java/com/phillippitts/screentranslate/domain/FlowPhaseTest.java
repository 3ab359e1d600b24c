package com.phillippitts.screentranslate.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowPhaseTest {

    @Test
    void progressFollowsPhaseOrder() {
        assertThat(FlowPhase.IDLE.progress()).isEqualTo(0.0);
        assertThat(FlowPhase.ANALYZING.progress()).isEqualTo(0.25);
        assertThat(FlowPhase.TRANSLATING.progress()).isEqualTo(0.5);
        assertThat(FlowPhase.RENDERING.progress()).isEqualTo(0.75);
        assertThat(FlowPhase.COMPLETED.progress()).isEqualTo(1.0);
    }

    @Test
    void failedPhaseCarriesError() {
        FlowPhase failed = FlowPhase.failed(FlowError.noTextFound());

        assertThat(failed.isTerminal()).isTrue();
        assertThat(failed.isProcessing()).isFalse();
        assertThat(failed.isCancelled()).isFalse();
        assertThat(failed.error().kind()).isEqualTo(FlowError.Kind.NO_TEXT_FOUND);
    }

    @Test
    void cancellationIsAFailedPhaseThatIsNotUserVisible() {
        FlowPhase cancelled = FlowPhase.failed(FlowError.cancelled());

        assertThat(cancelled.isCancelled()).isTrue();
        assertThat(cancelled.error().isUserVisible()).isFalse();
    }

    @Test
    void errorOnlyAllowedForFailedKind() {
        assertThatThrownBy(() -> new FlowPhase(FlowPhase.Kind.COMPLETED, FlowError.cancelled()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlowPhase(FlowPhase.Kind.FAILED, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void translationFailureUsesDefaultSuggestionWhenNoneGiven() {
        FlowError error = FlowError.translationFailure("boom", null);

        assertThat(error.message()).isEqualTo("Translation failed: boom");
        assertThat(error.recoverySuggestion()).isNotBlank();
    }
}
