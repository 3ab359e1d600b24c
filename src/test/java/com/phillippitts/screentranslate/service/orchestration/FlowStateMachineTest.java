package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.domain.FlowError;
import com.phillippitts.screentranslate.domain.FlowPhase;
import com.phillippitts.screentranslate.domain.FlowResult;
import com.phillippitts.screentranslate.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowStateMachineTest {

    private final FlowStateMachine machine = new FlowStateMachine();

    private static FlowResult resultFor(UUID id) {
        BufferedImage image = TestImages.white(4, 4);
        return new FlowResult(id, image, image, List.of(), Duration.ofMillis(5));
    }

    @Test
    void startsIdle() {
        assertThat(machine.phase()).isEqualTo(FlowPhase.IDLE);
        assertThat(machine.flowId()).isEmpty();
        assertThat(machine.result()).isEmpty();
    }

    @Test
    void walksHappyPath() {
        UUID id = UUID.randomUUID();
        machine.begin(id, new CancellationToken());

        assertThat(machine.phase()).isEqualTo(FlowPhase.ANALYZING);
        assertThat(machine.transition(id, FlowPhase.TRANSLATING)).isTrue();
        assertThat(machine.transition(id, FlowPhase.RENDERING)).isTrue();
        assertThat(machine.complete(id, resultFor(id))).isTrue();
        assertThat(machine.phase()).isEqualTo(FlowPhase.COMPLETED);
        assertThat(machine.result()).isPresent();
    }

    @Test
    void beginCancelsRunningFlowAndRejectsItsUpdates() {
        UUID first = UUID.randomUUID();
        CancellationToken firstToken = new CancellationToken();
        machine.begin(first, firstToken);
        machine.transition(first, FlowPhase.TRANSLATING);

        UUID second = UUID.randomUUID();
        assertThat(machine.begin(second, new CancellationToken())).contains(first);

        assertThat(firstToken.isCancelled()).isTrue();
        assertThat(machine.transition(first, FlowPhase.RENDERING)).isFalse();
        assertThat(machine.complete(first, resultFor(first))).isFalse();
        assertThat(machine.fail(first, FlowError.analysisFailure("late"))).isFalse();
        assertThat(machine.phase()).isEqualTo(FlowPhase.ANALYZING);
        assertThat(machine.isCurrent(second)).isTrue();
    }

    @Test
    void beginAfterCompletionReportsNothingSuperseded() {
        UUID first = UUID.randomUUID();
        machine.begin(first, new CancellationToken());
        machine.transition(first, FlowPhase.TRANSLATING);
        machine.transition(first, FlowPhase.RENDERING);
        machine.complete(first, resultFor(first));

        assertThat(machine.begin(UUID.randomUUID(), new CancellationToken())).isEmpty();
        assertThat(machine.result()).isEmpty();
    }

    @Test
    void cancelMovesToCancelledFailureAndBlocksCompletion() {
        UUID id = UUID.randomUUID();
        CancellationToken token = new CancellationToken();
        machine.begin(id, token);
        machine.transition(id, FlowPhase.TRANSLATING);

        assertThat(machine.cancel()).contains(id);

        assertThat(token.isCancelled()).isTrue();
        assertThat(machine.phase().isCancelled()).isTrue();
        assertThat(machine.transition(id, FlowPhase.RENDERING)).isFalse();
        assertThat(machine.complete(id, resultFor(id))).isFalse();
        assertThat(machine.result()).isEmpty();
        assertThat(machine.cancel()).isEmpty();
    }

    @Test
    void failOnlyAppliesWhileProcessing() {
        UUID id = UUID.randomUUID();
        machine.begin(id, new CancellationToken());

        assertThat(machine.fail(id, FlowError.noTextFound())).isTrue();
        assertThat(machine.phase().error().kind()).isEqualTo(FlowError.Kind.NO_TEXT_FOUND);
        assertThat(machine.fail(id, FlowError.analysisFailure("again"))).isFalse();
    }

    @Test
    void resetReturnsToIdleAndCancelsToken() {
        UUID id = UUID.randomUUID();
        CancellationToken token = new CancellationToken();
        machine.begin(id, token);

        machine.reset();

        assertThat(token.isCancelled()).isTrue();
        assertThat(machine.phase()).isEqualTo(FlowPhase.IDLE);
        assertThat(machine.flowId()).isEmpty();
    }

    @Test
    void transitionRejectsNonProcessingPhase() {
        assertThatThrownBy(() -> machine.transition(UUID.randomUUID(), FlowPhase.COMPLETED))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
