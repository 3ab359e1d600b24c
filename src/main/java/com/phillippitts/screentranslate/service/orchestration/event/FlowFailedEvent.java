package com.phillippitts.screentranslate.service.orchestration.event;

import com.phillippitts.screentranslate.domain.FlowError;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a flow ends in a user-visible failure. Not published for cancellation.
 *
 * <p>PII note: the error message carries provider diagnostics only, never segment text.
 */
public record FlowFailedEvent(UUID flowId, FlowError error, Instant at) {}
