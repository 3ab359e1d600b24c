/**
 * Coordination of the translation pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator} -
 *       batch translation with a single fallback attempt and a strict length contract</li>
 *   <li>{@link com.phillippitts.screentranslate.service.orchestration.FlowController} -
 *       analyze, translate and render with cancel-and-replace semantics</li>
 *   <li>{@link com.phillippitts.screentranslate.service.orchestration.FlowStateMachine} -
 *       lock-guarded owner of the current flow's phase and result</li>
 * </ul>
 *
 * <p>Phase changes, failures and fallbacks are published as Spring application events
 * (see the {@code event} sub-package).
 */
package com.phillippitts.screentranslate.service.orchestration;
