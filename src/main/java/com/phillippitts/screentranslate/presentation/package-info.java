/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@code FlowController}, {@code TranslationOrchestrator} and {@code ProviderRegistry}; domain
 * exceptions are mapped to HTTP responses by the global exception handler.
 */
package com.phillippitts.screentranslate.presentation;
