/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.screentranslate.exception.ScreenTranslateException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.screentranslate.exception.TranslationProviderException} - A translation
 *       backend failed; categorised by {@code Kind} (empty input, invalid configuration, connection,
 *       translation, rate limit)</li>
 *   <li>{@link com.phillippitts.screentranslate.exception.AnalysisException} - A vision backend could not
 *       extract text from an image</li>
 *   <li>{@link com.phillippitts.screentranslate.exception.FlowException} - Phase-scoped failure of the
 *       capture-to-overlay flow, the only error type the presentation layer sees from a flow</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP status
 * codes in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.screentranslate.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.screentranslate.exception;
