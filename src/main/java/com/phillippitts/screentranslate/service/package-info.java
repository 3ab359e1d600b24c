/**
 * Service layer of the screen translation pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.vision} - text extraction through vision-capable model endpoints</li>
 *   <li>{@code service.translation} - translation providers and the provider registry</li>
 *   <li>{@code service.orchestration} - translation fallback and the capture-to-overlay flow</li>
 *   <li>{@code service.rendering} - bilingual overlay rendering</li>
 *   <li>{@code service.credentials} - API key lookup</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions) and use constructor injection.
 */
package com.phillippitts.screentranslate.service;
