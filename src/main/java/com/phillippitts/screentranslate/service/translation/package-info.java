/**
 * Translation providers and their registry.
 *
 * <p>Every backend implements {@link com.phillippitts.screentranslate.service.translation.TranslationProvider}.
 * {@link com.phillippitts.screentranslate.service.translation.ProviderRegistry} owns all live
 * instances and is the only place that maps an
 * {@link com.phillippitts.screentranslate.service.translation.EngineType} to a constructor.
 */
package com.phillippitts.screentranslate.service.translation;
