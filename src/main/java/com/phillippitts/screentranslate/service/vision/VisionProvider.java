package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.exception.AnalysisException;

/**
 * A vision-capable model endpoint that can read text from an image.
 *
 * <p>Implementations send one image plus the extraction prompts and return the model's raw
 * reply. Parsing is done by {@link VisionResponseParser}.
 */
public interface VisionProvider {

    /**
     * @return provider identifier, also the credential id
     */
    String id();

    /**
     * @return {@code true} if the provider has the credentials it needs
     */
    boolean isConfigured();

    /**
     * @param base64Jpeg JPEG image, base64-encoded
     * @param systemPrompt instructions describing the output format
     * @param userPrompt the extraction request
     * @return raw model reply; continuations of a truncated reply are concatenated
     * @throws AnalysisException on HTTP, authentication or response-format failure
     */
    String extractText(String base64Jpeg, String systemPrompt, String userPrompt);
}
