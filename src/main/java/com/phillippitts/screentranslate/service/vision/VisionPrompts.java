package com.phillippitts.screentranslate.service.vision;

/**
 * Fixed prompts for screen text extraction.
 */
final class VisionPrompts {

    static final String SYSTEM_PROMPT = """
            You are a precise screen text extraction assistant. You read every piece of visible text \
            in a screenshot and report where it is. Respond ONLY with valid JSON, no explanations.""";

    static final String USER_PROMPT = """
            Extract all visible text from this screenshot.

            Return a JSON object of this exact form:
            {"segments":[{"text":"...","bbox":[x1,y1,x2,y2],"confidence":0.95}]}

            Rules:
            - bbox holds the top-left (x1,y1) and bottom-right (x2,y2) corners of the text, \
            normalized to the image size so every value is between 0 and 1
            - one segment per line or logical text block, in reading order
            - keep the original text exactly as shown, do not translate it
            - confidence is between 0 and 1
            - if there is no text, return {"segments":[]}""";

    static final String CONTINUE_PROMPT =
            "Continue exactly where you stopped. Output only the remaining JSON, without repeating anything.";

    private VisionPrompts() {
        // Constants holder - prevent instantiation
    }
}
