package com.phillippitts.screentranslate.presentation.controller;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import com.phillippitts.screentranslate.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain text translation ({@code POST /api/translate}), e.g. for a text selection. Without an
 * {@code engine}, the text-selection scene's configured engines are used.
 */
@RestController
class TranslateController {

    private static final Logger LOG = LogManager.getLogger(TranslateController.class);

    private final TranslationOrchestrator orchestrator;
    private final TranslationProperties properties;

    TranslateController(TranslationOrchestrator orchestrator, TranslationProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/api/translate")
    ResponseEntity<TranslationResult> translate(@Valid @RequestBody TranslateRequest request) {
        String engine = isBlank(request.engine()) ? null : request.engine();
        String target = isBlank(request.target()) ? properties.getTargetLanguage() : request.target();
        String source = isBlank(request.source()) ? properties.sourceLanguageOrNull() : request.source();
        LOG.debug("Translate request: engine={}, target={}, text={}", engine == null ? "configured" : engine, target,
                LogSanitizer.preview(request.text(), 40));
        return ResponseEntity.ok(orchestrator.translateText(request.text(), target, engine, source));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    record TranslateRequest(
            @NotBlank(message = "text must not be blank")
            @Size(max = 10_000, message = "text must be at most 10000 characters")
            String text,
            String target,
            String source,
            String engine
    ) {}
}
