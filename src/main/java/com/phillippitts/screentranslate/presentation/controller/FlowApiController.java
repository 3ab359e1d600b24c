package com.phillippitts.screentranslate.presentation.controller;

import com.phillippitts.screentranslate.config.properties.OverlayProperties;
import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.domain.BilingualSegment;
import com.phillippitts.screentranslate.domain.BoundingBox;
import com.phillippitts.screentranslate.domain.FlowError;
import com.phillippitts.screentranslate.domain.FlowPhase;
import com.phillippitts.screentranslate.domain.FlowResult;
import com.phillippitts.screentranslate.service.orchestration.FlowController;
import com.phillippitts.screentranslate.service.orchestration.FlowRequest;
import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import com.phillippitts.screentranslate.service.rendering.OverlayMode;
import com.phillippitts.screentranslate.service.rendering.OverlayStyle;
import com.phillippitts.screentranslate.util.ImageEncoding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * HTTP surface of the flow controller: upload a captured image, poll progress, fetch the result.
 *
 * <ul>
 *   <li>{@code POST /api/flows} - multipart {@code image}, optional {@code target}, {@code source},
 *       {@code engine}, {@code mode}; replaces any running flow. {@code engine} is a built-in
 *       id or {@code custom:<index>}; unknown ids are rejected before the flow starts. The 202
 *       body carries the id of the flow this request started, with {@code current=false} if a
 *       concurrent request has already replaced it</li>
 *   <li>{@code GET /api/flows/current} - phase, progress and error</li>
 *   <li>{@code GET /api/flows/current/segments} - bilingual segments once completed</li>
 *   <li>{@code GET /api/flows/current/image} - rendered PNG once completed</li>
 *   <li>{@code DELETE /api/flows/current} - cancel</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/flows")
class FlowApiController {

    private static final Logger LOG = LogManager.getLogger(FlowApiController.class);

    private final FlowController flowController;
    private final TranslationOrchestrator orchestrator;
    private final TranslationProperties translationProperties;
    private final OverlayProperties overlayProperties;

    FlowApiController(FlowController flowController, TranslationOrchestrator orchestrator,
                      TranslationProperties translationProperties, OverlayProperties overlayProperties) {
        this.flowController = flowController;
        this.orchestrator = orchestrator;
        this.translationProperties = translationProperties;
        this.overlayProperties = overlayProperties;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> start(@RequestParam("image") MultipartFile image,
                                              @RequestParam(value = "target", required = false) String target,
                                              @RequestParam(value = "source", required = false) String source,
                                              @RequestParam(value = "engine", required = false) String engine,
                                              @RequestParam(value = "mode", required = false) String mode) {
        BufferedImage decoded;
        try {
            decoded = ImageEncoding.decode(image.getBytes());
        } catch (IOException e) {
            throw new IllegalArgumentException("Uploaded file is not a readable image: " + e.getMessage(), e);
        }

        if (!isBlank(engine)) {
            orchestrator.resolve(engine);
        }
        OverlayStyle style = overlayProperties.toStyle();
        if (mode != null && !mode.isBlank()) {
            style = style.withMode(OverlayMode.fromString(mode));
        }
        FlowRequest request = new FlowRequest(decoded,
                isBlank(target) ? translationProperties.getTargetLanguage() : target,
                isBlank(source) ? translationProperties.sourceLanguageOrNull() : source,
                engine,
                style);

        UUID flowId = flowController.start(request);
        LOG.info("Flow {} accepted ({}x{}, engine={})", flowId, decoded.getWidth(), decoded.getHeight(),
                isBlank(engine) ? "configured" : engine);
        Map<String, Object> body = status();
        body.put("flowId", flowId.toString());
        body.put("current", flowController.currentFlowId().filter(flowId::equals).isPresent());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/current")
    ResponseEntity<Map<String, Object>> current() {
        return ResponseEntity.ok(status());
    }

    @GetMapping("/current/segments")
    ResponseEntity<List<Map<String, Object>>> segments() {
        return flowController.currentResult()
                .map(result -> ResponseEntity.ok(result.segments().stream().map(FlowApiController::toJson).toList()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/current/image", produces = MediaType.IMAGE_PNG_VALUE)
    ResponseEntity<byte[]> image() {
        Optional<FlowResult> result = flowController.currentResult();
        return result
                .map(r -> ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(ImageEncoding.toPng(r.renderedImage())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/current")
    ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = flowController.cancel();
        Map<String, Object> body = status();
        body.put("cancelled", cancelled);
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> status() {
        FlowPhase phase = flowController.currentPhase();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("flowId", flowController.currentFlowId().map(UUID::toString).orElse(null));
        body.put("phase", phase.kind().name().toLowerCase(Locale.ROOT));
        body.put("progress", phase.progress());
        FlowError error = phase.error();
        if (error != null && error.isUserVisible()) {
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("kind", error.kind().name());
            err.put("message", error.message());
            err.put("suggestion", error.recoverySuggestion());
            body.put("error", err);
        }
        flowController.currentResult().ifPresent(r -> {
            body.put("segmentCount", r.segments().size());
            body.put("processingMillis", r.processingTime().toMillis());
        });
        return body;
    }

    private static Map<String, Object> toJson(BilingualSegment segment) {
        BoundingBox box = segment.boundingBox();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", segment.id().toString());
        json.put("original", segment.originalText());
        json.put("translated", segment.translatedText());
        json.put("sourceLanguage", segment.sourceLanguage());
        json.put("targetLanguage", segment.targetLanguage());
        json.put("bbox", List.of(box.x1(), box.y1(), box.x2(), box.y2()));
        return json;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
