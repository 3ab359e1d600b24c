package com.phillippitts.screentranslate.presentation.controller;

import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import com.phillippitts.screentranslate.service.translation.EngineType;
import com.phillippitts.screentranslate.service.translation.ProviderRegistry;
import com.phillippitts.screentranslate.service.translation.TranslationProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists translation engines and runs connection checks.
 */
@RestController
@RequestMapping("/api/engines")
class EngineController {

    private final ProviderRegistry registry;
    private final TranslationOrchestrator orchestrator;

    EngineController(ProviderRegistry registry, TranslationOrchestrator orchestrator) {
        this.registry = registry;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    ResponseEntity<List<Map<String, Object>>> engines() {
        List<EngineType> registered = registry.registeredEngines();
        List<EngineType> available = registry.availableEngines();
        List<Map<String, Object>> body = new ArrayList<>();
        for (EngineType type : EngineType.values()) {
            Map<String, Object> engine = new LinkedHashMap<>();
            engine.put("id", type.id());
            engine.put("name", type.displayName());
            engine.put("requiresApiKey", type.requiresApiKey());
            engine.put("configured", registry.isEngineConfigured(type));
            engine.put("registered", registered.contains(type));
            engine.put("available", available.contains(type));
            body.add(engine);
        }
        for (String id : registry.compatibleProviderIds()) {
            registry.compatibleProvider(id).ifPresent(p -> {
                Map<String, Object> engine = new LinkedHashMap<>();
                engine.put("id", p.id());
                engine.put("name", p.name());
                engine.put("registered", true);
                engine.put("available", p.isAvailable());
                body.add(engine);
            });
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Translates a short sentinel through the engine. Creates the provider if needed.
     */
    @PostMapping("/{id}/check")
    ResponseEntity<Map<String, Object>> check(@PathVariable("id") String id) {
        TranslationProvider provider = orchestrator.resolve(id);
        boolean ok = provider.checkConnection();
        return ResponseEntity.ok(Map.of("id", provider.id(), "connected", ok));
    }
}
