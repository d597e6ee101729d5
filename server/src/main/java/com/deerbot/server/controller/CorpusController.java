package com.deerbot.server.controller;

import com.deerbot.server.ai.GenerationResult;
import com.deerbot.server.service.CorpusService;
import com.deerbot.server.service.GenerationRequest;
import com.deerbot.server.service.UnknownCorpusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/corpora")
public class CorpusController {

    private static final Logger logger = LoggerFactory.getLogger(CorpusController.class);
    private final CorpusService corpusService;

    public CorpusController(CorpusService corpusService) {
        this.corpusService = corpusService;
    }

    public static class SourceRequest {
        public String sourceId;
        public String text;
    }

    @GetMapping
    public ResponseEntity<?> languages() {
        return ResponseEntity.ok(corpusService.languages());
    }

    @GetMapping("/{language}")
    public ResponseEntity<?> stats(@PathVariable String language) {
        try {
            return ResponseEntity.ok(corpusService.stats(language));
        } catch (UnknownCorpusException e) {
            return ResponseEntity.status(404).body(e.getMessage());
        }
    }

    @PostMapping("/{language}/sources")
    public ResponseEntity<?> analyze(@PathVariable String language, @RequestBody SourceRequest request) {
        logger.info("Received source '{}' for '{}'", request.sourceId, language);
        try {
            int tokens = corpusService.analyze(language, request.sourceId, request.text);
            return ResponseEntity.ok(Map.of(
                    "language", language,
                    "sourceId", request.sourceId,
                    "tokens", tokens));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/{language}/generate")
    public ResponseEntity<?> generate(@PathVariable String language, @RequestBody GenerationRequest request) {
        logger.info("Received generation request for '{}' with keywords {}", language, request.keywords);
        try {
            GenerationResult result = corpusService.generate(language, request);
            return ResponseEntity.ok(result);
        } catch (UnknownCorpusException e) {
            return ResponseEntity.status(404).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/save")
    public ResponseEntity<?> save() {
        try {
            int saved = corpusService.save();
            return ResponseEntity.ok(Map.of("saved", saved));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(500).body(e.getMessage());
        }
    }
}
