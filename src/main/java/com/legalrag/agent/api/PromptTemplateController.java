package com.legalrag.agent.api;

import com.legalrag.agent.prompt.PromptTemplates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.TreeMap;

/**
 * GET /api/v1/rag/templates         all prompt templates by name
 * PUT /api/v1/rag/templates/{name}  replace one template, body {"content": "..."}
 *
 * Runtime overrides are in-memory only and reset on restart.
 */
@RestController
@RequestMapping("/api/v1/rag/templates")
@RequiredArgsConstructor
@Slf4j
public class PromptTemplateController {

    private final PromptTemplates promptTemplates;

    @GetMapping
    public ResponseEntity<Map<String, String>> getTemplates() {
        return ResponseEntity.ok(new TreeMap<>(promptTemplates.getAllTemplates()));
    }

    @PutMapping("/{name}")
    public ResponseEntity<Map<String, String>> updateTemplate(@PathVariable String name,
                                                              @RequestBody Map<String, String> body) {
        promptTemplates.updateTemplate(name, body.get("content"));
        log.info("Prompt template [{}] updated at runtime", name);
        return ResponseEntity.ok(Map.of("name", name, "status", "updated"));
    }
}
