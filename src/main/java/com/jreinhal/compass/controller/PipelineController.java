package com.jreinhal.compass.controller;

import com.jreinhal.compass.autonomous.groundtruth.SourceSheet;
import com.jreinhal.compass.pipeline.CacheEntryInfo;
import com.jreinhal.compass.pipeline.GlobalPipelineState;
import com.jreinhal.compass.pipeline.NamespacePipelineState;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.pipeline.SchemaCacheCoordinator;
import com.jreinhal.compass.pipeline.UpdateReason;
import com.jreinhal.compass.schema.DynamicSchema;
import com.jreinhal.compass.service.DocumentIngestionService;
import com.jreinhal.compass.service.DocumentIngestionService.IngestionResult;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Namespace documents, schema cache state and manual refreshes.
 */
@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private final SchemaCacheCoordinator coordinator;
    private final DocumentIngestionService ingestionService;

    public PipelineController(SchemaCacheCoordinator coordinator, DocumentIngestionService ingestionService) {
        this.coordinator = coordinator;
        this.ingestionService = ingestionService;
    }

    public record IngestRequest(String documentId, SourceSheet sheet) {
    }

    @GetMapping("/status")
    public PipelineStatus status(@RequestParam("namespaces") List<String> namespaces) {
        return this.coordinator.checkPipelineStatus(namespaces);
    }

    @GetMapping("/state")
    public GlobalPipelineState globalState() {
        return this.coordinator.getGlobalState();
    }

    @GetMapping("/state/{namespace}")
    public ResponseEntity<NamespacePipelineState> namespaceState(@PathVariable String namespace) {
        return this.coordinator.getState(namespace)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/cache")
    public List<CacheEntryInfo> cacheInfo() {
        return this.coordinator.getCacheInfo();
    }

    @GetMapping("/schemas")
    public List<DynamicSchema> schemas(@RequestParam("namespaces") List<String> namespaces) {
        return this.coordinator.getSchemas(namespaces);
    }

    @PostMapping("/{namespace}/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable String namespace) {
        this.coordinator.requestUpdate(namespace, UpdateReason.MANUAL_REFRESH, null);
        return ResponseEntity.accepted().body(Map.of("namespace", namespace, "reason", UpdateReason.MANUAL_REFRESH));
    }

    @DeleteMapping("/{namespace}/cache")
    public ResponseEntity<Void> invalidate(@PathVariable String namespace) {
        this.coordinator.invalidateCache(namespace);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{namespace}/documents")
    public IngestionResult ingest(@PathVariable String namespace, @RequestBody IngestRequest request) {
        if (request.sheet() == null) {
            throw new IllegalArgumentException("sheet is required");
        }
        return this.ingestionService.ingest(namespace, request.documentId(), request.sheet());
    }

    @DeleteMapping("/{namespace}/documents/{documentId}")
    public IngestionResult deleteDocument(@PathVariable String namespace, @PathVariable String documentId) {
        return this.ingestionService.delete(namespace, documentId);
    }
}
