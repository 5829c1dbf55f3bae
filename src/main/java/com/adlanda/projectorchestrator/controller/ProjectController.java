package com.adlanda.projectorchestrator.controller;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.DiscoveryTimeoutException;
import com.adlanda.projectorchestrator.exception.FileUtilityException;
import com.adlanda.projectorchestrator.exception.InvalidTransitionException;
import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.exception.ProjectMismatchException;
import com.adlanda.projectorchestrator.exception.ProjectNotFoundException;
import com.adlanda.projectorchestrator.exception.ProjectRegistryException;
import com.adlanda.projectorchestrator.model.ActiveProjectSnapshot;
import com.adlanda.projectorchestrator.model.DiscoveryResult;
import com.adlanda.projectorchestrator.model.IngestionSummary;
import com.adlanda.projectorchestrator.model.ProjectRecord;
import com.adlanda.projectorchestrator.model.RegisterProjectRequest;
import com.adlanda.projectorchestrator.model.StatusUpdateRequest;
import com.adlanda.projectorchestrator.model.SwitchResult;
import com.adlanda.projectorchestrator.model.SystemHealth;
import com.adlanda.projectorchestrator.service.FileDiscoveryService;
import com.adlanda.projectorchestrator.service.IngestionService;
import com.adlanda.projectorchestrator.service.ProgressSink;
import com.adlanda.projectorchestrator.service.ProjectRegistryService;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for the project registry and project switching.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectRegistryService registry;
    private final ProjectSwitchService switchService;
    private final FileDiscoveryService discoveryService;
    private final IngestionService ingestionService;
    private final WorkspaceProperties properties;

    public ProjectController(ProjectRegistryService registry,
                             ProjectSwitchService switchService,
                             FileDiscoveryService discoveryService,
                             IngestionService ingestionService,
                             WorkspaceProperties properties) {
        this.registry = registry;
        this.switchService = switchService;
        this.discoveryService = discoveryService;
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    /**
     * POST /api/v1/projects: Register a project.
     */
    @PostMapping
    public ResponseEntity<?> register(@Valid @RequestBody RegisterProjectRequest request) {
        try {
            ProjectRecord project = registry.register(request.name(), request.sourcePath());
            return ResponseEntity.status(HttpStatus.CREATED).body(project);
        } catch (ProjectRegistryException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<List<ProjectRecord>> list() {
        return ResponseEntity.ok(registry.list());
    }

    /**
     * GET /api/v1/projects/current: Active project and the status of each resource manager.
     */
    @GetMapping("/current")
    public ResponseEntity<ActiveProjectSnapshot> current() {
        return ResponseEntity.ok(switchService.activeSnapshot());
    }

    @GetMapping("/health")
    public ResponseEntity<SystemHealth> health() {
        SystemHealth health = switchService.health();
        HttpStatus status = health.status() == SystemHealth.Status.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        Optional<ProjectRecord> project = registry.get(id);
        if (project.isEmpty()) {
            return notFound(id);
        }
        return ResponseEntity.ok(project.get());
    }

    /**
     * PUT /api/v1/projects/{id}/status: Move the training status forward.
     */
    @PutMapping("/{id}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest request) {
        try {
            return ResponseEntity.ok(registry.updateStatus(id, request.status()));
        } catch (ProjectNotFoundException e) {
            return notFound(id);
        } catch (InvalidTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/projects/{id}: Remove a project that is not active.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> remove(@PathVariable String id) {
        try {
            switchService.removeProject(id);
            return ResponseEntity.noContent().build();
        } catch (ProjectNotFoundException e) {
            return notFound(id);
        } catch (ProjectRegistryException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/projects/{id}/switch: Make a project the active one.
     * A degraded switch is still a 200; the body lists the degraded managers.
     */
    @PostMapping("/{id}/switch")
    public ResponseEntity<?> switchProject(@PathVariable String id) {
        if (registry.get(id).isEmpty()) {
            return notFound(id);
        }
        SwitchResult result = switchService.switchProject(id);
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/projects/{id}/files: Run discovery on the project's source tree.
     */
    @GetMapping("/{id}/files")
    public ResponseEntity<?> files(@PathVariable String id,
                                   @RequestParam(required = false) Long timeoutSeconds) {
        Optional<ProjectRecord> project = registry.get(id);
        if (project.isEmpty()) {
            return notFound(id);
        }
        try {
            DiscoveryResult result = discoveryService.scan(
                    Path.of(project.get().sourcePath()), timeout(timeoutSeconds), progressLogger(id));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("projectId", id);
            body.put("root", result.root().toString());
            body.put("totalFiles", result.files().size());
            body.put("sourceFiles", result.sourceFiles().size());
            body.put("filesVisited", result.filesVisited());
            body.put("entriesSkipped", result.entriesSkipped());
            body.put("elapsedMs", result.elapsed().toMillis());
            body.put("files", result.files().stream()
                    .map(f -> {
                        Map<String, Object> file = new LinkedHashMap<>();
                        file.put("path", f.relativePath());
                        file.put("type", f.type());
                        file.put("language", f.language());
                        file.put("size", f.size());
                        return file;
                    })
                    .toList());
            return ResponseEntity.ok(body);
        } catch (DiscoveryTimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(Map.of("error", e.getMessage()));
        } catch (FileUtilityException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/projects/{id}/index: Index the active project's sources into its vector store.
     */
    @PostMapping("/{id}/index")
    public ResponseEntity<?> index(@PathVariable String id,
                                   @RequestParam(required = false) Long timeoutSeconds) {
        try {
            IngestionSummary summary = ingestionService.indexProject(id, timeout(timeoutSeconds), progressLogger(id));
            return ResponseEntity.ok(summary);
        } catch (ProjectNotFoundException e) {
            return notFound(id);
        } catch (NoActiveProjectException | ProjectMismatchException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (DiscoveryTimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(Map.of("error", e.getMessage()));
        } catch (FileUtilityException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private Duration timeout(Long timeoutSeconds) {
        return timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : properties.getDiscovery().getTimeout();
    }

    private static ProgressSink progressLogger(String projectId) {
        return message -> log.debug("[{}] {}", projectId, message);
    }

    private static ResponseEntity<Map<String, String>> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Project not found: " + id));
    }
}
