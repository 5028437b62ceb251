package com.invdash.controller;

import com.invdash.api.ProvidersResponse;
import com.invdash.api.RefreshRequest;
import com.invdash.model.JobStatus;
import com.invdash.model.SnapshotPayload;
import com.invdash.refresh.InventoryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1/inventory")
public class InventoryController {

    private static final Logger log = LoggerFactory.getLogger(InventoryController.class);

    private final InventoryService inventoryService;

    public InventoryController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    /**
     * List the providers that have a collector.
     *
     * GET /v1/inventory/providers
     */
    @GetMapping("/providers")
    public ResponseEntity<ProvidersResponse> providers() {
        return ResponseEntity.ok(new ProvidersResponse(new ArrayList<>(inventoryService.providers())));
    }

    /**
     * Read a scope's snapshot, refreshing it first when it is not fresh.
     *
     * GET /v1/inventory/{provider}/snapshot?scope=vms&amp;hosts=h1,h2&amp;level=summary&amp;force=false
     *
     * @param provider provider id
     * @param scope scope name, {@code vms} or {@code hosts}
     * @param hosts target hosts, comma separated
     * @param level detail level, defaults to {@code summary}
     * @param force refresh even when the cached snapshot is fresh
     * @return snapshot payload
     */
    @GetMapping("/{provider}/snapshot")
    public ResponseEntity<SnapshotPayload> snapshot(
            @PathVariable("provider") String provider,
            @RequestParam("scope") String scope,
            @RequestParam("hosts") List<String> hosts,
            @RequestParam(value = "level", required = false) String level,
            @RequestParam(value = "force", defaultValue = "false") boolean force
    ) {
        log.info("Snapshot requested: provider={}, scope={}, hosts={}, force={}, trace_id={}",
                provider, scope, hosts, force, MDC.get("trace_id"));
        return ResponseEntity.ok(inventoryService.getOrRefresh(provider, scope, hosts, level, force));
    }

    /**
     * Start a background refresh.
     *
     * POST /v1/inventory/{provider}/refresh
     *
     * @return 202 with the job to poll, or 204 when the cached snapshot is still fresh
     */
    @PostMapping("/{provider}/refresh")
    public ResponseEntity<JobStatus> refresh(
            @PathVariable("provider") String provider,
            @Valid @RequestBody RefreshRequest request
    ) {
        Optional<JobStatus> job = inventoryService.triggerRefresh(
                provider, request.getScope(), request.getHosts(), request.getLevel(), request.isForce());
        if (job.isEmpty()) {
            log.info("Refresh skipped, snapshot fresh: provider={}, scope={}, trace_id={}",
                    provider, request.getScope(), MDC.get("trace_id"));
            return ResponseEntity.noContent().build();
        }
        log.info("Refresh accepted: provider={}, job_id={}, trace_id={}", provider, job.get().getJobId(), MDC.get("trace_id"));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job.get());
    }

    /**
     * Poll a refresh job.
     *
     * GET /v1/inventory/{provider}/jobs/{job_id}
     */
    @GetMapping("/{provider}/jobs/{job_id}")
    public ResponseEntity<JobStatus> job(
            @PathVariable("provider") String provider,
            @PathVariable("job_id") String jobId
    ) {
        return ResponseEntity.ok(inventoryService.getJobStatus(provider, jobId));
    }
}
