package com.openforge.memoria.api;

import com.openforge.memoria.worker.RecoveryCoordinator;
import com.openforge.memoria.worker.RecoveryResult;
import com.openforge.memoria.worker.WorkerLifecycle;
import com.openforge.memoria.worker.WorkerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Operational endpoints for the processing layer.
 *
 *   GET  /api/admin/status   — liveness snapshot
 *   POST /api/admin/restart  — stop then start consumers in this JVM
 *   POST /api/admin/recover  — run a recovery pass now
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final WorkerLifecycle     lifecycle;
    private final RecoveryCoordinator recovery;

    @GetMapping("/status")
    public WorkerStatus status() {
        return lifecycle.status();
    }

    @PostMapping("/restart")
    public WorkerStatus restart() {
        lifecycle.restart();
        return lifecycle.status();
    }

    @PostMapping("/recover")
    public RecoveryResult recover() {
        if (!lifecycle.isRunning()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Worker is not running");
        }
        RecoveryResult result = recovery.runPass();
        log.info("[Admin] Manual recovery pass {}", result);
        return result;
    }
}
