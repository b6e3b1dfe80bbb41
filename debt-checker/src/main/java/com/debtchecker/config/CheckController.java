package com.debtchecker.config;

import com.debtchecker.service.CheckRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CheckController {

    private final CheckRunService checkRunService;

    /**
     * Start a run over the configured input file in the background.
     *
     * POST /check/trigger
     */
    @PostMapping("/check/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (checkRunService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a check run is already in progress"));
        }
        new Thread(checkRunService::runSafely, "manual-check-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/check/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(checkRunService.status());
    }

    /**
     * Stop dispatching and save progress. A second call, or force=true, abandons
     * in-flight lookups immediately.
     *
     * POST /check/cancel?force=false
     */
    @PostMapping("/check/cancel")
    public ResponseEntity<Map<String, String>> cancel(@RequestParam(defaultValue = "false") boolean force) {
        if (!checkRunService.cancel(force)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "no check run in progress"));
        }
        log.info("Cancel requested via API (force={})", force);
        return ResponseEntity.accepted().body(Map.of("status", force ? "stopping" : "cancelling"));
    }
}
