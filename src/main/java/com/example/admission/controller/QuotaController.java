package com.example.admission.controller;

import com.example.admission.model.EnvironmentQuotaStatus;
import com.example.admission.model.QuotaStatusReport;
import com.example.admission.quota.QuotaManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator view of the shared daily quota; mirrors the {@code quota} CLI commands.
 */
@RestController
@RequestMapping("/api/quota")
public class QuotaController {

    private final QuotaManager quotaManager;

    public QuotaController(QuotaManager quotaManager) {
        this.quotaManager = quotaManager;
    }

    @GetMapping("/status")
    public ResponseEntity<?> status(@RequestParam(required = false) String environment) {
        if (environment != null) {
            EnvironmentQuotaStatus status = quotaManager.getUsageStatus(environment);
            return ResponseEntity.ok(status);
        }
        QuotaStatusReport report = quotaManager.getStatusReport();
        return ResponseEntity.ok(report);
    }

    @PostMapping("/allocate")
    public ResponseEntity<EnvironmentQuotaStatus> allocate(@RequestParam String environment, @RequestParam long amount) {
        return ResponseEntity.ok(quotaManager.allocate(environment, amount));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestParam(required = false) String environment) {
        quotaManager.reset(environment);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "reset");
        body.put("provider", quotaManager.getProvider());
        body.put("day", quotaManager.today().toString());
        body.put("environment", environment == null ? "all" : environment);
        return ResponseEntity.ok(body);
    }
}
