package com.autonomous.gateway.controller;

import com.autonomous.gateway.service.ModelGatewayService;
import com.autonomous.gateway.service.SpendingScope;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/gateway")
public class GatewayController {

    @Autowired
    private ModelGatewayService gateway;

    @PostMapping("/invoke")
    public ResponseEntity<?> invoke(@RequestParam Map<String, String> params) {
        String endpoint = requireParam(params, "endpoint");
        String prompt = params.getOrDefault("prompt", "");
        Double budget = params.containsKey("budget") ? Double.valueOf(params.get("budget")) : null;
        Duration timeout = params.containsKey("timeout_ms") ? Duration.ofMillis(Long.parseLong(params.get("timeout_ms"))) : null;
        Integer maxAttempts = params.containsKey("max_attempts") ? Integer.valueOf(params.get("max_attempts")) : null;

        try (SpendingScope scope = gateway.openScope(budget)) {
            String text = gateway.invoke(endpoint, prompt, timeout, maxAttempts, scope);
            return ResponseEntity.ok(Map.of(
                "text", text,
                "scope_usage", gateway.currentUsage(scope)
            ));
        }
    }

    @PostMapping("/invoke-boolean")
    public ResponseEntity<?> invokeBoolean(@RequestParam Map<String, String> params) {
        boolean answer = gateway.invokeForBoolean(
            requireParam(params, "endpoint"),
            params.getOrDefault("prompt", ""),
            params.getOrDefault("true_keyword", ModelGatewayService.DEFAULT_TRUE_KEYWORD),
            params.getOrDefault("false_keyword", ModelGatewayService.DEFAULT_FALSE_KEYWORD),
            null,
            null
        );
        return ResponseEntity.ok(Map.of("answer", answer));
    }

    @GetMapping("/budget")
    public ResponseEntity<?> budget() {
        return ResponseEntity.ok(Map.of("text", "Global budget: " + gateway.formatBudgetStatus()));
    }

    @GetMapping("/endpoints/{endpointId}/limiter")
    public ResponseEntity<?> limiter(@PathVariable String endpointId) {
        return ResponseEntity.ok(gateway.limiterSnapshot(endpointId));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    private static String requireParam(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }
}
