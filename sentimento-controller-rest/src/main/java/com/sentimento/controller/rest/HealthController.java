package com.sentimento.controller.rest;

import com.sentimento.live.model.IsoTimestamps;
import com.sentimento.service.core.hub.ConnectionRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final ConnectionRegistry registry;
    private final Clock clock;

    public HealthController(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", IsoTimestamps.now(clock));
        body.put("clientCount", registry.size());
        return body;
    }
}
