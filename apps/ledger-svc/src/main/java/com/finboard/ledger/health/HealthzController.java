package com.finboard.ledger.health;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for load balancers. Actuator health stays available for deeper checks.
 */
@RestController
public class HealthzController {

    private final Clock clock;

    public HealthzController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "ledger-svc");
        body.put("time", clock.instant().toString());
        return body;
    }
}
