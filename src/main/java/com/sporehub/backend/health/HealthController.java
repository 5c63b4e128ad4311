package com.sporehub.backend.health;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
public class HealthController {

    public record Health(String status, String service, Instant serverTime) {}

    private final Clock clock;

    @GetMapping("/health")
    public Health health() {
        return new Health("ok", "sporehub-backend", clock.instant());
    }
}
