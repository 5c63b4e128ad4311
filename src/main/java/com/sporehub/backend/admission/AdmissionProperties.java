package com.sporehub.backend.admission;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app.admission")
public class AdmissionProperties {

    /** Master switch (local tooling may turn it off). */
    private boolean enabled = true;

    /** Requests admitted per client within one window. */
    private int requestsPerMinute = 60;

    /** Fixed window length. */
    private Duration window = Duration.ofMinutes(1);

    /** Buckets untouched for longer than this are dropped by the sweeper. */
    private Duration idleTtl = Duration.ofMinutes(10);

    /** Use X-Forwarded-For / X-Real-IP as the client key (only behind a trusted proxy). */
    private boolean trustForwardedHeaders = false;
}
