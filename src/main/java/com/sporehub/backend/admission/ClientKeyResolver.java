package com.sporehub.backend.admission;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the client identifier used for admission counting.
 */
@Component
@RequiredArgsConstructor
public class ClientKeyResolver {

    private final AdmissionProperties props;

    public String resolve(HttpServletRequest request) {
        if (props.isTrustForwardedHeaders()) {
            String xff = request.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isEmpty()) return first;
            }
            String real = request.getHeader("X-Real-IP");
            if (real != null && !real.isBlank()) return real.trim();
        }
        return request.getRemoteAddr();
    }
}
