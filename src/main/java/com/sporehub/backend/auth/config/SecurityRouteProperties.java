package com.sporehub.backend.auth.config;

import com.sporehub.backend.auth.model.Role;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * app.security.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.security")
public class SecurityRouteProperties {

    /** Ant patterns that require a bearer token. */
    private List<String> protectedPaths = new ArrayList<>(List.of("/api/**"));

    /** Ant patterns skipped by both admission and authentication. */
    private List<String> openPaths = new ArrayList<>(List.of("/health", "/actuator/**", "/error"));

    /** First matching rule wins; a protected path without a rule only needs a valid token. */
    private List<RoleRule> roleRules = new ArrayList<>();

    @Data
    public static class RoleRule {
        private String pattern;
        /** Empty means every HTTP method. */
        private List<String> methods = new ArrayList<>();
        private Set<Role> roles = EnumSet.noneOf(Role.class);
    }
}
