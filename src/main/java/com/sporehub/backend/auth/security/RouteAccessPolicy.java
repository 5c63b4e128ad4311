package com.sporehub.backend.auth.security;

import com.sporehub.backend.auth.config.SecurityRouteProperties;
import com.sporehub.backend.auth.model.Role;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides, per request path and method, whether the access guard applies and which roles it requires.
 */
@Component
@RequiredArgsConstructor
public class RouteAccessPolicy {

    private final SecurityRouteProperties props;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public boolean isOpen(String path) {
        return props.getOpenPaths().stream().anyMatch(p -> matcher.match(p, path));
    }

    public boolean isProtected(String path) {
        return props.getProtectedPaths().stream().anyMatch(p -> matcher.match(p, path));
    }

    public Set<Role> requiredRoles(String method, String path) {
        for (SecurityRouteProperties.RoleRule rule : props.getRoleRules()) {
            if (rule.getPattern() == null || !matcher.match(rule.getPattern(), path)) continue;
            boolean methodOk = rule.getMethods() == null || rule.getMethods().isEmpty()
                    || rule.getMethods().stream().anyMatch(m -> m.equalsIgnoreCase(method));
            if (!methodOk) continue;
            return (rule.getRoles() == null || rule.getRoles().isEmpty())
                    ? EnumSet.noneOf(Role.class)
                    : EnumSet.copyOf(rule.getRoles());
        }
        return EnumSet.noneOf(Role.class);
    }
}
