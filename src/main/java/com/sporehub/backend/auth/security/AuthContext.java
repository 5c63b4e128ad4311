package com.sporehub.backend.auth.security;

import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * Read-only access to the caller identity attached by {@link AccessGuardFilter}.
 * Every accessor throws {@link MissingIdentityException} when there is none.
 */
@Component
public class AuthContext {

    public Identity requireIdentity() {
        return currentIdentity().orElseThrow(() -> new MissingIdentityException("identity"));
    }

    public String requireSubjectId() {
        return currentIdentity().map(Identity::subjectId)
                .orElseThrow(() -> new MissingIdentityException("subject id"));
    }

    public String requireEmail() {
        return currentIdentity().map(Identity::email)
                .orElseThrow(() -> new MissingIdentityException("email"));
    }

    public Role requireRole() {
        return currentIdentity().map(Identity::role)
                .orElseThrow(() -> new MissingIdentityException("role"));
    }

    public Optional<Identity> currentIdentity() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof Identity id) {
            return Optional.of(id);
        }

        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();
            if (req.getAttribute(AccessGuardFilter.IDENTITY_ATTR) instanceof Identity id) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
