package com.sporehub.backend.auth.security;

import com.sporehub.backend.admission.AdmissionService;
import com.sporehub.backend.admission.ClientKeyResolver;
import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;
import com.sporehub.backend.common.web.ApiException;
import com.sporehub.backend.common.web.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Runs the {@link AccessGuard} in front of every protected route and admission alone in front of public ones.
 * On success the {@link Identity} is stored on the request and in the security context;
 * on failure the envelope is written here and the chain stops.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGuardFilter extends OncePerRequestFilter {

    public static final String IDENTITY_ATTR = "identity";

    private final AccessGuard guard;
    private final AdmissionService admission;
    private final ClientKeyResolver clientKeys;
    private final RouteAccessPolicy routes;
    private final ErrorResponseWriter errors;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // CORS preflight never carries credentials
        if (HttpMethod.OPTIONS.matches(request.getMethod())) return true;
        return routes.isOpen(pathOf(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String path = pathOf(req);
        String clientKey = clientKeys.resolve(req);

        Identity identity;
        try {
            if (!routes.isProtected(path)) {
                admission.checkOrThrow(clientKey);
                chain.doFilter(req, res);
                return;
            }
            Set<Role> roles = routes.requiredRoles(req.getMethod(), path);
            identity = guard.authorize(clientKey, req.getHeader(HttpHeaders.AUTHORIZATION), roles);
        } catch (ApiException e) {
            log.info("access denied kind={} method={} path={} client={}", e.kind(), req.getMethod(), path, clientKey);
            errors.write(res, e);
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                identity,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + identity.role().name()))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        req.setAttribute(IDENTITY_ATTR, identity);

        chain.doFilter(req, res);
    }

    private static String pathOf(HttpServletRequest req) {
        String uri = req.getRequestURI();
        String ctx = req.getContextPath();
        return (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) ? uri.substring(ctx.length()) : uri;
    }
}
