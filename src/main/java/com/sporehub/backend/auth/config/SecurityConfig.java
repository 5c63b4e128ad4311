package com.sporehub.backend.auth.config;

import com.sporehub.backend.auth.security.AccessGuardFilter;
import com.sporehub.backend.common.web.ErrorKind;
import com.sporehub.backend.common.web.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final AccessGuardFilter accessGuardFilter;
    private final SecurityRouteProperties routes;
    private final ErrorResponseWriter errors;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        String[] protectedPaths = routes.getProtectedPaths().toArray(String[]::new);

        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(protectedPaths).authenticated()
                        .anyRequest().permitAll()
                )
                .addFilterBefore(accessGuardFilter, UsernamePasswordAuthenticationFilter.class)
                // the guard filter answers first; these only fire if something slips past it
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) ->
                                errors.write(res, ErrorKind.UNAUTHENTICATED, "Authorization header is required"))
                        .accessDeniedHandler((req, res, e) ->
                                errors.write(res, ErrorKind.FORBIDDEN, "Insufficient permissions for this action"))
                );

        return http.build();
    }

    /** The guard runs inside the security chain only, not a second time as a plain servlet filter. */
    @Bean
    public FilterRegistrationBean<AccessGuardFilter> accessGuardFilterRegistration(AccessGuardFilter filter) {
        FilterRegistrationBean<AccessGuardFilter> reg = new FilterRegistrationBean<>(filter);
        reg.setEnabled(false);
        return reg;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource(
            @Value("${app.cors.allowed-origin-patterns:*}") List<String> allowedOriginPatterns
    ) {
        CorsConfiguration cfg = new CorsConfiguration();
        cfg.setAllowedOriginPatterns(allowedOriginPatterns);
        cfg.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("Content-Type", "Authorization", "X-Requested-With", "Accept", "Origin", "X-Request-Id"));
        cfg.setExposedHeaders(List.of("Content-Length", "Content-Range", "X-Request-Id", "Retry-After"));
        cfg.setAllowCredentials(true);
        cfg.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
