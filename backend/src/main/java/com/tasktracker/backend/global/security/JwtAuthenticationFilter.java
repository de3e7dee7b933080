package com.tasktracker.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.tasktracker.backend.global.error.ProblemResponseWriter;
import com.tasktracker.backend.modules.auth.application.AuthService;
import com.tasktracker.backend.modules.auth.application.exception.AuthenticationFailedException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-request gate. A presented access token must pass {@link AuthService#requireAuth};
 * otherwise the request ends here with a 401 before any handler runs. Requests
 * without a token continue unauthenticated and are stopped by the security rules.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private static final List<String> PUBLIC_PATHS = List.of("/auth/login", "/auth/refresh", "/auth/logout");
    private static final List<String> PUBLIC_PREFIXES = List.of("/actuator/health", "/v3/api-docs", "/swagger-ui");

    private final AuthService authService;
    private final BearerTokenResolver tokenResolver;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            AuthService authService,
            BearerTokenResolver tokenResolver,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.authService = authService;
        this.tokenResolver = tokenResolver;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        Optional<String> token = tokenResolver.resolveAccessToken(request);
        if (token.isPresent()) {
            try {
                JwtAuthenticationPrincipal principal = authService.requireAuth(token.get());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, USER_AUTHORITIES);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthenticationFailedException ex) {
                SecurityContextHolder.clearContext();
                problemResponseWriter.write(request, response, ex);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return PUBLIC_PATHS.contains(path) || PUBLIC_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
