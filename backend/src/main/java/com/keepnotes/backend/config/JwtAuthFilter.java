package com.keepnotes.backend.config;

import com.keepnotes.backend.dto.ResolvedIdentity;
import com.keepnotes.backend.service.AuthResult;
import com.keepnotes.backend.service.IdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Installs the {@link ResolvedIdentity} behind an {@code Authorization: Bearer} header as the
 * request principal. A missing or rejected token leaves the request anonymous, and the
 * authorization rules answer 401 for protected routes.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityResolver identityResolver;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.startsWith(BEARER_PREFIX)) {
            String token = auth.substring(BEARER_PREFIX.length()).trim();
            AuthResult<ResolvedIdentity> result = identityResolver.resolve(token);
            if (result.isSuccess()) {
                var authToken = new UsernamePasswordAuthenticationToken(
                        result.getValue(), null, List.of(new SimpleGrantedAuthority("ROLE_USER"))
                );
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } else {
                log.warn("bearer token rejected on {} {}: {}",
                        req.getMethod(), req.getRequestURI(), result.getReason());
            }
        }
        chain.doFilter(req, res);
    }
}
