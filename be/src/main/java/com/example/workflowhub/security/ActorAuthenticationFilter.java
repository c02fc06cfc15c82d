package com.example.workflowhub.security;

import com.example.workflowhub.api.ErrorResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.databind.json.JsonMapper;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Resolves the acting identity of {@code /api/v1/**} requests from {@code Authorization: Bearer <token>} and
 * exposes it as the {@value #ACTOR_ATTRIBUTE} request attribute. The health endpoint is open.
 * Identities claimed in request bodies are never used.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ActorAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACTOR_ATTRIBUTE = "hub.actor";

    private static final String API_PREFIX = "/api/v1/";
    private static final String HEALTH_PATH = "/api/v1/health";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ActorDirectory actorDirectory;
    private final JsonMapper jsonMapper;

    public ActorAuthenticationFilter(ActorDirectory actorDirectory, JsonMapper jsonMapper) {
        this.actorDirectory = actorDirectory;
        this.jsonMapper = jsonMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PREFIX) || path.equals(HEALTH_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<Actor> actor = actorDirectory.authenticate(bearerToken(request));
        if (actor.isEmpty()) {
            log.debug("Authentication rejected method={} path={}", request.getMethod(), request.getRequestURI());
            writeUnauthorized(response);
            return;
        }
        request.setAttribute(ACTOR_ATTRIBUTE, actor.get());
        filterChain.doFilter(request, response);
    }

    private static String bearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(jsonMapper.writeValueAsString(
                new ErrorResponse("Unauthenticated", "Missing or unknown bearer token")));
        response.getWriter().flush();
    }
}
