package com.pocketping.app.filter;

import com.pocketping.common.config.BridgeConfig;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer API key on every {@code /api/*} route, the event stream included.
 * Without a configured key the API is open.
 */
@Component
@Order(3)
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    private final BridgeConfig config;

    public ApiKeyAuthFilter(BridgeConfig config) {
        this.config = config;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !config.hasApiKey() || !ApiPaths.isApi(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (!authorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
            FilterResponses.writeError(response, HttpStatus.UNAUTHORIZED.value(), "Unauthorized");
            return;
        }
        chain.doFilter(request, response);
    }

    private boolean authorized(String header) {
        if (header == null) {
            return false;
        }
        byte[] expected = ("Bearer " + config.getApiKey()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, header.getBytes(StandardCharsets.UTF_8));
    }
}
