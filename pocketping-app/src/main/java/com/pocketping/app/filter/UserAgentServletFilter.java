package com.pocketping.app.filter;

import com.pocketping.gateway.filter.FilterDecision;
import com.pocketping.gateway.filter.UserAgentFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Rejects bots on the routes a visitor's traffic reaches.
 */
@Slf4j
@Component
@Order(2)
public class UserAgentServletFilter extends OncePerRequestFilter {

    private final UserAgentFilter filter;

    public UserAgentServletFilter(UserAgentFilter filter) {
        this.filter = filter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !filter.isEnabled() || !ApiPaths.isVisitorRoute(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        FilterDecision decision = filter.check(userAgent);
        if (!decision.allowed()) {
            if (filter.isLogBlocked()) {
                log.warn("Blocked {} {} for User-Agent \"{}\" ({}{})", request.getMethod(), request.getRequestURI(),
                        userAgent, decision.reason().wireName(),
                        decision.matchedPattern() != null ? ": " + decision.matchedPattern() : "");
            }
            FilterResponses.writeError(response, HttpStatus.FORBIDDEN.value(), "Forbidden");
            return;
        }
        chain.doFilter(request, response);
    }
}
