package com.pocketping.app.filter;

import com.pocketping.gateway.filter.FilterDecision;
import com.pocketping.gateway.filter.IpFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * First filter on {@code /api/*}: rejects clients by address.
 */
@Slf4j
@Component
@Order(1)
public class IpFilterServletFilter extends OncePerRequestFilter {

    private final IpFilter filter;

    public IpFilterServletFilter(IpFilter filter) {
        this.filter = filter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !filter.isEnabled() || !ApiPaths.isApi(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String ip = IpFilter.clientIp(request::getHeader, request.getRemoteAddr());
        FilterDecision decision = filter.check(ip);
        if (!decision.allowed()) {
            if (filter.isLogBlocked()) {
                log.warn("Blocked {} {} from {} ({}{})", request.getMethod(), request.getRequestURI(), ip,
                        decision.reason().wireName(),
                        decision.matchedPattern() != null ? ": " + decision.matchedPattern() : "");
            }
            FilterResponses.writeError(response, filter.getBlockedStatusCode(), filter.getBlockedMessage());
            return;
        }
        chain.doFilter(request, response);
    }
}
