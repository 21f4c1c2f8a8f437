package com.pocketping.app.filter;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Set;

/**
 * Route classes the filters apply to.
 */
final class ApiPaths {

    /** Routes whose traffic originates from a visitor's browser. */
    private static final Set<String> VISITOR_ROUTES = Set.of(
            "/api/events", "/api/sessions", "/api/messages", "/api/custom-events", "/api/disconnect");

    private ApiPaths() {
    }

    static boolean isApi(HttpServletRequest request) {
        String path = path(request);
        return path.equals("/api") || path.startsWith("/api/");
    }

    static boolean isVisitorRoute(HttpServletRequest request) {
        return VISITOR_ROUTES.contains(path(request));
    }

    private static String path(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String context = request.getContextPath();
        if (uri == null) {
            return "";
        }
        if (context != null && !context.isEmpty() && uri.startsWith(context)) {
            uri = uri.substring(context.length());
        }
        return uri.length() > 1 && uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
    }
}
