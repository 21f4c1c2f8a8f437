package com.pocketping.app.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.infra.JsonSupport;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON error bodies written by the servlet filters.
 */
final class FilterResponses {

    private static final ObjectMapper MAPPER = JsonSupport.newMapper();

    private FilterResponses() {
    }

    static void writeError(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        MAPPER.writeValue(response.getOutputStream(), Map.of("error", message));
    }
}
