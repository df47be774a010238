package com.streamity.telemetry.ingest;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds the permissive CORS headers to every logger response and answers
 * {@code OPTIONS} pre-flights directly with an empty 200.
 * <p>
 * Setting {@code Access-Control-Allow-Origin} before the dispatcher runs also keeps
 * Spring's own CORS processing from adding it a second time.
 */
@Component
public class LoggerCorsFilter extends OncePerRequestFilter {

    static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (path == null || path.isEmpty()) {
            path = request.getRequestURI();
        }
        return !(LoggerController.PATH.equals(path) || LoggerController.LEGACY_PATH.equals(path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        response.setHeader(ALLOW_ORIGIN, "*");
        response.setHeader(ALLOW_METHODS, "POST");
        response.setHeader(ALLOW_HEADERS, "Content-Type");

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setStatus(HttpServletResponse.SC_OK);
            return;
        }
        chain.doFilter(request, response);
    }
}
