package com.zzf.miku.infrastructure;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every review API request for log correlation.
 * <p>
 * {@code traceId} comes from {@code X-Trace-Id} or is generated, and is echoed back. Requests
 * addressed to a single review session also carry {@code reviewSessionId}, taken from the
 * {@code /api/review/sessions/{id}} path, so every engine log line of that request names the session.
 */
@Component
public final class ReviewTraceFilter extends OncePerRequestFilter {
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String TRACE_KEY = "traceId";
    public static final String SESSION_KEY = "reviewSessionId";

    private static final Pattern SESSION_PATH = Pattern.compile("^/api/review/sessions/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.trim().isEmpty()) {
            traceId = "trace-" + UUID.randomUUID();
        }
        MDC.put(TRACE_KEY, traceId);
        response.setHeader(TRACE_HEADER, traceId);

        String sessionId = sessionIdOf(request);
        if (sessionId != null) {
            MDC.put(SESSION_KEY, sessionId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_KEY);
            MDC.remove(SESSION_KEY);
        }
    }

    static String sessionIdOf(HttpServletRequest request) {
        String path = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (path == null) {
            return null;
        }
        if (contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)) {
            path = path.substring(contextPath.length());
        }
        Matcher m = SESSION_PATH.matcher(path);
        return m.find() ? m.group(1) : null;
    }
}
