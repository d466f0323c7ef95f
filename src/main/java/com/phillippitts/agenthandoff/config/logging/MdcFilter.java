package com.phillippitts.agenthandoff.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from the X-Request-ID header, or a generated UUID; echoed on the response</li>
 *   <li>method, uri: HTTP method and request URI</li>
 *   <li>contextId: taken from {@code /api/contexts/{contextId}/...} paths</li>
 * </ul>
 *
 * <p>Values are removed when the request completes, also on failure, so pooled servlet threads
 * never carry them into the next request. The orchestrator sets {@code contextId} again on its
 * own threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern CONTEXT_PATH = Pattern.compile("^/api/contexts/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = headerOrGenerate(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Map<String, String> values = new LinkedHashMap<>();
        values.put("requestId", requestId);
        values.put("method", request.getMethod());
        values.put("uri", request.getRequestURI());
        String contextId = contextIdOf(request.getRequestURI());
        if (contextId != null) {
            values.put("contextId", contextId);
        }

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(values)) {
            chain.doFilter(request, response);
        }
    }

    static String contextIdOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = CONTEXT_PATH.matcher(uri);
        return m.find() ? m.group(1) : null;
    }

    private static String headerOrGenerate(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
