package com.invdash.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request's trace id and, for inventory routes, its provider into the MDC so every log
 * line of a refresh request can be correlated.
 *
 * <p>A caller-supplied {@code X-Request-Id} is reused only when it is a short token; anything else
 * is replaced by a generated id so raw header text never reaches the logs. The id is echoed back
 * on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_PROVIDER = "provider";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");
    private static final Pattern INVENTORY_ROUTE = Pattern.compile("^/v1/inventory/([^/]+)/");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        String provider = providerOf(request.getRequestURI());
        if (provider != null) {
            MDC.put(MDC_PROVIDER, provider);
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_PROVIDER);
        }
    }

    static String resolveTraceId(String header) {
        if (header != null) {
            String trimmed = header.trim();
            if (ACCEPTED_TRACE_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }

    static String providerOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher matcher = INVENTORY_ROUTE.matcher(uri);
        if (!matcher.find()) {
            return null;
        }
        String provider = matcher.group(1).toLowerCase(Locale.ROOT);
        return ACCEPTED_TRACE_ID.matcher(provider).matches() ? provider : null;
    }
}
