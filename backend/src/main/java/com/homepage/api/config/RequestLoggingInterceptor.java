package com.homepage.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs method, URI, status and duration of API requests.
 * Backup, restore and delete calls are logged at INFO; reads only at DEBUG.
 */
@Slf4j
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final String START_TIME_ATTR = "requestStartTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.nanoTime());
        log.debug("Request: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startNanos = (Long) request.getAttribute(START_TIME_ATTR);
        long durationMs = startNanos != null ? (System.nanoTime() - startNanos) / 1_000_000 : 0;

        int status = response.getStatus();
        String method = request.getMethod();
        String uri = request.getRequestURI();

        if (status >= 500) {
            log.error("Response: {} {} -> {} ({}ms){}", method, uri, status, durationMs,
                    ex != null ? " - " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Response: {} {} -> {} ({}ms)", method, uri, status, durationMs);
        } else if (isMutating(method)) {
            log.info("Response: {} {} -> {} ({}ms)", method, uri, status, durationMs);
        } else {
            log.debug("Response: {} {} -> {} ({}ms)", method, uri, status, durationMs);
        }
    }

    private boolean isMutating(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "DELETE".equals(method);
    }
}
