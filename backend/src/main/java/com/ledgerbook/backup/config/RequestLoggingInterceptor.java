package com.ledgerbook.backup.config;

import com.ledgerbook.backup.controller.BackupController;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs each backup API call with the requesting owner, response status and duration.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final String START_TIME_ATTR = "requestStartTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getAttribute(START_TIME_ATTR) == null) {
            request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
            log.debug("Request: {} {} owner={}", request.getMethod(), request.getRequestURI(), owner(request));
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(START_TIME_ATTR);
        long duration = startTime != null ? System.currentTimeMillis() - startTime : 0;
        int status = response.getStatus();

        if (status >= 500) {
            log.error("Response: {} {} owner={} -> {} ({}ms){}", request.getMethod(), request.getRequestURI(),
                    owner(request), status, duration, ex != null ? " - " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Response: {} {} owner={} -> {} ({}ms)", request.getMethod(), request.getRequestURI(),
                    owner(request), status, duration);
        } else if ("GET".equals(request.getMethod())) {
            log.debug("Response: {} {} owner={} -> {} ({}ms)", request.getMethod(), request.getRequestURI(),
                    owner(request), status, duration);
        } else {
            // Backups and restores are worth seeing at INFO
            log.info("Response: {} {} owner={} -> {} ({}ms)", request.getMethod(), request.getRequestURI(),
                    owner(request), status, duration);
        }
    }

    private String owner(HttpServletRequest request) {
        String owner = request.getHeader(BackupController.OWNER_HEADER);
        return owner != null && !owner.isBlank() ? owner : "-";
    }
}
