package com.recipenest.notification.api.config;

import com.recipenest.notification.api.service.CallerContext;
import com.recipenest.notification.api.service.ForbiddenException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects admin API calls whose caller lacks the {@value CallerContext#ADMIN_SCOPE} scope.
 */
@Component
@Slf4j
public class AdminScopeInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        CallerContext caller = CallerContextArgumentResolver.fromHeaders(
            request.getHeader(CallerContextArgumentResolver.CALLER_ID_HEADER),
            request.getHeader(CallerContextArgumentResolver.CALLER_SCOPES_HEADER));
        if (!caller.isAdmin()) {
            log.warn("Admin API {} {} rejected for caller {}", request.getMethod(), request.getRequestURI(),
                caller.callerId());
            throw new ForbiddenException("Scope " + CallerContext.ADMIN_SCOPE + " required");
        }
        return true;
    }
}
