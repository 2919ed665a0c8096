package com.bikerly.security;

import com.bikerly.shared.dto.UserPublic;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Interceptor that resolves the bearer token on protected routes and applies {@link RequireRole}.
 * The resolved identity is exposed to handlers as the {@link #CURRENT_USER_ATTRIBUTE} request attribute.
 * Failures propagate as ApiException and are rendered by the global exception handler.
 */
@Component
public class BearerAuthInterceptor implements HandlerInterceptor {

    public static final String CURRENT_USER_ATTRIBUTE = "bikerly.currentUser";

    private final AuthGate authGate;

    public BearerAuthInterceptor(AuthGate authGate) {
        this.authGate = authGate;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerMethod handlerMethod = (HandlerMethod) handler;

        UserPublic currentUser = authGate.authenticateBearer(request.getHeader(HttpHeaders.AUTHORIZATION));

        RequireRole requireRole = handlerMethod.getMethodAnnotation(RequireRole.class);
        if (requireRole == null) {
            requireRole = handlerMethod.getBeanType().getAnnotation(RequireRole.class);
        }
        if (requireRole != null) {
            authGate.authorize(currentUser, requireRole.value());
        }

        request.setAttribute(CURRENT_USER_ATTRIBUTE, currentUser);
        return true;
    }
}
