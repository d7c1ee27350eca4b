package com.recipenest.notification.api.config;

import com.recipenest.notification.api.service.BadRequestException;
import com.recipenest.notification.api.service.CallerContext;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds a {@link CallerContext} from the gateway headers {@value #CALLER_ID_HEADER} and
 * {@value #CALLER_SCOPES_HEADER} (comma separated).
 */
@Component
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_SCOPES_HEADER = "X-Caller-Scopes";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return fromHeaders(webRequest.getHeader(CALLER_ID_HEADER), webRequest.getHeader(CALLER_SCOPES_HEADER));
    }

    static CallerContext fromHeaders(String callerIdHeader, String scopesHeader) {
        UUID callerId = null;
        if (callerIdHeader != null && !callerIdHeader.isBlank()) {
            try {
                callerId = UUID.fromString(callerIdHeader.trim());
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Invalid " + CALLER_ID_HEADER + " header: " + callerIdHeader);
            }
        }
        return new CallerContext(callerId, parseScopes(scopesHeader));
    }

    static Set<String> parseScopes(String scopesHeader) {
        if (scopesHeader == null || scopesHeader.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(scopesHeader.split(","))
            .map(String::trim)
            .filter(scope -> !scope.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }
}
