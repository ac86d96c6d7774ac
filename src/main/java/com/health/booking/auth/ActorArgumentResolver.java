package com.health.booking.auth;

import org.apache.commons.lang3.StringUtils;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;

public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentActor.class)
                && Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) throws Exception {
        String role = webRequest.getHeader(ROLE_HEADER);
        if (StringUtils.isBlank(role)) {
            throw new MissingRequestHeaderException(ROLE_HEADER, parameter);
        }
        Actor.Role parsedRole;
        try {
            parsedRole = Actor.Role.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ServletRequestBindingException("Unknown role: " + role, e);
        }
        String id = webRequest.getHeader(USER_ID_HEADER);
        if (StringUtils.isBlank(id)) {
            if (parsedRole == Actor.Role.SYSTEM) {
                return Actor.system();
            }
            throw new MissingRequestHeaderException(USER_ID_HEADER, parameter);
        }
        try {
            return new Actor(Long.valueOf(id.trim()), parsedRole);
        } catch (NumberFormatException e) {
            throw new ServletRequestBindingException("Invalid " + USER_ID_HEADER + ": " + id, e);
        }
    }
}
