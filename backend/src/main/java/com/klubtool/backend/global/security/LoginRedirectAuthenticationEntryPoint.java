package com.klubtool.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Anonymous callers of protected pages are redirected to sign in, carrying the requested path as {@code next}.
 */
@Component
public class LoginRedirectAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final String loginUrl;

    public LoginRedirectAuthenticationEntryPoint(@Value("${app.security.login-url:/user/settings/}") String loginUrl) {
        this.loginUrl = loginUrl;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        String requested = request.getRequestURI();
        if (request.getQueryString() != null) {
            requested = requested + "?" + request.getQueryString();
        }
        String location = UriComponentsBuilder.fromUriString(loginUrl)
                .queryParam("next", requested)
                .encode()
                .toUriString();
        response.setStatus(HttpStatus.FOUND.value());
        response.setHeader(HttpHeaders.LOCATION, location);
    }
}
