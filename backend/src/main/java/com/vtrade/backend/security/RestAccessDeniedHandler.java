package com.vtrade.backend.security;

import com.vtrade.backend.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** Authenticated caller without the role a route needs, e.g. a USER token on an admin route. */
@Component
@Slf4j
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Access denied path={} method={} userId={}", request.getRequestURI(), request.getMethod(),
                MDC.get("userId"));
        errorWriter.write(request, response, ErrorCode.FORBIDDEN, "Insufficient role for " + request.getRequestURI());
    }
}
