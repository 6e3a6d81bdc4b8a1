package com.imperium.companion.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求确定 requestId，并把 requestId / userId 放入 MDC 供日志输出。
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(RequestIdSupport.HEADER_REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            requestId = RequestIdSupport.newRequestId();
        }
        request.setAttribute(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        String userId = request.getHeader(RequestIdSupport.HEADER_USER_ID);
        if (userId != null && !userId.isBlank()) {
            MDC.put(RequestIdSupport.MDC_USER_ID, userId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
            MDC.remove(RequestIdSupport.MDC_USER_ID);
        }
    }
}
