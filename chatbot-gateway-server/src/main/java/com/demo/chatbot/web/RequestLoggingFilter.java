package com.demo.chatbot.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Locale;

/**
 * Logs each HTTP request with its status and elapsed time, and reports the elapsed seconds in
 * {@code X-Process-Time}.
 */
@Slf4j
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    static final String PROCESS_TIME_HEADER = "X-Process-Time";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.nanoTime();
        log.info("Request: {} {}", request.getMethod(), request.getRequestURI());

        // Body is buffered so the header can still be added after the handler ran
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
        } finally {
            String elapsed = formatSeconds(System.nanoTime() - start);
            wrapper.setHeader(PROCESS_TIME_HEADER, elapsed);
            log.info("Response: {} {} status={} time={}s",
                    request.getMethod(), request.getRequestURI(), wrapper.getStatus(), elapsed);
            wrapper.copyBodyToResponse();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/ws/");
    }

    static String formatSeconds(long elapsedNanos) {
        return String.format(Locale.ROOT, "%.4f", elapsedNanos / 1_000_000_000.0);
    }
}
