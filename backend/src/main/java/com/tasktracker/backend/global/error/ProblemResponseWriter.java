package com.tasktracker.backend.global.error;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes problem bodies straight to the servlet response. Used from the security
 * filter chain, where {@code @ControllerAdvice} handlers are not reached.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException problem) throws IOException {
        ProblemResponse body = ProblemResponse.of(
                problem.getHttpStatus(),
                problem.getCode(),
                problem.getDetailMessage(),
                request.getRequestURI()
        );
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
