package com.tapas.rollup.api;

import com.tapas.rollup.service.RollupConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Reports misconfigured rollup definitions as 422 so they read as an administrative problem
 * rather than bad input data.
 */
@RestControllerAdvice
public class RollupExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RollupExceptionHandler.class);

    @ExceptionHandler(RollupConfigurationException.class)
    public ProblemDetail handleConfiguration(RollupConfigurationException e) {
        log.warn("Rollup configuration error: {}", e.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        problem.setTitle("Invalid rollup configuration");
        problem.setProperty("error", e.getClass().getSimpleName());
        return problem;
    }
}
