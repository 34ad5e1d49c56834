package com.atpwatcher.watcher.application.controller;

import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.exceptions.WatchTargetNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WatchTargetNotFoundException.class)
    public ProblemDetail handleWatchNotFound(WatchTargetNotFoundException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Watch Not Found");
        problem.setProperty("code", ErrorCodes.WATCH_NOT_FOUND);
        return problem;
    }

    @ExceptionHandler(InvalidWatchConfigException.class)
    public ProblemDetail handleInvalidConfig(InvalidWatchConfigException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        var errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        return problem;
    }

    @ExceptionHandler(SignalFetchException.class)
    public ProblemDetail handleSignalUnavailable(SignalFetchException ex) {
        log.warn("Signal unavailable: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
        problem.setTitle("Signal Unavailable");
        problem.setProperty("code", ErrorCodes.SIGNAL_UNAVAILABLE);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }
}
