package com.commodityforecast.exception;

import com.commodityforecast.config.RequestIdFilter;
import com.commodityforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more fields failed validation", null, null, request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be read", null, null, request, null);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ApiError> handleInvalidInput(
            InvalidInputException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Input", ex, request);
    }

    @ExceptionHandler(NoFeasibleSolutionException.class)
    public ResponseEntity<ApiError> handleInfeasible(
            NoFeasibleSolutionException ex, HttpServletRequest request) {
        log.warn("No feasible plan at stage {}: {}", ex.getStage(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "No Feasible Solution", ex, request);
    }

    @ExceptionHandler(CommodityAnalysisException.class)
    public ResponseEntity<ApiError> handleModelling(
            CommodityAnalysisException ex, HttpServletRequest request) {
        log.warn("Analysis failed at stage {} [{}]: {}", ex.getStage(), ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Analysis Failed", ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", null, null, request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, CommodityAnalysisException ex, HttpServletRequest request) {
        return build(status, error, ex.getErrorCode(), ex.getMessage(), ex.getStage(),
                     ex.getParameters().isEmpty() ? null : ex.getParameters(), request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String errorCode, String message,
            String stage, Map<String, Object> parameters,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .stage(stage)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.requestId(request))
            .timestamp(Instant.now())
            .parameters(parameters)
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
