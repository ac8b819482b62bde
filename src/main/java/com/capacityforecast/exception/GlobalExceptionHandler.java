package com.capacityforecast.exception;

import com.capacityforecast.config.RequestIdFilter;
import com.capacityforecast.dto.ApiError;
import com.capacityforecast.model.TransformationRun;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
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

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_ERROR",
                     "One or more fields failed validation", request, fieldErrors, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_ERROR",
                     "One or more parameters failed validation", request, fieldErrors, null);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        String msg = ex instanceof MethodArgumentTypeMismatchException mismatch
            ? String.format("Parameter '%s' should be of type %s", mismatch.getName(),
                            mismatch.getRequiredType() != null ? mismatch.getRequiredType().getSimpleName() : "unknown")
            : "Request body could not be read";
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "BAD_REQUEST", msg, request, null, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "BAD_REQUEST", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(InputException.class)
    public ResponseEntity<ApiError> handleInput(InputException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Input", ex.getErrorCode(),
                     ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(PipelineStageException.class)
    public ResponseEntity<ApiError> handleStage(PipelineStageException ex, HttpServletRequest request) {
        log.warn("Transformation stage rejected | stage={} | reason={}", ex.getStage().name().label(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stage", ex.getStage().name().label());
        details.put("order", ex.getStage().order());
        TransformationRun partial = ex.getPartialRun();
        if (partial != null) {
            details.put("completedStages", partial.getIntermediateResults().size());
            details.put("intermediateResults", partial.getIntermediateResults());
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Transformation Stage Failed", ex.getErrorCode(),
                     ex.getMessage(), request, null, details);
    }

    @ExceptionHandler({RunNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(CapacityPlanningException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getErrorCode(), ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ApiError> handleConfig(ConfigException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Configuration", ex.getErrorCode(),
                     ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(ForecastStoreException.class)
    public ResponseEntity<ApiError> handleStore(ForecastStoreException ex, HttpServletRequest request) {
        log.error("Forecast store failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", ex.getErrorCode(),
                     ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", request, null, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String errorCode, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors, Map<String, Object> details) {

        Object attribute = request.getAttribute(RequestIdFilter.ATTRIBUTE);
        String requestId = attribute != null ? attribute.toString() : request.getHeader(RequestIdFilter.HEADER);

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .details(details)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
