package com.RK8.FieldReport.Exception;

import com.RK8.FieldReport.DTO.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ReportException.class)
    public ResponseEntity<ApiErrorResponse> handleReport(ReportException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Report run failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Report run rejected: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingPart(
            MissingServletRequestPartException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Missing upload: " + ex.getRequestPartName(),
                Map.of("field", ex.getRequestPartName()), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Missing parameter: " + ex.getParameterName(),
                Map.of("field", ex.getParameterName()), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Invalid value for " + ex.getName() + ": " + ex.getValue(),
                Map.of("field", ex.getName()), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleUploadSize(
            MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.INVALID_FILE, "Upload exceeds the configured size limit", null, request);
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiErrorResponse> handleMultipart(MultipartException ex, HttpServletRequest request) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return buildResponse(ErrorCode.INVALID_FILE, ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        // framework request errors (wrong method, media type, ...) keep their 4xx status
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            if (status.is4xxClientError()) {
                log.warn("Request rejected: {}", ex.getMessage());
                return buildResponse(ErrorCode.BAD_REQUEST, status.value(), ex.getMessage(), null, request);
            }
        }
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return buildResponse(errorCode, errorCode.getHttpStatus(), message, details, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(ErrorCode errorCode, int httpStatus, String message,
                                                           Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .status(httpStatus)
                .message(message)
                .details(details != null ? details : Map.of())
                .path(request.getRequestURI())
                .timestamp(Instant.now().toString())
                .build();
        return ResponseEntity.status(httpStatus).body(response);
    }
}
