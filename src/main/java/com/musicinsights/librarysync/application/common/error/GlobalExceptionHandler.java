package com.musicinsights.librarysync.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.r2dbc.BadSqlGrammarException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

/**
 * 전역 예외 처리기.
 *
 * <p>애플리케이션 전반의 예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * {@link ConflictException}을 409 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 409 ErrorResponse
     */
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(
                        409,
                        "Conflict",
                        e.getMessage(),
                        path,
                        e.code()
                ));
    }

    /**
     * {@link NotFoundException}을 404 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 404 ErrorResponse
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(
                        404,
                        "Not Found",
                        e.getMessage(),
                        path,
                        e.code()
                ));
    }

    /**
     * DB 접근/SQL 오류를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(DB_ERROR)
     */
    @ExceptionHandler({DataAccessException.class, BadSqlGrammarException.class})
    public ResponseEntity<ErrorResponse> handleDb(Exception e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        500,
                        "Internal Server Error",
                        "Database error",
                        path,
                        "DB_ERROR"
                ));
    }

    /**
     * 프레임워크가 상태 코드를 정한 예외(잘못된 파라미터 타입 등)는 그 상태 그대로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return ErrorResponse
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String error = status != null ? status.getReasonPhrase() : "Error";
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(
                        e.getStatusCode().value(),
                        error,
                        e.getReason() != null ? e.getReason() : error,
                        path,
                        "REQUEST_ERROR"
                ));
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(INTERNAL_ERROR)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        500,
                        "Internal Server Error",
                        "Unexpected error",
                        path,
                        "INTERNAL_ERROR"
                ));
    }

    /**
     * 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();

        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", msg, path, "VALIDATION_ERROR"));
    }

    /**
     * 컨트롤러 메서드 파라미터 검증(HandlerMethodValidation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();

        String msg = e.getAllErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage() == null ? "Validation failed" : err.getDefaultMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", msg, path, "VALIDATION_ERROR"));
    }
}
