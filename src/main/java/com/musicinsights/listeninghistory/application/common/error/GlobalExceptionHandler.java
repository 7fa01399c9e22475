package com.musicinsights.listeninghistory.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.r2dbc.BadSqlGrammarException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * 전역 예외 처리기.
 *
 * <p>요청 단계에서 발생한 예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.
 * 백그라운드 job에서 발생한 예외는 이곳을 거치지 않고 job 상태의 error 필드로만 노출된다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * {@link BadRequestException}을 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e, ServerWebExchange ex) {
        return badRequest(e.getMessage(), ex, e.code());
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
                .body(ErrorResponse.of(404, "Not Found", e.getMessage(), path, e.code()));
    }

    /**
     * 업로드 본문이 허용 크기를 넘은 경우 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(FILE_TOO_LARGE)
     */
    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(DataBufferLimitException e, ServerWebExchange ex) {
        return badRequest("File too large", ex, "FILE_TOO_LARGE");
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
        log.error("Database error on {}", ex.getRequest().getPath().value(), e);
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Database error", path, "DB_ERROR"));
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
        log.error("Unexpected error on {}", ex.getRequest().getPath().value(), e);
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Unexpected error", path, "INTERNAL_ERROR"));
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
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 컨트롤러 내장 메서드 검증 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String msg = e.getAllErrors().stream()
                .findFirst()
                .map(err -> String.valueOf(err.getDefaultMessage()))
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 바인딩/파라미터 검증(WebExchangeBind) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");

        return badRequest(msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 필수 헤더/파라미터/파트 누락 등 입력 오류를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(INVALID_INPUT)
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e, ServerWebExchange ex) {
        return badRequest(e.getReason() == null ? "Invalid input" : e.getReason(), ex, "INVALID_INPUT");
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, ServerWebExchange ex, String code) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", message, path, code));
    }
}
