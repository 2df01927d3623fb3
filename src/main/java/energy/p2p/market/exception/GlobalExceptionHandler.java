package energy.p2p.market.exception;

import energy.p2p.market.dto.ApiResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({OrderNotFoundException.class, InstallationNotInstalledException.class})
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ValidationException e) {
        log.warn("Reference not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(NotAuthorizedException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotAuthorized(NotAuthorizedException e) {
        log.warn("Caller not authorized: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e);
    }

    /**
     * Invalid input and insufficient payment
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    /**
     * Not matched, already matched, already executed
     */
    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleStateConflict(StateConflictException e) {
        log.warn("Order state conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    /**
     * Transfer failure; the message tells the caller the payment stays in escrow
     */
    @ExceptionHandler(SettlementFailedException.class)
    public ResponseEntity<ApiResponse<Void>> handleSettlementFailed(SettlementFailedException e) {
        log.error("Settlement failed: orderId={}, recipient={}, amount={}, strandedPayment={}",
                e.getOrderId(), e.getRecipient(), e.getSettlementAmount(), e.getStrandedPayment());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, BusinessException e) {
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), e.getCategory(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        log.warn("Request validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.<Map<String, String>>builder()
                        .code(400)
                        .message("Request validation failed")
                        .data(errors)
                        .build());
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
    }

    /**
     * Handle static resource not found (e.g., favicon.ico)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, "Resource not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Internal server error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, "Internal server error, please try again later"));
    }
}
