package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;

/** Maps gateway errors raised by admin calls to HTTP responses. */
@RestControllerAdvice(assignableTypes = AdminController.class)
public class AdminErrors {
    private static final Logger log = LoggerFactory.getLogger(AdminErrors.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<AdminModels.ErrorView> gateway(GatewayException e) {
        HttpStatus status = status(e.code());
        if (status.is5xxServerError()) {
            log.warn("Admin call failed: {}", e.getMessage(), e);
        } else {
            log.debug("Admin call rejected: {} {}", e.code(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new AdminModels.ErrorView(e.code().name().toLowerCase(Locale.ROOT), e.getMessage()));
    }

    static HttpStatus status(ErrorCode code) {
        return switch (code) {
            case CONNECTOR_NOT_FOUND, LINK_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT, MALFORMED_REQUEST -> HttpStatus.BAD_REQUEST;
            case CONNECTOR_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
