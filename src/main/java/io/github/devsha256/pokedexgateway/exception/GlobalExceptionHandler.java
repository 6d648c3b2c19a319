package io.github.devsha256.pokedexgateway.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Generic handler to avoid leaking stack traces or upstream details.
 * Standard Spring MVC errors (bad query parameters and the like) keep their 4xx status.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Void> handleAll(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.internalServerError().build();
    }
}
