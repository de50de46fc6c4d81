package com.minilex.playground.controller;

import com.minilex.playground.dto.ScanRequest;
import com.minilex.playground.dto.ScanResponse;
import com.minilex.playground.exception.ScanRejectedException;
import com.minilex.playground.service.ScannerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/scan")
@Validated
public class ScanController {

    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);

    private final ScannerService scannerService;

    public ScanController(ScannerService scannerService) {
        this.scannerService = scannerService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<ScanResponse> analyze(@Valid @RequestBody ScanRequest request) {
        try {
            logger.debug("Received scan request for {} characters", request.sourceCode().length());

            ScanResponse response = scannerService.scan(request);

            logger.debug("Scan finished: success={}, tokens={}",
                response.success(), response.tokens().size());

            return ResponseEntity.ok(response);

        } catch (ScanRejectedException e) {
            return ResponseEntity.badRequest()
                .body(ScanResponse.error(e.getMessage(), 0));
        } catch (Exception e) {
            logger.error("Unexpected error during scan", e);
            return ResponseEntity.internalServerError()
                .body(ScanResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    // not bean-validated: every rejection, null source included, answers in text/plain
    @PostMapping("/render")
    public ResponseEntity<String> render(@RequestBody ScanRequest request) {
        try {
            String rendered = scannerService.render(request.sourceCode());
            return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(rendered);

        } catch (ScanRejectedException e) {
            logger.warn("Render rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .contentType(MediaType.TEXT_PLAIN)
                .body(e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error during render", e);
            return ResponseEntity.internalServerError()
                .contentType(MediaType.TEXT_PLAIN)
                .body("Internal server error: " + e.getMessage());
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scanner service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ScanResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(ScanResponse.error(errorMessage.toString(), 0));
    }
}
