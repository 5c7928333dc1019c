package com.mikov.emailsanitizer.controller;

import com.mikov.emailsanitizer.config.SanitizerProperties;
import com.mikov.emailsanitizer.config.WebConfig;
import com.mikov.emailsanitizer.dtos.SanitizationReport;
import com.mikov.emailsanitizer.model.ExportEmailsRequest;
import com.mikov.emailsanitizer.model.ValidationOptions;
import com.mikov.emailsanitizer.services.EmailSanitizationService;
import com.mikov.emailsanitizer.services.SanitizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * REST controller for email list sanitization
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/api/sanitize-emails")
public class EmailSanitizationController {

    private static final Logger logger = LoggerFactory.getLogger(EmailSanitizationController.class);
    private static final String EXPORT_FILE_NAME = "sanitized-emails.csv";
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final EmailSanitizationService sanitizationService;
    private final AsyncTaskExecutor taskExecutor;
    private final long responseTimeoutMs;

    public EmailSanitizationController(final EmailSanitizationService sanitizationService,
                                       @Qualifier("asyncTaskExecutor") final AsyncTaskExecutor taskExecutor,
                                       final SanitizerProperties properties) {
        this.sanitizationService = sanitizationService;
        this.taskExecutor = taskExecutor;
        this.responseTimeoutMs = WebConfig.responseTimeoutMillis(properties);
    }

    @PostMapping
    public DeferredResult<ResponseEntity<SanitizationReport>> sanitizeEmails(
            @RequestParam(value = "emails", required = false) final String emails,
            @RequestParam(value = "checkFormat", defaultValue = "true") final boolean checkFormat,
            @RequestParam(value = "checkDisposable", defaultValue = "true") final boolean checkDisposable,
            @RequestParam(value = "checkMx", defaultValue = "true") final boolean checkMx,
            @RequestParam(value = "removeDuplicates", defaultValue = "true") final boolean removeDuplicates) {
        final var deferredResult = new DeferredResult<ResponseEntity<SanitizationReport>>(responseTimeoutMs);
        deferredResult.onTimeout(() -> deferredResult.setErrorResult(
                errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Sanitization did not finish in time")));

        if (emails == null || emails.isBlank()) {
            logger.info("Received sanitization request without emails");
            deferredResult.setResult(ResponseEntity.ok(SanitizationReport.empty()));
            return deferredResult;
        }

        final var options = ValidationOptions.builder()
                .checkFormat(checkFormat)
                .checkDisposable(checkDisposable)
                .checkMx(checkMx)
                .removeDuplicates(removeDuplicates)
                .build();

        CompletableFuture.supplyAsync(() -> sanitizationService.sanitizeText(emails, options), taskExecutor)
            .thenAccept(report -> deferredResult.setResult(ResponseEntity.ok(report)))
            .exceptionally(ex -> {
                final var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                if (cause instanceof SanitizationException) {
                    logger.error("Sanitization aborted: {}", cause.getMessage());
                    deferredResult.setErrorResult(errorResponse(HttpStatus.SERVICE_UNAVAILABLE, cause.getMessage()));
                } else {
                    logger.error("Error sanitizing emails: {}", cause.getMessage(), cause);
                    deferredResult.setErrorResult(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to sanitize emails"));
                }
                return null;
            });

        return deferredResult;
    }

    @PostMapping(value = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportEmails(@RequestBody final ExportEmailsRequest request) {
        if (request == null || request.getEmails() == null) {
            logger.warn("Received export request without emails");
            return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body("No emails to export");
        }

        logger.info("Exporting {} emails as CSV", request.getEmails().size());
        final var disposition = ContentDisposition.attachment().filename(EXPORT_FILE_NAME).build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(TEXT_CSV)
                .body(sanitizationService.exportCsv(request.getEmails()));
    }

    private static ResponseEntity<Map<String, String>> errorResponse(final HttpStatus status, final String message) {
        return ResponseEntity.status(status).body(Map.of("message", message == null ? status.getReasonPhrase() : message));
    }
}
