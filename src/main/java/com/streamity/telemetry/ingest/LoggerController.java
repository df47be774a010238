package com.streamity.telemetry.ingest;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface the capture agents report to.
 * <p>
 * {@code /logger.php} is kept as an alias for players still posting to the legacy path.
 * Pre-flight {@code OPTIONS} requests and CORS headers are handled by {@link LoggerCorsFilter}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping({LoggerController.PATH, LoggerController.LEGACY_PATH})
public class LoggerController {

    public static final String PATH = "/logger";
    public static final String LEGACY_PATH = "/logger.php";

    private final ErrorIngestionService ingestionService;
    private final ClientIdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<LoggerResponse> logError(
            @RequestBody(required = false) String body,
            HttpServletRequest request
    ) {
        String caller = identityResolver.resolve(request).value();
        IngestionResult result = ingestionService.ingest(body, caller);

        return switch (result.outcome()) {
            case ACCEPTED -> json(HttpStatus.OK, LoggerResponse.success(result.timestamp()));
            case RATE_LIMITED -> json(HttpStatus.TOO_MANY_REQUESTS, LoggerResponse.error("Rate limit exceeded"));
            case INVALID, STORAGE_FAILED -> json(HttpStatus.INTERNAL_SERVER_ERROR,
                    LoggerResponse.error("Failed to log error: " + result.reason()));
        };
    }

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
    public ResponseEntity<LoggerResponse> methodNotAllowed(HttpServletRequest request) {
        log.debug("Rejected {} {}", request.getMethod(), request.getRequestURI());
        return json(HttpStatus.METHOD_NOT_ALLOWED, LoggerResponse.error("Method not allowed"));
    }

    private static ResponseEntity<LoggerResponse> json(HttpStatus status, LoggerResponse body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
