package org.artsrv.index.edge;

import jakarta.servlet.http.HttpServletRequest;
import org.artsrv.index.listing.ListingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Serves listings straight to a browser under {@code /browse/}. With no origin behind it, a
 * passthrough becomes a 404.
 */
@RestController
public class BrowseController {
    private static final Logger log = LoggerFactory.getLogger(BrowseController.class);

    static final String BASE = "/browse";

    private final ListingRequestHandler handler;

    public BrowseController(ListingRequestHandler handler) {
        this.handler = handler;
    }

    @GetMapping({BASE, BASE + "/**"})
    public ResponseEntity<String> browse(HttpServletRequest servletRequest) {
        String path = servletRequest.getRequestURI().substring(servletRequest.getContextPath().length() + BASE.length());
        if (path.isEmpty()) path = "/";

        EdgeResult result = handler.handle(new EdgeRequest(path, servletRequest.getQueryString(), null));
        if (result.isPassthrough()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Not Found");
        }
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .cacheControl(CacheControl.maxAge(Duration.ZERO))
                .body(result.response().body());
    }

    @ExceptionHandler(ListingException.class)
    public ResponseEntity<String> listingFailed(ListingException e) {
        log.error("Directory listing failed", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .contentType(MediaType.TEXT_PLAIN)
                .body("Directory listing is temporarily unavailable.");
    }
}
