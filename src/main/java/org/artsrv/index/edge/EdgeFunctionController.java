package org.artsrv.index.edge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.artsrv.index.listing.ListingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Receives CloudFront origin-request events ({@code Records[0].cf.request}) and answers with
 * either a generated response or the request object exactly as it came in.
 */
@RestController
@RequestMapping("/v1/edge")
public class EdgeFunctionController {
    private static final Logger log = LoggerFactory.getLogger(EdgeFunctionController.class);

    private static final TypeReference<Map<String, List<EdgeHeader>>> HEADERS_TYPE = new TypeReference<>() {};

    private final ListingRequestHandler handler;
    private final ObjectMapper mapper;

    public EdgeFunctionController(ListingRequestHandler handler, ObjectMapper mapper) {
        this.handler = handler;
        this.mapper = mapper;
    }

    @PostMapping(value = "/origin-request", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> originRequest(@RequestBody JsonNode event) {
        JsonNode requestNode = event.path("Records").path(0).path("cf").path("request");
        if (!requestNode.isObject()) {
            return ResponseEntity.badRequest().body(Map.of("error", "event has no Records[0].cf.request"));
        }

        EdgeRequest request;
        try {
            request = new EdgeRequest(
                    requestNode.path("uri").asText(""),
                    requestNode.path("querystring").asText(""),
                    requestNode.hasNonNull("headers") ? mapper.convertValue(requestNode.get("headers"), HEADERS_TYPE) : Map.of());
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting malformed origin-request event: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "malformed request headers"));
        }

        EdgeResult result = handler.handle(request);
        if (result.isPassthrough()) {
            return ResponseEntity.ok(requestNode);
        }
        return ResponseEntity.ok(result.response());
    }

    @ExceptionHandler(ListingException.class)
    public ResponseEntity<EdgeResponse> listingFailed(ListingException e) {
        log.error("Directory listing failed", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(EdgeResponse.badGateway());
    }
}
