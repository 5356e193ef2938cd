package com.manufacturing.semanticlayer.controller;

import com.manufacturing.semanticlayer.dto.ErrorResponse;
import com.manufacturing.semanticlayer.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Maps the semantic layer's exceptions to HTTP statuses and a JSON body that
 * carries the identifiers needed to fix the catalog.
 */
@RestControllerAdvice(assignableTypes = SemanticLayerController.class)
@Slf4j
public class SemanticLayerExceptionHandler {

    @ExceptionHandler(UnknownNodeException.class)
    public ResponseEntity<ErrorResponse> handleUnknownNode(UnknownNodeException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request, Map.of("nodeId", e.getNodeId()), null);
    }

    @ExceptionHandler(NoPathException.class)
    public ResponseEntity<ErrorResponse> handleNoPath(NoPathException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request,
                Map.of("sourceTable", e.getSourceTable(), "targetTable", e.getTargetTable()), null);
    }

    @ExceptionHandler(NoApplicableConceptException.class)
    public ResponseEntity<ErrorResponse> handleNoConcept(NoApplicableConceptException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request,
                Map.of("intent", e.getIntentName(), "field", e.getFieldName()), null);
    }

    @ExceptionHandler(AmbiguousResolutionException.class)
    public ResponseEntity<ErrorResponse> handleAmbiguous(AmbiguousResolutionException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e, request,
                Map.of("intent", e.getIntentName(), "field", e.getFieldName()), e.getCandidates());
    }

    @ExceptionHandler(GraphNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleGraphNotFound(GraphNotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request, Map.of("storeName", e.getStoreName()), null);
    }

    @ExceptionHandler(GraphAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleGraphExists(GraphAlreadyExistsException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e, request, Map.of("storeName", e.getStoreName()), null);
    }

    @ExceptionHandler(CatalogIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(CatalogIntegrityException e, HttpServletRequest request) {
        log.error("Catalog rejected: {} violation(s)", e.getViolations().size());
        return ResponseEntity.unprocessableEntity()
                .body(body(HttpStatus.UNPROCESSABLE_ENTITY, e, request)
                        .violations(e.getViolations())
                        .build());
    }

    @ExceptionHandler(PartialWriteException.class)
    public ResponseEntity<ErrorResponse> handlePartialWrite(PartialWriteException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, e, request,
                Map.of("storeName", e.getStoreName(), "phase", e.getPhase(), "batchIndex", e.getBatchIndex()), null);
    }

    @ExceptionHandler({StoreUnavailableException.class, GraphNotLoadedException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(SemanticLayerException e, HttpServletRequest request) {
        Map<String, Object> details = e instanceof StoreUnavailableException
                ? Map.of("storeName", ((StoreUnavailableException) e).getStoreName())
                : Map.of();
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, request, details, null);
    }

    @ExceptionHandler(OperationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(OperationCancelledException e, HttpServletRequest request) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e, request, Map.of(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e, request, Map.of(), null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, RuntimeException e, HttpServletRequest request,
                                                  Map<String, Object> details, List<String> candidates) {
        return ResponseEntity.status(status)
                .body(body(status, e, request)
                        .details(details)
                        .candidates(candidates)
                        .build());
    }

    private ErrorResponse.ErrorResponseBuilder body(HttpStatus status, RuntimeException e, HttpServletRequest request) {
        log.warn("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(), e.getMessage());
        return ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(e.getClass().getSimpleName())
                .message(e.getMessage())
                .path(request.getRequestURI());
    }
}
