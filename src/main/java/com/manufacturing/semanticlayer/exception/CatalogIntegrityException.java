package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when catalog rows cannot form a valid graph. Carries every violation
 * found in the run, each naming the offending row's keys.
 */
@Getter
public class CatalogIntegrityException extends SemanticLayerException {

    private final List<String> violations;

    public CatalogIntegrityException(List<String> violations) {
        super("Catalog integrity check failed with " + violations.size() + " violation(s): "
                + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
