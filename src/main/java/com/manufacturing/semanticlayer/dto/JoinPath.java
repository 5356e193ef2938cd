package com.manufacturing.semanticlayer.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
@Jacksonized
public class JoinPath {
    String sourceTable;
    String targetTable;
    List<String> tables;
    List<JoinStep> steps;
    double totalCost;

    /**
     * Renders the path as {@code equipment --[produces]--> product --[ordered_in]--> order}.
     */
    public String describe() {
        if (steps.isEmpty()) {
            return sourceTable;
        }
        return sourceTable + steps.stream()
                .map(step -> " --[" + (step.getRelationshipKind() != null ? step.getRelationshipKind() : "relates_to")
                        + "]--> " + step.getTo())
                .collect(Collectors.joining());
    }
}
