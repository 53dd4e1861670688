package org.carball.insight.model.tool;

import java.util.List;

/**
 * A named, persona-scoped pairing of an applicability check and a deterministic lookup.
 */
public record ToolDescriptor(
        String name,
        ToolPredicate predicate,
        ToolExecutor executor,
        String description,
        List<String> exampleTriggers
) {

    public ToolDescriptor {
        exampleTriggers = exampleTriggers == null ? List.of() : List.copyOf(exampleTriggers);
    }

    public ToolDescriptor(String name, ToolPredicate predicate, ToolExecutor executor, String description) {
        this(name, predicate, executor, description, List.of());
    }
}
