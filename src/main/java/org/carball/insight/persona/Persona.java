package org.carball.insight.persona;

import java.util.List;

/**
 * A domain knowledge module: who asks, which tables matter, how to query them.
 */
public record Persona(String name, String description, List<String> tables, String content) {

    public Persona {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
