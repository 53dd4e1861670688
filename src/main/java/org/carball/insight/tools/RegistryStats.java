package org.carball.insight.tools;

import java.util.List;
import java.util.Map;

public record RegistryStats(int personaCount, int toolCount, Map<String, List<String>> toolsByPersona) {
}
