package org.carball.insight.session;

import java.util.Map;

public record SessionEvent(String requestId, SessionEventType type, long elapsedMs, Map<String, Object> data) {
}
