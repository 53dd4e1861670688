package org.carball.insight.ai;

/**
 * Cleans up model output before it is parsed.
 */
public final class JsonPayloads {

    private JsonPayloads() {
        // Utility class - prevent instantiation
    }

    /**
     * Removes a surrounding Markdown code fence such as {@code ```json ... ```} or {@code ```sql ... ```}.
     */
    public static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline >= 0 ? cleaned.substring(firstNewline + 1) : cleaned.substring(3);
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
        }
        return cleaned.trim();
    }

    /**
     * The outermost JSON object in the text, or the cleaned text when there is none.
     */
    public static String extractJsonObject(String text) {
        String cleaned = stripCodeFences(text);
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return cleaned.substring(start, end + 1);
        }
        return cleaned;
    }
}
