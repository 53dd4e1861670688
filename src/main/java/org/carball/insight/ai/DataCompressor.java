package org.carball.insight.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.session.SessionTrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shrinks row sets before they go into a prompt: fields shared by every row are listed once,
 * then only the fields that vary.
 */
@Slf4j
public class DataCompressor {

    public static final String NO_DATA = "No data available";
    private static final int MAX_VARIANTS = 5;
    private static final int MAX_PLAIN_RECORDS = 3;

    private final int maxRecords;

    public DataCompressor(int maxRecords) {
        this.maxRecords = Math.max(1, maxRecords);
    }

    public record CompressionStats(int originalSize, int compressedSize) {

        public double ratio() {
            return originalSize == 0 ? 0.0 : (double) (originalSize - compressedSize) / originalSize;
        }
    }

    public String compress(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return NO_DATA;
        }

        List<Map<String, Object>> limited = rows.subList(0, Math.min(maxRecords, rows.size()));
        if (limited.size() == 1) {
            return format(limited.get(0));
        }

        // Fields whose non-null values are identical in every record
        Map<String, Object> common = new LinkedHashMap<>();
        for (String key : limited.get(0).keySet()) {
            Set<Object> distinct = limited.stream()
                    .map(row -> row.get(key))
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (distinct.size() <= 1) {
                common.put(key, distinct.isEmpty() ? null : distinct.iterator().next());
            }
        }

        if (common.isEmpty()) {
            return limited.stream()
                    .limit(MAX_PLAIN_RECORDS)
                    .map(DataCompressor::format)
                    .collect(Collectors.joining(" | "));
        }

        List<String> variants = new ArrayList<>();
        for (Map<String, Object> row : limited) {
            Map<String, Object> varying = new LinkedHashMap<>();
            row.forEach((key, value) -> {
                if (!common.containsKey(key) && value != null) {
                    varying.put(key, value);
                }
            });
            if (!varying.isEmpty() && variants.size() < MAX_VARIANTS) {
                variants.add(format(varying));
            }
        }
        return "Common: " + format(common) + " | Variants: " + String.join(" | ", variants);
    }

    /**
     * Compresses and records the size reduction on the current session trace.
     */
    public String compressForStage(String stage, List<Map<String, Object>> rows) {
        String compressed = compress(rows);
        if (rows != null && !rows.isEmpty()) {
            CompressionStats stats = stats(rows, compressed);
            log.debug("Compressed {} data from {} to {} chars", stage, stats.originalSize(), stats.compressedSize());
            SessionTrace.current().ifPresent(t -> t.compression(stage, stats.originalSize(), stats.compressedSize()));
        }
        return compressed;
    }

    public CompressionStats stats(List<Map<String, Object>> rows, String compressed) {
        int original = rows == null ? 0 : rows.toString().length();
        return new CompressionStats(original, compressed.length());
    }

    private static String format(Map<String, Object> record) {
        return record.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
