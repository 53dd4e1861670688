package org.carball.insight.model.stage;

/**
 * Keys used in the response's stage results, in the order stages can run.
 */
public enum StageName {
    DIRECT_TOOL("direct_tool"),
    FALLBACK_QUERY("fallback_query"),
    DISCOVERY("stage1_discovery"),
    SELECTION("intermediate_selection"),
    ANALYSIS("stage2_analysis"),
    EVALUATION("stage3_evaluation");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
