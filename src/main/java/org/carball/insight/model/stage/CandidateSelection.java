package org.carball.insight.model.stage;

import java.util.List;

/**
 * Items picked from discovery results for the analysis query, with the reasoning behind the pick.
 */
public record CandidateSelection(
        String summary,
        List<String> selectedItems,
        String reasoning,
        String analysisFocus,
        boolean autoSelected
) {

    public CandidateSelection {
        selectedItems = selectedItems == null ? List.of() : List.copyOf(selectedItems);
        summary = summary == null ? "" : summary;
        reasoning = reasoning == null ? "" : reasoning;
        analysisFocus = analysisFocus == null ? "" : analysisFocus;
    }

    public static CandidateSelection empty(String reasoning) {
        return new CandidateSelection("No candidates found", List.of(), reasoning, "", false);
    }

    public boolean isEmpty() {
        return selectedItems.isEmpty();
    }
}
