package org.carball.insight.ai;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON returned by the candidate selection call. {@code selected_items} may be a list or a single string.
 */
@Data
@NoArgsConstructor
public class SelectionResponse {

    private String summary;

    @JsonProperty("selected_items")
    private Object selectedItems;

    private String reasoning;

    @JsonProperty("stage2_focus")
    private String stage2Focus;
}
