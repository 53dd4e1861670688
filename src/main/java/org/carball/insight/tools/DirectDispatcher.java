package org.carball.insight.tools;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.tool.DispatchOutcome;
import org.carball.insight.model.tool.ToolDescriptor;
import org.carball.insight.model.tool.ToolResult;

import java.util.List;

/**
 * Runs the first direct tool whose predicate accepts the question. Registration order decides
 * between tools that both match; nothing thrown by a tool escapes.
 */
@Slf4j
public class DirectDispatcher {

    private final DirectToolRegistry registry;

    public DirectDispatcher(DirectToolRegistry registry) {
        this.registry = registry;
    }

    public DispatchOutcome dispatch(String question, ClassificationRecord classification) {
        List<ToolDescriptor> tools = registry.toolsFor(classification.persona());
        if (tools.isEmpty()) {
            log.debug("No direct tools registered for persona {}", classification.persona());
            return DispatchOutcome.noMatch();
        }

        ToolDescriptor chosen = null;
        for (ToolDescriptor tool : tools) {
            if (applies(tool, question, classification)) {
                chosen = tool;
                break;
            }
        }
        if (chosen == null) {
            log.debug("No direct tool matched for persona {}", classification.persona());
            return DispatchOutcome.noMatch();
        }

        log.info("Dispatching direct tool {}", chosen.name());
        try {
            ToolResult result = chosen.executor().execute(question, classification);
            if (result == null) {
                return DispatchOutcome.failed(chosen.name(),
                        new IllegalStateException("Tool " + chosen.name() + " returned no result"));
            }
            log.info("Direct tool {} returned {} rows", chosen.name(), result.rowCount());
            return DispatchOutcome.success(chosen.name(), result);
        } catch (Exception e) {
            log.warn("Direct tool {} failed: {}", chosen.name(), e.getMessage());
            return DispatchOutcome.failed(chosen.name(), e);
        }
    }

    private static boolean applies(ToolDescriptor tool, String question, ClassificationRecord classification) {
        try {
            return tool.predicate().test(question, classification);
        } catch (RuntimeException e) {
            log.warn("Predicate of {} threw, treating as not applicable: {}", tool.name(), e.getMessage());
            return false;
        }
    }
}
