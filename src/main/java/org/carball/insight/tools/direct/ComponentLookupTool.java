package org.carball.insight.tools.direct;

import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.EntityKinds;
import org.carball.insight.store.StoreQueryCapability;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Components of an assembly from the product structure table.
 */
public class ComponentLookupTool extends KeyedLookupTool {

    public static final String NAME = "component_lookup";

    private static final Pattern STRUCTURE = Pattern.compile(
            "(?i)(\\bcomponents?\\b|bill of materials|\\bbom\\b|made of|consist of|\\bparts of\\b|構成)");

    private final String productStructureTable;

    public ComponentLookupTool(StoreQueryCapability store, ProductKeyExtractor extractor, String productStructureTable,
                               int rowLimit) {
        super(store, extractor, rowLimit);
        this.productStructureTable = productStructureTable;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Direct bill-of-materials lookup for named assemblies";
    }

    @Override
    public List<String> exampleTriggers() {
        return List.of("What are the components of KIT-4410?", "Show the BOM for DR2200");
    }

    @Override
    public boolean applies(String question, ClassificationRecord classification) {
        return mentions(STRUCTURE, question)
                && (classification.hasEntity(EntityKinds.PRODUCT_CODES) || extractor.mentionsCode(question));
    }

    @Override
    protected List<String> lookupKeys(String question, ClassificationRecord classification) {
        return distinct(classification.entityValues(EntityKinds.PRODUCT_CODES), extractor.productCodes(question));
    }

    @Override
    protected String buildSql(String placeholders) {
        return "SELECT TOP " + rowLimit + " ps_par AS parent_code, ps_comp AS component_code, ps_qty_per AS quantity_per"
                + " FROM " + productStructureTable
                + " WHERE UPPER(ps_par) IN (" + placeholders + ")"
                + " ORDER BY ps_par, ps_comp";
    }

    @Override
    protected String keyColumn() {
        return "parent_code";
    }
}
