package org.carball.insight.tools.direct;

import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.EntityKinds;
import org.carball.insight.store.StoreQueryCapability;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps competitor products to our equivalents through the sales mapping table.
 */
public class CompetitorMappingTool extends KeyedLookupTool {

    public static final String NAME = "competitor_mapping";

    private static final Pattern EQUIVALENCE = Pattern.compile(
            "(?i)\\b(equivalent|replace|replacement|alternative|substitute|instead of|our version|cross[- ]reference|competitor)\\b");

    private final String mappingTable;

    public CompetitorMappingTool(StoreQueryCapability store, ProductKeyExtractor extractor, String mappingTable, int rowLimit) {
        super(store, extractor, rowLimit);
        this.mappingTable = mappingTable;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Direct lookup of our equivalent products for competitor product codes";
    }

    @Override
    public List<String> exampleTriggers() {
        return List.of(
                "What is our equivalent for Hogy BR-56U10?",
                "Replace Hogy BD Luer-Lock Syringe 2.5mL with our equivalent",
                "Hogy catheter equivalent");
    }

    @Override
    public boolean applies(String question, ClassificationRecord classification) {
        if (classification.hasEntity(EntityKinds.COMPETITOR_PRODUCT)) {
            return true;
        }
        if (extractor.mentionsBrandProduct(question)) {
            return true;
        }
        return extractor.mentionsCode(question) && mentions(EQUIVALENCE, question);
    }

    @Override
    protected List<String> lookupKeys(String question, ClassificationRecord classification) {
        List<String> keys = distinct(classification.entityValues(EntityKinds.COMPETITOR_PRODUCT),
                extractor.brandProducts(question));
        return keys.isEmpty() ? extractor.productCodes(question) : keys;
    }

    @Override
    protected String buildSql(String placeholders) {
        return "SELECT TOP " + rowLimit + " [HOGY品番] AS competitor_product, [品番] AS our_product"
                + " FROM " + mappingTable
                + " WHERE UPPER([HOGY品番]) IN (" + placeholders + ")";
    }

    @Override
    protected String keyColumn() {
        return "competitor_product";
    }
}
