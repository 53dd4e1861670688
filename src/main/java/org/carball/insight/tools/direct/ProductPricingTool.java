package org.carball.insight.tools.direct;

import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.EntityKinds;
import org.carball.insight.store.StoreQueryCapability;

import java.util.List;
import java.util.regex.Pattern;

/**
 * List price and unit of measure for explicitly named part codes.
 */
public class ProductPricingTool extends KeyedLookupTool {

    public static final String NAME = "product_pricing";

    private static final Pattern PRICING = Pattern.compile("(?i)(\\bprice\\b|\\bpricing\\b|\\bcost\\b|how much|価格)");

    private final String partMasterTable;

    public ProductPricingTool(StoreQueryCapability store, ProductKeyExtractor extractor, String partMasterTable, int rowLimit) {
        super(store, extractor, rowLimit);
        this.partMasterTable = partMasterTable;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Direct price lookup for named part codes";
    }

    @Override
    public List<String> exampleTriggers() {
        return List.of("What is the price of TX2040?", "How much does SP-1200A cost?");
    }

    @Override
    public boolean applies(String question, ClassificationRecord classification) {
        return mentions(PRICING, question)
                && (classification.hasEntity(EntityKinds.PRODUCT_CODES) || extractor.mentionsCode(question));
    }

    @Override
    protected List<String> lookupKeys(String question, ClassificationRecord classification) {
        return distinct(classification.entityValues(EntityKinds.PRODUCT_CODES), extractor.productCodes(question));
    }

    @Override
    protected String buildSql(String placeholders) {
        return "SELECT TOP " + rowLimit + " pt_part AS part_code, pt_desc1 AS description, pt_um AS unit,"
                + " pt_price AS list_price"
                + " FROM " + partMasterTable
                + " WHERE UPPER(pt_part) IN (" + placeholders + ")";
    }

    @Override
    protected String keyColumn() {
        return "part_code";
    }
}
