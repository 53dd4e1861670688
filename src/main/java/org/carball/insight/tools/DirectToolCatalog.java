package org.carball.insight.tools;

import org.carball.insight.config.InsightConfig;
import org.carball.insight.store.StoreQueryCapability;
import org.carball.insight.tools.direct.ComponentLookupTool;
import org.carball.insight.tools.direct.CompetitorMappingTool;
import org.carball.insight.tools.direct.ProductKeyExtractor;
import org.carball.insight.tools.direct.ProductPricingTool;

/**
 * The direct tools shipped with the application, per persona.
 */
public final class DirectToolCatalog {

    public static final String SALES_REP = "spt_sales_rep";
    public static final String PRODUCT_PLANNING = "product_planning";

    private DirectToolCatalog() {
        // Utility class - prevent instantiation
    }

    public static DirectToolRegistry standard(StoreQueryCapability store, InsightConfig config) {
        ProductKeyExtractor extractor = new ProductKeyExtractor(config.getCompetitorBrands());
        int limit = config.getDirectToolRowLimit();

        DirectToolRegistry.Builder builder = DirectToolRegistry.builder();
        for (String persona : config.getPersonas()) {
            builder.persona(persona);
        }

        // Order matters: the first matching tool wins
        return builder
                .register(SALES_REP, new CompetitorMappingTool(store, extractor, config.getCompetitorMappingTable(), limit)
                        .descriptor())
                .register(SALES_REP, new ProductPricingTool(store, extractor, config.getPartMasterTable(), limit)
                        .descriptor())
                .register(PRODUCT_PLANNING, new ComponentLookupTool(store, extractor, config.getProductStructureTable(), limit)
                        .descriptor())
                .build();
    }
}
