package org.carball.insight.model.classification;

/**
 * Entity kinds the classifier is asked to extract.
 */
public final class EntityKinds {

    public static final String COMPETITOR_PRODUCT = "competitor_product";
    public static final String COMPETITOR_BRAND = "competitor_brand";
    public static final String PRODUCT_CODES = "product_codes";
    public static final String INTENT_SUBTYPE = "intent_subtype";

    private EntityKinds() {
        // Constants holder
    }
}
