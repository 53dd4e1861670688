package org.carball.insight.tools.direct;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds product codes and "&lt;brand&gt; &lt;product&gt;" phrases in question text.
 */
public class ProductKeyExtractor {

    // Upper-case codes containing at least one digit: BR-56U10, TX2040
    private static final Pattern PRODUCT_CODE = Pattern.compile(
            "\\b(?=[A-Z0-9-]*\\d)(?:[A-Z]{1,4}-[A-Z0-9]{3,10}|[A-Z]{2,4}\\d{2,6})\\b");
    private static final String TRAILING_PUNCTUATION = "[?.!,;:]+$";

    private final List<Pattern> brandPhrases;

    public ProductKeyExtractor(List<String> competitorBrands) {
        this.brandPhrases = competitorBrands.stream()
                .map(brand -> Pattern.compile(Pattern.quote(brand)
                        + "\\s+([\\w\\-.]+(?:\\s+[\\w\\-.]+)*?)"
                        + "(?=\\s+(?:with|and|equivalent|alternative|replacement)\\b|\\s*[?.!,]?\\s*$)",
                        Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    public List<String> productCodes(String question) {
        Set<String> codes = new LinkedHashSet<>();
        if (question != null) {
            Matcher matcher = PRODUCT_CODE.matcher(question);
            while (matcher.find()) {
                codes.add(matcher.group());
            }
        }
        return new ArrayList<>(codes);
    }

    /**
     * Product names following a competitor brand, e.g. "BD Luer-Lock Syringe 2.5mL" from
     * "Replace Hogy BD Luer-Lock Syringe 2.5mL with our equivalent".
     */
    public List<String> brandProducts(String question) {
        Set<String> products = new LinkedHashSet<>();
        if (question != null) {
            for (Pattern pattern : brandPhrases) {
                Matcher matcher = pattern.matcher(question);
                while (matcher.find()) {
                    String product = matcher.group(1).trim().replaceAll(TRAILING_PUNCTUATION, "");
                    if (!product.isEmpty()) {
                        products.add(product);
                    }
                }
            }
        }
        return new ArrayList<>(products);
    }

    public boolean mentionsCode(String question) {
        return question != null && PRODUCT_CODE.matcher(question).find();
    }

    public boolean mentionsBrandProduct(String question) {
        return !brandProducts(question).isEmpty();
    }
}
