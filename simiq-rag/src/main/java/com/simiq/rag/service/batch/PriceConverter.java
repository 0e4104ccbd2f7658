package com.simiq.rag.service.batch;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Converts catalog display prices (e.g. "฿7,999") to a USD display string (e.g. "$279.97")
 * using a fixed linear rate. Anything that does not parse as a number is passed through as is.
 */
public final class PriceConverter {

    private static final Pattern NON_NUMERIC = Pattern.compile("[\\p{Sc},\\s]");

    private PriceConverter() {
    }

    public static String toUsd(String price, double exchangeRate) {
        if (price == null) {
            return null;
        }
        String cleaned = NON_NUMERIC.matcher(price).replaceAll("");
        if (cleaned.isEmpty()) {
            return price;
        }
        try {
            BigDecimal amount = new BigDecimal(cleaned)
                    .multiply(BigDecimal.valueOf(exchangeRate))
                    .setScale(2, RoundingMode.HALF_UP);
            return "$" + amount.toPlainString();
        } catch (NumberFormatException e) {
            return price;
        }
    }
}
