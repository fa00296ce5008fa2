package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.RawProduct;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls country of origin and shipping method out of the detail table, with a
 * "Made in X" phrase in the title or description as a fallback for origin.
 */
public class OriginExtractor implements NormalizerStep {

    private static final List<String> ORIGIN_KEYS = List.of("country of origin", "origin", "made in", "country of manufacture");
    private static final List<String> SHIPPING_KEYS = List.of("shipping", "shipping method", "delivery", "ships via");
    private static final Pattern MADE_IN = Pattern.compile("\\bmade\\s+in\\s+(?:the\\s+)?([A-Za-z][A-Za-z .]{1,30}?)(?=[,.;)|]|$|\\s{2})",
            Pattern.CASE_INSENSITIVE);

    @Override
    public boolean supports(RawProduct raw) {
        return raw.getDetails() != null || raw.getTitle() != null || raw.getDescription() != null;
    }

    @Override
    public void apply(RawProduct raw, NormalizationDraft draft) {
        Map<String, String> details = raw.getDetails();
        if (draft.getOrigin() == null) {
            String origin = lookup(details, ORIGIN_KEYS);
            if (origin == null) origin = madeIn(raw.getTitle());
            if (origin == null) origin = madeIn(raw.getDescription());
            if (origin != null) draft.setOrigin(origin);
        }
        if (draft.getShippingMethod() == null) {
            String shipping = lookup(details, SHIPPING_KEYS);
            if (shipping != null) draft.setShippingMethod(shipping);
        }
    }

    private static String lookup(Map<String, String> details, List<String> keys) {
        if (details == null) return null;
        for (Map.Entry<String, String> e : details.entrySet()) {
            if (e.getKey() == null || e.getValue() == null || e.getValue().isBlank()) continue;
            if (keys.contains(e.getKey().trim().toLowerCase(Locale.ROOT))) {
                return e.getValue().trim();
            }
        }
        return null;
    }

    static String madeIn(String text) {
        if (text == null) return null;
        Matcher m = MADE_IN.matcher(text.trim());
        return m.find() ? m.group(1).trim() : null;
    }
}
