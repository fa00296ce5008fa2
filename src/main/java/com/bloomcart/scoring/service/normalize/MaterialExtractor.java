package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.RawProduct;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword scan against a fixed material vocabulary over the title, description
 * and material-labelled detail rows. Leaves the draft untouched when nothing
 * matches; the Normalizer substitutes {@code "mixed"} at the end.
 */
public class MaterialExtractor implements NormalizerStep {

    // canonical material -> surface forms
    private static final Map<String, Pattern> VOCABULARY = new LinkedHashMap<>();
    static {
        VOCABULARY.put("plastic", Pattern.compile("\\b(plastics?|abs|polycarbonate|pvc|polypropylene|acrylic)\\b"));
        VOCABULARY.put("aluminum", Pattern.compile("\\b(aluminum|aluminium)\\b"));
        VOCABULARY.put("steel", Pattern.compile("\\b(steel|stainless)\\b"));
        VOCABULARY.put("metal", Pattern.compile("\\b(metal|metallic|iron|copper|brass)\\b"));
        VOCABULARY.put("cotton", Pattern.compile("\\bcotton\\b"));
        VOCABULARY.put("fabric", Pattern.compile("\\b(fabric|cloth|canvas|linen)\\b"));
        VOCABULARY.put("polyester", Pattern.compile("\\b(polyester|nylon|spandex)\\b"));
        VOCABULARY.put("wool", Pattern.compile("\\b(wool|cashmere|merino)\\b"));
        VOCABULARY.put("wood", Pattern.compile("\\b(wood|wooden|oak|pine|walnut|plywood)\\b"));
        VOCABULARY.put("bamboo", Pattern.compile("\\bbamboo\\b"));
        VOCABULARY.put("glass", Pattern.compile("\\bglass\\b"));
        VOCABULARY.put("paper", Pattern.compile("\\bpaper\\b"));
        VOCABULARY.put("cardboard", Pattern.compile("\\b(cardboard|paperboard|corrugated)\\b"));
        VOCABULARY.put("leather", Pattern.compile("\\bleather\\b"));
        VOCABULARY.put("rubber", Pattern.compile("\\b(rubber|latex)\\b"));
        VOCABULARY.put("ceramic", Pattern.compile("\\b(ceramic|porcelain|stoneware)\\b"));
        VOCABULARY.put("silicone", Pattern.compile("\\bsilicone\\b"));
    }

    @Override
    public boolean supports(RawProduct raw) {
        return raw.getTitle() != null || raw.getDescription() != null || raw.getDetails() != null;
    }

    @Override
    public void apply(RawProduct raw, NormalizationDraft draft) {
        StringBuilder text = new StringBuilder();
        if (raw.getTitle() != null) text.append(raw.getTitle()).append(' ');
        if (raw.getDescription() != null) text.append(raw.getDescription()).append(' ');
        if (raw.getDetails() != null) {
            for (Map.Entry<String, String> e : raw.getDetails().entrySet()) {
                String label = e.getKey() == null ? "" : e.getKey().toLowerCase(Locale.ROOT);
                if ((label.contains("material") || label.contains("fabric")) && e.getValue() != null) {
                    text.append(e.getValue()).append(' ');
                }
            }
        }
        draft.addMaterials(scan(text.toString()), "keyword");
    }

    /**
     * Returns the canonical materials mentioned in the text, in vocabulary order.
     */
    public static Set<String> scan(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return found;
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> e : VOCABULARY.entrySet()) {
            if (e.getValue().matcher(lower).find()) found.add(e.getKey());
        }
        return found;
    }

    /**
     * Maps a free-form material name (e.g. from an AI hint) onto the vocabulary.
     *
     * @return The canonical material, or null when it is not in the vocabulary
     */
    public static String canonical(String material) {
        Set<String> found = scan(material);
        return found.isEmpty() ? null : found.iterator().next();
    }
}
