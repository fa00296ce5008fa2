package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.ProductCategory;
import com.bloomcart.scoring.model.RawProduct;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    private RawProduct raw(String asin, String title, String category, String desc, Map<String, String> details) {
        RawProduct r = new RawProduct();
        r.setProductKey(asin);
        r.setTitle(title);
        r.setCategory(category);
        r.setDescription(desc);
        r.setDetails(details);
        return r;
    }

    private static boolean hasWarning(NormalizedProduct p, String code) {
        return p.getWarnings().stream().anyMatch(w -> code.equals(w.getCode()));
    }

    @Test
    public void emptyRecordStillYieldsPositiveWeight() {
        NormalizedProduct p = normalizer.normalize(new RawProduct());

        assertEquals(WeightParser.FLOOR_DEFAULT_KG, p.getWeightKg(), 1e-9);
        assertEquals(ProductCategory.DEFAULT, p.getCategory());
        assertEquals(Set.of("mixed"), p.getMaterials());
        assertEquals(Normalizer.UNKNOWN_TITLE, p.getTitle());
        assertTrue(hasWarning(p, "WEIGHT_DEFAULTED"));
        assertTrue(hasWarning(p, "CATEGORY_DEFAULTED"));
        assertTrue(hasWarning(p, "MATERIALS_DEFAULTED"));
        assertEquals("floor_default", p.getProvenance().get("weightKg"));
    }

    @Test
    public void nullRecordIsTreatedAsEmpty() {
        NormalizedProduct p = normalizer.normalize(null);
        assertTrue(p.getWeightKg() > 0);
    }

    @Test
    public void earbudsUseTypeDefaultBeforeCategoryDefault() {
        NormalizedProduct p = normalizer.normalize(raw("B0TEST0001", "Wireless Bluetooth Earbuds", null, null, null));

        assertEquals(ProductCategory.ELECTRONICS, p.getCategory());
        assertEquals(0.4, p.getWeightKg(), 1e-9);
        assertEquals("type_default", p.getProvenance().get("weightKg"));
        assertEquals(Set.of("mixed"), p.getMaterials());
    }

    @Test
    public void explicitElectronicsCategoryWithoutWeight() {
        NormalizedProduct p = normalizer.normalize(raw(null, "wireless earbuds", "Electronics", null, null));

        assertEquals(ProductCategory.ELECTRONICS, p.getCategory());
        assertEquals("explicit", p.getProvenance().get("category"));
        assertEquals(0.4, p.getWeightKg(), 1e-9);
        assertTrue(hasWarning(p, "WEIGHT_DEFAULTED"));
    }

    @Test
    public void explicitFieldsAreKeptWithProvenance() {
        NormalizedProduct p = normalizer.normalize(raw("B0TEST0002", "Bamboo Cutting Board", "Kitchen & Dining",
                "Made in Vietnam, ships in plastic-free packaging",
                Map.of("Item Weight", "1.1 kg", "Shipping", "Sea freight")));

        assertEquals(ProductCategory.KITCHEN, p.getCategory());
        assertEquals("explicit", p.getProvenance().get("category"));
        assertEquals(1.1, p.getWeightKg(), 1e-9);
        assertEquals("explicit", p.getProvenance().get("weightKg"));
        assertTrue(p.getMaterials().contains("bamboo"));
        assertEquals("Vietnam", p.getOrigin());
        assertEquals("Sea freight", p.getShippingMethod());
        assertFalse(hasWarning(p, "WEIGHT_DEFAULTED"));
    }

    @Test
    public void aiHintsFillOnlyGaps() {
        ExtractionHints hints = new ExtractionHints();
        hints.setCleanedTitle("Desk Lamp");
        hints.setWeight(new ExtractionHints.WeightHint(900.0, "g"));
        hints.setMaterials(List.of("Aluminium alloy"));
        hints.setCategory("Home");

        NormalizedProduct p = normalizer.normalize(
                raw("B0TEST0003", "ACME LED Desk Lamp w/ USB 2 kg!!", "Office Products", null, null), hints);

        assertEquals("Desk Lamp", p.getTitle());
        assertEquals("ai", p.getProvenance().get("title"));
        // Rule-based values win over hints
        assertEquals(ProductCategory.OFFICE, p.getCategory());
        assertEquals(2.0, p.getWeightKg(), 1e-9);
        // Gap filled by AI
        assertEquals(Set.of("aluminum"), p.getMaterials());
        assertEquals("ai", p.getProvenance().get("materials"));
    }

    @Test
    public void invalidAiHintsAreRejectedWithWarning() {
        ExtractionHints hints = new ExtractionHints();
        hints.setWeight(new ExtractionHints.WeightHint(-3.0, "kg"));
        hints.setMaterials(List.of("unobtainium"));
        hints.setCategory("spaceships");

        NormalizedProduct p = normalizer.normalize(raw(null, "Mystery Gadget", null, null, null), hints);

        assertTrue(p.getWeightKg() > 0);
        assertEquals(3, p.getWarnings().stream().filter(w -> "AI_HINT_REJECTED".equals(w.getCode())).count());
        assertEquals(Set.of("mixed"), p.getMaterials());
    }

    @Test
    public void descriptionIsComposedFromTitleBrandAndText() {
        RawProduct r = raw(null, "Wool Socks", null, "Warm socks.", null);
        r.setBrand("Knitters");
        NormalizedProduct p = normalizer.normalize(r);

        assertEquals("Wool Socks by Knitters. Warm socks.", p.getDescription());
        assertEquals(ProductCategory.CLOTHING, p.getCategory());
        assertEquals("title_keyword", p.getProvenance().get("category"));
        assertTrue(p.getMaterials().contains("wool"));
    }

    @Test
    public void productRejectsNonPositiveWeight() {
        assertThrows(IllegalArgumentException.class,
                () -> new NormalizedProduct("x", ProductCategory.DEFAULT, 0.0, Set.of(), ""));
        assertThrows(IllegalArgumentException.class,
                () -> new NormalizedProduct("x", ProductCategory.DEFAULT, Double.NaN, Set.of(), ""));
    }
}
