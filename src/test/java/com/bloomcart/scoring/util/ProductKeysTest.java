package com.bloomcart.scoring.util;

import com.bloomcart.scoring.model.RawProduct;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProductKeysTest {

    @Test
    public void asinIsTrimmedAndUpperCased() {
        assertEquals("B08XYZ1234", ProductKeys.of(" b08xyz1234 ", "ignored"));
    }

    @Test
    public void titleKeyIsStableAcrossWhitespace() {
        String a = ProductKeys.of(null, "Bamboo Toothbrush");
        String b = ProductKeys.of("  ", "  Bamboo Toothbrush ");
        assertEquals(a, b);
        assertTrue(a.startsWith(ProductKeys.TITLE_PREFIX));
        assertEquals(ProductKeys.TITLE_PREFIX.length() + 64, a.length());
    }

    @Test
    public void canonicalLeavesTitleKeysAlone() {
        RawProduct raw = new RawProduct();
        raw.setTitle("Steel Bottle");
        String key = ProductKeys.of(raw);
        assertEquals(key, ProductKeys.canonical(key));
        assertEquals("B0ABC", ProductKeys.canonical("b0abc"));
    }
}
