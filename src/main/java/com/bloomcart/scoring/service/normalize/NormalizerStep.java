package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.RawProduct;

/**
 * Interface for deterministic steps of the normalization pipeline.
 *
 * <p>Each step reads the raw record and fills fields of the shared
 * {@link NormalizationDraft} that are still unset. Steps run in a fixed order
 * and must be:
 * <ul>
 *   <li><strong>deterministic</strong> - same input always produces same output</li>
 *   <li><strong>total</strong> - any field of the raw record may be null; a step never throws</li>
 *   <li><strong>non-destructive</strong> - never overwrite a field an earlier step has set</li>
 * </ul>
 *
 * @see Normalizer
 * @see NormalizationDraft
 */
public interface NormalizerStep {
    /**
     * Checks if this step has anything to read in the given product.
     *
     * @param raw The raw product data to check
     * @return true if this step can contribute, false otherwise
     */
    boolean supports(RawProduct raw);

    /**
     * Reads the raw product and fills unset fields of the draft, recording
     * provenance and warnings on it.
     *
     * @param raw The raw product data as scraped
     * @param draft The working state shared by all steps
     */
    void apply(RawProduct raw, NormalizationDraft draft);

    default String getName() {
        return this.getClass().getSimpleName();
    }
}
