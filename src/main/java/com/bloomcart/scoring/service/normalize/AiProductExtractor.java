package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.model.RawProduct;
import reactor.core.publisher.Mono;

/**
 * Optional AI collaborator that suggests structured attributes for a scraped product.
 * Implementations may fail or time out; {@link NormalizationService} absorbs both.
 */
public interface AiProductExtractor {

    boolean isEnabled();

    Mono<ExtractionHints> extract(RawProduct raw);
}
