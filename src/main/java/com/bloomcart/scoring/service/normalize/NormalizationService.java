package com.bloomcart.scoring.service.normalize;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.model.NormalizedProduct;
import com.bloomcart.scoring.model.RawProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reactive entry point of normalization. Fetches AI hints when the extractor is
 * enabled and hands them to the synchronous {@link Normalizer}; any extractor
 * failure degrades to rule-only normalization.
 */
@Service
public class NormalizationService {
    private static final Logger log = LoggerFactory.getLogger(NormalizationService.class);

    private final Normalizer normalizer;
    private final AiProductExtractor extractor;
    private final Duration extractionTimeout;

    @Autowired
    public NormalizationService(AiProductExtractor extractor, AppProperties appProperties) {
        this(new Normalizer(), extractor, Duration.ofMillis(appProperties.getExtractionTimeoutMs()));
    }

    public NormalizationService(Normalizer normalizer, AiProductExtractor extractor, Duration extractionTimeout) {
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.extractionTimeout = extractionTimeout;
    }

    public Mono<NormalizedProduct> normalize(RawProduct raw) {
        if (extractor == null || !extractor.isEnabled()) {
            return Mono.fromCallable(() -> normalizer.normalize(raw));
        }
        return extractor.extract(raw)
                .timeout(extractionTimeout)
                .onErrorResume(e -> {
                    log.warn("AI extraction failed for {}, using rule-based normalization: {}",
                            raw != null ? raw.getProductKey() : null, e.toString());
                    return Mono.empty();
                })
                .defaultIfEmpty(ExtractionHints.none())
                .map(hints -> normalizer.normalize(raw, hints));
    }
}
