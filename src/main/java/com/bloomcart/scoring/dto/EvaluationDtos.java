package com.bloomcart.scoring.dto;

import com.bloomcart.scoring.model.ProductEvaluation;
import com.bloomcart.scoring.model.RawProduct;
import com.bloomcart.scoring.service.cache.ScoringCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class EvaluationDtos {
    /** One evaluation and whether it was served from the store */
    public static class EvaluateResponse {
        private ProductEvaluation evaluation;
        private boolean cached;

        public EvaluateResponse() {}

        public EvaluateResponse(ProductEvaluation evaluation, boolean cached) {
            this.evaluation = evaluation;
            this.cached = cached;
        }

        public static EvaluateResponse from(ScoringCoordinator.Result result) {
            return new EvaluateResponse(result.getEvaluation(), result.isCached());
        }

        public ProductEvaluation getEvaluation() { return evaluation; }
        public void setEvaluation(ProductEvaluation evaluation) { this.evaluation = evaluation; }
        public boolean isCached() { return cached; }
        public void setCached(boolean cached) { this.cached = cached; }
    }

    public static class BatchRequest {
        @NotNull
        @NotEmpty
        @Valid
        private List<RawProduct> products;

        public List<RawProduct> getProducts() { return products; }
        public void setProducts(List<RawProduct> products) { this.products = products; }
    }

    /** Batch results, in request order */
    public static class BatchResponse {
        private int count;
        private int cached_count; // served from the store without computing
        private List<EvaluateResponse> results;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public int getCached_count() { return cached_count; }
        public void setCached_count(int cached_count) { this.cached_count = cached_count; }
        public List<EvaluateResponse> getResults() { return results; }
        public void setResults(List<EvaluateResponse> results) { this.results = results; }
    }
}
