package com.bloomcart.scoring.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Represents a product record as scraped from a retailer product page.
 * This is the initial data structure before any normalization or scoring.
 *
 * <p>Every field may be absent. The scraper produces whatever the page exposed:
 * <ul>
 *   <li>Product key (ASIN or catalog SKU), used for caching and deduplication</li>
 *   <li>Title, brand and free-text description</li>
 *   <li>Category text, either a department name or a breadcrumb trail</li>
 *   <li>Detail table rows (e.g. "Item Weight", "Country of Origin")</li>
 * </ul>
 *
 * <p>This class serves as the input to the normalization step and should not
 * be modified during processing. Normalized values live in {@link NormalizedProduct}.
 *
 * @see NormalizedProduct
 * @see com.bloomcart.scoring.service.normalize.Normalizer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawProduct {
    /** ASIN or catalog SKU as scraped; canonicalized by ProductKeys */
    @JsonAlias({"asin", "product_key"})
    private String productKey;

    /** Product title as displayed on the page */
    private String title;

    /** Brand or byline text */
    private String brand;

    /** Department name or breadcrumb trail ("Electronics › Headphones › Earbuds") */
    private String category;

    /** Free-text description or feature bullets */
    private String description;

    /** Detail table rows, label to value */
    private Map<String, String> details;

    public RawProduct() {}

    public String getProductKey() { return productKey; }
    public void setProductKey(String productKey) { this.productKey = productKey; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Map<String, String> getDetails() { return details; }
    public void setDetails(Map<String, String> details) { this.details = details; }
}
