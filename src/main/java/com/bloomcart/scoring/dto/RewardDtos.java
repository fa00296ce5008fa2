package com.bloomcart.scoring.dto;

public class RewardDtos {
    /** Exactly one of grade or productKey; grade wins when both are present */
    public static class ApplyRequest {
        private String grade; // letter grade, e.g. "B"
        private String productKey; // ASIN or title: key of an evaluated product

        public String getGrade() { return grade; }
        public void setGrade(String grade) { this.grade = grade; }
        public String getProductKey() { return productKey; }
        public void setProductKey(String productKey) { this.productKey = productKey; }
    }
}
