package com.example.fileingest.review;

/**
 * Criteria for listing pending reviews. Null customer or project matches everything.
 */
public record ReviewFilter(String customer, String project, double minConfidence, double maxConfidence) {

    public static ReviewFilter all() {
        return new ReviewFilter(null, null, 0.0, 1.0);
    }

    public ReviewFilter withCustomer(String value) {
        return new ReviewFilter(value, project, minConfidence, maxConfidence);
    }

    public ReviewFilter withProject(String value) {
        return new ReviewFilter(customer, value, minConfidence, maxConfidence);
    }

    public ReviewFilter withConfidence(double min, double max) {
        return new ReviewFilter(customer, project, min, max);
    }

    boolean matches(ReviewItem item) {
        if (customer != null && !customer.equals(item.customer())) {
            return false;
        }
        if (project != null && !project.equals(item.project())) {
            return false;
        }
        return item.confidence() >= minConfidence && item.confidence() <= maxConfidence;
    }
}
