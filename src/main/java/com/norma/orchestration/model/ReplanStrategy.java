package com.norma.orchestration.model;

public enum ReplanStrategy {
    REFINE_AND_RESTRICT_SEARCH("Narrow the search to the priority documents and more specific terms"),
    CHANGE_KEYWORDS("Search again with different keywords"),
    FORM_NEW_HYPOTHESIS("Form a new hypothesis about where the answer is stated"),
    FORM_CALCULATION_STEP("Add a calculation step over the facts already gathered");

    private final String label;

    ReplanStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
