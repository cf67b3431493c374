package com.questrail.synop.model;

/**
 * Qualifier attached to an open-ended or bounded value.
 */
public enum Quantifier
{
    IS_LESS("isLess"),
    IS_GREATER("isGreater"),
    IS_GREATER_OR_EQUAL("isGreaterOrEqual");

    private final String label;

    Quantifier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
