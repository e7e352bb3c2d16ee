package com.klubtool.backend.modules.committee.domain;

/**
 * Committee kinds, displayed by their German designation. The label doubles as calendar badge.
 */
public enum CommitteeType {
    AUSSCHUSS("Ausschuss"),
    KOMMISSION("Kommission");

    private final String label;

    CommitteeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
