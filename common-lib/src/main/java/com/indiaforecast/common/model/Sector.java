package com.indiaforecast.common.model;

/**
 * Development sectors tracked by the dashboard. Display names match the labels
 * used in source documents and search terms.
 */
public enum Sector {
    ECONOMY("Economy"),
    ENERGY("Energy"),
    INFRASTRUCTURE("Infrastructure"),
    TECHNOLOGY("Technology"),
    AGRICULTURE("Agriculture"),
    EDUCATION("Education"),
    HEALTHCARE("Healthcare"),
    ENVIRONMENT("Environment"),
    SOCIAL_DEVELOPMENT("Social Development");

    private final String displayName;

    Sector(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves either the enum constant name ({@code SOCIAL_DEVELOPMENT}) or the display
     * name ({@code Social Development}), ignoring case.
     *
     * @throws IllegalArgumentException when nothing matches
     */
    public static Sector fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Sector label must not be null");
        }
        String trimmed = label.trim();
        for (Sector sector : values()) {
            if (sector.name().equalsIgnoreCase(trimmed) || sector.displayName.equalsIgnoreCase(trimmed)) {
                return sector;
            }
        }
        throw new IllegalArgumentException("Unknown sector: " + label);
    }
}
