package com.morphirbridge.core.format;

/**
 * The closed list of information a parse or migration is allowed to drop. Anything not listed
 * here must survive every migration.
 */
public enum CosmeticLoss {
    TYPE_ATTRIBUTES("type attribute annotations"),
    VALUE_ATTRIBUTES("value and pattern attribute annotations"),
    FORMAT_VERSION_LABEL("original spelling of formatVersion"),
    LAYOUT_HINT("document tree layout hint");

    private final String description;

    CosmeticLoss(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
