package com.govcomms.collector.dto;

public enum AssetKind {
    MONTHLY_COUNTS("monthly_counts"),
    ROLLING_AVERAGE("rolling_average"),
    WORD_FREQUENCIES("word_frequencies");

    private final String value;

    AssetKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Only the time series get a chart image.
     */
    public boolean hasChart() {
        return this != WORD_FREQUENCIES;
    }
}
