package com.capacityforecast.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One uploaded row, kept as text until {@code SeriesNormalizer} parses it.
 */
public record RawRecord(
    @JsonProperty("date") @JsonAlias({"Date", "ds"}) String date,
    @JsonProperty("volume") @JsonAlias({"Volume", "y", "value"}) String volume,
    @JsonProperty("category") @JsonAlias("Category") String category,
    @JsonProperty("iqValue") @JsonAlias({"IQ_value", "iq_value"}) String iqValue
) {

    public static RawRecord of(String date, String volume) {
        return new RawRecord(date, volume, null, null);
    }
}
