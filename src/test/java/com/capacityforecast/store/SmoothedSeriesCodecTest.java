package com.capacityforecast.store;

import com.capacityforecast.exception.InputException;
import com.capacityforecast.model.Granularity;
import com.capacityforecast.model.Series;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SmoothedSeriesCodecTest {

    private final SmoothedSeriesCodec codec = new SmoothedSeriesCodec();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void interchangeJson_isReadIntoSortedSeries() throws Exception {
        String json = """
            {"granularity":"MONTHLY","category":"Retail","records":[
              {"Date":"2024-02-01","Final_Smoothed_Value":120.5,"IQ_value":1.0},
              {"Date":"2024-01-01","Final_Smoothed_Value":100.0,"IQ_value":0.0}
            ]}
            """;

        Series series = codec.toSeries(objectMapper.readValue(json, SmoothedSeriesDocument.class));

        assertThat(series.getGranularity()).isEqualTo(Granularity.MONTHLY);
        assertThat(series.getCategory()).isEqualTo("Retail");
        assertThat(series.periods()).containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1));
        assertThat(series.values()).containsExactly(100.0, 120.5);
        assertThat(series.hasIqValues()).isTrue();
    }

    @Test
    void fromSeries_writesInterchangeFieldNames() throws Exception {
        Series series = codec.toSeries(SmoothedSeriesDocument.builder()
            .records(List.of(new SmoothedSeriesRecord(LocalDate.of(2024, 1, 1), 5.0, null)))
            .build());

        String json = objectMapper.writeValueAsString(codec.fromSeries(series, List.of(LocalDate.of(2024, 12, 25))));

        assertThat(json).contains("\"Date\":\"2024-01-01\"")
            .contains("\"Final_Smoothed_Value\":5.0")
            .doesNotContain("IQ_value")
            .contains("\"holidays\":[\"2024-12-25\"]");
    }

    @Test
    void duplicatePeriods_areRejected() {
        SmoothedSeriesDocument document = SmoothedSeriesDocument.builder()
            .records(List.of(
                new SmoothedSeriesRecord(LocalDate.of(2024, 1, 1), 1.0, null),
                new SmoothedSeriesRecord(LocalDate.of(2024, 1, 15), 2.0, null)))
            .build();

        assertThatThrownBy(() -> codec.toSeries(document))
            .isInstanceOf(InputException.class)
            .hasMessageContaining("Duplicate period");
    }

    @Test
    void missingValues_areRejected() {
        SmoothedSeriesDocument document = SmoothedSeriesDocument.builder()
            .records(List.of(new SmoothedSeriesRecord(LocalDate.of(2024, 1, 1), null, null)))
            .build();

        assertThatThrownBy(() -> codec.toSeries(document)).isInstanceOf(InputException.class);
    }
}
