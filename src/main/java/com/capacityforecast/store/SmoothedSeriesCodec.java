package com.capacityforecast.store;

import com.capacityforecast.exception.InputException;
import com.capacityforecast.model.Series;
import com.capacityforecast.model.TimePoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Converts between {@link Series} and the smoothed-series interchange document.
 */
@Component
public class SmoothedSeriesCodec {

    public Series toSeries(SmoothedSeriesDocument document) {
        List<SmoothedSeriesRecord> records = new ArrayList<>(document.getRecords());
        for (SmoothedSeriesRecord record : records) {
            if (record == null || record.date() == null || record.finalSmoothedValue() == null
                || !Double.isFinite(record.finalSmoothedValue())) {
                throw new InputException("Smoothed series records need a Date and a finite Final_Smoothed_Value");
            }
        }
        records.sort(Comparator.comparing(SmoothedSeriesRecord::date));
        List<TimePoint> points = new ArrayList<>(records.size());
        LocalDate previous = null;
        for (SmoothedSeriesRecord record : records) {
            LocalDate period = document.getGranularity().align(record.date());
            if (period.equals(previous)) {
                throw new InputException("Duplicate period in smoothed series: " + period);
            }
            points.add(new TimePoint(period, record.finalSmoothedValue(), document.getCategory(), record.iqValue()));
            previous = period;
        }
        return new Series(document.getGranularity(), document.getCategory(), points);
    }

    public SmoothedSeriesDocument fromSeries(Series series, Collection<LocalDate> holidays) {
        List<SmoothedSeriesRecord> records = series.getPoints().stream()
            .map(p -> new SmoothedSeriesRecord(p.period(), p.value(), p.iqFlag()))
            .toList();
        return SmoothedSeriesDocument.builder()
            .granularity(series.getGranularity())
            .category(series.getCategory())
            .records(records)
            .holidays(holidays == null ? List.of() : holidays.stream().sorted().toList())
            .build();
    }
}
