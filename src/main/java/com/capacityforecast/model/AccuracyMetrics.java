package com.capacityforecast.model;

public record AccuracyMetrics(int sampleCount, Double mae, Double rmse, Double mape) {

    public static AccuracyMetrics of(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted lengths differ");
        }
        if (actual.length == 0) {
            return new AccuracyMetrics(0, null, null, null);
        }
        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;
        for (int i = 0; i < actual.length; i++) {
            double error = predicted[i] - actual[i];
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (actual[i] != 0.0d) {
                apeSum += Math.abs(error / actual[i]);
                apeCount++;
            }
        }
        double n = actual.length;
        Double mape = apeCount > 0 ? round((apeSum / apeCount) * 100.0) : null;
        return new AccuracyMetrics(actual.length, round(absErrorSum / n), round(Math.sqrt(squaredErrorSum / n)), mape);
    }

    public Double value(ErrorMetric metric) {
        return switch (metric) {
            case MAPE -> mape;
            case RMSE -> rmse;
            case MAE -> mae;
        };
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
