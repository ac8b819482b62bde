package com.capacityforecast.forecast;

/**
 * Unclipped model output, one entry per horizon step.
 */
record RawForecast(double[] mean, double[] lower, double[] upper) {

    RawForecast {
        if (mean.length != lower.length || mean.length != upper.length) {
            throw new IllegalArgumentException("Forecast arrays differ in length");
        }
    }

    static RawForecast symmetric(double[] mean, double sigma, double z, boolean widening) {
        double[] lower = new double[mean.length];
        double[] upper = new double[mean.length];
        for (int h = 0; h < mean.length; h++) {
            double spread = z * sigma * (widening ? Math.sqrt(h + 1.0) : 1.0);
            lower[h] = mean[h] - spread;
            upper[h] = mean[h] + spread;
        }
        return new RawForecast(mean, lower, upper);
    }
}
