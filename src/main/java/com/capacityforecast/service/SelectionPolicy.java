package com.capacityforecast.service;

/**
 * How a single forecast is picked from an orchestrator run.
 */
public enum SelectionPolicy {
    /** Top of the accuracy ranking. */
    BEST,
    /** Period-wise mean of the top N ranked results. */
    MEAN_OF_TOP_N
}
