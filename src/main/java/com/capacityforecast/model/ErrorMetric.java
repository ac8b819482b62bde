package com.capacityforecast.model;

public enum ErrorMetric {
    MAPE,
    RMSE,
    MAE
}
