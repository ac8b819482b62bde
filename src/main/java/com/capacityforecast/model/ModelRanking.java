package com.capacityforecast.model;

public record ModelRanking(int rank, ModelId modelId, double score) {}
