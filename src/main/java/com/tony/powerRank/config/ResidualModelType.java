package com.tony.powerRank.config;

public enum ResidualModelType {
    GRADIENT_BOOSTING,
    RANDOM_FOREST,
    LINEAR
}
