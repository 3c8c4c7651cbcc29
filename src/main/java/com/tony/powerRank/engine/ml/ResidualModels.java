package com.tony.powerRank.engine.ml;

import com.tony.powerRank.config.MlConfig;

public final class ResidualModels {

    private ResidualModels() {
    }

    public static ResidualModel create(MlConfig config) {
        return switch (config.getModel()) {
            case RANDOM_FOREST -> new RandomForestRegressor(
                    config.getForestTrees(),
                    config.getForestMaxDepth(),
                    config.getForestMinSamplesLeaf(),
                    config.getSeed());
            case LINEAR -> new LinearResidualModel();
            case GRADIENT_BOOSTING -> new GradientBoostedRegressor(
                    config.getTrees(),
                    config.getMaxDepth(),
                    config.getLearningRate(),
                    config.getSubsample(),
                    config.getMinSamplesLeaf(),
                    config.getSeed());
        };
    }
}
