package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.model.ModelId;
import org.springframework.stereotype.Component;
import smile.base.cart.Loss;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

import java.util.Arrays;
import java.util.List;

/**
 * Gradient-boosted regression trees with least-squares loss over lag features.
 */
@Component
public class XgboostModel extends AbstractTreeModel {

    private static final String TARGET = "volume";

    @Override
    public ModelId id() {
        return ModelId.XGBOOST;
    }

    @Override
    protected Predictor train(LagFeatures features, LagFeatures.Matrix data, Hyperparameters params) {
        int trees = params.getInt(ModelDefaults.N_ESTIMATORS, 1);
        int maxDepth = params.getInt(ModelDefaults.MAX_DEPTH, 1);
        int maxNodes = params.getInt("max_nodes", 2);
        int nodeSize = params.getInt("node_size", 1);
        double shrinkage = params.getDouble("learning_rate", 1e-4, 1.0);
        double subsample = params.getDouble("subsample", 0.1, 1.0);
        long seed = params.getLong(ModelDefaults.SEED);

        String[] columns = columns(features.names());
        double[][] matrix = new double[data.y().length][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = Arrays.copyOf(data.x()[i], features.width() + 1);
            matrix[i][features.width()] = data.y()[i];
        }

        // MathEx keeps one generator per thread, so the seed only affects this fit.
        MathEx.setSeed(seed);
        GradientTreeBoost model = GradientTreeBoost.fit(Formula.lhs(TARGET), DataFrame.of(matrix, columns), Loss.ls(),
            trees, maxDepth, maxNodes, nodeSize, shrinkage, subsample);

        return row -> {
            double[] values = Arrays.copyOf(row, features.width() + 1);
            return model.predict(DataFrame.of(new double[][] {values}, columns).get(0));
        };
    }

    private static String[] columns(List<String> featureNames) {
        String[] columns = featureNames.toArray(new String[featureNames.size() + 1]);
        columns[featureNames.size()] = TARGET;
        return columns;
    }
}
