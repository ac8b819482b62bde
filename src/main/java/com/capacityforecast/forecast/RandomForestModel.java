package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.config.ModelDefaults;
import com.capacityforecast.exception.FitException;
import com.capacityforecast.model.ModelId;
import org.springframework.stereotype.Component;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Bagged regression trees over lag features. Training runs on a single execution slot with a
 * fixed seed so repeated fits on the same history are identical.
 */
@Component
public class RandomForestModel extends AbstractTreeModel {

    @Override
    public ModelId id() {
        return ModelId.RF;
    }

    @Override
    protected Predictor train(LagFeatures features, LagFeatures.Matrix data, Hyperparameters params) {
        int trees = params.getInt(ModelDefaults.N_ESTIMATORS, 1);
        int maxDepth = params.getInt(ModelDefaults.MAX_DEPTH, 0);
        int seed = params.getInt(ModelDefaults.SEED, 0);

        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : features.names()) {
            attributes.add(new Attribute(name));
        }
        attributes.add(new Attribute("volume"));
        Instances dataset = new Instances("capacity", attributes, data.y().length);
        dataset.setClassIndex(attributes.size() - 1);
        for (int i = 0; i < data.y().length; i++) {
            double[] row = Arrays.copyOf(data.x()[i], features.width() + 1);
            row[features.width()] = data.y()[i];
            dataset.add(new DenseInstance(1.0, row));
        }

        RandomForest forest = new RandomForest();
        forest.setNumIterations(trees);
        forest.setMaxDepth(maxDepth);
        forest.setSeed(seed);
        forest.setNumExecutionSlots(1);
        try {
            forest.buildClassifier(dataset);
        } catch (Exception ex) {
            throw new FitException("random forest training failed: " + ex.getMessage(), ex);
        }

        return row -> {
            double[] values = Arrays.copyOf(row, features.width() + 1);
            values[features.width()] = Utils.missingValue();
            DenseInstance instance = new DenseInstance(1.0, values);
            instance.setDataset(dataset);
            try {
                return forest.classifyInstance(instance);
            } catch (Exception ex) {
                throw new FitException("random forest prediction failed: " + ex.getMessage(), ex);
            }
        };
    }
}
