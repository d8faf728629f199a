package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Weka dataset layout shared by every model handle: one numeric attribute
 * per feature column followed by the nominal {@code decision} class, whose
 * values follow {@link Decision} declaration order.
 */
public final class WekaSchema {

    public static final String RELATION = "governance";
    public static final String CLASS_ATTRIBUTE = "decision";
    public static final int CLASS_INDEX = FeatureVector.DIMENSIONS;

    private WekaSchema() {
    }

    /**
     * Fresh, empty dataset with the class index set.
     */
    public static Instances emptyDataset(int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(FeatureVector.DIMENSIONS + 1);
        for (String name : FeatureVector.FEATURE_NAMES) {
            attributes.add(new Attribute(name));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE, new ArrayList<>(Decision.LABELS)));
        Instances dataset = new Instances(RELATION, attributes, capacity);
        dataset.setClassIndex(CLASS_INDEX);
        return dataset;
    }

    public static Instances dataset(List<LabeledSample> samples) {
        Instances dataset = emptyDataset(samples.size());
        for (LabeledSample sample : samples) {
            dataset.add(labeled(sample.features(), sample.label(), dataset));
        }
        return dataset;
    }

    /**
     * Unlabeled instance bound to {@code header}, for inference.
     */
    public static Instance unlabeled(double[] features, Instances header) {
        checkWidth(features);
        double[] values = new double[FeatureVector.DIMENSIONS + 1];
        System.arraycopy(features, 0, values, 0, FeatureVector.DIMENSIONS);
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        instance.setClassMissing();
        return instance;
    }

    public static Instance labeled(double[] features, Decision label, Instances header) {
        checkWidth(features);
        double[] values = new double[FeatureVector.DIMENSIONS + 1];
        System.arraycopy(features, 0, values, 0, FeatureVector.DIMENSIONS);
        values[CLASS_INDEX] = label.index();
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }

    private static void checkWidth(double[] features) {
        if (features == null || features.length != FeatureVector.DIMENSIONS) {
            throw new IllegalArgumentException("Expected " + FeatureVector.DIMENSIONS + " features, got "
                    + (features == null ? "null" : features.length));
        }
    }
}
