package com.z254.arbiter.drift;

import com.z254.arbiter.domain.model.FeatureVector;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-sample Kolmogorov-Smirnov statistic per feature column; the aggregate
 * score is their mean.
 */
public class KolmogorovSmirnovDriftCalculator implements DriftScoreCalculator {

    private final KolmogorovSmirnovTest test = new KolmogorovSmirnovTest();

    @Override
    public DriftScore score(DriftWindows windows) {
        List<String> names = FeatureVector.FEATURE_NAMES;
        Map<String, Double> perFeature = new LinkedHashMap<>();
        double total = 0.0;
        for (int column = 0; column < names.size(); column++) {
            double statistic = test.kolmogorovSmirnovStatistic(
                    column(windows.reference(), column),
                    column(windows.current(), column));
            perFeature.put(names.get(column), statistic);
            total += statistic;
        }
        return new DriftScore(total / names.size(), perFeature);
    }

    private static double[] column(double[][] rows, int index) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][index];
        }
        return values;
    }
}
