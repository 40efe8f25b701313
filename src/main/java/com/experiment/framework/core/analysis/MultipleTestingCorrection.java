package com.experiment.framework.core.analysis;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Family-wise error corrections applied when more than one metric is tested.
 */
public enum MultipleTestingCorrection {

    BONFERRONI {
        @Override
        public double[] adjust(double[] pValues) {
            int m = pValues.length;
            return Arrays.stream(pValues).map(p -> Math.min(1.0, p * m)).toArray();
        }
    },

    /** Holm step-down; adjusted values are made monotone in the order of the raw p-values. */
    HOLM {
        @Override
        public double[] adjust(double[] pValues) {
            int m = pValues.length;
            Integer[] order = IntStream.range(0, m).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingDouble(i -> pValues[i]));
            double[] adjusted = new double[m];
            double runningMax = 0.0;
            for (int rank = 0; rank < m; rank++) {
                int index = order[rank];
                double candidate = Math.min(1.0, (m - rank) * pValues[index]);
                runningMax = Math.max(runningMax, candidate);
                adjusted[index] = runningMax;
            }
            return adjusted;
        }
    },

    NONE {
        @Override
        public double[] adjust(double[] pValues) {
            return pValues.clone();
        }
    };

    /**
     * Adjusted p-values, in the same order as the input.
     */
    public abstract double[] adjust(double[] pValues);

    public static MultipleTestingCorrection fromName(String name) {
        for (MultipleTestingCorrection correction : values()) {
            if (correction.name().equalsIgnoreCase(name)) {
                return correction;
            }
        }
        throw new IllegalArgumentException("Unknown multiple testing correction: " + name
                + ". Available: " + Arrays.toString(values()));
    }
}
