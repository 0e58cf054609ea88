/**
 *
 */
package org.theseed.forest.decision;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * This object is used to determine the best split point for a feature in the decision tree.  The subclass
 * determines the candidate split values, and the base class evaluates each candidate.  Only a limited number
 * of candidates are tested for each feature.
 *
 * @author Bruce Parrello
 *
 */
public abstract class SplitPointFinder {

    // FIELDS
    /** impurity measure */
    private final Impurity impurity;
    /** maximum number of candidate values to test */
    private final int candidateLimit;
    /** size of a label-count array */
    private final int nLabels;

    /**
     * Construct a split point finder.
     *
     * @param impurity			impurity measure for scoring splits
     * @param candidateLimit	maximum number of candidate values to test
     * @param nLabels			one more than the highest label value
     */
    protected SplitPointFinder(Impurity impurity, int candidateLimit, int nLabels) {
        this.impurity = impurity;
        this.candidateLimit = candidateLimit;
        this.nLabels = nLabels;
    }

    /**
     * @return a split point finder for the specified column type
     *
     * @param type				column type
     * @param impurity			impurity measure for scoring splits
     * @param candidateLimit	maximum number of candidate values to test
     * @param nLabels			one more than the highest label value
     */
    public static SplitPointFinder create(ColumnType type, Impurity impurity, int candidateLimit, int nLabels) {
        SplitPointFinder retVal;
        switch (type) {
        case UNORDERED :
            retVal = new Categories(impurity, candidateLimit, nLabels);
            break;
        default :
            retVal = new Thresholds(impurity, candidateLimit, nLabels);
        }
        return retVal;
    }

    /**
     * @return the candidate split values for a list of feature values
     *
     * @param values	feature values for the rows being split
     */
    protected abstract double[] getCandidates(double[] values);

    /**
     * @return the column type handled by this finder
     */
    public abstract ColumnType getType();

    /**
     * @return the best splitter for the specified input feature, or NULL if no split is valid
     *
     * @param iFeature	index of the specified feature
     * @param data		feature rows for the whole training set
     * @param labels	labels for the whole training set
     * @param rows		indices of the rows at the current node
     * @param before	impurity at the current node
     */
    public Splitter computeSplit(int iFeature, double[][] data, int[] labels, int[] rows, double before) {
        Splitter retVal = Splitter.NULL;
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++)
            values[i] = data[rows[i]][iFeature];
        ColumnType type = this.getType();
        for (double limit : this.getCandidates(values)) {
            int[] leftLabels = new int[this.nLabels];
            int[] rightLabels = new int[this.nLabels];
            for (int i = 0; i < rows.length; i++) {
                int label = labels[rows[i]];
                if (type.goesLeft(values[i], limit))
                    leftLabels[label]++;
                else
                    rightLabels[label]++;
            }
            Splitter test = Splitter.computeSplitter(iFeature, type, limit, this.impurity, before,
                    leftLabels, rightLabels);
            if (test.isBetter(retVal))
                retVal = test;
        }
        return retVal;
    }

    /**
     * @return the maximum number of candidates
     */
    public int getCandidateLimit() {
        return this.candidateLimit;
    }

    /**
     * This finder splits ordered features on thresholds.  If there are too many distinct values, the
     * thresholds are taken at evenly-spaced percentiles.
     */
    public static class Thresholds extends SplitPointFinder {

        public Thresholds(Impurity impurity, int candidateLimit, int nLabels) {
            super(impurity, candidateLimit, nLabels);
        }

        @Override
        protected double[] getCandidates(double[] values) {
            double[] retVal = Arrays.stream(values).distinct().sorted().toArray();
            int limit = this.getCandidateLimit();
            if (retVal.length > limit) {
                Percentile computer = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
                computer.setData(values);
                double[] points = new double[limit];
                points[0] = retVal[0];
                for (int i = 1; i < limit; i++)
                    points[i] = computer.evaluate(i * 100.0 / (limit - 1));
                retVal = Arrays.stream(points).distinct().toArray();
            }
            return retVal;
        }

        @Override
        public ColumnType getType() {
            return ColumnType.ORDERED;
        }

    }

    /**
     * This finder splits unordered features on a single category.  If there are too many categories, only
     * the most frequent ones are tested.
     */
    public static class Categories extends SplitPointFinder {

        public Categories(Impurity impurity, int candidateLimit, int nLabels) {
            super(impurity, candidateLimit, nLabels);
        }

        @Override
        protected double[] getCandidates(double[] values) {
            Map<Double, Integer> counts = new LinkedHashMap<Double, Integer>();
            for (double value : values)
                counts.merge(value, 1, Integer::sum);
            List<Map.Entry<Double, Integer>> entries = new ArrayList<Map.Entry<Double, Integer>>(counts.entrySet());
            int limit = this.getCandidateLimit();
            if (entries.size() > limit) {
                // This is a stable sort, so equal counts stay in order of first appearance.
                entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
                entries = entries.subList(0, limit);
            }
            return entries.stream().mapToDouble(x -> x.getKey()).toArray();
        }

        @Override
        public ColumnType getType() {
            return ColumnType.UNORDERED;
        }

    }

}
