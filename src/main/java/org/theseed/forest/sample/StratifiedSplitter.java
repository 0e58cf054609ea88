/**
 *
 */
package org.theseed.forest.sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.decision.TabularData;

/**
 * This object splits a set of rows into a training set and a testing set, preserving the proportion of each
 * stratification value in both parts.  The rows of each stratum are shuffled and the first portion of each
 * stratum goes to the testing set.  The two resulting index sets are then shuffled separately.
 *
 * @author Bruce Parrello
 *
 */
public class StratifiedSplitter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StratifiedSplitter.class);
    /** fraction of each stratum to put in the testing set */
    private final double testFraction;
    /** random-number generator */
    private final Random rand;

    /**
     * This class holds the result of a split.
     */
    public static class Result {

        /** training row indices */
        private final int[] train;
        /** testing row indices */
        private final int[] test;

        private Result(int[] train, int[] test) {
            this.train = train;
            this.test = test;
        }

        /**
         * @return the training row indices
         */
        public int[] getTrain() {
            return this.train.clone();
        }

        /**
         * @return the testing row indices
         */
        public int[] getTest() {
            return this.test.clone();
        }

    }

    /**
     * Construct a stratified splitter.
     *
     * @param testFraction	fraction of each stratum to put in the testing set
     * @param seed			random-number seed
     */
    public StratifiedSplitter(double testFraction, long seed) {
        if (! (testFraction > 0.0 && testFraction < 1.0))
            throw new IllegalArgumentException("Test fraction must be strictly between 0 and 1, but was "
                    + testFraction + ".");
        this.testFraction = testFraction;
        this.rand = new Random(seed);
    }

    /**
     * Split a set of rows by stratum.
     *
     * @param strata	stratification value for each row
     *
     * @return the training and testing row indices
     */
    public Result split(int[] strata) {
        // Group the row indices by stratum.
        SortedMap<Integer, List<Integer>> groups = new TreeMap<Integer, List<Integer>>();
        for (int i = 0; i < strata.length; i++)
            groups.computeIfAbsent(strata[i], k -> new ArrayList<Integer>()).add(i);
        List<Integer> trainList = new ArrayList<Integer>(strata.length);
        List<Integer> testList = new ArrayList<Integer>(strata.length);
        for (List<Integer> group : groups.values()) {
            int[] rows = group.stream().mapToInt(Integer::intValue).toArray();
            Shuffler.shuffle(rows, this.rand);
            int nTest = (int) Math.round(rows.length * this.testFraction);
            for (int i = 0; i < rows.length; i++) {
                if (i < nTest)
                    testList.add(rows[i]);
                else
                    trainList.add(rows[i]);
            }
        }
        int[] train = trainList.stream().mapToInt(Integer::intValue).toArray();
        int[] test = testList.stream().mapToInt(Integer::intValue).toArray();
        Shuffler.shuffle(train, this.rand);
        Shuffler.shuffle(test, this.rand);
        log.debug("Stratified split produced {} training rows and {} testing rows from {} strata.", train.length,
                test.length, groups.size());
        return new Result(train, test);
    }

    /**
     * Split a data set into training and testing sets, stratified by label.
     *
     * @param dataset	data set to split
     *
     * @return a two-element array containing the training set and the testing set
     */
    public TabularData[] split(TabularData dataset) {
        Result result = this.split(dataset.getLabels());
        if (result.train.length == 0 || result.test.length == 0)
            throw new IllegalArgumentException("Data set of " + dataset.size() + " rows is too small to split at "
                    + this.testFraction + ".");
        return new TabularData[] { dataset.subset(result.train), dataset.subset(result.test) };
    }

}
