/**
 *
 */
package org.theseed.forest.reports;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.commons.lang3.tuple.Pair;
import org.nd4j.evaluation.classification.ConfusionMatrix;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * This class contains static utilities for evaluating the predictions of a classifier.
 *
 * @author Bruce Parrello
 *
 */
public class ClassEvaluation {

    /**
     * @return the fraction of predictions that match the expected labels
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    public static double accuracy(int[] expected, int[] predicted) {
        checkLengths(expected, predicted);
        int good = 0;
        for (int i = 0; i < expected.length; i++) {
            if (expected[i] == predicted[i])
                good++;
        }
        return (expected.length == 0 ? 0.0 : good / (double) expected.length);
    }

    /**
     * @return the sorted list of labels found in either the expected or the predicted labels
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    public static List<Integer> labelList(int[] expected, int[] predicted) {
        SortedSet<Integer> labels = new TreeSet<Integer>();
        for (int label : expected)
            labels.add(label);
        for (int label : predicted)
            labels.add(label);
        return new ArrayList<Integer>(labels);
    }

    /**
     * @return a confusion matrix for a set of predictions
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    public static ConfusionMatrix<Integer> confusionMatrix(int[] expected, int[] predicted) {
        checkLengths(expected, predicted);
        ConfusionMatrix<Integer> retVal = new ConfusionMatrix<Integer>(labelList(expected, predicted));
        for (int i = 0; i < expected.length; i++)
            retVal.add(expected[i], predicted[i]);
        return retVal;
    }

    /**
     * @return the confusion matrix as a grid of counts, with rows for the expected labels and columns for the
     * 		   predicted labels, both in sorted label order
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    public static int[][] confusionCounts(int[] expected, int[] predicted) {
        ConfusionMatrix<Integer> matrix = confusionMatrix(expected, predicted);
        List<Integer> labels = matrix.getClasses();
        int n = labels.size();
        int[][] retVal = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++)
                retVal[i][j] = matrix.getCount(labels.get(i), labels.get(j));
        }
        return retVal;
    }

    /**
     * @return a list of feature names paired with their importances, most important first
     *
     * @param importances	feature importance vector
     * @param names			feature names, in column order
     */
    public static List<Pair<String, Double>> rankImpact(INDArray importances, List<String> names) {
        double[] values = importances.toDoubleVector();
        if (values.length != names.size())
            throw new IllegalArgumentException("There are " + values.length + " importances but " + names.size()
                    + " feature names.");
        List<Pair<String, Double>> retVal = new ArrayList<Pair<String, Double>>(values.length);
        for (int i = 0; i < values.length; i++)
            retVal.add(Pair.of(names.get(i), values[i]));
        retVal.sort(Comparator.comparing((Pair<String, Double> x) -> x.getRight()).reversed());
        return retVal;
    }

    /**
     * Verify that two label arrays are the same length.
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    private static void checkLengths(int[] expected, int[] predicted) {
        if (expected.length != predicted.length)
            throw new IllegalArgumentException("There are " + expected.length + " expected labels but "
                    + predicted.length + " predictions.");
    }

}
