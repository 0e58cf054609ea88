/**
 *
 */
package org.theseed.forest.reports;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.TextStringBuilder;
import org.nd4j.evaluation.classification.ConfusionMatrix;

/**
 * This report computes the precision, recall, F1 score, and support for each label in a set of predictions,
 * along with a support-weighted average.  A statistic whose denominator is zero is reported as zero.
 *
 * @author Bruce Parrello
 *
 */
public class ClassificationReport {

    // FIELDS
    /** labels, in sorted order */
    private final List<Integer> labels;
    /** precision for each label */
    private final double[] precision;
    /** recall for each label */
    private final double[] recall;
    /** F1 score for each label */
    private final double[] f1;
    /** number of expected occurrences of each label */
    private final int[] support;
    /** overall accuracy */
    private final double accuracy;

    /**
     * Compute the report for a set of predictions.
     *
     * @param expected		expected labels
     * @param predicted		predicted labels
     */
    public ClassificationReport(int[] expected, int[] predicted) {
        ConfusionMatrix<Integer> matrix = ClassEvaluation.confusionMatrix(expected, predicted);
        this.labels = matrix.getClasses();
        int n = this.labels.size();
        this.precision = new double[n];
        this.recall = new double[n];
        this.f1 = new double[n];
        this.support = new int[n];
        for (int i = 0; i < n; i++) {
            Integer label = this.labels.get(i);
            int truePositive = matrix.getCount(label, label);
            int actual = matrix.getActualTotal(label);
            int guessed = matrix.getPredictedTotal(label);
            this.precision[i] = ratio(truePositive, guessed);
            this.recall[i] = ratio(truePositive, actual);
            double denom = this.precision[i] + this.recall[i];
            this.f1[i] = (denom > 0.0 ? 2.0 * this.precision[i] * this.recall[i] / denom : 0.0);
            this.support[i] = actual;
        }
        this.accuracy = ClassEvaluation.accuracy(expected, predicted);
    }

    /**
     * @return a ratio, or 0 if the denominator is 0
     *
     * @param num		numerator
     * @param denom		denominator
     */
    private static double ratio(int num, int denom) {
        return (denom == 0 ? 0.0 : num / (double) denom);
    }

    /**
     * @return the support-weighted mean of a per-label statistic
     *
     * @param stats		array of per-label statistics
     */
    private double weighted(double[] stats) {
        double total = 0.0;
        int count = 0;
        for (int i = 0; i < stats.length; i++) {
            total += stats[i] * this.support[i];
            count += this.support[i];
        }
        return (count == 0 ? 0.0 : total / count);
    }

    /**
     * @return the labels in the report
     */
    public List<Integer> getLabels() {
        return this.labels;
    }

    /**
     * @return the precision for the label at the specified position
     *
     * @param i		position of the label in the label list
     */
    public double getPrecision(int i) {
        return this.precision[i];
    }

    /**
     * @return the recall for the label at the specified position
     *
     * @param i		position of the label in the label list
     */
    public double getRecall(int i) {
        return this.recall[i];
    }

    /**
     * @return the F1 score for the label at the specified position
     *
     * @param i		position of the label in the label list
     */
    public double getF1(int i) {
        return this.f1[i];
    }

    /**
     * @return the support for the label at the specified position
     *
     * @param i		position of the label in the label list
     */
    public int getSupport(int i) {
        return this.support[i];
    }

    /**
     * @return the support-weighted mean precision
     */
    public double getWeightedPrecision() {
        return this.weighted(this.precision);
    }

    /**
     * @return the support-weighted mean recall
     */
    public double getWeightedRecall() {
        return this.weighted(this.recall);
    }

    /**
     * @return the support-weighted mean F1 score
     */
    public double getWeightedF1() {
        return this.weighted(this.f1);
    }

    /**
     * @return the total support
     */
    public int getTotalSupport() {
        int retVal = 0;
        for (int count : this.support)
            retVal += count;
        return retVal;
    }

    /**
     * @return the overall accuracy
     */
    public double getAccuracy() {
        return this.accuracy;
    }

    @Override
    public String toString() {
        String boundary = StringUtils.repeat('-', 54);
        TextStringBuilder buffer = new TextStringBuilder(60 * (this.labels.size() + 6));
        buffer.appendln("%12s %10s %10s %10s %8s", "label", "precision", "recall", "f1", "support");
        buffer.appendln(boundary);
        for (int i = 0; i < this.labels.size(); i++)
            buffer.appendln("%12d %10.4f %10.4f %10.4f %8d", this.labels.get(i), this.precision[i], this.recall[i],
                    this.f1[i], this.support[i]);
        buffer.appendln(boundary);
        buffer.appendln("%12s %10s %10s %10.4f %8d", "accuracy", "", "", this.accuracy, this.getTotalSupport());
        buffer.appendln("%12s %10.4f %10.4f %10.4f %8d", "weighted avg", this.getWeightedPrecision(),
                this.getWeightedRecall(), this.getWeightedF1(), this.getTotalSupport());
        return buffer.toString();
    }

}
