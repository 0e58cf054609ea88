/**
 *
 */
package org.theseed.forest.search;

import java.util.Comparator;

/**
 * This object contains the cross-validation result for a single hyperparameter combination:  the mean accuracy,
 * model depth, and model size across the folds.
 *
 * @author Bruce Parrello
 *
 */
public class SearchResult {

    // FIELDS
    /** index of the combination in the grid */
    private final int idx;
    /** hyperparameter combination */
    private final HyperParameters parms;
    /** mean validation accuracy */
    private final double accuracy;
    /** mean model depth */
    private final double depth;
    /** mean model node count */
    private final double size;
    /** validation accuracy for each fold */
    private final double[] foldAccuracies;

    /**
     * Ordering that puts the preferred result first:  highest accuracy, then lowest depth, then lowest size.
     */
    public static final Comparator<SearchResult> PREFERENCE = Comparator.comparingDouble(SearchResult::getAccuracy)
            .reversed().thenComparingDouble(SearchResult::getDepth).thenComparingDouble(SearchResult::getSize);

    /**
     * Construct a search result.
     *
     * @param idx				index of the combination in the grid
     * @param parms				hyperparameter combination
     * @param accuracy			mean validation accuracy
     * @param depth				mean model depth
     * @param size				mean model node count
     * @param foldAccuracies	validation accuracy for each fold
     */
    public SearchResult(int idx, HyperParameters parms, double accuracy, double depth, double size,
            double[] foldAccuracies) {
        this.idx = idx;
        this.parms = parms;
        this.accuracy = accuracy;
        this.depth = depth;
        this.size = size;
        this.foldAccuracies = foldAccuracies.clone();
    }

    /**
     * @return the index of the combination in the grid
     */
    public int getIdx() {
        return this.idx;
    }

    /**
     * @return the hyperparameter combination
     */
    public HyperParameters getParms() {
        return this.parms;
    }

    /**
     * @return the mean validation accuracy
     */
    public double getAccuracy() {
        return this.accuracy;
    }

    /**
     * @return the mean model depth
     */
    public double getDepth() {
        return this.depth;
    }

    /**
     * @return the mean model node count
     */
    public double getSize() {
        return this.size;
    }

    /**
     * @return the validation accuracy for each fold
     */
    public double[] getFoldAccuracies() {
        return this.foldAccuracies.clone();
    }

    @Override
    public String toString() {
        return String.format("[%s] accuracy=%6.4f, depth=%4.2f, nodes=%4.2f", this.parms, this.accuracy,
                this.depth, this.size);
    }

}
