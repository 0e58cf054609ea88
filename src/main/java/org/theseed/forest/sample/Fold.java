/**
 *
 */
package org.theseed.forest.sample;

/**
 * This object represents a single fold of a cross-validation.  It contains the indices of the training rows and
 * the indices of the validation rows.
 *
 * @author Bruce Parrello
 *
 */
public class Fold {

    // FIELDS
    /** index of this fold */
    private final int idx;
    /** training row indices */
    private final int[] train;
    /** validation row indices */
    private final int[] test;

    /**
     * Construct a fold.
     *
     * @param idx		index of this fold (0-based)
     * @param train		training row indices
     * @param test		validation row indices
     */
    public Fold(int idx, int[] train, int[] test) {
        this.idx = idx;
        this.train = train;
        this.test = test;
    }

    /**
     * @return the index of this fold
     */
    public int getIdx() {
        return this.idx;
    }

    /**
     * @return the training row indices
     */
    public int[] getTrain() {
        return this.train.clone();
    }

    /**
     * @return the validation row indices
     */
    public int[] getTest() {
        return this.test.clone();
    }

    @Override
    public String toString() {
        return "Fold " + (this.idx + 1) + " (" + this.train.length + " training, " + this.test.length + " validation)";
    }

}
