/**
 *
 */
package org.theseed.forest.decision;

/**
 * This class contains a proposal for splitting a choice node.  The best splitter has the lowest weighted
 * impurity after the split.  Note that this is not a set-capable ordering, since two different split schemes
 * can compare equal.
 *
 * @author Bruce Parrello
 *
 */
public class Splitter implements Comparable<Splitter> {

    /** index of feature to split on */
    private int feature;
    /** type of the split feature */
    private ColumnType type;
    /** threshold or category to split on */
    private double limit;
    /** weighted impurity after the split */
    private double score;
    /** impurity gain */
    private double gain;
    /** left node count */
    private int leftCount;
    /** right node count */
    private int rightCount;
    /** null splitter, indicating do not split */
    public static final Splitter NULL = new Splitter();

    /**
     * Create a null splitter.
     */
    private Splitter() {
        this.feature = -1;
        this.type = ColumnType.ORDERED;
        this.score = Double.POSITIVE_INFINITY;
        this.gain = 0.0;
    }

    /**
     * Compute a split proposal from the left and right label counts.
     *
     * @param feature		index of the feature being used to split
     * @param type			type of the feature
     * @param limit			value to split on
     * @param impurity		impurity measure
     * @param oldImpurity	impurity at the current node
     * @param leftLabels	label counts on the left
     * @param rightLabels	label counts on the right
     *
     * @return the split proposal, or NULL if one side is empty
     */
    public static Splitter computeSplitter(int feature, ColumnType type, double limit, Impurity impurity,
            double oldImpurity, int[] leftLabels, int[] rightLabels) {
        Splitter retVal;
        int leftCount = (int) Impurity.total(leftLabels);
        int rightCount = (int) Impurity.total(rightLabels);
        if (leftCount <= 0 || rightCount <= 0)
            retVal = NULL;
        else {
            // Here we have a useful split.
            retVal = new Splitter();
            retVal.feature = feature;
            retVal.type = type;
            retVal.limit = limit;
            retVal.score = (impurity.compute(leftLabels) * leftCount + impurity.compute(rightLabels) * rightCount)
                    / (leftCount + rightCount);
            retVal.gain = oldImpurity - retVal.score;
            retVal.leftCount = leftCount;
            retVal.rightCount = rightCount;
        }
        return retVal;
    }

    /**
     * Here we sort better splits to the beginning, so a negative number is returned if
     * this is the better split.
     */
    @Override
    public int compareTo(Splitter o) {
        return Double.compare(this.score, o.score);
    }

    /**
     * @return TRUE if this split can replace the specified one as the best so far
     *
     * @param best		best split found so far
     */
    public boolean isBetter(Splitter best) {
        return (this != NULL && this.gain >= 0.0 && this.score < best.score);
    }

    /**
     * @return a choice node created from this splitter
     *
     * @param depth		depth of the new node
     */
    protected DecisionTree.ChoiceNode createNode(int depth) {
        return new DecisionTree.ChoiceNode(this.feature, this.type, this.limit, this.gain, depth);
    }

    /**
     * @return the index of the split feature
     */
    public int getFeature() {
        return this.feature;
    }

    /**
     * @return the split threshold or category
     */
    public double getLimit() {
        return this.limit;
    }

    /**
     * @return the type of the split feature
     */
    public ColumnType getType() {
        return this.type;
    }

    /**
     * @return the weighted impurity after the split
     */
    public double getScore() {
        return this.score;
    }

    /**
     * @return the impurity gain of the split
     */
    public double getGain() {
        return this.gain;
    }

    /**
     * @return the number of rows that would split left
     */
    public int getLeftCount() {
        return this.leftCount;
    }

    /**
     * @return the number of rows that would split right
     */
    public int getRightCount() {
        return this.rightCount;
    }

    /**
     * @return TRUE if the specified feature row would split left, else FALSE
     *
     * @param row		feature row to check
     */
    public boolean splitsLeft(double[] row) {
        return this.type.goesLeft(row[this.feature], this.limit);
    }

}
