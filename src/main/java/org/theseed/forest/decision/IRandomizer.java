/**
 *
 */
package org.theseed.forest.decision;

/**
 * This interface defines the functions required by a randomizer for choosing the training data in a random forest.
 * There is a preparation function and then a function that gets the individual sample for each tree.  That last
 * function is executed in parallel, and must be coded accordingly.
 *
 * @author Bruce Parrello
 *
 */
public interface IRandomizer {

    /**
     * Initialize for building a random forest.
     *
     * @param trainingSet	input training set
     */
    public void initializeData(TabularData trainingSet);

    /**
     * @return the indices of the training rows for a particular tree
     *
     * @param seed		seed for random-number generator
     */
    public int[] getData(long seed);

}
