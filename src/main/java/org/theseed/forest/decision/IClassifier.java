/**
 *
 */
package org.theseed.forest.decision;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * This interface describes a classification model that can be trained on a data set and then used to
 * predict labels.  The grid search uses it to evaluate both single trees and forests.
 *
 * @author Bruce Parrello
 *
 */
public interface IClassifier {

    /**
     * Train the model on a data set, replacing any previous training.
     *
     * @param dataset	training set
     */
    void fit(TabularData dataset);

    /**
     * @return the predicted label for each row of a feature array
     *
     * @param features	two-dimensional feature array, one row per example
     */
    int[] predict(INDArray features);

    /**
     * @return the normalized importance of each input feature
     */
    INDArray getFeatureImportances();

    /**
     * @return the depth of the model (the mean member depth for an ensemble)
     */
    double getDepth();

    /**
     * @return the number of nodes in the model (the mean member size for an ensemble)
     */
    double getSize();

}
