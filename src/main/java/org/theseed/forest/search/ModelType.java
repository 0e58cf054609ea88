/**
 *
 */
package org.theseed.forest.search;

import org.theseed.forest.decision.DecisionTree;
import org.theseed.forest.decision.IClassifier;
import org.theseed.forest.decision.RandomForest;
import org.theseed.forest.decision.TreeParms;

/**
 * This defines the type of a model.  The model type is used to create a fresh, untrained model from a set of
 * named hyperparameters.
 *
 * TREE			a single decision tree
 *
 * FOREST		a random forest of decision trees
 *
 * @author Bruce Parrello
 *
 */
public enum ModelType {
    TREE {
        @Override
        public IClassifier create(HyperParameters parms) {
            TreeParms treeParms = new TreeParms();
            for (String name : parms.getNames()) {
                if (! treeParms.configure(name, parms.get(name)))
                    throw new IllegalArgumentException("Invalid decision tree parameter " + name + ".");
            }
            return new DecisionTree(treeParms);
        }

        @Override
        public String getDescription() {
            return "Decision Tree";
        }
    }, FOREST {
        @Override
        public IClassifier create(HyperParameters parms) {
            RandomForest.Parms forestParms = new RandomForest.Parms();
            for (String name : parms.getNames()) {
                if (! forestParms.configure(name, parms.get(name)))
                    throw new IllegalArgumentException("Invalid random forest parameter " + name + ".");
            }
            return new RandomForest(forestParms);
        }

        @Override
        public String getDescription() {
            return "Random Forest";
        }
    };

    /**
     * @return an untrained model with the specified hyperparameters
     *
     * @param parms		hyperparameters for the model
     *
     * @throws IllegalArgumentException if a parameter is unknown or has an invalid value
     */
    public abstract IClassifier create(HyperParameters parms);

    /**
     * @return a description of this model type
     */
    public abstract String getDescription();

}
