/**
 *
 */
package org.theseed.forest.decision;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A random forest is a set of decision trees, each trained on a randomly-selected sample of the full training
 * set.  An entire forest predicts an outcome by voting, with ties going to the lowest label.
 *
 * The trees are built in parallel.  Each tree gets its own seed, drawn in sequence from the forest's seed before
 * the parallel phase begins, so the result depends only on the seed and the number of trees.
 *
 * @author Bruce Parrello
 *
 */
public class RandomForest implements IClassifier {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RandomForest.class);
    /** offset added to a tree's sampling seed to get its feature-selection seed */
    private static final long TREE_SEED_OFFSET = 3719;
    /** hyperparameters */
    private final Parms parms;
    /** trees in this forest */
    private List<DecisionTree> trees;
    /** size of a label-count array */
    private int nLabels;
    /** number of input features */
    private int nFeatures;
    /** normalized feature importances */
    private double[] importances;

    /**
     * type of randomization
     *
     * BALANCED-- random with replacement, equal numbers of each class
     * RANDOM-- random with replacement (bootstrap)
     */
    public static enum Method {
        BALANCED {
            @Override
            IRandomizer create() {
                return new BalancedRandomizer();
            }

            @Override
            public String getDescription() {
                return "Class-balanced example sets with replacement.";
            }
        }, RANDOM {
            @Override
            IRandomizer create() {
                return new ReplacingRandomizer();
            }

            @Override
            public String getDescription() {
                return "Random example sets with replacement.";
            }
        };

        /**
         * @return a randomizer of the appropriate type
         */
        abstract IRandomizer create();

        /**
         * @return a description of this method
         */
        public abstract String getDescription();

    }

    /**
     * This class represents the hyperparameters for the random forest.  The tree parameters are shared by every
     * tree; the seed in the tree parameters is ignored, since each tree gets its own.
     */
    public static class Parms {

        /** number of trees */
        private int nTrees;
        /** type of randomization */
        private Method method;
        /** master random-number seed */
        private long seed;
        /** parameters for each tree */
        private TreeParms treeParms;

        /** parameter name for number of trees */
        public static final String N_ESTIMATORS = "nEstimators";
        /** parameter name for randomization method */
        public static final String METHOD = "method";

        /**
         * Construct hyperparameters with default values.
         */
        public Parms() {
            this.nTrees = 100;
            this.method = Method.RANDOM;
            this.seed = 0;
            this.treeParms = new TreeParms();
        }

        /**
         * Construct a copy of another hyperparameter object.
         *
         * @param other		object to copy
         */
        public Parms(Parms other) {
            this.nTrees = other.nTrees;
            this.method = other.method;
            this.seed = other.seed;
            this.treeParms = new TreeParms(other.treeParms);
        }

        /**
         * Set a parameter by name.  Tree parameters are passed through to the tree parameter object.
         *
         * @param name		name of the parameter
         * @param value		value to store
         *
         * @return TRUE if the parameter was recognized, else FALSE
         *
         * @throws IllegalArgumentException if the value is invalid for the parameter
         */
        public boolean configure(String name, Object value) {
            boolean retVal = true;
            switch (name) {
            case N_ESTIMATORS :
                this.setNumTrees(TreeParms.toInt(name, value));
                break;
            case METHOD :
                if (value instanceof Method)
                    this.setMethod((Method) value);
                else {
                    try {
                        this.setMethod(Method.valueOf(String.valueOf(value).toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid randomization method \"" + value + "\".");
                    }
                }
                break;
            case TreeParms.SEED :
                this.setSeed(TreeParms.toLong(name, value));
                break;
            default :
                retVal = this.treeParms.configure(name, value);
            }
            return retVal;
        }

        /**
         * @return the number of trees to build
         */
        public int getNumTrees() {
            return this.nTrees;
        }

        /**
         * Specify the number of trees to build.
         *
         * @param nTrees 	the number of trees to build
         */
        public Parms setNumTrees(int nTrees) {
            if (nTrees < 1)
                throw new IllegalArgumentException("Number of trees must be positive, but was " + nTrees + ".");
            this.nTrees = nTrees;
            return this;
        }

        /**
         * Specify the type of randomizer.
         *
         * @param method	randomization method
         */
        public Parms setMethod(Method method) {
            this.method = method;
            return this;
        }

        /**
         * @return the randomizing method
         */
        public Method getMethod() {
            return this.method;
        }

        /**
         * @return the master random-number seed
         */
        public long getSeed() {
            return this.seed;
        }

        /**
         * Specify the master random-number seed.
         *
         * @param seed		seed to use
         */
        public Parms setSeed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @return the parameters for each tree
         */
        public TreeParms getTreeParms() {
            return this.treeParms;
        }

        /**
         * Specify the parameters for each tree.
         *
         * @param treeParms		tree parameters to use
         */
        public Parms setTreeParms(TreeParms treeParms) {
            this.treeParms = new TreeParms(treeParms);
            return this;
        }

        @Override
        public String toString() {
            return "nEstimators=" + this.nTrees + ", method=" + this.method + ", " + this.treeParms;
        }

    }

    /**
     * Construct an untrained random forest.
     *
     * @param parms		hyperparameters
     */
    public RandomForest(Parms parms) {
        this.parms = new Parms(parms);
        this.trees = Collections.emptyList();
        this.importances = new double[0];
    }

    /**
     * Construct a forest based on the specified training set.
     *
     * @param dataset		training set to use
     * @param parms			hyper-parameters
     */
    public RandomForest(TabularData dataset, Parms parms) {
        this(parms);
        this.fit(dataset);
    }

    @Override
    public void fit(TabularData dataset) {
        int nTrees = this.parms.getNumTrees();
        IRandomizer randomizer = this.parms.getMethod().create();
        randomizer.initializeData(dataset);
        // Create an array of randomizer seeds.  This is sequential, so the seeds do not depend on scheduling.
        long[] seeds = new Random(this.parms.getSeed()).longs(nTrees).toArray();
        log.info("Building {} trees from {} rows.", nTrees, dataset.size());
        long start = System.currentTimeMillis();
        // Create the decision trees in the random forest.  An exception in any tree aborts the whole fit.
        List<DecisionTree> newTrees = IntStream.range(0, nTrees).parallel()
                .mapToObj(i -> this.buildTree(dataset, randomizer, seeds[i]))
                .collect(Collectors.toList());
        // Sum the feature importances and renormalize.
        double[] impact = new double[dataset.width()];
        for (DecisionTree tree : newTrees) {
            double[] treeImpact = tree.getImportanceArray();
            for (int i = 0; i < impact.length; i++)
                impact[i] += treeImpact[i];
        }
        double total = 0.0;
        for (double val : impact)
            total += val;
        if (total > 0.0) {
            for (int i = 0; i < impact.length; i++)
                impact[i] /= total;
        }
        // Install the new forest.
        this.trees = newTrees;
        this.nLabels = dataset.labelRange();
        this.nFeatures = dataset.width();
        this.importances = impact;
        log.info("Forest built in {} seconds.", (System.currentTimeMillis() - start) / 1000.0);
    }

    /**
     * Create a decision tree from a random sample of the rows in a dataset.  All the trees are built in
     * parallel, so this method must not modify any shared state.
     *
     * @param dataset		full training set
     * @param randomizer	sample selector
     * @param seed			seed for this tree
     *
     * @return a decision tree for the sampled subset
     */
    private DecisionTree buildTree(TabularData dataset, IRandomizer randomizer, long seed) {
        TabularData sample = dataset.subset(randomizer.getData(seed));
        TreeParms treeParms = new TreeParms(this.parms.getTreeParms()).setSeed(seed + TREE_SEED_OFFSET);
        return new DecisionTree(sample, treeParms);
    }

    @Override
    public int[] predict(INDArray features) {
        if (this.trees.isEmpty())
            throw new IllegalStateException("Random forest has not been trained.");
        if (features.rank() != 2 || features.columns() != this.nFeatures)
            throw new IllegalArgumentException("Feature array has " + features.columns()
                    + " columns but the model requires " + this.nFeatures + ".");
        double[][] rows = features.toDoubleMatrix();
        // Ask each tree to vote.
        int[][] votes = new int[rows.length][this.nLabels];
        for (DecisionTree tree : this.trees) {
            int[] predictions = tree.predict(rows);
            for (int r = 0; r < rows.length; r++)
                votes[r][predictions[r]]++;
        }
        int[] retVal = new int[rows.length];
        for (int r = 0; r < rows.length; r++)
            retVal[r] = DecisionTree.bestLabel(votes[r]);
        return retVal;
    }

    @Override
    public INDArray getFeatureImportances() {
        return Nd4j.create(this.importances.clone());
    }

    /**
     * @return the trees in this forest
     */
    public List<DecisionTree> getTrees() {
        return Collections.unmodifiableList(this.trees);
    }

    /**
     * @return the mean depth of the trees
     */
    public double getMeanDepth() {
        return this.trees.stream().mapToInt(DecisionTree::getMaxDepth).average().orElse(0.0);
    }

    /**
     * @return the mean number of nodes in the trees
     */
    public double getMeanNodeCount() {
        return this.trees.stream().mapToInt(DecisionTree::getNodeCount).average().orElse(0.0);
    }

    @Override
    public double getDepth() {
        return this.getMeanDepth();
    }

    @Override
    public double getSize() {
        return this.getMeanNodeCount();
    }

    /**
     * @return the hyperparameters of this forest
     */
    public Parms getParms() {
        return this.parms;
    }

}
