/**
 *
 */
package org.theseed.forest.decision;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * This class represents the hyperparameters for a single decision tree.  The setters return the object
 * itself so that calls can be chained.  Parameters can also be set by name, which is how the grid search
 * applies a parameter combination.
 *
 * @author Bruce Parrello
 *
 */
public class TreeParms {

    // FIELDS
    /** maximum tree depth, or UNLIMITED */
    private int maxDepth;
    /** minimum number of rows required to split a node */
    private int minSplit;
    /** impurity measure */
    private Impurity impurity;
    /** minimum impurity gain required to keep a split */
    private double pruneLimit;
    /** feature subsampling policy */
    private FeatureSelector selector;
    /** maximum number of split candidates tested per feature */
    private int candidateLimit;
    /** seed for the tree's random-number generator */
    private long seed;

    /** maximum-depth value indicating no limit */
    public static final int UNLIMITED = -1;
    /** default maximum number of split candidates per feature */
    public static final int DEFAULT_CANDIDATE_LIMIT = 10;

    /** parameter name for maximum depth */
    public static final String MAX_DEPTH = "maxDepth";
    /** parameter name for minimum split size */
    public static final String MIN_SPLIT = "minSplit";
    /** parameter name for impurity criterion */
    public static final String CRITERION = "criterion";
    /** parameter name for prune limit */
    public static final String PRUNE_LIMIT = "pruneLimit";
    /** parameter name for feature subsampling */
    public static final String MAX_FEATURES = "maxFeatures";
    /** parameter name for candidate limit */
    public static final String CANDIDATE_LIMIT = "candidateLimit";
    /** parameter name for random seed */
    public static final String SEED = "seed";

    /**
     * Construct hyperparameters with default values.
     */
    public TreeParms() {
        this.maxDepth = UNLIMITED;
        this.minSplit = 2;
        this.impurity = Impurity.GINI;
        this.pruneLimit = 0.0;
        this.selector = FeatureSelector.ALL;
        this.candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        this.seed = 0;
    }

    /**
     * Construct a copy of another hyperparameter object.
     *
     * @param other		object to copy
     */
    public TreeParms(TreeParms other) {
        this.maxDepth = other.maxDepth;
        this.minSplit = other.minSplit;
        this.impurity = other.impurity;
        this.pruneLimit = other.pruneLimit;
        this.selector = other.selector;
        this.candidateLimit = other.candidateLimit;
        this.seed = other.seed;
    }

    /**
     * Set a parameter by name.
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
        case MAX_DEPTH :
            this.setMaxDepth(value == null ? UNLIMITED : toInt(name, value));
            break;
        case MIN_SPLIT :
            this.setMinSplit(toInt(name, value));
            break;
        case CRITERION :
            this.setImpurity(value instanceof Impurity ? (Impurity) value : Impurity.parse(String.valueOf(value)));
            break;
        case PRUNE_LIMIT :
            this.setPruneLimit(toDouble(name, value));
            break;
        case MAX_FEATURES :
            this.setSelector(FeatureSelector.parse(value));
            break;
        case CANDIDATE_LIMIT :
            this.setCandidateLimit(toInt(name, value));
            break;
        case SEED :
            this.setSeed(toLong(name, value));
            break;
        default :
            retVal = false;
        }
        return retVal;
    }

    /**
     * @return the integer value of a parameter
     *
     * @param name		parameter name, for error messages
     * @param value		parameter value
     */
    public static int toInt(String name, Object value) {
        int retVal;
        if (value instanceof Integer || value instanceof Long || value instanceof Short)
            retVal = ((Number) value).intValue();
        else if (value != null && NumberUtils.isDigits(StringUtils.removeStart(value.toString().trim(), "-")))
            retVal = Integer.parseInt(value.toString().trim());
        else
            throw new IllegalArgumentException("Parameter " + name + " requires an integer, but was \"" + value + "\".");
        return retVal;
    }

    /**
     * @return the long integer value of a parameter
     *
     * @param name		parameter name, for error messages
     * @param value		parameter value
     */
    public static long toLong(String name, Object value) {
        long retVal;
        if (value instanceof Integer || value instanceof Long || value instanceof Short)
            retVal = ((Number) value).longValue();
        else if (value != null && NumberUtils.isDigits(StringUtils.removeStart(value.toString().trim(), "-")))
            retVal = Long.parseLong(value.toString().trim());
        else
            throw new IllegalArgumentException("Parameter " + name + " requires an integer, but was \"" + value + "\".");
        return retVal;
    }

    /**
     * @return the floating-point value of a parameter
     *
     * @param name		parameter name, for error messages
     * @param value		parameter value
     */
    public static double toDouble(String name, Object value) {
        double retVal;
        if (value instanceof Number)
            retVal = ((Number) value).doubleValue();
        else if (value != null && NumberUtils.isCreatable(value.toString().trim()))
            retVal = NumberUtils.createDouble(value.toString().trim());
        else
            throw new IllegalArgumentException("Parameter " + name + " requires a number, but was \"" + value + "\".");
        return retVal;
    }

    /**
     * @return the maximum tree depth, or UNLIMITED
     */
    public int getMaxDepth() {
        return this.maxDepth;
    }

    /**
     * Specify the maximum tree depth.
     *
     * @param maxDepth 	the depth to set, or UNLIMITED
     */
    public TreeParms setMaxDepth(int maxDepth) {
        if (maxDepth < 0 && maxDepth != UNLIMITED)
            throw new IllegalArgumentException("Invalid maximum depth " + maxDepth + ".");
        this.maxDepth = maxDepth;
        return this;
    }

    /**
     * @return TRUE if the tree depth is limited
     */
    public boolean hasMaxDepth() {
        return this.maxDepth != UNLIMITED;
    }

    /**
     * @return the minimum number of rows required to split a node
     */
    public int getMinSplit() {
        return this.minSplit;
    }

    /**
     * Specify the minimum number of rows required to split a node.
     *
     * @param minSplit 	the minimum to set
     */
    public TreeParms setMinSplit(int minSplit) {
        if (minSplit < 1)
            throw new IllegalArgumentException("Invalid minimum split size " + minSplit + ".");
        this.minSplit = minSplit;
        return this;
    }

    /**
     * @return the impurity measure
     */
    public Impurity getImpurity() {
        return this.impurity;
    }

    /**
     * Specify the impurity measure.
     *
     * @param impurity 	the measure to use
     */
    public TreeParms setImpurity(Impurity impurity) {
        this.impurity = impurity;
        return this;
    }

    /**
     * @return the minimum impurity gain required to keep a split
     */
    public double getPruneLimit() {
        return this.pruneLimit;
    }

    /**
     * Specify the minimum impurity gain required to keep a split.
     *
     * @param pruneLimit 	the limit to set
     */
    public TreeParms setPruneLimit(double pruneLimit) {
        this.pruneLimit = pruneLimit;
        return this;
    }

    /**
     * @return the feature subsampling policy
     */
    public FeatureSelector getSelector() {
        return this.selector;
    }

    /**
     * Specify the feature subsampling policy.
     *
     * @param selector 	the policy to use
     */
    public TreeParms setSelector(FeatureSelector selector) {
        this.selector = selector;
        return this;
    }

    /**
     * @return the maximum number of split candidates per feature
     */
    public int getCandidateLimit() {
        return this.candidateLimit;
    }

    /**
     * Specify the maximum number of split candidates per feature.
     *
     * @param candidateLimit 	the limit to set
     */
    public TreeParms setCandidateLimit(int candidateLimit) {
        if (candidateLimit < 2)
            throw new IllegalArgumentException("Candidate limit must be at least 2, but was " + candidateLimit + ".");
        this.candidateLimit = candidateLimit;
        return this;
    }

    /**
     * @return the random-number seed
     */
    public long getSeed() {
        return this.seed;
    }

    /**
     * Specify the random-number seed.
     *
     * @param seed 	the seed to set
     */
    public TreeParms setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    @Override
    public String toString() {
        return "maxDepth=" + (this.hasMaxDepth() ? Integer.toString(this.maxDepth) : "none") + ", minSplit="
                + this.minSplit + ", criterion=" + this.impurity + ", pruneLimit=" + this.pruneLimit
                + ", maxFeatures=" + this.selector;
    }

}
