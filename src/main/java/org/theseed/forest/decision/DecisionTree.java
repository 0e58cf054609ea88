/**
 *
 */
package org.theseed.forest.decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.TextStringBuilder;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A decision tree is a data structure that can be used to classify an item based on a set of features.  Each
 * choice node of the tree specifies a feature and a split value.  For an ordered feature, values less than or
 * equal to the threshold are classified on the left and those greater than the threshold on the right.  For an
 * unordered feature, values equal to the split category go left and all others go right.  At the leaf level an
 * output class is specified.
 *
 * The tree is grown by recursive best-first splitting.  A node becomes a leaf if it is too deep, too small, or
 * pure, if no valid split exists, or if the best split does not improve impurity by at least the prune limit.
 *
 * @author Bruce Parrello
 *
 */
public class DecisionTree implements IClassifier {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DecisionTree.class);
    /** hyperparameters */
    private final TreeParms parms;
    /** number of features */
    private int nFeatures;
    /** root node, or NULL if the tree is not trained */
    private Node root;
    /** number of nodes in tree */
    private int size;
    /** depth of the deepest node */
    private int depth;
    /** normalized feature importances */
    private double[] importances;

    /**
     * This nested class represents a tree node.
     */
    public static abstract class Node {

        /** depth of this node (0 for the root) */
        private final int depth;

        protected Node(int depth) {
            this.depth = depth;
        }

        /**
         * @return the depth of this node
         */
        public int getDepth() {
            return this.depth;
        }

        /**
         * @return TRUE if this is a leaf
         */
        public abstract boolean isLeaf();

    }

    /**
     * This is a decision node, with two children.
     */
    public static class ChoiceNode extends Node {

        /** index of deciding feature */
        private final int iFeature;
        /** type of the deciding feature */
        private final ColumnType type;
        /** threshold (inclusive on the left) or category (equal on the left) */
        private final double limit;
        /** impurity gain */
        private final double gain;
        /** left child */
        private Node left;
        /** right child */
        private Node right;

        /**
         * Create a new node with the specified decision criteria.
         *
         * @param iFeat		index of deciding feature
         * @param type		type of the deciding feature
         * @param lim		split threshold or category
         * @param gain		impurity gain
         * @param depth		depth of this node
         */
        protected ChoiceNode(int iFeat, ColumnType type, double lim, double gain, int depth) {
            super(depth);
            this.iFeature = iFeat;
            this.type = type;
            this.limit = lim;
            this.gain = gain;
            this.left = null;
            this.right = null;
        }

        /**
         * @return the child of this node relevant to the specified input row
         *
         * @param row	feature values of the row
         */
        public Node choose(double[] row) {
            return (this.type.goesLeft(row[this.iFeature], this.limit) ? this.left : this.right);
        }

        /**
         * Attach the fully-built children.
         *
         * @param left 		the left-side child node
         * @param right		the right-side child node
         */
        protected void setChildren(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        /**
         * @return the left-side child
         */
        public Node getLeft() {
            return this.left;
        }

        /**
         * @return the right-side child
         */
        public Node getRight() {
            return this.right;
        }

        /**
         * @return the impurity gain for this node
         */
        public double getGain() {
            return this.gain;
        }

        /**
         * @return the decision feature index for this node
         */
        public int getFeatureIdx() {
            return this.iFeature;
        }

        /**
         * @return the type of the decision feature
         */
        public ColumnType getType() {
            return this.type;
        }

        /**
         * @return the split threshold or category
         */
        public double getLimit() {
            return this.limit;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public String toString() {
            return "ChoiceNode@" + Integer.toHexString(System.identityHashCode(this)) +
                    "[iFeature=" + this.iFeature + ", " + this.type.getOperator() + " " + this.limit + "]";
        }

    }

    /**
     * This class represents a leaf node.
     */
    public static class LeafNode extends Node {

        /** index of predicted class */
        private final int iClass;

        /**
         * Construct a leaf node.
         *
         * @param iClass	index of class decided by leaf node
         * @param depth		depth of this node
         */
        protected LeafNode(int iClass, int depth) {
            super(depth);
            this.iClass = iClass;
        }

        /**
         * @return the class decided by this leaf
         */
        public int getiClass() {
            return this.iClass;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public String toString() {
            return "LeafNode@" + Integer.toHexString(System.identityHashCode(this)) +
                    "[iClass=" + this.iClass + "]";
        }

    }

    /**
     * This class holds the working state for a single growth run.  It is discarded when the tree is built.
     */
    private class Grower {

        /** feature rows */
        private final double[][] data;
        /** labels */
        private final int[] labels;
        /** size of a label-count array */
        private final int nLabels;
        /** split point finder for each column */
        private final SplitPointFinder[] finders;
        /** random-number generator for feature selection */
        private final Random randomizer;
        /** accumulated importance of each feature */
        private final double[] impact;
        /** number of nodes built */
        private int count;
        /** depth of deepest node */
        private int deepest;

        /**
         * Set up to grow a tree.
         *
         * @param dataset	training set
         */
        protected Grower(TabularData dataset) {
            this.data = dataset.toMatrix();
            this.labels = dataset.getLabels();
            this.nLabels = dataset.labelRange();
            Impurity impurity = DecisionTree.this.parms.getImpurity();
            int limit = DecisionTree.this.parms.getCandidateLimit();
            this.finders = new SplitPointFinder[dataset.width()];
            for (int i = 0; i < this.finders.length; i++)
                this.finders[i] = SplitPointFinder.create(dataset.getType(i), impurity, limit, this.nLabels);
            this.randomizer = new Random(DecisionTree.this.parms.getSeed());
            this.impact = new double[dataset.width()];
            this.count = 0;
            this.deepest = 0;
        }

        /**
         * Recursively compute the tree node for a set of rows.
         *
         * @param rows		indices of the rows to be classified by this node
         * @param depth		depth of the node in question
         *
         * @return a node for deciding this set
         */
        protected Node computeNode(int[] rows, int depth) {
            Node retVal;
            this.count++;
            if (depth > this.deepest) this.deepest = depth;
            TreeParms parms = DecisionTree.this.parms;
            int[] counts = this.countLabels(rows);
            // Is this a leaf?
            if (parms.hasMaxDepth() && depth >= parms.getMaxDepth() || rows.length < parms.getMinSplit()
                    || Impurity.observed(counts) <= 1) {
                retVal = new LeafNode(bestLabel(counts), depth);
            } else {
                double before = parms.getImpurity().compute(counts);
                // Find the best split among the selected features.
                Splitter best = Splitter.NULL;
                for (int i : parms.getSelector().getFeaturesToUse(this.finders.length, this.randomizer)) {
                    Splitter test = this.finders[i].computeSplit(i, this.data, this.labels, rows, before);
                    if (test.compareTo(best) < 0)
                        best = test;
                }
                if (best == Splitter.NULL || best.getGain() < parms.getPruneLimit()) {
                    // Either no split was possible or the best one is not worth keeping.
                    retVal = new LeafNode(bestLabel(counts), depth);
                } else {
                    ChoiceNode newNode = best.createNode(depth);
                    this.impact[best.getFeature()] += best.getGain();
                    // Split the incoming rows.
                    int[] left = new int[best.getLeftCount()];
                    int[] right = new int[best.getRightCount()];
                    int l = 0;
                    int r = 0;
                    for (int row : rows) {
                        if (best.splitsLeft(this.data[row]))
                            left[l++] = row;
                        else
                            right[r++] = row;
                    }
                    Node leftNode = this.computeNode(left, depth + 1);
                    Node rightNode = this.computeNode(right, depth + 1);
                    newNode.setChildren(leftNode, rightNode);
                    retVal = newNode;
                }
            }
            return retVal;
        }

        /**
         * @return the label counts for a set of rows
         *
         * @param rows		indices of the rows to count
         */
        private int[] countLabels(int[] rows) {
            int[] retVal = new int[this.nLabels];
            for (int row : rows)
                retVal[this.labels[row]]++;
            return retVal;
        }

    }

    /**
     * Create an untrained decision tree.
     *
     * @param parms		hyperparameters
     */
    public DecisionTree(TreeParms parms) {
        this.parms = new TreeParms(parms);
        this.root = null;
        this.size = 0;
        this.depth = 0;
        this.nFeatures = 0;
        this.importances = new double[0];
    }

    /**
     * Create a decision tree for the specified dataset.
     *
     * @param dataset	dataset to use for training the tree
     * @param parms		hyperparameters
     */
    public DecisionTree(TabularData dataset, TreeParms parms) {
        this(parms);
        this.fit(dataset);
    }

    @Override
    public void fit(TabularData dataset) {
        Grower grower = this.new Grower(dataset);
        int[] rows = new int[dataset.size()];
        for (int i = 0; i < rows.length; i++)
            rows[i] = i;
        Node newRoot = grower.computeNode(rows, 0);
        // Normalize the feature importances.
        double[] impact = grower.impact;
        double total = 0.0;
        for (double val : impact)
            total += val;
        if (total > 0.0) {
            for (int i = 0; i < impact.length; i++)
                impact[i] /= total;
        }
        // Install the new tree.
        this.nFeatures = dataset.width();
        this.root = newRoot;
        this.size = grower.count;
        this.depth = grower.deepest;
        this.importances = impact;
        log.debug("Tree fit on {} rows: {} nodes, depth {}.", rows.length, this.size, this.depth);
    }

    /**
     * @return the index of the most popular label in a label-count array, with ties going to the lowest label
     *
     * @param counts	array of label counts
     */
    public static int bestLabel(int[] counts) {
        int retVal = 0;
        int max = -1;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > max) {
                retVal = i;
                max = counts[i];
            }
        }
        return retVal;
    }

    /**
     * @return the predicted label for the specified data row
     *
     * @param row		feature values of the row
     */
    public int predict(double[] row) {
        Node current = this.getRoot();
        while (current instanceof ChoiceNode) {
            ChoiceNode curr = (ChoiceNode) current;
            current = curr.choose(row);
        }
        LeafNode curr = (LeafNode) current;
        return curr.getiClass();
    }

    @Override
    public int[] predict(INDArray features) {
        return this.predict(this.checkFeatures(features));
    }

    /**
     * @return the predicted labels for an array of feature rows
     *
     * @param rows		feature rows to classify
     */
    public int[] predict(double[][] rows) {
        int[] retVal = new int[rows.length];
        for (int i = 0; i < rows.length; i++)
            retVal[i] = this.predict(rows[i]);
        return retVal;
    }

    /**
     * @return the feature array as primitive rows, after verifying it is compatible with this tree
     *
     * @param features		feature array to check
     */
    protected double[][] checkFeatures(INDArray features) {
        this.getRoot();
        if (features.rank() != 2 || features.columns() != this.nFeatures)
            throw new IllegalArgumentException("Feature array has shape " + StringUtils.join(features.shape(), 'x')
                    + " but the model requires " + this.nFeatures + " columns.");
        return features.toDoubleMatrix();
    }

    @Override
    public INDArray getFeatureImportances() {
        return Nd4j.create(this.importances.clone());
    }

    /**
     * @return the normalized feature importances as a primitive array
     */
    public double[] getImportanceArray() {
        return this.importances.clone();
    }

    /**
     * @return the root node of the tree
     *
     * @throws IllegalStateException if the tree has not been trained
     */
    public Node getRoot() {
        if (this.root == null)
            throw new IllegalStateException("Decision tree has not been trained.");
        return this.root;
    }

    /**
     * @return TRUE if the tree has been trained
     */
    public boolean isTrained() {
        return this.root != null;
    }

    /**
     * @return the depth of the deepest node (0 for a single leaf)
     */
    public int getMaxDepth() {
        return this.depth;
    }

    /**
     * @return the number of nodes in the tree
     */
    public int getNodeCount() {
        return this.size;
    }

    @Override
    public double getDepth() {
        return this.depth;
    }

    @Override
    public double getSize() {
        return this.size;
    }

    /**
     * @return the hyperparameters of this tree
     */
    public TreeParms getParms() {
        return this.parms;
    }

    /**
     * @return a text rendering of the tree, one node per line, indented by depth
     *
     * @param names		names of the features (if NULL, the feature indices are used)
     */
    public String describe(List<String> names) {
        List<String> featureNames = names;
        if (featureNames == null) {
            featureNames = new ArrayList<String>(this.nFeatures);
            for (int i = 0; i < this.nFeatures; i++)
                featureNames.add("x" + i);
        }
        TextStringBuilder buffer = new TextStringBuilder(40 * this.size);
        this.describe(buffer, this.getRoot(), featureNames, "");
        return buffer.toString();
    }

    /**
     * Add the description of a subtree to a text buffer.
     *
     * @param buffer	output buffer
     * @param node		root of the subtree
     * @param names		feature names
     * @param prefix	prefix for the node's line
     */
    private void describe(TextStringBuilder buffer, Node node, List<String> names, String prefix) {
        String indent = StringUtils.repeat("    ", node.getDepth());
        if (node.isLeaf())
            buffer.appendln("%s%sclass %d", indent, prefix, ((LeafNode) node).getiClass());
        else {
            ChoiceNode choice = (ChoiceNode) node;
            buffer.appendln("%s%s%s %s %s (gain %6.4f)", indent, prefix, names.get(choice.getFeatureIdx()),
                    choice.getType().getOperator(), formatLimit(choice.getLimit()), choice.getGain());
            this.describe(buffer, choice.getLeft(), names, "T: ");
            this.describe(buffer, choice.getRight(), names, "F: ");
        }
    }

    /**
     * @return a compact string for a split value
     *
     * @param limit		split value to format
     */
    private static String formatLimit(double limit) {
        String retVal;
        if (limit == Math.rint(limit) && Math.abs(limit) < 1e15)
            retVal = Long.toString((long) limit);
        else
            retVal = Double.toString(limit);
        return retVal;
    }

}
