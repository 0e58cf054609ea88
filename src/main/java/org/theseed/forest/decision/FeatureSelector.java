/**
 *
 */
package org.theseed.forest.decision;

import java.util.Random;
import java.util.stream.IntStream;

/**
 * This object determines the list of features that should be examined at a decision tree node.  The subclass
 * determines how many features are wanted; the features themselves are chosen at random without replacement
 * using the tree's random-number generator.  The number chosen is always at least 1 and never more than the
 * number of features available.
 *
 * @author Bruce Parrello
 *
 */
public abstract class FeatureSelector {

    /** selector that uses every feature */
    public static final FeatureSelector ALL = new All();

    /**
     * @return the number of features to examine at each node
     *
     * @param nFeatures		number of features available
     */
    protected abstract int computeCount(int nFeatures);

    /**
     * @return the number of features to examine, clamped to the legal range
     *
     * @param nFeatures		number of features available
     */
    public int getCount(int nFeatures) {
        int retVal = this.computeCount(nFeatures);
        if (retVal < 1) retVal = 1;
        if (retVal > nFeatures) retVal = nFeatures;
        return retVal;
    }

    /**
     * @return the features to examine at a node
     *
     * @param nFeatures		number of features available
     * @param randomizer	random-number generator to use
     */
    public int[] getFeaturesToUse(int nFeatures, Random randomizer) {
        // Get all the possible feature indices in an array.
        int[] range = IntStream.range(0, nFeatures).toArray();
        int nSelect = this.getCount(nFeatures);
        int[] retVal;
        if (nSelect >= nFeatures)
            retVal = range;
        else {
            retVal = new int[nSelect];
            // Loop through the range array, picking random items.
            for (int i = 0; i < nSelect; i++) {
                int rand = randomizer.nextInt(nFeatures - i) + i;
                retVal[i] = range[rand];
                range[rand] = range[i];
            }
        }
        return retVal;
    }

    /**
     * @return a feature selector for a parameter value
     *
     * The value can be NULL or "all" (all features), "sqrt", "log2", an integer (fixed count), or a
     * floating-point fraction greater than 0 and no greater than 1.
     *
     * @param value		parameter value to convert
     *
     * @throws IllegalArgumentException if the value is not a valid selection policy
     */
    public static FeatureSelector parse(Object value) {
        FeatureSelector retVal;
        if (value == null)
            retVal = ALL;
        else if (value instanceof FeatureSelector)
            retVal = (FeatureSelector) value;
        else if (value instanceof Integer || value instanceof Long)
            retVal = new Fixed(((Number) value).intValue());
        else if (value instanceof Number)
            retVal = new Fraction(((Number) value).doubleValue());
        else {
            String string = value.toString().trim();
            switch (string.toLowerCase()) {
            case "all" :
                retVal = ALL;
                break;
            case "sqrt" :
                retVal = new Sqrt();
                break;
            case "log2" :
                retVal = new Log2();
                break;
            default :
                try {
                    if (string.contains("."))
                        retVal = new Fraction(Double.parseDouble(string));
                    else
                        retVal = new Fixed(Integer.parseInt(string));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid feature selection policy \"" + string + "\".");
                }
            }
        }
        return retVal;
    }

    /**
     * This selector uses all the features.
     */
    public static class All extends FeatureSelector {

        @Override
        protected int computeCount(int nFeatures) {
            return nFeatures;
        }

        @Override
        public String toString() {
            return "all";
        }

    }

    /**
     * This selector uses a fixed number of features.
     */
    public static class Fixed extends FeatureSelector {

        /** number of features to select */
        private int nSelect;

        /**
         * Construct a fixed-count selector.
         *
         * @param nSelect	number of features to select
         */
        public Fixed(int nSelect) {
            if (nSelect < 1)
                throw new IllegalArgumentException("Feature count must be positive, but was " + nSelect + ".");
            this.nSelect = nSelect;
        }

        @Override
        protected int computeCount(int nFeatures) {
            return this.nSelect;
        }

        @Override
        public String toString() {
            return Integer.toString(this.nSelect);
        }

    }

    /**
     * This selector uses the square root of the number of features.
     */
    public static class Sqrt extends FeatureSelector {

        @Override
        protected int computeCount(int nFeatures) {
            return (int) Math.sqrt(nFeatures);
        }

        @Override
        public String toString() {
            return "sqrt";
        }

    }

    /**
     * This selector uses the base-2 log of the number of features.
     */
    public static class Log2 extends FeatureSelector {

        @Override
        protected int computeCount(int nFeatures) {
            return (int) (Math.log(nFeatures) / Math.log(2.0));
        }

        @Override
        public String toString() {
            return "log2";
        }

    }

    /**
     * This selector uses a fraction of the features.
     */
    public static class Fraction extends FeatureSelector {

        /** fraction of the features to use */
        private double fraction;

        /**
         * Construct a fractional selector.
         *
         * @param fraction	fraction of the features to use
         */
        public Fraction(double fraction) {
            if (! (fraction > 0.0 && fraction <= 1.0))
                throw new IllegalArgumentException("Feature fraction must be greater than 0 and at most 1, but was "
                        + fraction + ".");
            this.fraction = fraction;
        }

        @Override
        protected int computeCount(int nFeatures) {
            return (int) (nFeatures * this.fraction);
        }

        @Override
        public String toString() {
            return Double.toString(this.fraction);
        }

    }

}
