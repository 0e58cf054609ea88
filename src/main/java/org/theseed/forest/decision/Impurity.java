/**
 *
 */
package org.theseed.forest.decision;

/**
 * This enumeration describes the impurity measures available for evaluating splits.  Each measure is computed
 * from an array of label counts, where the index of each element is the label and the value is the number
 * of rows with that label.  Labels with a count of zero are not observed and do not participate.
 *
 * For exactly two observed classes GINI is computed as 2p(1-p), and ENTROPY is halved.  Prune limits are
 * calibrated to these magnitudes.
 *
 * @author Bruce Parrello
 *
 */
public enum Impurity {
    GINI {
        @Override
        public double compute(int[] counts) {
            double total = total(counts);
            double retVal;
            if (observed(counts) == 2) {
                double p = first(counts) / total;
                retVal = 2.0 * p * (1.0 - p);
            } else {
                retVal = 1.0;
                for (int count : counts) {
                    double p = count / total;
                    retVal -= p * p;
                }
            }
            return retVal;
        }
    }, ENTROPY {
        @Override
        public double compute(int[] counts) {
            double total = total(counts);
            double retVal = 0.0;
            for (int count : counts) {
                if (count > 0) {
                    double p = count / total;
                    retVal -= p * Math.log(p);
                }
            }
            return retVal / LOG2BASE / 2.0;
        }
    }, ERROR {
        @Override
        public double compute(int[] counts) {
            double total = total(counts);
            int max = 0;
            for (int count : counts) {
                if (count > max) max = count;
            }
            return 1.0 - max / total;
        }
    }, SQRT {
        @Override
        public double compute(int[] counts) {
            double retVal = 0.0;
            if (observed(counts) > 1) {
                double p = first(counts) / total(counts);
                retVal = Math.sqrt(p * (1.0 - p));
            }
            return retVal;
        }
    };

    /** log base 2 factor */
    private static final double LOG2BASE = Math.log(2.0);

    /**
     * @return the impurity of a set of rows with the specified label counts
     *
     * @param counts	array of label counts, indexed by label
     */
    public abstract double compute(int[] counts);

    /**
     * @return the impurity measure with the specified name
     *
     * @param name		name of the measure (case-insensitive)
     *
     * @throws IllegalArgumentException if the name is not a known measure
     */
    public static Impurity parse(String name) {
        Impurity retVal = null;
        for (Impurity type : Impurity.values()) {
            if (type.name().equalsIgnoreCase(name))
                retVal = type;
        }
        if (retVal == null)
            throw new IllegalArgumentException("Unknown impurity criterion \"" + name + "\".");
        return retVal;
    }

    /**
     * @return the total number of rows represented by a label-count array
     *
     * @param counts	array of label counts
     */
    protected static double total(int[] counts) {
        int retVal = 0;
        for (int count : counts)
            retVal += count;
        return retVal;
    }

    /**
     * @return the number of distinct labels observed in a label-count array
     *
     * @param counts	array of label counts
     */
    protected static int observed(int[] counts) {
        int retVal = 0;
        for (int count : counts) {
            if (count > 0) retVal++;
        }
        return retVal;
    }

    /**
     * @return the count for the lowest observed label
     *
     * @param counts	array of label counts
     */
    protected static int first(int[] counts) {
        int retVal = 0;
        for (int i = 0; i < counts.length && retVal == 0; i++)
            retVal = counts[i];
        return retVal;
    }

    @Override
    public String toString() {
        return this.name().toLowerCase();
    }

}
