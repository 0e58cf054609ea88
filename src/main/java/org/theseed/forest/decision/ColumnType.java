/**
 *
 */
package org.theseed.forest.decision;

/**
 * This enumeration describes how the values in a feature column can be compared.  An ordered column holds
 * numbers that can be compared with a threshold.  An unordered column holds category codes that can only
 * be tested for equality.
 *
 * @author Bruce Parrello
 *
 */
public enum ColumnType {
    /** numeric column, split on a threshold */
    ORDERED {
        @Override
        public boolean goesLeft(double value, double splitValue) {
            return (value <= splitValue);
        }

        @Override
        public String getOperator() {
            return "<=";
        }
    },
    /** categorical column, split on a single category */
    UNORDERED {
        @Override
        public boolean goesLeft(double value, double splitValue) {
            return (value == splitValue);
        }

        @Override
        public String getOperator() {
            return "==";
        }
    };

    /**
     * @return TRUE if a row with the specified value belongs on the left side of a split
     *
     * @param value			feature value of the row
     * @param splitValue	threshold or category of the split
     */
    public abstract boolean goesLeft(double value, double splitValue);

    /**
     * @return the comparison operator used when describing a split of this type
     */
    public abstract String getOperator();

}
