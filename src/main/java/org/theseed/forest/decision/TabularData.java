/**
 *
 */
package org.theseed.forest.decision;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * This object contains a training or testing set for the decision models.  It consists of a two-dimensional
 * feature array (one row per example, one column per feature), a label for each row, and a type for each
 * column.  Categorical columns contain category codes; they are only ever compared for equality.
 *
 * The object is immutable.  Subsets are created as new objects.
 *
 * @author Bruce Parrello
 *
 */
public class TabularData {

    // FIELDS
    /** feature array */
    private final INDArray features;
    /** label for each row */
    private final int[] labels;
    /** type of each column */
    private final ColumnType[] types;

    /**
     * Construct a data set from a feature array, a label array, and the column types.
     *
     * @param features	two-dimensional feature array, one row per example
     * @param labels	label for each example
     * @param types		type of each feature column
     */
    public TabularData(INDArray features, int[] labels, ColumnType... types) {
        if (features.rank() != 2)
            throw new IllegalArgumentException("Feature array must be two-dimensional, but has rank " + features.rank() + ".");
        int rows = (int) features.rows();
        if (rows != labels.length)
            throw new IllegalArgumentException("Feature array has " + rows + " rows, but there are "
                    + labels.length + " labels.");
        if (rows == 0)
            throw new IllegalArgumentException("Data set must contain at least one row.");
        int cols = (int) features.columns();
        if (types.length != cols)
            throw new IllegalArgumentException("Feature array has " + cols + " columns, but " + types.length
                    + " column types were specified.");
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < 0)
                throw new IllegalArgumentException("Invalid negative label " + labels[i] + " in row " + i + ".");
        }
        this.features = (features.dataType() == DataType.DOUBLE ? features : features.castTo(DataType.DOUBLE));
        this.labels = labels.clone();
        this.types = types.clone();
    }

    /**
     * Construct a data set from primitive rows.
     *
     * @param rows		array of feature rows
     * @param labels	label for each row
     * @param types		type of each feature column
     */
    public static TabularData create(double[][] rows, int[] labels, ColumnType... types) {
        if (rows.length == 0)
            throw new IllegalArgumentException("Data set must contain at least one row.");
        return new TabularData(Nd4j.create(rows), labels, types);
    }

    /**
     * Construct a data set in which every column is ordered.
     *
     * @param rows		array of feature rows
     * @param labels	label for each row
     */
    public static TabularData ordered(double[][] rows, int[] labels) {
        ColumnType[] types = new ColumnType[rows.length == 0 ? 0 : rows[0].length];
        Arrays.fill(types, ColumnType.ORDERED);
        return create(rows, labels, types);
    }

    /**
     * @return a new data set containing the specified rows of this one
     *
     * @param idxes		indices of the rows to keep, in order (duplicates are allowed)
     */
    public TabularData subset(int[] idxes) {
        INDArray subFeatures = this.features.getRows(idxes);
        int[] subLabels = Arrays.stream(idxes).map(i -> this.labels[i]).toArray();
        return new TabularData(subFeatures, subLabels, this.types);
    }

    /**
     * @return the number of examples
     */
    public int size() {
        return this.labels.length;
    }

    /**
     * @return the number of feature columns
     */
    public int width() {
        return this.types.length;
    }

    /**
     * @return the feature array
     */
    public INDArray getFeatures() {
        return this.features;
    }

    /**
     * @return a copy of the feature array as primitive rows
     */
    public double[][] toMatrix() {
        return this.features.toDoubleMatrix();
    }

    /**
     * @return a copy of the label array
     */
    public int[] getLabels() {
        return this.labels.clone();
    }

    /**
     * @return the label for the specified row
     *
     * @param r		index of the row of interest
     */
    public int getLabel(int r) {
        return this.labels[r];
    }

    /**
     * @return the type of the specified column
     *
     * @param c		index of the column of interest
     */
    public ColumnType getType(int c) {
        return this.types[c];
    }

    /**
     * @return a copy of the column type array
     */
    public ColumnType[] getTypes() {
        return this.types.clone();
    }

    /**
     * @return the sorted set of distinct labels
     */
    public SortedSet<Integer> getLabelSet() {
        SortedSet<Integer> retVal = new TreeSet<Integer>();
        for (int label : this.labels)
            retVal.add(label);
        return retVal;
    }

    /**
     * @return one more than the highest label, which is the size needed for a label-count array
     */
    public int labelRange() {
        return Arrays.stream(this.labels).max().orElse(-1) + 1;
    }

}
