/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.bayesiantree.input;

import static com.amazon.bayesiantree.CommonUtils.checkArgument;
import static com.amazon.bayesiantree.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A sparse feature matrix in compressed sparse column form. Entries that are not
 * stored are zero. Column access is cheap, which is what split search and
 * prediction routing need.
 * <p>
 * The offsets are encoded as follows: the stored entries of column c occupy the
 * positions {@code columnPointers[c]} (inclusive) to
 * {@code columnPointers[c + 1]} (exclusive) of {@code rowIndices} and
 * {@code values}, with row indices strictly increasing within a column.
 */
public class SparseFeatureMatrix implements IFeatureMatrix {

    private final int numberOfRows;
    private final int numberOfColumns;
    private final int[] columnPointers;
    private final int[] rowIndices;
    private final double[] values;

    SparseFeatureMatrix(int numberOfRows, int numberOfColumns, int[] columnPointers, int[] rowIndices,
            double[] values) {
        this.numberOfRows = numberOfRows;
        this.numberOfColumns = numberOfColumns;
        this.columnPointers = columnPointers;
        this.rowIndices = rowIndices;
        this.values = values;
    }

    /**
     * Builds a matrix from (row, column, value) triplets. Duplicate coordinates are
     * summed.
     *
     * @param numberOfRows    number of rows
     * @param numberOfColumns number of columns
     * @param rows            row index of each entry
     * @param columns         column index of each entry
     * @param entries         value of each entry
     * @return the sparse matrix
     */
    public static SparseFeatureMatrix fromTriplets(int numberOfRows, int numberOfColumns, int[] rows,
            int[] columns, double[] entries) {
        checkNotNull(rows, "rows must not be null");
        checkNotNull(columns, "columns must not be null");
        checkNotNull(entries, "entries must not be null");
        checkArgument(numberOfRows >= 0 && numberOfColumns >= 0, "matrix shape must not be negative");
        checkArgument(rows.length == columns.length && rows.length == entries.length,
                "rows, columns and entries must have the same length");

        Integer[] order = new Integer[entries.length];
        for (int i = 0; i < order.length; i++) {
            int row = rows[i];
            int column = columns[i];
            checkArgument(row >= 0 && row < numberOfRows,
                    () -> String.format("row index %d out of range [0, %d)", row, numberOfRows));
            checkArgument(column >= 0 && column < numberOfColumns,
                    () -> String.format("column index %d out of range [0, %d)", column, numberOfColumns));
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> (columns[a] != columns[b]) ? Integer.compare(columns[a], columns[b])
                : Integer.compare(rows[a], rows[b]));

        int[] columnPointers = new int[numberOfColumns + 1];
        int[] rowIndices = new int[entries.length];
        double[] values = new double[entries.length];
        int size = 0;
        for (int k = 0; k < order.length; k++) {
            int i = order[k];
            if (size > 0 && k > 0 && columns[order[k - 1]] == columns[i] && rowIndices[size - 1] == rows[i]) {
                values[size - 1] += entries[i];
            } else {
                rowIndices[size] = rows[i];
                values[size] = entries[i];
                columnPointers[columns[i] + 1]++;
                size++;
            }
        }
        for (int c = 0; c < numberOfColumns; c++) {
            columnPointers[c + 1] += columnPointers[c];
        }
        return new SparseFeatureMatrix(numberOfRows, numberOfColumns, columnPointers,
                Arrays.copyOf(rowIndices, size), Arrays.copyOf(values, size));
    }

    /**
     * Builds a matrix from compressed sparse row arrays.
     *
     * @param numberOfRows    number of rows
     * @param numberOfColumns number of columns
     * @param rowPointers     offsets of each row into {@code columnIndices}, length
     *                        {@code numberOfRows + 1}
     * @param columnIndices   column index of each stored entry
     * @param entries         value of each stored entry
     * @return the sparse matrix
     */
    public static SparseFeatureMatrix fromCompressedRows(int numberOfRows, int numberOfColumns, int[] rowPointers,
            int[] columnIndices, double[] entries) {
        checkNotNull(rowPointers, "rowPointers must not be null");
        checkNotNull(entries, "entries must not be null");
        checkArgument(rowPointers.length == numberOfRows + 1, "rowPointers must have numberOfRows + 1 entries");
        checkArgument(rowPointers[0] == 0 && rowPointers[numberOfRows] == entries.length,
                "rowPointers must start at 0 and end at the number of entries");
        for (int row = 0; row < numberOfRows; row++) {
            checkArgument(rowPointers[row] <= rowPointers[row + 1], "rowPointers must be non-decreasing");
        }
        int[] rows = new int[entries.length];
        for (int row = 0; row < numberOfRows; row++) {
            for (int k = rowPointers[row]; k < rowPointers[row + 1]; k++) {
                rows[k] = row;
            }
        }
        return fromTriplets(numberOfRows, numberOfColumns, rows, columnIndices, entries);
    }

    @Override
    public int getNumberOfRows() {
        return numberOfRows;
    }

    @Override
    public int getNumberOfColumns() {
        return numberOfColumns;
    }

    @Override
    public double getValue(int row, int column) {
        int position = Arrays.binarySearch(rowIndices, columnPointers[column], columnPointers[column + 1], row);
        return (position >= 0) ? values[position] : 0.0;
    }

    @Override
    public double[] getColumn(int column) {
        double[] result = new double[numberOfRows];
        for (int k = columnPointers[column]; k < columnPointers[column + 1]; k++) {
            result[rowIndices[k]] = values[k];
        }
        return result;
    }

    /**
     * @return the number of explicitly stored entries
     */
    public int getNumberOfStoredEntries() {
        return values.length;
    }
}
