package io.nosqlbench.vinecop.structure;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Arrays;
import java.util.BitSet;

/**
 * Checks that a square integer matrix encodes a regular vine.
 *
 * <p>With {@code diag(k)} the entry at {@code (d-1-k, k)}, the checks are, in order:
 * <ol>
 *   <li>entries with {@code row + column > d-1} are zero</li>
 *   <li>entries with {@code row + column <= d-1} lie in {@code 1..d}</li>
 *   <li>the diagonal is a permutation of {@code 1..d}</li>
 *   <li>column {@code j} holds exactly the labels {@code diag(j), ..., diag(d-1)}</li>
 *   <li>proximity: the variables {@code m(0,j), ..., m(t,j)} of a tree-{@code t} edge
 *       form the full variable set of some tree-{@code (t-1)} edge stored in a
 *       column right of {@code j}</li>
 * </ol>
 *
 * <p>The first failing check is reported as an {@link InvalidRVineMatrixException}.
 */
final class RVineMatrixValidator {

    private RVineMatrixValidator() {
    }

    static void validate(int[][] matrix) {
        int d = MatrixRelabeler.requireSquare(matrix);
        if (d == 0) {
            throw new InvalidRVineMatrixException("R-vine matrix must have at least one variable");
        }
        checkRegions(matrix, d);
        int[] columnOf = checkDiagonal(matrix, d);
        checkColumnLabels(matrix, d, columnOf);
        checkProximity(matrix, d);
    }

    private static void checkRegions(int[][] matrix, int d) {
        for (int i = 0; i < d; i++) {
            for (int j = 0; j < d; j++) {
                int value = matrix[i][j];
                if (i + j > d - 1) {
                    if (value != 0) {
                        throw new InvalidRVineMatrixException(
                            "Entries below the diagonal must be zero, found " + value, i, j);
                    }
                } else if (value < 1 || value > d) {
                    throw new InvalidRVineMatrixException(
                        "Entry " + value + " is outside the label range 1.." + d, i, j);
                }
            }
        }
    }

    /// Returns, for every label, the column whose diagonal holds it.
    private static int[] checkDiagonal(int[][] matrix, int d) {
        int[] columnOf = new int[d + 1];
        Arrays.fill(columnOf, -1);
        for (int j = 0; j < d; j++) {
            int label = matrix[d - 1 - j][j];
            if (columnOf[label] >= 0) {
                throw new InvalidRVineMatrixException(
                    "Diagonal is not a permutation of 1.." + d + ", label " + label + " repeats",
                    d - 1 - j, j);
            }
            columnOf[label] = j;
        }
        return columnOf;
    }

    private static void checkColumnLabels(int[][] matrix, int d, int[] columnOf) {
        for (int j = 0; j < d; j++) {
            BitSet seen = new BitSet(d + 1);
            for (int i = 0; i <= d - 1 - j; i++) {
                int label = matrix[i][j];
                if (columnOf[label] < j) {
                    throw new InvalidRVineMatrixException(
                        "Label " + label + " is not a diagonal label of this or a later column", i, j);
                }
                if (seen.get(label)) {
                    throw new InvalidRVineMatrixException("Label " + label + " repeats within its column", i, j);
                }
                seen.set(label);
            }
        }
    }

    private static void checkProximity(int[][] matrix, int d) {
        for (int t = 1; t <= d - 2; t++) {
            for (int j = 0; j <= d - 2 - t; j++) {
                BitSet target = new BitSet(d + 1);
                for (int r = 0; r <= t; r++) {
                    target.set(matrix[r][j]);
                }
                boolean found = false;
                for (int k = j + 1; k <= d - 1 - t && !found; k++) {
                    BitSet candidate = new BitSet(d + 1);
                    candidate.set(matrix[d - 1 - k][k]);
                    for (int r = 0; r < t; r++) {
                        candidate.set(matrix[r][k]);
                    }
                    found = candidate.equals(target);
                }
                if (!found) {
                    throw new InvalidRVineMatrixException(
                        "Proximity condition violated: edge in tree " + (t + 1)
                            + " does not join two edges of tree " + t, t, j);
                }
            }
        }
    }
}
