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

import java.util.HashMap;
import java.util.Map;

/// Relabels the variables of an R-vine matrix.
///
/// # Matrix Layout
///
/// R-vine matrices use the anti-diagonal layout: for dimension `d`, the
/// variable of column `j` sits at `(d-1-j, j)` and the structure occupies the
/// triangle `row + column <= d-1`. Entries outside that triangle are zero.
///
/// ```text
///   d = 4          reversed diagonal (old labels)
///  ┌─────────┐     read bottom-left to top-right:
///  │ a b c D │
///  │ e f C 0 │       A, B, C, D
///  │ g B 0 0 │
///  │ A 0 0 0 │
///  └─────────┘
/// ```
///
/// # Relabeling
///
/// Old and new labels are aligned by position: every entry equal to
/// `oldLabels[k]` becomes `newLabels[k]`. Entries that match no old label
/// raise a [LabelLookupException].
///
/// @see RVineMatrix#inNaturalOrder()
public final class MatrixRelabeler {

    private MatrixRelabeler() {
        // Utility class
    }

    /// Relabels a matrix against its own reversed diagonal.
    ///
    /// @param matrix a square R-vine matrix
    /// @param newLabels the labels that replace the reversed diagonal, position by position
    /// @return a freshly allocated relabeled matrix
    /// @throws DimensionMismatchException if the matrix is not square or the label count is not `d`
    /// @throws LabelLookupException if an entry is not on the diagonal
    public static int[][] relabel(int[][] matrix, int[] newLabels) {
        return relabel(matrix, reversedDiagonal(matrix), newLabels);
    }

    /// Relabels a matrix using an explicit old-to-new correspondence.
    ///
    /// @param matrix a square R-vine matrix
    /// @param oldLabels labels currently used in the matrix
    /// @param newLabels replacement labels, aligned by position with `oldLabels`
    /// @return a freshly allocated relabeled matrix
    /// @throws DimensionMismatchException if the sizes of matrix and label sequences disagree
    /// @throws IllegalArgumentException if either label sequence contains duplicates
    /// @throws LabelLookupException if an entry is not among the old labels
    public static int[][] relabel(int[][] matrix, int[] oldLabels, int[] newLabels) {
        int d = requireSquare(matrix);
        if (oldLabels.length != d) {
            throw new DimensionMismatchException("old label count", d, oldLabels.length);
        }
        if (newLabels.length != d) {
            throw new DimensionMismatchException("new label count", d, newLabels.length);
        }

        Map<Integer, Integer> correspondence = new HashMap<>(d * 2);
        for (int k = 0; k < d; k++) {
            if (correspondence.put(oldLabels[k], newLabels[k]) != null) {
                throw new IllegalArgumentException("Duplicate old label: " + oldLabels[k]);
            }
        }
        if (correspondence.values().stream().distinct().count() != d) {
            throw new IllegalArgumentException("New labels must be distinct");
        }

        int[][] relabeled = new int[d][d];
        for (int i = 0; i < d; i++) {
            for (int j = 0; j < d - i; j++) {
                Integer label = correspondence.get(matrix[i][j]);
                if (label == null) {
                    throw new LabelLookupException(matrix[i][j], i, j);
                }
                relabeled[i][j] = label;
            }
        }
        return relabeled;
    }

    /// Returns the diagonal of the matrix read from bottom-left to top-right.
    ///
    /// Element `k` is the entry at `(d-1-k, k)`.
    ///
    /// @param matrix a square R-vine matrix
    /// @return the reversed diagonal
    /// @throws DimensionMismatchException if the matrix is not square
    public static int[] reversedDiagonal(int[][] matrix) {
        int d = requireSquare(matrix);
        int[] diagonal = new int[d];
        for (int k = 0; k < d; k++) {
            diagonal[k] = matrix[d - 1 - k][k];
        }
        return diagonal;
    }

    static int requireSquare(int[][] matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("Matrix must not be null");
        }
        int d = matrix.length;
        for (int i = 0; i < d; i++) {
            if (matrix[i] == null || matrix[i].length != d) {
                throw new DimensionMismatchException(
                    "column count of row " + i, d, matrix[i] == null ? 0 : matrix[i].length);
            }
        }
        return d;
    }
}
