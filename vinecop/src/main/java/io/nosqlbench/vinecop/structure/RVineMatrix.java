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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// Regular vine structure stored as a `d x d` integer matrix.
///
/// # Layout
///
/// The variable of column `j` sits on the anti-diagonal at `(d-1-j, j)`.
/// Rows above it hold, from the top, the partner of that variable in tree 1,
/// tree 2, and so on; the entries above a partner form the conditioning set
/// of that edge. Everything below the anti-diagonal is zero.
///
/// ```text
///   D-vine on order (1, 2, 3, 4)
///
///          col 0  col 1  col 2  col 3
///  row 0 │   3      2      1      1   │   tree 1: 4-3, 3-2, 2-1
///  row 1 │   2      1      2      0   │   tree 2: 4-2|3, 3-1|2
///  row 2 │   1      3      0      0   │   tree 3: 4-1|3,2
///  row 3 │   4      0      0      0   │
/// ```
///
/// # Derived Matrices
///
/// | Method | Result |
/// |--------|--------|
/// | [#inNaturalOrder()] | relabeled so the diagonal reads `d, ..., 1` from bottom-left |
/// | [#getMaxMatrix()] | column-wise running maximum of the natural-order matrix |
/// | [#getNeededHfunc1()] | where the first h-function must be evaluated |
/// | [#getNeededHfunc2()] | where the second h-function must be evaluated |
///
/// Every derivation returns a freshly allocated array; instances are immutable.
///
/// # Validation
///
/// The constructor rejects matrices that do not encode a regular vine, see
/// [RVineMatrixValidator]. There is no best-effort repair.
public final class RVineMatrix {

    private static final Logger logger = LogManager.getLogger(RVineMatrix.class);

    private final int d;
    private final int[][] matrix;

    /// Creates an R-vine matrix from an explicit structure matrix.
    ///
    /// @param matrix a square matrix in the anti-diagonal layout; copied, not retained
    /// @throws InvalidRVineMatrixException if the matrix does not encode a regular vine
    /// @throws DimensionMismatchException if the matrix is not square
    public RVineMatrix(int[][] matrix) {
        RVineMatrixValidator.validate(matrix);
        this.d = matrix.length;
        this.matrix = copy(matrix);
        logger.debug("Created R-vine matrix of dimension {} with order {}", () -> d, () -> Arrays.toString(getOrder()));
    }

    /// Creates the D-vine (every tree a path) on the given variable order.
    ///
    /// @param order a permutation of `1..d`
    /// @return the D-vine structure
    /// @throws InvalidRVineMatrixException if `order` is not a permutation of `1..d`
    public static RVineMatrix dVine(int[] order) {
        return new RVineMatrix(constructDVineMatrix(order));
    }

    /// Builds the raw D-vine matrix for the given variable order.
    ///
    /// The diagonal entry of column `i` is `order[d-1-i]`; the entry at
    /// `(d-1-i, j)` for `j < i` is `order[i-j-1]`.
    ///
    /// @param order the variable order
    /// @return the D-vine matrix, not validated
    public static int[][] constructDVineMatrix(int[] order) {
        int d = order.length;
        int[][] vineMatrix = new int[d][d];
        for (int i = 0; i < d; i++) {
            vineMatrix[d - 1 - i][i] = order[d - 1 - i];
        }
        for (int i = 1; i < d; i++) {
            for (int j = 0; j < i; j++) {
                vineMatrix[d - 1 - i][j] = order[i - j - 1];
            }
        }
        return vineMatrix;
    }

    /// Returns the labels `d, d-1, ..., 1`, the reversed diagonal of every
    /// natural-order matrix.
    ///
    /// @param d the dimension
    /// @return the natural-order labels
    public static int[] naturalOrderLabels(int d) {
        int[] labels = new int[d];
        for (int k = 0; k < d; k++) {
            labels[k] = d - k;
        }
        return labels;
    }

    public int getDimension() {
        return d;
    }

    /// @return a copy of the structure matrix
    public int[][] getMatrix() {
        return copy(matrix);
    }

    public int getEntry(int row, int column) {
        return matrix[row][column];
    }

    /// Returns the variable order: the diagonal read from top-right to bottom-left.
    ///
    /// For a D-vine this is the order it was built from.
    ///
    /// @return the order, entry `k` taken from `(k, d-1-k)`
    public int[] getOrder() {
        int[] order = new int[d];
        for (int k = 0; k < d; k++) {
            order[k] = matrix[k][d - 1 - k];
        }
        return order;
    }

    /// Returns the matrix relabeled to natural order.
    ///
    /// The reversed diagonal is mapped onto `d, ..., 1`, so the variable of
    /// column `j` becomes `d-j`. Applying this to a matrix already in natural
    /// order returns an equal matrix.
    ///
    /// @return a new natural-order matrix
    public int[][] inNaturalOrder() {
        return MatrixRelabeler.relabel(matrix, naturalOrderLabels(d));
    }

    /// @return a new instance holding [#inNaturalOrder()]
    public RVineMatrix toNaturalOrder() {
        return new RVineMatrix(inNaturalOrder());
    }

    public boolean isNaturalOrder() {
        return Arrays.equals(MatrixRelabeler.reversedDiagonal(matrix), naturalOrderLabels(d));
    }

    /// Relabels the variables of this structure.
    ///
    /// @param newLabels replacements for the reversed diagonal, position by position
    /// @return the relabeled structure
    /// @throws DimensionMismatchException if `newLabels` does not have `d` entries
    /// @throws InvalidRVineMatrixException if the new labels are not a permutation of `1..d`
    public RVineMatrix relabel(int[] newLabels) {
        return new RVineMatrix(MatrixRelabeler.relabel(matrix, newLabels));
    }

    /// Returns the maximum matrix.
    ///
    /// Starting from the natural-order matrix, each row inside the structure
    /// triangle is replaced top to bottom by the elementwise maximum of itself
    /// and the (already replaced) row above. Row 0 is unchanged.
    ///
    /// ```text
    ///   natural order        maximum matrix
    ///   3  2  1  1           3  2  1  1
    ///   2  1  2  0    ──►    3  2  2  0
    ///   1  3  0  0           3  3  0  0
    ///   4  0  0  0           4  0  0  0
    /// ```
    ///
    /// @return a new maximum matrix
    public int[][] getMaxMatrix() {
        int[][] maxMatrix = inNaturalOrder();
        for (int i = 0; i < d - 1; i++) {
            for (int j = 0; j < d - i - 1; j++) {
                maxMatrix[i + 1][j] = Math.max(maxMatrix[i][j], maxMatrix[i + 1][j]);
            }
        }
        return maxMatrix;
    }

    /// Returns where the first h-function of a pair-copula is needed.
    ///
    /// For each column `i` in `1..d-2` with `j = d - i`, row `r < j` is flagged
    /// when some column `k < i` has a natural-order entry different from `j`
    /// at row `r` while the maximum matrix holds `j` there. Those rows need a
    /// transformed pseudo-observation that no sibling edge provides.
    ///
    /// @return a new `d x d` flag matrix
    public boolean[][] getNeededHfunc1() {
        boolean[][] needed = new boolean[d][d];
        int[][] noMatrix = inNaturalOrder();
        int[][] maxMatrix = getMaxMatrix();
        for (int i = 1; i < d - 1; i++) {
            int j = d - i;
            for (int r = 0; r < j; r++) {
                boolean any = false;
                for (int k = 0; k < i && !any; k++) {
                    any = noMatrix[r][k] != j && maxMatrix[r][k] == j;
                }
                needed[r][i] = any;
            }
        }
        return needed;
    }

    /// Returns where the second h-function of a pair-copula is needed.
    ///
    /// Column 0 is flagged above its diagonal entry. Every column `i` in
    /// `1..d-2` is flagged above its diagonal entry; the diagonal row
    /// `j - 1 = d - 1 - i` is flagged only if some column `k < i` holds `j` at
    /// that row in both the natural-order and the maximum matrix.
    ///
    /// @return a new `d x d` flag matrix
    public boolean[][] getNeededHfunc2() {
        boolean[][] needed = new boolean[d][d];
        for (int r = 0; r < d - 1; r++) {
            needed[r][0] = true;
        }
        int[][] noMatrix = inNaturalOrder();
        int[][] maxMatrix = getMaxMatrix();
        for (int i = 1; i < d - 1; i++) {
            int j = d - i;
            for (int r = 0; r < d - i; r++) {
                needed[r][i] = true;
            }
            boolean any = false;
            for (int k = 0; k < i && !any; k++) {
                any = noMatrix[j - 1][k] == j && maxMatrix[j - 1][k] == j;
            }
            needed[j - 1][i] = any;
        }
        return needed;
    }

    private static int[][] copy(int[][] source) {
        int[][] target = new int[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RVineMatrix)) return false;
        RVineMatrix that = (RVineMatrix) o;
        return Arrays.deepEquals(matrix, that.matrix);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(matrix);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RVineMatrix[d=").append(d).append(']');
        for (int[] row : matrix) {
            sb.append(System.lineSeparator()).append(Arrays.toString(row));
        }
        return sb.toString();
    }
}
