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

/// Thrown when relabeling meets a matrix entry that is not among the old labels.
///
/// Relabeling never substitutes a placeholder for an unknown label, since a
/// placeholder would silently corrupt every matrix derived from the result.
public class LabelLookupException extends IllegalArgumentException {

    private final int label;
    private final int row;
    private final int column;

    public LabelLookupException(int label, int row, int column) {
        super(String.format("Label %d at row %d, column %d is not among the old labels", label, row, column));
        this.label = label;
        this.row = row;
        this.column = column;
    }

    public int getLabel() {
        return label;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }
}
