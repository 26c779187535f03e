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

/// Thrown when a matrix does not describe a regular vine.
///
/// The offending position is reported when the failure can be pinned to a
/// single entry; otherwise [#getRow()] and [#getColumn()] return -1.
public class InvalidRVineMatrixException extends IllegalArgumentException {

    private final int row;
    private final int column;

    public InvalidRVineMatrixException(String message) {
        this(message, -1, -1);
    }

    public InvalidRVineMatrixException(String message, int row, int column) {
        super(row < 0 ? message : String.format("%s (at row %d, column %d)", message, row, column));
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }
}
