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

/// Thrown when an input's size disagrees with the dimension it is used against,
/// e.g. label sequences of the wrong length or a non-square matrix.
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(String.format("%s: expected %d but got %d", what, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
