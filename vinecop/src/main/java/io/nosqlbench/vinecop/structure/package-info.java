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

/// # R-Vine Structure Matrices
///
/// A regular vine factors a d-dimensional density into d(d-1)/2 pair-copulas
/// arranged in d-1 nested trees. This package stores the tree sequence as a
/// triangular integer matrix and derives the matrices an evaluator needs.
///
/// ```text
///  RVineMatrix (any labeling)
///        │ inNaturalOrder()        relabel diagonal to d, ..., 1
///        ▼
///  natural-order matrix ──────► getMaxMatrix()
///        │                           │
///        └─────────────┬─────────────┘
///                      ▼
///        getNeededHfunc1(), getNeededHfunc2()
/// ```
///
/// @see RVineMatrix
/// @see MatrixRelabeler
package io.nosqlbench.vinecop.structure;
