package io.nosqlbench.vinecop.bicop;

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

/// Capability set every bivariate copula family provides.
///
/// # Contract
///
/// All functions take a single pair `(u1, u2)` of pseudo-observations in
/// `(0, 1)` and the family's parameter vector. [Bicop] clamps inputs away from
/// the boundary and loops over sample rows, so kernels stay scalar and
/// stateless.
///
/// | Function | Meaning |
/// |----------|---------|
/// | `pdf` | copula density c(u1, u2) |
/// | `hfunc1` | P(U2 ≤ u2 \| U1 = u1) |
/// | `hfunc2` | P(U1 ≤ u1 \| U2 = u2) |
/// | `hinv1` | inverse of `hfunc1` in its second argument |
/// | `hinv2` | inverse of `hfunc2` in its first argument |
///
/// The set of implementations is closed; a family is added by adding a
/// kernel here and a tag to [BicopFamily].
public sealed interface BicopKernel permits IndependenceKernel, GaussianKernel {

    double pdf(double u1, double u2, double[] parameters);

    double hfunc1(double u1, double u2, double[] parameters);

    double hfunc2(double u1, double u2, double[] parameters);

    double hinv1(double u1, double u2, double[] parameters);

    double hinv2(double u1, double u2, double[] parameters);

    /// Converts Kendall's tau to family parameters.
    ///
    /// @param tau Kendall's rank correlation
    /// @return the parameter vector with that tau
    /// @throws IllegalArgumentException if no parameter of this family attains `tau`
    double[] tauToParameters(double tau);

    double parametersToTau(double[] parameters);

    /// Returns the parameters of the copula with its two arguments swapped.
    double[] flip(double[] parameters);

    /// Returns a starting point for parameter optimization at the given tau.
    double[] startParameters(double tau);

    /// @throws IllegalArgumentException if the parameters are outside the family's domain
    void checkParameters(double[] parameters);
}
