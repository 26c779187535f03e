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

import io.nosqlbench.vinecop.structure.DimensionMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/// A bivariate (pair) copula: a family tag plus its parameter vector.
///
/// # Dispatch
///
/// Every operation is routed by the [BicopFamily] tag to that family's
/// [BicopKernel]. Callers depend only on this class.
///
/// ```text
///  Bicop(GAUSSIAN, [ρ])
///      │  pdf / hfunc1 / hfunc2 / hinv1 / hinv2 over n x 2 samples
///      ▼
///  clamp each u into [eps, 1 - eps]
///      │
///      ▼
///  family.kernel().hfunc1(u1, u2, ρ)   per row, parallel above the threshold
/// ```
///
/// # Samples
///
/// Batch functions take an `n x 2` array; row `i` is the pair
/// `(u[i][0], u[i][1])`. Rows are independent of each other.
///
/// # Mutability
///
/// Parameters may be replaced with [#setParameters(double[])] and the
/// orientation changed with [#flip()]. Instances are not thread-safe while
/// being mutated.
public final class Bicop {

    private static final Logger logger = LogManager.getLogger(Bicop.class);

    private final BicopFamily family;
    private final BicopOptions options;
    private double[] parameters;

    /// Creates a copula of the given family with its default parameters.
    public Bicop(BicopFamily family) {
        this(family, family.defaultParameters(), BicopOptions.defaults());
    }

    public Bicop(BicopFamily family, double[] parameters) {
        this(family, parameters, BicopOptions.defaults());
    }

    /// @throws IllegalArgumentException if the parameters are invalid for the family
    public Bicop(BicopFamily family, double[] parameters, BicopOptions options) {
        this.family = Objects.requireNonNull(family, "family");
        this.options = Objects.requireNonNull(options, "options");
        setParameters(parameters);
    }

    /// Creates a copula of the given family whose Kendall's tau equals `tau`.
    ///
    /// @throws IllegalArgumentException if the family cannot attain `tau`
    public static Bicop fromTau(BicopFamily family, double tau) {
        return new Bicop(family, family.kernel().tauToParameters(tau));
    }

    public BicopFamily getFamily() {
        return family;
    }

    public BicopOptions getOptions() {
        return options;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    /// @throws IllegalArgumentException if the parameters are invalid for the family
    public void setParameters(double[] parameters) {
        Objects.requireNonNull(parameters, "parameters");
        family.kernel().checkParameters(parameters);
        this.parameters = parameters.clone();
    }

    public double[] pdf(double[][] u) {
        return evaluate(u, family.kernel()::pdf);
    }

    public double[] hfunc1(double[][] u) {
        return evaluate(u, family.kernel()::hfunc1);
    }

    public double[] hfunc2(double[][] u) {
        return evaluate(u, family.kernel()::hfunc2);
    }

    public double[] hinv1(double[][] u) {
        return evaluate(u, family.kernel()::hinv1);
    }

    public double[] hinv2(double[][] u) {
        return evaluate(u, family.kernel()::hinv2);
    }

    /// @return Kendall's tau implied by the current parameters
    public double parametersToTau() {
        return family.kernel().parametersToTau(parameters);
    }

    public double[] tauToParameters(double tau) {
        return family.kernel().tauToParameters(tau);
    }

    public double[] startParameters(double tau) {
        return family.kernel().startParameters(tau);
    }

    /// Swaps the roles of the two arguments in place.
    public void flip() {
        parameters = family.kernel().flip(parameters).clone();
    }

    private double[] evaluate(double[][] u, PairFunction function) {
        Objects.requireNonNull(u, "u");
        for (int i = 0; i < u.length; i++) {
            if (u[i] == null || u[i].length != 2) {
                throw new DimensionMismatchException("column count of sample row " + i, 2,
                    u[i] == null ? 0 : u[i].length);
            }
        }
        double[] result = new double[u.length];
        double[] params = parameters;
        IntStream rows = IntStream.range(0, u.length);
        if (u.length >= options.parallelThreshold()) {
            logger.debug("Evaluating {} rows of {} copula in parallel", u.length, family);
            rows = rows.parallel();
        }
        rows.forEach(i -> result[i] = function.apply(clamp(u[i][0]), clamp(u[i][1]), params));
        return result;
    }

    private double clamp(double value) {
        double eps = options.clampEpsilon();
        return Math.min(Math.max(value, eps), 1.0 - eps);
    }

    @FunctionalInterface
    private interface PairFunction {
        double apply(double u1, double u2, double[] parameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bicop)) return false;
        Bicop that = (Bicop) o;
        return family == that.family && Arrays.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return 31 * family.hashCode() + Arrays.hashCode(parameters);
    }

    @Override
    public String toString() {
        return "Bicop[family=" + family + ", parameters=" + Arrays.toString(parameters) + "]";
    }
}
