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

/// Evaluation options for [Bicop].
///
/// # Usage
///
/// ```java
/// // Defaults: clamp epsilon 1e-10, parallel from 10,000 rows
/// BicopOptions defaults = BicopOptions.defaults();
///
/// BicopOptions options = BicopOptions.builder()
///     .clampEpsilon(1e-12)
///     .parallelThreshold(50_000)
///     .build();
///
/// Bicop copula = new Bicop(BicopFamily.GAUSSIAN, new double[]{0.5}, options);
/// ```
public final class BicopOptions {

    public static final double DEFAULT_CLAMP_EPSILON = 1e-10;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 10_000;

    private final double clampEpsilon;
    private final int parallelThreshold;

    private BicopOptions(Builder builder) {
        this.clampEpsilon = builder.clampEpsilon;
        this.parallelThreshold = builder.parallelThreshold;
    }

    /// Returns the distance from 0 and 1 that inputs are clamped to.
    ///
    /// Every pseudo-observation is moved into `[eps, 1 - eps]` before a kernel
    /// sees it, keeping normal quantiles finite.
    ///
    /// @return the clamp epsilon
    public double clampEpsilon() {
        return clampEpsilon;
    }

    /// Returns the batch size from which rows are evaluated in parallel.
    ///
    /// @return the row count threshold
    public int parallelThreshold() {
        return parallelThreshold;
    }

    public static BicopOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .clampEpsilon(this.clampEpsilon)
            .parallelThreshold(this.parallelThreshold);
    }

    @Override
    public String toString() {
        return "BicopOptions{" +
            "clampEpsilon=" + clampEpsilon +
            ", parallelThreshold=" + parallelThreshold +
            '}';
    }

    /// Builder for [BicopOptions].
    public static final class Builder {
        private double clampEpsilon = DEFAULT_CLAMP_EPSILON;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

        private Builder() {
        }

        /// @param clampEpsilon distance from the unit interval's bounds, in `[0, 0.5)`
        /// @return this builder
        public Builder clampEpsilon(double clampEpsilon) {
            if (!(clampEpsilon >= 0.0 && clampEpsilon < 0.5)) {
                throw new IllegalArgumentException("Clamp epsilon must be in [0, 0.5), got: " + clampEpsilon);
            }
            this.clampEpsilon = clampEpsilon;
            return this;
        }

        /// @param parallelThreshold minimum row count for parallel evaluation; must be positive
        /// @return this builder
        public Builder parallelThreshold(int parallelThreshold) {
            if (parallelThreshold <= 0) {
                throw new IllegalArgumentException("Parallel threshold must be positive, got: " + parallelThreshold);
            }
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public BicopOptions build() {
            return new BicopOptions(this);
        }
    }
}
