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

import java.util.Arrays;

/// Closed set of supported bivariate copula families.
///
/// Each tag carries the kernel that implements the family's capabilities and
/// the default parameters a fresh [Bicop] of that family starts with.
///
/// | Tag | Name | Parameters |
/// |-----|------|------------|
/// | [#INDEPENDENCE] | `indep` | none |
/// | [#GAUSSIAN] | `gaussian` | ρ ∈ (-1, 1) |
public enum BicopFamily {

    INDEPENDENCE("indep", IndependenceKernel.INSTANCE, new double[0]),
    GAUSSIAN("gaussian", GaussianKernel.INSTANCE, new double[]{0.0});

    private final String familyName;
    private final BicopKernel kernel;
    private final double[] defaultParameters;

    BicopFamily(String familyName, BicopKernel kernel, double[] defaultParameters) {
        this.familyName = familyName;
        this.kernel = kernel;
        this.defaultParameters = defaultParameters;
    }

    public String familyName() {
        return familyName;
    }

    public BicopKernel kernel() {
        return kernel;
    }

    public int parameterCount() {
        return defaultParameters.length;
    }

    public double[] defaultParameters() {
        return defaultParameters.clone();
    }

    /// Looks up a family by its name.
    ///
    /// @param name the family name, case-insensitive
    /// @return the matching family
    /// @throws IllegalArgumentException if no family has that name
    public static BicopFamily fromName(String name) {
        for (BicopFamily family : values()) {
            if (family.familyName.equalsIgnoreCase(name)) {
                return family;
            }
        }
        throw new IllegalArgumentException(
            "Unknown copula family: " + name + ". Expected one of " + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return familyName;
    }
}
