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

/// Independence copula C(u1, u2) = u1 u2.
///
/// Density is 1 everywhere, each h-function returns its conditioned argument
/// unchanged, and there are no parameters.
public final class IndependenceKernel implements BicopKernel {

    static final IndependenceKernel INSTANCE = new IndependenceKernel();

    private static final double[] NO_PARAMETERS = new double[0];

    private IndependenceKernel() {
    }

    @Override
    public double pdf(double u1, double u2, double[] parameters) {
        return 1.0;
    }

    @Override
    public double hfunc1(double u1, double u2, double[] parameters) {
        return u2;
    }

    @Override
    public double hfunc2(double u1, double u2, double[] parameters) {
        return u1;
    }

    @Override
    public double hinv1(double u1, double u2, double[] parameters) {
        return u2;
    }

    @Override
    public double hinv2(double u1, double u2, double[] parameters) {
        return u1;
    }

    @Override
    public double[] tauToParameters(double tau) {
        return NO_PARAMETERS.clone();
    }

    @Override
    public double parametersToTau(double[] parameters) {
        return 0.0;
    }

    @Override
    public double[] flip(double[] parameters) {
        return parameters;
    }

    @Override
    public double[] startParameters(double tau) {
        return NO_PARAMETERS.clone();
    }

    @Override
    public void checkParameters(double[] parameters) {
        if (parameters.length != 0) {
            throw new IllegalArgumentException(
                "Independence copula takes no parameters, got " + parameters.length);
        }
    }

    @Override
    public String toString() {
        return "IndependenceKernel";
    }
}
