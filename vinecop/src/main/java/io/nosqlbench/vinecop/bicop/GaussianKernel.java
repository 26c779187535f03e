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

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Gaussian copula with correlation parameter ρ in (-1, 1).
 *
 * <p>With x = Φ⁻¹(u1), y = Φ⁻¹(u2) and s = 1 - ρ²:
 * <ul>
 *   <li><b>PDF</b>: exp(-(ρ²(x² + y²) - 2ρxy) / 2s) / √s</li>
 *   <li><b>hfunc1</b>: Φ((y - ρx) / √s)</li>
 *   <li><b>hfunc2</b>: Φ((x - ρy) / √s)</li>
 *   <li><b>Kendall's tau</b>: τ = (2/π) asin ρ, so ρ = sin(πτ/2)</li>
 * </ul>
 *
 * <p>The copula is exchangeable, so flipping leaves ρ unchanged.
 */
public final class GaussianKernel implements BicopKernel {

    static final GaussianKernel INSTANCE = new GaussianKernel();

    private final NormalDistribution standardNormal = new NormalDistribution(null, 0.0, 1.0);

    private GaussianKernel() {
    }

    @Override
    public double pdf(double u1, double u2, double[] parameters) {
        double rho = parameters[0];
        double x = quantile(u1);
        double y = quantile(u2);
        double s = 1.0 - rho * rho;
        return Math.exp(-(rho * rho * (x * x + y * y) - 2.0 * rho * x * y) / (2.0 * s)) / Math.sqrt(s);
    }

    @Override
    public double hfunc1(double u1, double u2, double[] parameters) {
        double rho = parameters[0];
        return cdf((quantile(u2) - rho * quantile(u1)) / Math.sqrt(1.0 - rho * rho));
    }

    @Override
    public double hfunc2(double u1, double u2, double[] parameters) {
        double rho = parameters[0];
        return cdf((quantile(u1) - rho * quantile(u2)) / Math.sqrt(1.0 - rho * rho));
    }

    @Override
    public double hinv1(double u1, double u2, double[] parameters) {
        double rho = parameters[0];
        return cdf(quantile(u2) * Math.sqrt(1.0 - rho * rho) + rho * quantile(u1));
    }

    @Override
    public double hinv2(double u1, double u2, double[] parameters) {
        double rho = parameters[0];
        return cdf(quantile(u1) * Math.sqrt(1.0 - rho * rho) + rho * quantile(u2));
    }

    @Override
    public double[] tauToParameters(double tau) {
        if (!(tau > -1.0 && tau < 1.0)) {
            throw new IllegalArgumentException("Kendall's tau must be in (-1, 1) for the Gaussian copula, got: " + tau);
        }
        return new double[]{Math.sin(Math.PI * tau / 2.0)};
    }

    @Override
    public double parametersToTau(double[] parameters) {
        return 2.0 / Math.PI * Math.asin(parameters[0]);
    }

    @Override
    public double[] flip(double[] parameters) {
        return parameters;
    }

    @Override
    public double[] startParameters(double tau) {
        return tauToParameters(tau);
    }

    @Override
    public void checkParameters(double[] parameters) {
        if (parameters.length != 1) {
            throw new IllegalArgumentException(
                "Gaussian copula takes exactly one parameter, got " + parameters.length);
        }
        double rho = parameters[0];
        if (!(rho > -1.0 && rho < 1.0)) {
            throw new IllegalArgumentException("Correlation must be in (-1, 1), got: " + rho);
        }
    }

    private double quantile(double u) {
        return standardNormal.inverseCumulativeProbability(u);
    }

    private double cdf(double x) {
        return standardNormal.cumulativeProbability(x);
    }

    @Override
    public String toString() {
        return "GaussianKernel";
    }
}
