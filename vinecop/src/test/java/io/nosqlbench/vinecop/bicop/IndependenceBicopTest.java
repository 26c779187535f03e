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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the independence copula through the {@link Bicop} interface.
 */
class IndependenceBicopTest {

    private static final double[][] SAMPLE = {
        {0.1, 0.9},
        {0.5, 0.5},
        {0.25, 0.75},
        {0.999, 0.001}
    };

    @Test
    void densityIsUniform() {
        Bicop copula = new Bicop(BicopFamily.INDEPENDENCE);
        for (double value : copula.pdf(SAMPLE)) {
            assertEquals(1.0, value);
        }
    }

    @Test
    void hfunctionsReturnConditionedArgument() {
        Bicop copula = new Bicop(BicopFamily.INDEPENDENCE);
        double[] h1 = copula.hfunc1(SAMPLE);
        double[] h2 = copula.hfunc2(SAMPLE);
        double[] hi1 = copula.hinv1(SAMPLE);
        double[] hi2 = copula.hinv2(SAMPLE);
        for (int i = 0; i < SAMPLE.length; i++) {
            assertEquals(SAMPLE[i][1], h1[i]);
            assertEquals(SAMPLE[i][0], h2[i]);
            assertEquals(SAMPLE[i][1], hi1[i]);
            assertEquals(SAMPLE[i][0], hi2[i]);
        }
    }

    @Test
    void hasNoParametersAndZeroTau() {
        Bicop copula = new Bicop(BicopFamily.INDEPENDENCE);
        assertEquals(0, copula.getParameters().length);
        assertEquals(0.0, copula.parametersToTau());
        assertEquals(0, copula.tauToParameters(0.7).length);
        assertEquals(0, copula.startParameters(-0.3).length);
        assertEquals(0.0, Bicop.fromTau(BicopFamily.INDEPENDENCE, 0.4).parametersToTau());
    }

    @Test
    void flipLeavesCopulaUnchanged() {
        Bicop copula = new Bicop(BicopFamily.INDEPENDENCE);
        copula.flip();
        assertEquals(new Bicop(BicopFamily.INDEPENDENCE), copula);
        assertArrayEquals(new double[]{0.1, 0.5, 0.25, 0.999}, copula.hfunc2(SAMPLE));
    }

    @Test
    void rejectsParameters() {
        assertThrows(IllegalArgumentException.class,
            () -> new Bicop(BicopFamily.INDEPENDENCE, new double[]{0.5}));
    }

    @Test
    void rejectsRowsWithoutTwoColumns() {
        Bicop copula = new Bicop(BicopFamily.INDEPENDENCE);
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
            () -> copula.pdf(new double[][]{{0.1, 0.2}, {0.3, 0.4, 0.5}}));
        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
    }

    @Test
    void emptySampleYieldsEmptyResult() {
        assertEquals(0, new Bicop(BicopFamily.INDEPENDENCE).pdf(new double[0][]).length);
    }
}
