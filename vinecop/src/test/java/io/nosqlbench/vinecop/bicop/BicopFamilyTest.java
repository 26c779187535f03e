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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BicopFamilyTest {

    @Test
    void familiesAreFoundByName() {
        assertSame(BicopFamily.INDEPENDENCE, BicopFamily.fromName("indep"));
        assertSame(BicopFamily.GAUSSIAN, BicopFamily.fromName("Gaussian"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> BicopFamily.fromName("clayton"));
        assertTrue(e.getMessage().contains("clayton"));
    }

    @Test
    void tagsCarryTheirKernels() {
        assertInstanceOf(IndependenceKernel.class, BicopFamily.INDEPENDENCE.kernel());
        assertInstanceOf(GaussianKernel.class, BicopFamily.GAUSSIAN.kernel());
        assertEquals(0, BicopFamily.INDEPENDENCE.parameterCount());
        assertEquals(1, BicopFamily.GAUSSIAN.parameterCount());
    }

    @Test
    void defaultParametersAreCopies() {
        double[] parameters = BicopFamily.GAUSSIAN.defaultParameters();
        parameters[0] = 0.9;
        assertArrayEquals(new double[]{0.0}, BicopFamily.GAUSSIAN.defaultParameters());
    }

    @Test
    void optionsDefaultsAndValidation() {
        BicopOptions defaults = BicopOptions.defaults();
        assertEquals(BicopOptions.DEFAULT_CLAMP_EPSILON, defaults.clampEpsilon());
        assertEquals(BicopOptions.DEFAULT_PARALLEL_THRESHOLD, defaults.parallelThreshold());

        BicopOptions custom = defaults.toBuilder().clampEpsilon(1e-6).build();
        assertEquals(1e-6, custom.clampEpsilon());
        assertEquals(defaults.parallelThreshold(), custom.parallelThreshold());

        assertThrows(IllegalArgumentException.class, () -> BicopOptions.builder().clampEpsilon(0.5));
        assertThrows(IllegalArgumentException.class, () -> BicopOptions.builder().parallelThreshold(0));
    }
}
