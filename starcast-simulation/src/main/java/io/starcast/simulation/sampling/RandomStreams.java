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


package io.starcast.simulation.sampling;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/// Seeded random streams for Monte Carlo draws.
///
/// Draw `i` of a run seeded with `s` always reads the same stream, whatever
/// thread executes it and in whatever order, so a run is reproducible from
/// its seed alone. The per-draw seed passes `(s, i)` through the SplitMix64
/// finalizer before seeding an XoShiRo256++ generator.
public final class RandomStreams {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private RandomStreams() {
    }

    /// Creates the random stream of one draw.
    ///
    /// @param seed the run seed
    /// @param drawIndex zero-based draw index
    public static UniformRandomProvider forDraw(long seed, long drawIndex) {
        return RandomSource.XO_SHI_RO_256_PP.create(mix(seed, drawIndex));
    }

    static long mix(long seed, long index) {
        long z = seed + (index + 1) * GOLDEN_GAMMA;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
