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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RandomStreamsTest {

    @Test
    void sameSeedAndIndexReplayTheStream() {
        UniformRandomProvider a = RandomStreams.forDraw(42L, 17L);
        UniformRandomProvider b = RandomStreams.forDraw(42L, 17L);

        for (int i = 0; i < 100; i++) {
            assertThat(a.nextLong()).isEqualTo(b.nextLong());
        }
    }

    @Test
    void neighbouringDrawsGetDistinctStreams() {
        Set<Long> firstValues = new HashSet<>();
        for (long index = 0; index < 1000; index++) {
            firstValues.add(RandomStreams.forDraw(42L, index).nextLong());
        }
        assertThat(firstValues).hasSize(1000);
    }

    @Test
    void seedAndIndexDoNotCommute() {
        assertThat(RandomStreams.mix(1L, 2L)).isNotEqualTo(RandomStreams.mix(2L, 1L));
        assertThat(RandomStreams.mix(0L, 0L)).isNotEqualTo(RandomStreams.mix(0L, 1L));
    }
}
