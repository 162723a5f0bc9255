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


package io.starcast.simulation;

/// How often each outcome occurred for one measure across a run.
public record OutcomeCounts(long sampled, long fallback, long unavailable) {

    public static final OutcomeCounts NONE = new OutcomeCounts(0, 0, 0);

    public long total() {
        return sampled + fallback + unavailable;
    }
}
