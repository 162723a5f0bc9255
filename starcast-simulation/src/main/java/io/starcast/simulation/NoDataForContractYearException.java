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

/**
 * Thrown when a simulation is requested for an organization and year that
 * have no row in the observation panel.
 */
public class NoDataForContractYearException extends RuntimeException {

    private final String organizationId;
    private final int year;

    public NoDataForContractYearException(String organizationId, int year) {
        super(String.format("No data found for organization %s in year %d", organizationId, year));
        this.organizationId = organizationId;
        this.year = year;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public int getYear() {
        return year;
    }
}
