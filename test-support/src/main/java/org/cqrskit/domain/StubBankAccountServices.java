/*
 *
 *  Copyright 2025 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.cqrskit.domain;

import java.util.Set;

/**
 * {@link BankAccountServices} backed by fixed sets of unavailable ATMs and invalid checks.
 */
public class StubBankAccountServices implements BankAccountServices {
    private final Set<String> unavailableAtms;
    private final Set<String> invalidChecks;

    public StubBankAccountServices() {
        this(Set.of(), Set.of());
    }

    public StubBankAccountServices(Set<String> unavailableAtms, Set<String> invalidChecks) {
        this.unavailableAtms = Set.copyOf(unavailableAtms);
        this.invalidChecks = Set.copyOf(invalidChecks);
    }

    @Override
    public boolean isAtmAvailable(String atmId) {
        return !unavailableAtms.contains(atmId);
    }

    @Override
    public boolean isCheckValid(String checkNumber) {
        return !invalidChecks.contains(checkNumber);
    }
}
