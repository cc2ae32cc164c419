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

import org.cqrskit.event.EventEnvelope;
import org.cqrskit.query.Reactor;
import org.cqrskit.store.AggregateContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags an account for review when cash is withdrawn above a threshold. An account that is already flagged when a large
 * withdrawal happens means that the review process has been bypassed, which is reported as an error.
 *
 * @param <AC> The type of the aggregate context of the store that the reactor is used with
 */
public class LargeWithdrawalReactor<AC extends AggregateContext<BankAccount>> implements Reactor<BankAccount, BankAccountEvent, BankAccountException, BankAccountServices, AC> {
    private final long threshold;

    public LargeWithdrawalReactor(long threshold) {
        this.threshold = threshold;
    }

    @Override
    public List<BankAccountEvent> react(AC context, String aggregateId, BankAccountServices services, List<EventEnvelope<BankAccountEvent>> events) throws BankAccountException {
        List<CustomerWithdrewCash> largeWithdrawals = events.stream()
                .map(EventEnvelope::payload)
                .filter(CustomerWithdrewCash.class::isInstance)
                .map(CustomerWithdrewCash.class::cast)
                .filter(withdrawal -> withdrawal.amount() >= threshold)
                .collect(Collectors.toList());

        if (largeWithdrawals.isEmpty()) {
            return List.of();
        } else if (context.aggregate().isFlagged()) {
            throw new BankAccountException("large withdrawal from flagged account " + aggregateId);
        }
        return List.of(new AccountFlagged("large withdrawal of " + largeWithdrawals.get(0).amount()));
    }
}
