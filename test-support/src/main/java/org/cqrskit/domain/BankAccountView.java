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
import org.cqrskit.query.View;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A view of a bank account containing its balance and a human readable ledger.
 */
public class BankAccountView implements View<BankAccountEvent> {
    private String accountId;
    private long balance;
    private List<String> ledger = new ArrayList<>();

    public BankAccountView() {
    }

    @Override
    public void update(EventEnvelope<BankAccountEvent> event) {
        BankAccountEvent payload = event.payload();
        if (payload instanceof AccountOpened) {
            accountId = ((AccountOpened) payload).accountId();
        } else if (payload instanceof CustomerDepositedMoney) {
            CustomerDepositedMoney e = (CustomerDepositedMoney) payload;
            balance = e.balance();
            ledger.add("deposit " + e.amount());
        } else if (payload instanceof CustomerWithdrewCash) {
            CustomerWithdrewCash e = (CustomerWithdrewCash) payload;
            balance = e.balance();
            ledger.add("atm withdrawal " + e.amount());
        } else if (payload instanceof CustomerWroteCheck) {
            CustomerWroteCheck e = (CustomerWroteCheck) payload;
            balance = e.balance();
            ledger.add("check " + e.checkNumber() + " " + e.amount());
        }
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public long getBalance() {
        return balance;
    }

    public void setBalance(long balance) {
        this.balance = balance;
    }

    public List<String> getLedger() {
        return ledger;
    }

    public void setLedger(List<String> ledger) {
        this.ledger = ledger;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BankAccountView)) return false;
        BankAccountView that = (BankAccountView) o;
        return balance == that.balance && Objects.equals(accountId, that.accountId) && Objects.equals(ledger, that.ledger);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, balance, ledger);
    }

    @Override
    public String toString() {
        return "BankAccountView{" +
                "accountId='" + accountId + '\'' +
                ", balance=" + balance +
                ", ledger=" + ledger +
                '}';
    }
}
