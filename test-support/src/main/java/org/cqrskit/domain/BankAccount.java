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

import org.cqrskit.aggregate.Aggregate;
import org.cqrskit.command.*;

import java.util.List;

public class BankAccount implements Aggregate<BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices> {

    private String accountId;
    private long balance;
    private boolean flagged;

    @Override
    public String aggregateType() {
        return "Account";
    }

    @Override
    public List<BankAccountEvent> handle(BankAccountCommand command, BankAccountServices services) throws BankAccountException {
        if (command instanceof OpenAccount) {
            if (accountId != null) {
                throw new BankAccountException("account already opened");
            }
            return List.of(new AccountOpened(((OpenAccount) command).accountId()));
        }

        if (accountId == null) {
            throw new BankAccountException("account not opened");
        } else if (command instanceof DepositMoney) {
            long amount = ((DepositMoney) command).amount();
            requirePositive(amount);
            return List.of(new CustomerDepositedMoney(amount, balance + amount));
        } else if (command instanceof WithdrawMoney) {
            WithdrawMoney withdrawMoney = (WithdrawMoney) command;
            requirePositive(withdrawMoney.amount());
            if (withdrawMoney.amount() > balance) {
                throw new BankAccountException("funds not available");
            } else if (!services.isAtmAvailable(withdrawMoney.atmId())) {
                throw new BankAccountException("atm rule violation");
            }
            return List.of(new CustomerWithdrewCash(withdrawMoney.amount(), balance - withdrawMoney.amount()));
        } else if (command instanceof WriteCheck) {
            WriteCheck writeCheck = (WriteCheck) command;
            requirePositive(writeCheck.amount());
            if (writeCheck.amount() > balance) {
                throw new BankAccountException("funds not available");
            } else if (!services.isCheckValid(writeCheck.checkNumber())) {
                throw new BankAccountException("check invalid");
            }
            return List.of(new CustomerWroteCheck(writeCheck.checkNumber(), writeCheck.amount(), balance - writeCheck.amount()));
        }
        throw new IllegalArgumentException("Unsupported command: " + command);
    }

    @Override
    public void apply(BankAccountEvent event) {
        if (event instanceof AccountOpened) {
            accountId = ((AccountOpened) event).accountId();
        } else if (event instanceof CustomerDepositedMoney) {
            balance = ((CustomerDepositedMoney) event).balance();
        } else if (event instanceof CustomerWithdrewCash) {
            balance = ((CustomerWithdrewCash) event).balance();
        } else if (event instanceof CustomerWroteCheck) {
            balance = ((CustomerWroteCheck) event).balance();
        } else if (event instanceof AccountFlagged) {
            flagged = true;
        } else if (event instanceof AccountUnflagged) {
            flagged = false;
        }
    }

    public String accountId() {
        return accountId;
    }

    public long balance() {
        return balance;
    }

    public boolean isFlagged() {
        return flagged;
    }

    private static void requirePositive(long amount) throws BankAccountException {
        if (amount <= 0) {
            throw new BankAccountException("amount must be positive");
        }
    }
}
