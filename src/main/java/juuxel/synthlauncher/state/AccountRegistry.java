/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.data.Account;
import juuxel.synthlauncher.task.LauncherException;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered list of signed-in accounts. Indices are stable until a removal,
 * which shifts every higher index down by one.
 */
public final class AccountRegistry {
    private final List<Account> accounts = new ArrayList<>();

    AccountRegistry(List<Account> initial) {
        accounts.addAll(initial);
    }

    public synchronized int size() {
        return accounts.size();
    }

    public synchronized Account get(int index) throws LauncherException {
        checkIndex(index);
        return accounts.get(index);
    }

    /**
     * Adds the account, or replaces the one with the same profile id in place.
     *
     * @return the account's index
     */
    public synchronized int upsert(Account account) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).profile().id().equals(account.profile().id())) {
                accounts.set(i, account);
                return i;
            }
        }

        accounts.add(account);
        return accounts.size() - 1;
    }

    public synchronized void replace(int index, Account account) throws LauncherException {
        checkIndex(index);
        accounts.set(index, account);
    }

    public synchronized Account remove(int index) throws LauncherException {
        checkIndex(index);
        return accounts.remove(index);
    }

    public synchronized List<Account> toList() {
        return List.copyOf(accounts);
    }

    private void checkIndex(int index) throws LauncherException {
        if (index < 0 || index >= accounts.size()) {
            throw LauncherException.precondition("No account at index " + index + " (" + accounts.size() + " registered)");
        }
    }
}
