package com.filenvault.account;

import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

/**
 * The keys of the current session. Each engine call reads them once when it starts, so a
 * refresh in the middle of a call does not change the keys that call uses.
 */
@Component
public class AccountKeysHolder {

    private final AtomicReference<AccountKeys> keys = new AtomicReference<>();

    public AccountKeys current() {
        AccountKeys current = keys.get();
        if (current == null) {
            throw new IllegalStateException("no account keys loaded");
        }
        return current;
    }

    public boolean isLoaded() {
        return keys.get() != null;
    }

    public void set(AccountKeys accountKeys) {
        keys.set(accountKeys);
    }

    public void clear() {
        keys.set(null);
    }
}
