package com.sandkev.redditclient.error;

/**
 * Rate-limit bookkeeping was attempted for the bypass account.
 */
public class AccountIdRequiredException extends IllegalStateException {

    public AccountIdRequiredException() {
        super("Rate limit bookkeeping requires a reddit account id");
    }
}
