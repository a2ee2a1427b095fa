package com.yieldbasket.staking.exception;

public class StakeEntryNotFoundException extends RuntimeException {

    public StakeEntryNotFoundException(String owner) {
        super("no stake entry for owner " + owner);
    }
}
