package com.yieldbasket.staking.exception;

/** Amount or pool state makes the request impossible; nothing was changed. */
public class InvalidStakingRequestException extends RuntimeException {

    public InvalidStakingRequestException(String message) {
        super(message);
    }
}
