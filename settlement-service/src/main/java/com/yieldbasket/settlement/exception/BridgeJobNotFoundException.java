package com.yieldbasket.settlement.exception;

public class BridgeJobNotFoundException extends RuntimeException {

    public BridgeJobNotFoundException(long jobId) {
        super("no bridge job with id " + jobId);
    }
}
