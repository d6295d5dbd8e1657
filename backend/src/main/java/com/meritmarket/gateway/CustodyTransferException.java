package com.meritmarket.gateway;

public class CustodyTransferException extends RuntimeException {

    public CustodyTransferException(String message) {
        super(message);
    }
}
