package com.meritmarket.service;

public class ReentrantOperationException extends RuntimeException {

    public ReentrantOperationException(String operation, String inFlight) {
        super("Operation " + operation + " attempted while " + inFlight + " is in flight");
    }
}
