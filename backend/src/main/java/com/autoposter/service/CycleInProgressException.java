package com.autoposter.service;

public class CycleInProgressException extends RuntimeException {

    public CycleInProgressException() {
        super("A posting cycle is already in progress");
    }
}
