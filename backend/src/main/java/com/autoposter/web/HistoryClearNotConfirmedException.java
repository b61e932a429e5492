package com.autoposter.web;

public class HistoryClearNotConfirmedException extends RuntimeException {

    public HistoryClearNotConfirmedException() {
        super("Clearing post history requires confirm=true");
    }
}
