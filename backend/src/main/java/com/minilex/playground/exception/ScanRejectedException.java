package com.minilex.playground.exception;

public class ScanRejectedException extends Exception {

    public ScanRejectedException(String message) {
        super(message);
    }
}
