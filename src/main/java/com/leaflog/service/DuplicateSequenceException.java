package com.leaflog.service;

/**
 * The same changelog seq is stored for one tree under more than one slot.
 */
public class DuplicateSequenceException extends RuntimeException {

    public DuplicateSequenceException(String message) {
        super(message);
    }
}
