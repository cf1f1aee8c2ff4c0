package com.tempchan.error;

public class ValidationException extends TempChannelException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String category() { return "validation"; }
}
