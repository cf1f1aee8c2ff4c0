package com.tempchan.error;

public class AuthorizationException extends TempChannelException {

    public AuthorizationException(String message) {
        super(message);
    }

    @Override
    public String category() { return "authorization"; }
}
