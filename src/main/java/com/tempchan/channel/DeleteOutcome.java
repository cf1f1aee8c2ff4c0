package com.tempchan.channel;

public enum DeleteOutcome {
    DELETED,
    NOT_FOUND
}
