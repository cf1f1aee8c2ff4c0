package com.tempchan.lifecycle;

public enum MembershipChange {
    APPLIED,
    /** Duplicate invite or kick of a non-member; nothing was sent to the platform. */
    UNCHANGED
}
