package com.tempchan.lifecycle;

public enum DescriptorState {
    ACTIVE,
    /** Terminal. Entered once, when a deletion has been decided. */
    PENDING_DELETION
}
