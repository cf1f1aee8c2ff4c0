package com.tempchan.permission;

/**
 * Channel-level permissions the planner reasons about. Platform adapters map
 * these onto their own permission flags.
 */
public enum Permission {
    VIEW,
    SEND,
    MANAGE_MESSAGES,
    MANAGE_CHANNEL
}
