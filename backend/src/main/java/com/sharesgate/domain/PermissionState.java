package com.sharesgate.domain;

/**
 * Member permission level pushed to a community.
 */
public enum PermissionState {
    /** Send messages, media, polls and link previews. */
    FULL,
    /** Read only. */
    NONE
}
