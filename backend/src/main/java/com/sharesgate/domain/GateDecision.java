package com.sharesgate.domain;

/**
 * A permission change to apply to one member of one community.
 */
public record GateDecision(String externalIdentity, Community community, PermissionState permission) {
}
