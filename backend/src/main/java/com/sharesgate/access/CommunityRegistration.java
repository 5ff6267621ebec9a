package com.sharesgate.access;

/**
 * Input for registering a gated community; {@code chainType} may be null for the default chain.
 */
public record CommunityRegistration(
        String agentName,
        String bio,
        String inviteUrl,
        String botToken,
        String chatGroupId,
        String subjectAddress,
        String chainType
) {
}
