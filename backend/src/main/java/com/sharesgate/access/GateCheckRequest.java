package com.sharesgate.access;

/**
 * A user proving control of {@code user} by signing {@code challenge} (their community user id).
 */
public record GateCheckRequest(String challenge, String signature, String user, String chatId, String chainType) {
}
