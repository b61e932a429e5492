package com.autoposter.provider;

/**
 * Account a platform credential belongs to. The username may be null when the platform omits it.
 */
public record PlatformAccount(String id, String username) {
}
