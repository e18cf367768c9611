package com.mimecast.labeller.credentials;

import java.util.Arrays;

/**
 * Password, app password or OAuth bearer token.
 *
 * <p>Held as a char array so it can be wiped; never printed.
 */
public final class Secret {

    private final char[] value;
    private volatile boolean cleared;

    public Secret(char[] value) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("Secret cannot be empty");
        }
        this.value = Arrays.copyOf(value, value.length);
    }

    public static Secret of(String value) {
        return new Secret(value == null ? null : value.toCharArray());
    }

    /**
     * Gets the secret as a string for APIs that only accept strings.
     *
     * @return Secret value.
     * @throws IllegalStateException When cleared.
     */
    public String reveal() {
        if (cleared) {
            throw new IllegalStateException("Secret was cleared");
        }
        return new String(value);
    }

    /**
     * Overwrites the value. Further reveals fail.
     */
    public void clear() {
        Arrays.fill(value, '\0');
        cleared = true;
    }

    public boolean isCleared() {
        return cleared;
    }

    @Override
    public String toString() {
        return "Secret{****}";
    }
}
