package com.mimecast.labeller.main;

import com.mimecast.labeller.credentials.Secret;

import java.io.Console;
import java.util.Arrays;
import java.util.Optional;

/**
 * Interactive secret input, used when no stored credential exists.
 */
@FunctionalInterface
public interface PasswordPrompt {

    /**
     * Reads from the system console without echo. Empty when there is no console.
     */
    PasswordPrompt CONSOLE = principal -> {
        Console console = System.console();
        if (console == null) {
            return Optional.empty();
        }
        char[] value = console.readPassword("Password for %s: ", principal);
        if (value == null || value.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Secret(value));
        } finally {
            Arrays.fill(value, '\0');
        }
    };

    /**
     * Reads a secret for the principal.
     *
     * @param principal Principal.
     * @return Optional of Secret.
     */
    Optional<Secret> read(String principal);
}
