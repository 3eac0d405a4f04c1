package io.mnemoshard.cli;

import io.mnemoshard.recovery.PasswordPrompt;
import io.mnemoshard.recovery.PasswordRequest;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Reads passwords from the terminal without echo, falling back to a line
 * reader when no console is attached. A password passed on the command line
 * answers the first pass only; retries always go to the user.
 */
final class ConsolePasswordPrompt implements PasswordPrompt {
    private final Console console;
    private final BufferedReader fallback;
    private final PrintStream err;
    private final String preset;

    ConsolePasswordPrompt(Console console, BufferedReader fallback, PrintStream err, String preset) {
        this.console = console;
        this.fallback = fallback;
        this.err = err;
        this.preset = preset;
    }

    @Override
    public Optional<String> requestPassword(PasswordRequest request) {
        if (preset != null && !request.retry()) {
            return Optional.of(preset);
        }
        if (console != null) {
            char[] typed = console.readPassword("%s: ", request.message());
            return typed == null ? Optional.empty() : Optional.of(new String(typed));
        }
        err.println(request.message() + ":");
        try {
            String line = fallback == null ? null : fallback.readLine();
            return Optional.ofNullable(line);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read password", e);
        }
    }
}
