package io.github.cyfko.dartql.core.config;

/**
 * Policies for a server-compatible query that sets the same backend parameter more than once with
 * different values, e.g. {@code status = 'Todo' AND status = 'Done'}.
 * Repeating an identical value is always merged silently.
 */
public enum DuplicateFieldPolicy {
    /** Fall back to client-side filtering so that every constraint is evaluated. */
    CLIENT_SIDE,
    /** Report a compilation error. */
    REJECT,
    /** Keep the value written last and emit a warning. */
    LAST_WINS;
}
