// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

/**
 * ANSI escapes for trace output. Every constant is empty unless a console is attached or
 * {@code FORCE_COLOR=true} is set, so log files stay free of escape codes.
 */
public final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");

    /** Success. */
    public static final String TEAL = ansi("38;5;44");

    /** Errors. */
    public static final String CORAL = ansi("38;5;204");

    /** RPC traffic. */
    public static final String INDIGO = ansi("38;5;99");

    /** Gas and nonce decisions. */
    public static final String AMBER = ansi("38;5;214");

    /** Metadata such as durations. */
    public static final String SLATE = ansi("38;5;247");

    /** Transaction lifecycle. */
    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
