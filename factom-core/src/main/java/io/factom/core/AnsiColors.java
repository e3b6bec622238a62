// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

/**
 * ANSI color palette for debug output, disabled automatically outside a TTY.
 *
 * <p>Colors are only emitted when the JVM has a console or when
 * {@code FORCE_COLOR=true} is set, so log files and captured test output stay
 * free of escape sequences.
 *
 * <ul>
 * <li><b>TEAL</b> - the tag of a successful call</li>
 * <li><b>CORAL</b> - application and transport errors</li>
 * <li><b>INDIGO</b> - method names on successful calls</li>
 * <li><b>AMBER</b> - payload dumps</li>
 * <li><b>SLATE</b> - durations and other metadata</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** Clears all formatting. */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
