package com.williamcallahan.mathcore.domain.mathml;

/**
 * How conversion failures are surfaced.
 *
 * <p>The two recovery behaviors are independent and may be combined: with
 * {@link #ignoreUnknownCommands()} set, unknown commands become placeholders; any other failure
 * still aborts the conversion unless {@link #continueInline()} is also set, in which case it
 * becomes inline fallback markup.</p>
 *
 * @param continueInline render failures as {@code math-core-error} fallback markup
 * @param ignoreUnknownCommands render unknown commands as highlighted placeholder text
 */
public record ErrorPolicy(boolean continueInline, boolean ignoreUnknownCommands) {

    /**
     * Any failure aborts the conversion with a located error.
     */
    public static final ErrorPolicy RAISE = new ErrorPolicy(false, false);

    /**
     * Failures become inline fallback markup instead of an error.
     */
    public static final ErrorPolicy CONTINUE_INLINE = new ErrorPolicy(true, false);

    /**
     * Unknown commands become placeholders; other failures still abort.
     */
    public static final ErrorPolicy IGNORE_UNKNOWN_COMMANDS = new ErrorPolicy(false, true);
}
