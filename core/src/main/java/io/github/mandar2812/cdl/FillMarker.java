package io.github.mandar2812.cdl;

/**
 * Value of the CDL fill marker <code>_</code> as it appears in
 * a data list.
 *
 * <p>It stands for the effective fill value of the variable being
 * written in numeric data, and for a literal underscore in
 * character data.  It is a distinct object so that it cannot be
 * confused with the string constant <code>"_"</code>.
 *
 * @since    14 Oct 2026
 */
public final class FillMarker {

    /** Sole instance. */
    public static final FillMarker INSTANCE = new FillMarker();

    /** Text of the marker in CDL source. */
    public static final String TEXT = "_";

    /**
     * Private constructor prevents instantiation.
     */
    private FillMarker() {
    }

    @Override
    public String toString() {
        return TEXT;
    }
}
