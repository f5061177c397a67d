package com.questrail.spex.api;

/**
 * SpexException
 * -----------------------------------------------------------------------------
 * Root of the unchecked exception hierarchy raised by the conversion library.
 *
 * <p>Every failure that the library treats as fatal is reported through one of
 * the subclasses in this package. Non-fatal conditions (clamped energy bounds,
 * missing optional columns, unrecognised units) are never thrown; they are
 * reported as warnings through the observability sink and processing
 * continues.</p>
 *
 * <ul>
 *   <li>{@link FormatException}: malformed or missing table, column or keyword</li>
 *   <li>{@link IncompatibleMatrixException}: capability flag or grid mismatch</li>
 *   <li>{@link IncompatibleSpectrumException}: channel layout mismatch</li>
 *   <li>{@link RegionNotFoundException}: unknown (sector, region) key</li>
 *   <li>{@link DiscontinuousEnergyGridException}: non-positive model bin width</li>
 *   <li>{@link ChannelOutOfRangeException}: channel shift leaves the valid range</li>
 *   <li>{@link ArrayLengthMismatchException}: internal table invariant violated</li>
 * </ul>
 */
public class SpexException extends RuntimeException
{
    public SpexException(String message) {
        super(message);
    }

    public SpexException(String message, Throwable cause) {
        super(message, cause);
    }
}
