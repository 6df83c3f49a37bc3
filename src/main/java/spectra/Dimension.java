package spectra;

import com.google.errorprone.annotations.Immutable;
import lombok.NonNull;
import lombok.With;

/**
 * Metadata for one dimension of a spectrum. A spectrum keeps one record per dimension in current
 * data order, so the per-dimension fields can never drift out of length-sync.
 *
 * @param number 1-based logical dimension number, assigned at load and carried along by transposes
 * @param domainType time or frequency domain
 * @param dataType real, imaginary or complex samples
 * @param spectralWidth spectral width in Hz
 * @param label human-readable label, e.g. {@code "1H"}
 */
@Immutable
@With
public record Dimension(
        int number,
        @NonNull DomainType domainType,
        @NonNull DataType dataType,
        double spectralWidth,
        @NonNull String label) {

    public Dimension {
        if (number <= 0) {
            throw new IllegalArgumentException("Dimension number must be positive: " + number);
        }
        if (Double.isNaN(spectralWidth) || spectralWidth < 0) {
            throw new IllegalArgumentException(
                    "Spectral width cannot be negative or NaN: " + spectralWidth);
        }
    }

    /** Creates a time-domain dimension, the usual state right after acquisition. */
    public static Dimension time(
            int number, DataType dataType, double spectralWidth, String label) {
        return new Dimension(number, DomainType.TIME, dataType, spectralWidth, label);
    }
}
