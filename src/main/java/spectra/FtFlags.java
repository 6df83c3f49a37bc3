package spectra;

import com.google.errorprone.annotations.Immutable;
import lombok.Builder;

/**
 * Processing flags for {@link Spectrum#ft}.
 *
 * @param auto infer the flags from the spectrum; not supported by the core transform
 * @param real zero the imaginary component before transforming
 * @param inv apply the inverse transform
 * @param alt alternate the sign of odd-indexed points
 * @param neg negate the imaginary component before transforming
 * @param bruk Bruker/Redfield sequential data, implies {@code real} and {@code alt}
 */
@Immutable
@Builder(toBuilder = true)
public record FtFlags(
        boolean auto, boolean real, boolean inv, boolean alt, boolean neg, boolean bruk) {

    public static final FtFlags FORWARD = FtFlags.builder().build();

    public static final FtFlags INVERSE = FtFlags.builder().inv(true).build();

    /** Whether the imaginary component is zeroed, either directly or through {@code bruk}. */
    public boolean effectiveReal() {
        return real || bruk;
    }

    /** Whether odd points are sign-alternated, either directly or through {@code bruk}. */
    public boolean effectiveAlt() {
        return alt || bruk;
    }
}
