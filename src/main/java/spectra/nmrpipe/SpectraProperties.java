package spectra.nmrpipe;

import org.apache.commons.math3.transform.DftNormalization;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalized configuration for spectrum processing.
 *
 * @param fftShift centre the zero frequency after a forward transform
 * @param normalization scaling convention of the discrete Fourier transform
 */
@ConfigurationProperties(prefix = "spectra")
public record SpectraProperties(
        @DefaultValue("true") boolean fftShift,
        @DefaultValue("STANDARD") DftNormalization normalization) {}
