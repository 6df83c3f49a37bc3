package spectra.exceptions;

import lombok.NonNull;

/**
 * Thrown when a tensor shape cannot satisfy an operation: an axis that should hold paired
 * real/imaginary samples has odd length, a dimension index is out of range, or a tensor's rank or
 * element count does not match what was declared for it.
 */
public class ShapeException extends SpectrumException {

    public ShapeException(@NonNull String message) {
        super(message);
    }

    public ShapeException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}
