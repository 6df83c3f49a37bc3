package spectra.exceptions;

import lombok.NonNull;

/** Thrown when an operation is requested against a structurally impossible spectrum state. */
public class InvalidOperationException extends SpectrumException {

    public InvalidOperationException(@NonNull String message) {
        super(message);
    }

    public InvalidOperationException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }
}
