package spectra.exceptions;

import lombok.NonNull;

/** Base exception for all spectrum processing errors. */
public class SpectrumException extends RuntimeException {

    public SpectrumException(@NonNull String message) {
        super(message);
    }

    public SpectrumException(@NonNull String message, @NonNull Throwable cause) {
        super(message, cause);
    }

    public SpectrumException(@NonNull Throwable cause) {
        super(cause);
    }
}
