package spectra.exceptions;

import lombok.Getter;
import lombok.NonNull;
import spectra.Layout;

/**
 * Thrown when a layout-sensitive operation meets a storage layout it cannot convert. Either the
 * format variant is not implemented or an earlier step left the data inconsistent with {@link
 * spectra.Spectrum#dataLayout}.
 */
@Getter
public class UnsupportedLayoutException extends SpectrumException {

    /** The layout that was observed, if known. */
    private final Layout layout;

    public UnsupportedLayoutException(@NonNull String message) {
        super(message);
        this.layout = null;
    }

    public UnsupportedLayoutException(@NonNull String message, @NonNull Layout layout) {
        super(message + " (layout " + layout + ")");
        this.layout = layout;
    }
}
