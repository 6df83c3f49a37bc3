package spectra;

import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;
import spectra.tensor.Tensor;

/**
 * Builds spectra for the I/O collaborators. A loader hands over the decoded tensor and the
 * per-dimension metadata it read; the factory returns a spectrum that satisfies the layout
 * invariants or fails.
 */
public interface SpectrumFactory {

    default Spectrum create(@NonNull Tensor data, @NonNull List<Dimension> dimensions) {
        return create(data, dimensions, null, null);
    }

    /**
     * @param inPath file the data was read from, if any
     * @param outPath file the processed spectrum should be written to, if any
     */
    Spectrum create(
            @NonNull Tensor data, @NonNull List<Dimension> dimensions, Path inPath, Path outPath);
}
