package spectra.nmrpipe;

import com.google.errorprone.annotations.ThreadSafe;
import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;
import spectra.Dimension;
import spectra.Spectrum;
import spectra.SpectrumFactory;
import spectra.tensor.Tensor;
import spectra.transform.FourierTransform;

/** Creates {@link NmrPipeSpectrum}s sharing one Fourier transform kernel. */
@ThreadSafe
public class NmrPipeSpectrumFactory implements SpectrumFactory {

    private final FourierTransform fourierTransform;

    public NmrPipeSpectrumFactory(@NonNull FourierTransform fourierTransform) {
        this.fourierTransform = fourierTransform;
    }

    @Override
    public Spectrum create(
            @NonNull Tensor data, @NonNull List<Dimension> dimensions, Path inPath, Path outPath) {
        return new NmrPipeSpectrum(data, dimensions, fourierTransform, inPath, outPath);
    }
}
