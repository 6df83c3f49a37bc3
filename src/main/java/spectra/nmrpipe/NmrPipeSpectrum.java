package spectra.nmrpipe;

import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import spectra.AbstractSpectrum;
import spectra.DataType;
import spectra.Dimension;
import spectra.DomainType;
import spectra.FtFlags;
import spectra.Layout;
import spectra.exceptions.ShapeException;
import spectra.layout.LayoutCodec;
import spectra.tensor.Tensor;
import spectra.transform.FourierTransform;

/**
 * Spectrum stored the way NMRPipe stores it: complex points along the innermost dimension are
 * block-interleaved (a row of reals followed by a row of imaginaries), complex points along every
 * other dimension are single-interleaved (alternating real and imaginary rows).
 *
 * <p>{@link #ft} and {@link #phase} decode the innermost axis, run the base operation and store
 * the result back in block-interleaved form, updating the innermost dimension's domain and data
 * type on the way.
 */
@Slf4j
public class NmrPipeSpectrum extends AbstractSpectrum {

    public NmrPipeSpectrum(
            @NonNull Tensor data,
            @NonNull List<Dimension> dimensions,
            @NonNull FourierTransform fourierTransform) {
        this(data, dimensions, fourierTransform, null, null);
    }

    public NmrPipeSpectrum(
            @NonNull Tensor data,
            @NonNull List<Dimension> dimensions,
            @NonNull FourierTransform fourierTransform,
            Path inPath,
            Path outPath) {
        super(data, dimensions, fourierTransform, inPath, outPath);
    }

    @Override
    public Layout dataLayout(@NonNull DataType dataType, int dim) {
        if (dim < 0 || dim >= ndims()) {
            throw new ShapeException(
                    "Dimension "
                            + dim
                            + " out of range for spectrum with "
                            + ndims()
                            + " dimensions");
        }
        return switch (dataType) {
            case COMPLEX ->
                    dim == ndims() - 1 ? Layout.BLOCK_INTERLEAVE : Layout.SINGLE_INTERLEAVE;
            case REAL, IMAG -> Layout.REAL;
        };
    }

    /**
     * Fourier transforms the innermost dimension. With {@code auto} set, the direction follows the
     * dimension's current domain and real-only data gets a real transform.
     */
    @Override
    public void ft(@NonNull FtFlags flags) {
        FtFlags resolved = flags.auto() ? resolveAuto(flags) : flags;
        int last = ndims() - 1;
        Tensor original = decodeInnermost();
        try {
            super.ft(resolved);
        } catch (RuntimeException e) {
            setData(original);
            throw e;
        }

        DomainType domain = domainType(last).afterTransform(resolved.inv());
        log.debug("Innermost dimension {} -> {}", domainType(last), domain);
        setDomainType(last, domain);
        setDataType(last, DataType.COMPLEX);
        setData(LayoutCodec.combineBlockFromComplex(data()));
    }

    /** Phases the innermost dimension; discarding imaginaries leaves it {@link DataType#REAL}. */
    @Override
    public void phase(double p0, double p1, boolean discardImaginaries) {
        int last = ndims() - 1;
        Tensor original = decodeInnermost();
        try {
            super.phase(p0, p1, discardImaginaries);
        } catch (RuntimeException e) {
            setData(original);
            throw e;
        }

        if (discardImaginaries) {
            setDataType(last, DataType.REAL);
        } else {
            setData(LayoutCodec.combineBlockFromComplex(data()));
        }
    }

    /** Decodes a block-interleaved innermost axis in place, returning the tensor it replaced. */
    private Tensor decodeInnermost() {
        Tensor original = requireData();
        int last = ndims() - 1;
        Layout layout = dataLayout(dataType(last), last);
        if (layout == Layout.BLOCK_INTERLEAVE) {
            setData(LayoutCodec.convert(original, layout, Layout.COMPLEX));
        }
        return original;
    }

    private FtFlags resolveAuto(FtFlags flags) {
        int last = ndims() - 1;
        FtFlags resolved =
                flags.toBuilder()
                        .auto(false)
                        .inv(domainType(last) == DomainType.FREQ)
                        .real(dataType(last) != DataType.COMPLEX)
                        .build();
        log.debug("Resolved automatic FT flags to {}", resolved);
        return resolved;
    }
}
