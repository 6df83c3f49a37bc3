package spectra;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.NonNull;
import spectra.tensor.Tensor;

/**
 * A multidimensional NMR spectrum: a tensor plus per-dimension metadata, and the operations that
 * move the tensor between representations.
 *
 * <p>Dimensions are indexed from 0 in current data order; the last one ({@code ndims() - 1}) is the
 * innermost axis of {@link #data()}. Implementations are format-specific only in {@link
 * #dataLayout}; everything else is written once against this interface.
 *
 * <p>Not thread-safe. Every operation mutates the spectrum in place.
 */
public interface Spectrum {

    /** Attributes cleared by {@link #reset(Set)}. */
    enum Attribute {
        DATA,
        IN_PATH,
        OUT_PATH
    }

    int ndims();

    /** The tensor, or null after a reset. */
    Tensor data();

    /** Per-dimension metadata in current data order. */
    List<Dimension> dimensions();

    Dimension dimension(int dim);

    DomainType domainType(int dim);

    void setDomainType(int dim, @NonNull DomainType value);

    DataType dataType(int dim);

    void setDataType(int dim, @NonNull DataType value);

    double spectralWidth(int dim);

    String label(int dim);

    /** 1-based dimension numbers in current data order. */
    int[] order();

    /** Format-specific metadata, owned by the I/O collaborators. */
    Map<String, Object> meta();

    Path inPath();

    Path outPath();

    /** How data of the given type is stored along dimension {@code dim}. */
    Layout dataLayout(@NonNull DataType dataType, int dim);

    /** Replaces the tensor and metadata, keeping the paths. */
    void load(@NonNull Tensor data, @NonNull List<Dimension> dimensions);

    /** Clears {@link #meta()} and the default attributes: data, input path and output path. */
    void reset();

    /** Clears {@link #meta()} and the given attributes. */
    void reset(@NonNull Set<Attribute> attributes);

    /** Exchanges two dimensions, re-encoding complex layouts across the innermost axis. */
    default void transpose(int dim0, int dim1) {
        transpose(dim0, dim1, true);
    }

    void transpose(int dim0, int dim1, boolean interleaveComplex);

    /** Applies a phase ramp to the innermost axis and keeps only the real component. */
    default void phase(double p0, double p1) {
        phase(p0, p1, true);
    }

    void phase(double p0, double p1, boolean discardImaginaries);

    /** Fourier transforms the innermost axis. */
    void ft(@NonNull FtFlags flags);

    /**
     * Fourier transforms the innermost axis and hands the result on to a processing pipeline.
     *
     * @return a copy of {@code kwargs} whose {@code "data"} entry holds the transformed tensor
     */
    Map<String, Object> ft(@NonNull FtFlags flags, @NonNull Map<String, Object> kwargs);
}
