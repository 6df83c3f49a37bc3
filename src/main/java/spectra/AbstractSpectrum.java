package spectra;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.FastMath;
import spectra.exceptions.InvalidOperationException;
import spectra.exceptions.ShapeException;
import spectra.exceptions.UnsupportedLayoutException;
import spectra.layout.LayoutCodec;
import spectra.tensor.Tensor;
import spectra.transform.FourierTransform;

/**
 * Format-agnostic spectrum engine. Subclasses supply {@link #dataLayout} and may wrap {@link
 * #ft(FtFlags)} and {@link #phase(double, double, boolean)} with the domain and data type
 * bookkeeping their format needs.
 */
@Slf4j
public abstract class AbstractSpectrum implements Spectrum {

    private static final Set<Attribute> DEFAULT_RESET =
            Collections.unmodifiableSet(EnumSet.allOf(Attribute.class));

    private final int ndims;
    private final FourierTransform fourierTransform;
    private final Map<String, Object> meta = new HashMap<>();
    private final List<Dimension> dimensions = new ArrayList<>();

    private Tensor data;
    private Path inPath;
    private Path outPath;

    protected AbstractSpectrum(
            @NonNull Tensor data,
            @NonNull List<Dimension> dimensions,
            @NonNull FourierTransform fourierTransform,
            Path inPath,
            Path outPath) {
        if (dimensions.isEmpty()) {
            throw new InvalidOperationException("A spectrum needs at least one dimension");
        }
        this.ndims = dimensions.size();
        this.fourierTransform = fourierTransform;
        this.inPath = inPath;
        this.outPath = outPath;
        load(data, dimensions);
    }

    @Override
    public int ndims() {
        return ndims;
    }

    @Override
    public Tensor data() {
        return data;
    }

    /** Replaces the tensor. Subclasses re-encoding around the base operations use this. */
    protected void setData(@NonNull Tensor data) {
        this.data = data;
    }

    protected FourierTransform fourierTransform() {
        return fourierTransform;
    }

    @Override
    public List<Dimension> dimensions() {
        return Collections.unmodifiableList(new ArrayList<>(dimensions));
    }

    @Override
    public Dimension dimension(int dim) {
        return dimensions.get(checkDim(dim));
    }

    @Override
    public DomainType domainType(int dim) {
        return dimension(dim).domainType();
    }

    @Override
    public void setDomainType(int dim, @NonNull DomainType value) {
        dimensions.set(checkDim(dim), dimensions.get(dim).withDomainType(value));
    }

    @Override
    public DataType dataType(int dim) {
        return dimension(dim).dataType();
    }

    @Override
    public void setDataType(int dim, @NonNull DataType value) {
        dimensions.set(checkDim(dim), dimensions.get(dim).withDataType(value));
    }

    @Override
    public double spectralWidth(int dim) {
        return dimension(dim).spectralWidth();
    }

    @Override
    public String label(int dim) {
        return dimension(dim).label();
    }

    @Override
    public int[] order() {
        return dimensions.stream().mapToInt(Dimension::number).toArray();
    }

    @Override
    public Map<String, Object> meta() {
        return meta;
    }

    @Override
    public Path inPath() {
        return inPath;
    }

    @Override
    public Path outPath() {
        return outPath;
    }

    @Override
    public void load(@NonNull Tensor data, @NonNull List<Dimension> dimensions) {
        if (dimensions.size() != ndims) {
            throw new InvalidOperationException(
                    "Spectrum has "
                            + ndims
                            + " dimensions, cannot load "
                            + dimensions.size());
        }
        if (data.rank() != ndims) {
            throw new ShapeException(
                    "Tensor rank " + data.rank() + " doesn't match " + ndims + " dimensions");
        }
        checkNumbering(dimensions);
        for (int dim = 0; dim < ndims; dim++) {
            checkStorage(data, dim, dimensions.get(dim).dataType());
        }

        reset(EnumSet.of(Attribute.DATA));
        this.dimensions.clear();
        this.dimensions.addAll(dimensions);
        this.data = data;
        log.info("Loaded {} with order {}", data, Arrays.toString(order()));
    }

    /** Dimension numbers must be a permutation of {@code 1..ndims}. */
    private void checkNumbering(List<Dimension> dimensions) {
        boolean[] seen = new boolean[ndims + 1];
        for (Dimension dimension : dimensions) {
            int number = dimension.number();
            if (number > ndims || seen[number]) {
                throw new InvalidOperationException(
                        "Dimension numbers "
                                + Arrays.toString(
                                        dimensions.stream().mapToInt(Dimension::number).toArray())
                                + " are not a permutation of 1.."
                                + ndims);
            }
            seen[number] = true;
        }
    }

    /** Checks that the tensor's storage along {@code dim} agrees with {@link #dataLayout}. */
    private void checkStorage(Tensor tensor, int dim, DataType dataType) {
        Layout layout = dataLayout(dataType, dim);
        boolean innermost = dim == ndims - 1;
        switch (layout) {
            case SINGLE_INTERLEAVE, BLOCK_INTERLEAVE -> {
                if (tensor.size(dim) % 2 != 0) {
                    throw new ShapeException(
                            "Dimension "
                                    + dim
                                    + " is interleaved but has odd length "
                                    + tensor.size(dim));
                }
                if (innermost && tensor.isComplex()) {
                    throw new UnsupportedLayoutException(
                            "Innermost dimension should hold real-valued storage", layout);
                }
            }
            case COMPLEX -> {
                if (!innermost || !tensor.isComplex()) {
                    throw new UnsupportedLayoutException(
                            "Only a complex-valued innermost axis can be stored natively", layout);
                }
            }
            case REAL -> {
                if (innermost && tensor.isComplex()) {
                    throw new UnsupportedLayoutException(
                            "Innermost dimension should hold real-valued storage", layout);
                }
            }
        }
    }

    @Override
    public void reset() {
        reset(DEFAULT_RESET);
    }

    @Override
    public void reset(@NonNull Set<Attribute> attributes) {
        meta.clear();
        for (Attribute attribute : attributes) {
            switch (attribute) {
                case DATA -> data = null;
                case IN_PATH -> inPath = null;
                case OUT_PATH -> outPath = null;
            }
        }
        log.debug("Reset {}", attributes);
    }

    @Override
    public void transpose(int dim0, int dim1, boolean interleaveComplex) {
        if (ndims <= 1) {
            throw new InvalidOperationException(
                    "Cannot transpose a spectrum with " + ndims + " dimension");
        }
        checkDim(dim0);
        checkDim(dim1);
        Tensor tensor = requireData();
        if (dim0 == dim1) {
            return;
        }
        int low = Math.min(dim0, dim1);
        int high = Math.max(dim0, dim1);

        DataType lowType = dataType(low);
        DataType highType = dataType(high);
        Layout lowBefore = dataLayout(lowType, low);
        Layout highBefore = dataLayout(highType, high);
        // Layouts of the two data types once they sit at their new positions
        Layout lowAfter = dataLayout(lowType, high);
        Layout highAfter = dataLayout(highType, low);

        boolean innermost = interleaveComplex && high == ndims - 1;
        boolean layoutChanges = lowBefore != lowAfter || highBefore != highAfter;
        if (interleaveComplex && !innermost && layoutChanges) {
            throw new UnsupportedLayoutException(
                    "Dimensions "
                            + low
                            + " and "
                            + high
                            + " change layout when swapped ("
                            + lowBefore
                            + " -> "
                            + lowAfter
                            + ", "
                            + highBefore
                            + " -> "
                            + highAfter
                            + ")");
        }

        if (innermost && highType == DataType.COMPLEX) {
            if (highBefore != Layout.BLOCK_INTERLEAVE) {
                throw new UnsupportedLayoutException(
                        "Innermost complex dimension must be block-interleaved", highBefore);
            }
            if (!highAfter.isInterleaved()) {
                throw new UnsupportedLayoutException(
                        "Dimension " + low + " can only hold interleaved complex data", highAfter);
            }
            tensor = LayoutCodec.splitBlockToComplex(tensor);
            tensor = LayoutCodec.convert(tensor, Layout.COMPLEX, highAfter);
        }

        tensor = tensor.swapAxes(low, high);

        if (innermost && lowType == DataType.COMPLEX) {
            if (!lowBefore.isInterleaved()) {
                throw new UnsupportedLayoutException(
                        "Dimension " + low + " should have held interleaved complex data",
                        lowBefore);
            }
            if (lowBefore == Layout.SINGLE_INTERLEAVE) {
                tensor = LayoutCodec.interleaveSingleToBlock(tensor);
            }
            tensor = LayoutCodec.convert(tensor, Layout.BLOCK_INTERLEAVE, lowAfter);
        }

        // Metadata follows the data only once every re-encoding has succeeded
        Dimension lowDimension = dimensions.get(low);
        dimensions.set(low, dimensions.get(high));
        dimensions.set(high, lowDimension);
        data = tensor;
        log.debug(
                "Transposed dimensions {} and {}, order now {}",
                low,
                high,
                Arrays.toString(order()));
    }

    @Override
    public void phase(double p0, double p1, boolean discardImaginaries) {
        Tensor tensor = requireData();
        int last = ndims - 1;
        if (!tensor.isComplex()) {
            throw new UnsupportedLayoutException(
                    "Phase correction needs complex samples along the innermost axis",
                    dataLayout(dataType(last), last));
        }

        double sw = spectralWidth(last);
        int npts = tensor.size(-1);
        double[] cos = new double[npts];
        double[] sin = new double[npts];
        for (int i = 0; i < npts; i++) {
            double frequency = npts == 1 ? -sw / 2 : -sw / 2 + sw * i / (npts - 1);
            double angle = p0 + p1 * frequency;
            cos[i] = FastMath.cos(angle);
            sin[i] = FastMath.sin(angle);
        }

        double[] real = tensor.realValues();
        double[] imag = tensor.imagValues();
        for (int i = 0; i < real.length; i++) {
            int point = i % npts;
            double re = real[i];
            double im = imag[i];
            real[i] = re * cos[point] - im * sin[point];
            imag[i] = re * sin[point] + im * cos[point];
        }

        Tensor phased = Tensor.ofComplex(real, imag, tensor.shape());
        data = discardImaginaries ? phased.realPart() : phased;
        log.debug("Phased innermost axis with p0={}, p1={} over sw={}", p0, p1, sw);
    }

    @Override
    public void ft(@NonNull FtFlags flags) {
        if (flags.auto()) {
            throw new UnsupportedOperationException(
                    "Automatic FT flags must be resolved by the format-specific spectrum");
        }
        Tensor tensor = requireData();
        boolean inverse = flags.inv();
        boolean alternate = flags.effectiveAlt();
        int npts = tensor.size(-1);

        double[] real = tensor.realValues();
        double[] imag = tensor.imagValues();
        if (flags.effectiveReal()) {
            Arrays.fill(imag, 0.0);
        }
        if (alternate && !inverse) {
            negateOddPoints(real, imag, npts);
        }
        if (flags.neg()) {
            for (int i = 0; i < imag.length; i++) {
                imag[i] = -imag[i];
            }
        }

        Tensor result =
                fourierTransform.apply(
                        Tensor.ofComplex(real, imag, tensor.shape()),
                        inverse ? TransformType.INVERSE : TransformType.FORWARD);

        if (inverse && alternate) {
            double[] resultReal = result.realValues();
            double[] resultImag = result.imagValues();
            negateOddPoints(resultReal, resultImag, npts);
            result = Tensor.ofComplex(resultReal, resultImag, result.shape());
        }

        data = result;
        log.debug("Fourier transformed innermost axis with {}", flags);
    }

    @Override
    public Map<String, Object> ft(@NonNull FtFlags flags, @NonNull Map<String, Object> kwargs) {
        ft(flags);
        Map<String, Object> result = new LinkedHashMap<>(kwargs);
        result.put("data", data);
        return result;
    }

    private static void negateOddPoints(double[] real, double[] imag, int npts) {
        for (int i = 0; i < real.length; i++) {
            // Parity is taken within the lane
            if (i % npts % 2 == 1) {
                real[i] = -real[i];
                imag[i] = -imag[i];
            }
        }
    }

    protected Tensor requireData() {
        if (data == null) {
            throw new InvalidOperationException("Spectrum has no data loaded");
        }
        return data;
    }

    private int checkDim(int dim) {
        if (dim < 0 || dim >= ndims) {
            throw new ShapeException(
                    "Dimension "
                            + dim
                            + " out of range for spectrum with "
                            + ndims
                            + " dimensions");
        }
        return dim;
    }
}
