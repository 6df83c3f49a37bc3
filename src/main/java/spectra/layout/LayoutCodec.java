package spectra.layout;

import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import spectra.Layout;
import spectra.exceptions.ShapeException;
import spectra.exceptions.UnsupportedLayoutException;
import spectra.tensor.Tensor;

/**
 * Conversions between complex-valued tensors and the real-valued encodings of complex samples.
 *
 * <p>Every conversion works on the innermost axis only and leaves all other axes unchanged. They
 * are pure reindexing, so each conversion composed with its inverse reproduces its input exactly.
 */
@Slf4j
@UtilityClass
public class LayoutCodec {

    /**
     * Decodes a block-interleaved axis: the first N values become the real parts, the next N the
     * imaginary parts.
     *
     * @param tensor real-valued tensor whose last axis has length 2N
     * @return complex-valued tensor whose last axis has length N
     * @throws ShapeException if the last axis has odd length
     */
    public Tensor splitBlockToComplex(@NonNull Tensor tensor) {
        requireReal(tensor, "split block-interleaved samples");
        int half = pairCount(tensor);
        double[] values = tensor.realValues();
        int lanes = tensor.laneCount();
        double[] real = new double[lanes * half];
        double[] imag = new double[lanes * half];
        for (int lane = 0; lane < lanes; lane++) {
            System.arraycopy(values, lane * 2 * half, real, lane * half, half);
            System.arraycopy(values, lane * 2 * half + half, imag, lane * half, half);
        }
        return Tensor.ofComplex(real, imag, withLastAxis(tensor, half));
    }

    /**
     * Encodes a complex axis of N samples as 2N block-interleaved real values: real parts in {@code
     * [0, N)}, imaginary parts in {@code [N, 2N)}.
     */
    public Tensor combineBlockFromComplex(@NonNull Tensor tensor) {
        requireComplex(tensor, "combine block-interleaved samples");
        int n = tensor.size(-1);
        double[] real = tensor.realValues();
        double[] imag = tensor.imagValues();
        int lanes = tensor.laneCount();
        double[] values = new double[lanes * 2 * n];
        for (int lane = 0; lane < lanes; lane++) {
            System.arraycopy(real, lane * n, values, lane * 2 * n, n);
            System.arraycopy(imag, lane * n, values, lane * 2 * n + n, n);
        }
        return Tensor.ofReal(values, withLastAxis(tensor, 2 * n));
    }

    /**
     * Decodes a single-interleaved axis {@code (r0, i0, r1, i1, ...)} into N complex samples.
     *
     * @throws ShapeException if the last axis has odd length
     */
    public Tensor splitSingleToComplex(@NonNull Tensor tensor) {
        requireReal(tensor, "split single-interleaved samples");
        int half = pairCount(tensor);
        double[] values = tensor.realValues();
        int count = tensor.laneCount() * half;
        double[] real = new double[count];
        double[] imag = new double[count];
        for (int i = 0; i < count; i++) {
            real[i] = values[2 * i];
            imag[i] = values[2 * i + 1];
        }
        return Tensor.ofComplex(real, imag, withLastAxis(tensor, half));
    }

    /** Encodes a complex axis of N samples as 2N single-interleaved real values. */
    public Tensor combineSingleFromComplex(@NonNull Tensor tensor) {
        requireComplex(tensor, "combine single-interleaved samples");
        double[] real = tensor.realValues();
        double[] imag = tensor.imagValues();
        double[] values = new double[2 * real.length];
        for (int i = 0; i < real.length; i++) {
            values[2 * i] = real[i];
            values[2 * i + 1] = imag[i];
        }
        return Tensor.ofReal(values, withLastAxis(tensor, 2 * tensor.size(-1)));
    }

    /**
     * Reorders {@code (r0, i0, r1, i1, ...)} into {@code (r0, r1, ..., rN-1, i0, i1, ..., iN-1)}.
     *
     * @throws ShapeException if the last axis has odd length
     */
    public Tensor interleaveSingleToBlock(@NonNull Tensor tensor) {
        requireReal(tensor, "reorder single-interleaved samples");
        int half = pairCount(tensor);
        double[] values = tensor.realValues();
        double[] reordered = new double[values.length];
        for (int lane = 0; lane < tensor.laneCount(); lane++) {
            int base = lane * 2 * half;
            for (int i = 0; i < half; i++) {
                reordered[base + i] = values[base + 2 * i];
                reordered[base + half + i] = values[base + 2 * i + 1];
            }
        }
        return Tensor.ofReal(reordered, tensor.shape());
    }

    /**
     * Reorders {@code (r0, ..., rN-1, i0, ..., iN-1)} into {@code (r0, i0, r1, i1, ...)}.
     *
     * @throws ShapeException if the last axis has odd length
     */
    public Tensor interleaveBlockToSingle(@NonNull Tensor tensor) {
        requireReal(tensor, "reorder block-interleaved samples");
        int half = pairCount(tensor);
        double[] values = tensor.realValues();
        double[] reordered = new double[values.length];
        for (int lane = 0; lane < tensor.laneCount(); lane++) {
            int base = lane * 2 * half;
            for (int i = 0; i < half; i++) {
                reordered[base + 2 * i] = values[base + i];
                reordered[base + 2 * i + 1] = values[base + half + i];
            }
        }
        return Tensor.ofReal(reordered, tensor.shape());
    }

    /**
     * Re-encodes the innermost axis from one complex encoding to another. Supports every pair of
     * {@link Layout#SINGLE_INTERLEAVE}, {@link Layout#BLOCK_INTERLEAVE} and {@link Layout#COMPLEX};
     * equal layouts return the tensor unchanged.
     *
     * @throws UnsupportedLayoutException for any other layout
     */
    public Tensor convert(@NonNull Tensor tensor, @NonNull Layout from, @NonNull Layout to) {
        if (from == to) {
            return tensor;
        }
        log.debug("Re-encoding innermost axis of {} from {} to {}", tensor, from, to);
        return switch (from) {
            case SINGLE_INTERLEAVE -> switch (to) {
                case BLOCK_INTERLEAVE -> interleaveSingleToBlock(tensor);
                case COMPLEX -> splitSingleToComplex(tensor);
                default -> throw new UnsupportedLayoutException("Cannot convert to", to);
            };
            case BLOCK_INTERLEAVE -> switch (to) {
                case SINGLE_INTERLEAVE -> interleaveBlockToSingle(tensor);
                case COMPLEX -> splitBlockToComplex(tensor);
                default -> throw new UnsupportedLayoutException("Cannot convert to", to);
            };
            case COMPLEX -> switch (to) {
                case SINGLE_INTERLEAVE -> combineSingleFromComplex(tensor);
                case BLOCK_INTERLEAVE -> combineBlockFromComplex(tensor);
                default -> throw new UnsupportedLayoutException("Cannot convert to", to);
            };
            default -> throw new UnsupportedLayoutException("Cannot convert from", from);
        };
    }

    private int pairCount(Tensor tensor) {
        int length = tensor.size(-1);
        if (length % 2 != 0) {
            throw new ShapeException(
                    "Interleaved axis must have even length, found " + length + " in " + tensor);
        }
        return length / 2;
    }

    private int[] withLastAxis(Tensor tensor, int length) {
        int[] shape = tensor.shape();
        shape[shape.length - 1] = length;
        return shape;
    }

    private void requireReal(Tensor tensor, String action) {
        if (tensor.isComplex()) {
            throw new UnsupportedLayoutException(
                    "Cannot " + action + " from complex-valued storage", Layout.COMPLEX);
        }
    }

    private void requireComplex(Tensor tensor, String action) {
        if (!tensor.isComplex()) {
            throw new UnsupportedLayoutException("Cannot " + action + " from real-valued storage");
        }
    }
}
