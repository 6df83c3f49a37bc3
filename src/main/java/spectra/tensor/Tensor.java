package spectra.tensor;

import java.util.Arrays;
import lombok.NonNull;
import spectra.exceptions.ShapeException;

/**
 * Dense row-major tensor of doubles, either real-valued or complex-valued.
 *
 * <p>Instances are immutable: factories copy their inputs and accessors return copies. Operations
 * that change a tensor produce a new one, so a spectrum replacing its tensor never shares mutable
 * storage with anyone else.
 *
 * <p>Axis arguments accept negative values counted from the end, so {@code size(-1)} is the length
 * of the innermost axis.
 */
public final class Tensor {

    private final int[] shape;
    private final double[] real;
    private final double[] imag; // null for real-valued tensors

    private Tensor(int[] shape, double[] real, double[] imag) {
        this.shape = shape;
        this.real = real;
        this.imag = imag;
    }

    /** Creates a real-valued tensor from row-major values. */
    public static Tensor ofReal(@NonNull double[] values, @NonNull int... shape) {
        int[] checked = checkShape(shape, values.length);
        return new Tensor(checked, values.clone(), null);
    }

    /** Creates a complex-valued tensor from row-major real and imaginary components. */
    public static Tensor ofComplex(
            @NonNull double[] real, @NonNull double[] imag, @NonNull int... shape) {
        if (real.length != imag.length) {
            throw new ShapeException(
                    "Real and imaginary components differ in length: "
                            + real.length
                            + " vs "
                            + imag.length);
        }
        int[] checked = checkShape(shape, real.length);
        return new Tensor(checked, real.clone(), imag.clone());
    }

    /** Creates a zero-filled tensor. */
    public static Tensor zeros(boolean complex, @NonNull int... shape) {
        int[] checked = checkShape(shape, -1);
        int count = count(checked);
        return new Tensor(checked, new double[count], complex ? new double[count] : null);
    }

    private static int[] checkShape(int[] shape, int expectedCount) {
        if (shape.length == 0) {
            throw new ShapeException("Tensor must have at least one axis");
        }
        for (int size : shape) {
            if (size <= 0) {
                throw new ShapeException("Axis sizes must be positive: " + Arrays.toString(shape));
            }
        }
        int count = count(shape);
        if (expectedCount >= 0 && count != expectedCount) {
            throw new ShapeException(
                    "Value count ("
                            + expectedCount
                            + ") doesn't match shape "
                            + Arrays.toString(shape)
                            + " ("
                            + count
                            + " elements)");
        }
        return shape.clone();
    }

    private static int count(int[] shape) {
        long count = 1;
        for (int size : shape) {
            count *= size;
        }
        if (count > Integer.MAX_VALUE) {
            throw new ShapeException("Tensor too large: " + Arrays.toString(shape));
        }
        return (int) count;
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size(int axis) {
        return shape[normalizeAxis(axis)];
    }

    public boolean isComplex() {
        return imag != null;
    }

    /** Number of one-dimensional lanes along the innermost axis. */
    public int laneCount() {
        return real.length / shape[shape.length - 1];
    }

    /** Returns the real component at the given index. */
    public double real(@NonNull int... index) {
        return real[offset(index)];
    }

    /** Returns the imaginary component at the given index, 0 for real-valued tensors. */
    public double imag(@NonNull int... index) {
        return imag == null ? 0.0 : imag[offset(index)];
    }

    /** Returns a copy of the row-major real components. */
    public double[] realValues() {
        return real.clone();
    }

    /** Returns a copy of the row-major imaginary components, all zero for real-valued tensors. */
    public double[] imagValues() {
        return imag == null ? new double[real.length] : imag.clone();
    }

    /** Returns the real component as a real-valued tensor. */
    public Tensor realPart() {
        return imag == null ? this : new Tensor(shape, real.clone(), null);
    }

    /** Returns a tensor with axes {@code a} and {@code b} exchanged. */
    public Tensor swapAxes(int a, int b) {
        int axisA = normalizeAxis(a);
        int axisB = normalizeAxis(b);
        if (axisA == axisB) {
            return this;
        }

        int[] newShape = shape.clone();
        newShape[axisA] = shape[axisB];
        newShape[axisB] = shape[axisA];

        // Source stride for each destination axis
        int[] sourceStrides = strides(shape);
        int[] strides = sourceStrides.clone();
        strides[axisA] = sourceStrides[axisB];
        strides[axisB] = sourceStrides[axisA];

        int count = real.length;
        double[] newReal = new double[count];
        double[] newImag = imag == null ? null : new double[count];
        int[] index = new int[newShape.length];
        int source = 0;
        for (int target = 0; target < count; target++) {
            newReal[target] = real[source];
            if (newImag != null) {
                newImag[target] = imag[source];
            }
            // Advance the destination index, last axis fastest
            for (int d = newShape.length - 1; d >= 0; d--) {
                index[d]++;
                source += strides[d];
                if (index[d] < newShape[d]) {
                    break;
                }
                source -= strides[d] * index[d];
                index[d] = 0;
            }
        }
        return new Tensor(newShape, newReal, newImag);
    }

    private static int[] strides(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int d = shape.length - 1; d >= 0; d--) {
            strides[d] = stride;
            stride *= shape[d];
        }
        return strides;
    }

    private int normalizeAxis(int axis) {
        int normalized = axis < 0 ? axis + shape.length : axis;
        if (normalized < 0 || normalized >= shape.length) {
            throw new ShapeException(
                    "Axis " + axis + " out of range for tensor of rank " + shape.length);
        }
        return normalized;
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new ShapeException(
                    "Index rank " + index.length + " doesn't match tensor rank " + shape.length);
        }
        int offset = 0;
        for (int d = 0; d < shape.length; d++) {
            if (index[d] < 0 || index[d] >= shape[d]) {
                throw new ShapeException(
                        "Index " + Arrays.toString(index) + " out of bounds for shape "
                                + Arrays.toString(shape));
            }
            offset = offset * shape[d] + index[d];
        }
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tensor)) {
            return false;
        }
        Tensor other = (Tensor) o;
        return Arrays.equals(shape, other.shape)
                && Arrays.equals(real, other.real)
                && Arrays.equals(imag, other.imag);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(real);
        result = 31 * result + Arrays.hashCode(imag);
        return result;
    }

    @Override
    public String toString() {
        return String.format(
                "Tensor[%s, shape=%s]", isComplex() ? "complex" : "real", Arrays.toString(shape));
    }
}
