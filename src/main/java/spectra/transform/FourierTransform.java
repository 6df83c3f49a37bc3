package spectra.transform;

import lombok.NonNull;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.TransformType;
import spectra.tensor.Tensor;

/**
 * Discrete Fourier transform kernel applied along the innermost axis of a tensor.
 *
 * <p>Implementations must accept any lane length N &gt;= 1 and must make the inverse transform
 * undo the forward one, up to floating-point rounding.
 */
public interface FourierTransform {

    /**
     * Transforms one lane of samples.
     *
     * @param samples the lane, left unmodified
     * @param type forward or inverse
     * @return a new array holding the transformed lane
     */
    @NonNull
    Complex[] transform(@NonNull Complex[] samples, @NonNull TransformType type);

    /**
     * Transforms every lane along the innermost axis. Real-valued tensors are treated as complex
     * with a zero imaginary part; the result is always complex-valued.
     */
    @NonNull
    default Tensor apply(@NonNull Tensor tensor, @NonNull TransformType type) {
        int n = tensor.size(-1);
        double[] real = tensor.realValues();
        double[] imag = tensor.imagValues();
        Complex[] lane = new Complex[n];
        for (int start = 0; start < real.length; start += n) {
            for (int i = 0; i < n; i++) {
                lane[i] = new Complex(real[start + i], imag[start + i]);
            }
            Complex[] out = transform(lane, type);
            for (int i = 0; i < n; i++) {
                real[start + i] = out[i].getReal();
                imag[start + i] = out[i].getImaginary();
            }
        }
        return Tensor.ofComplex(real, imag, tensor.shape());
    }
}
