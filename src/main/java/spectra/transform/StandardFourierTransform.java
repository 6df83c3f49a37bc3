package spectra.transform;

import com.google.errorprone.annotations.Immutable;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * Fourier transform backed by Commons Math.
 *
 * <p>Power-of-two lanes go through {@link FastFourierTransformer}; other lengths fall back to a
 * direct DFT with the same normalization. With shifting enabled the forward result is rotated so
 * the zero frequency sits in the centre of the lane, and the inverse transform rotates it back
 * first.
 */
@Immutable
@Getter
public final class StandardFourierTransform implements FourierTransform {

    private final boolean shift;
    private final DftNormalization normalization;

    /** Shifted, {@link DftNormalization#STANDARD} transform. */
    public StandardFourierTransform() {
        this(true, DftNormalization.STANDARD);
    }

    public StandardFourierTransform(boolean shift, @NonNull DftNormalization normalization) {
        this.shift = shift;
        this.normalization = normalization;
    }

    @Override
    public Complex[] transform(@NonNull Complex[] samples, @NonNull TransformType type) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("Cannot transform an empty lane");
        }
        boolean inverse = type == TransformType.INVERSE;
        Complex[] input = shift && inverse ? rotate(samples, -(samples.length / 2)) : samples;
        Complex[] output =
                ArithmeticUtils.isPowerOfTwo(input.length)
                        ? new FastFourierTransformer(normalization).transform(input, type)
                        : directTransform(input, type);
        return shift && !inverse ? rotate(output, samples.length / 2) : output;
    }

    private Complex[] directTransform(Complex[] samples, TransformType type) {
        int n = samples.length;
        double sign = type == TransformType.FORWARD ? -1.0 : 1.0;
        double scale =
                switch (normalization) {
                    case STANDARD -> type == TransformType.FORWARD ? 1.0 : 1.0 / n;
                    case UNITARY -> 1.0 / FastMath.sqrt(n);
                };
        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int j = 0; j < n; j++) {
                // k * j reduced mod n keeps the angle small for long lanes
                double angle = sign * 2.0 * FastMath.PI * ((long) k * j % n) / n;
                double cos = FastMath.cos(angle);
                double sin = FastMath.sin(angle);
                re += samples[j].getReal() * cos - samples[j].getImaginary() * sin;
                im += samples[j].getReal() * sin + samples[j].getImaginary() * cos;
            }
            result[k] = new Complex(re * scale, im * scale);
        }
        return result;
    }

    /** Circular shift: element {@code i} moves to {@code (i + offset) mod n}. */
    private static Complex[] rotate(Complex[] samples, int offset) {
        int n = samples.length;
        Complex[] rotated = new Complex[n];
        for (int i = 0; i < n; i++) {
            rotated[Math.floorMod(i + offset, n)] = samples[i];
        }
        return rotated;
    }
}
