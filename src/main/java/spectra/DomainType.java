package spectra;

/** Whether a dimension's samples are in the time domain or the frequency domain. */
public enum DomainType {
    TIME,
    FREQ;

    /** The domain reached by a Fourier transform in the given direction. */
    public DomainType afterTransform(boolean inverse) {
        return inverse ? TIME : FREQ;
    }
}
