package spectra;

/** Whether a dimension's samples are real-only, imaginary-only or complex. */
public enum DataType {
    REAL,
    IMAG,
    COMPLEX
}
