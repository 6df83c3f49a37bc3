package spectra;

/** How complex values along one axis are encoded in the tensor's storage. */
public enum Layout {
    /** Real and imaginary parts alternate: {@code (r0, i0, r1, i1, ...)} over 2N values. */
    SINGLE_INTERLEAVE,

    /** All N real parts followed by all N imaginary parts over 2N values. */
    BLOCK_INTERLEAVE,

    /** Complex-native storage with no real-valued encoding. Innermost axis only. */
    COMPLEX,

    /** One real value per point; there is no imaginary component to decode. */
    REAL;

    /** Whether this layout packs a complex value into two real-valued positions of the axis. */
    public boolean isInterleaved() {
        return this == SINGLE_INTERLEAVE || this == BLOCK_INTERLEAVE;
    }
}
