package spectra.nmrpipe;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import spectra.DataType;
import spectra.Dimension;
import spectra.DomainType;
import spectra.FtFlags;
import spectra.Layout;
import spectra.Spectrum;
import spectra.exceptions.InvalidOperationException;
import spectra.exceptions.ShapeException;
import spectra.exceptions.UnsupportedLayoutException;
import spectra.layout.LayoutCodec;
import spectra.tensor.Tensor;
import spectra.transform.StandardFourierTransform;

/** Tests for NMRPipe-style storage and the layout handling of transpose, ft and phase. */
class NmrPipeSpectrumTest {

    private static final double TOLERANCE = 1e-9;

    private NmrPipeSpectrumFactory factory;

    @BeforeEach
    void setUp() {
        factory = new NmrPipeSpectrumFactory(new StandardFourierTransform());
    }

    private static Dimension complex(int number, String label) {
        return Dimension.time(number, DataType.COMPLEX, 1000.0 * number, label);
    }

    private static Dimension real(int number, String label) {
        return Dimension.time(number, DataType.REAL, 1000.0 * number, label);
    }

    private static double[] range(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i + 1;
        }
        return values;
    }

    @Test
    void reportsBlockLayoutOnlyForTheInnermostComplexDimension() {
        Spectrum spectrum =
                factory.create(
                        Tensor.zeros(false, 2, 4, 6),
                        List.of(complex(1, "13C"), complex(2, "15N"), complex(3, "1H")));

        assertEquals(Layout.SINGLE_INTERLEAVE, spectrum.dataLayout(DataType.COMPLEX, 0));
        assertEquals(Layout.SINGLE_INTERLEAVE, spectrum.dataLayout(DataType.COMPLEX, 1));
        assertEquals(Layout.BLOCK_INTERLEAVE, spectrum.dataLayout(DataType.COMPLEX, 2));
        assertEquals(Layout.REAL, spectrum.dataLayout(DataType.REAL, 2));
        assertEquals(Layout.REAL, spectrum.dataLayout(DataType.IMAG, 0));
        assertThrows(ShapeException.class, () -> spectrum.dataLayout(DataType.REAL, 3));
    }

    @Test
    void loadRejectsStorageThatDisagreesWithTheLayout() {
        assertThrows(
                ShapeException.class,
                () -> factory.create(Tensor.zeros(false, 5), List.of(complex(1, "1H"))));
        assertThrows(
                ShapeException.class,
                () ->
                        factory.create(
                                Tensor.zeros(false, 3, 4),
                                List.of(complex(1, "15N"), real(2, "1H"))));
        assertThrows(
                ShapeException.class,
                () ->
                        factory.create(
                                Tensor.zeros(false, 4), List.of(real(1, "15N"), real(2, "1H"))));
        assertThrows(
                UnsupportedLayoutException.class,
                () -> factory.create(Tensor.zeros(true, 4), List.of(complex(1, "1H"))));
        assertThrows(
                InvalidOperationException.class,
                () -> factory.create(Tensor.zeros(false, 4), List.of()));
        assertThrows(
                InvalidOperationException.class,
                () ->
                        factory.create(
                                Tensor.zeros(false, 2, 2),
                                List.of(real(1, "15N"), real(1, "1H"))));
        assertThrows(
                InvalidOperationException.class,
                () -> factory.create(Tensor.zeros(false, 2), List.of(real(7, "1H"))));
    }

    @Test
    void reloadAcceptsAnyPermutationOfDimensionNumbers() {
        Spectrum spectrum =
                factory.create(
                        Tensor.zeros(false, 2, 4), List.of(real(1, "15N"), complex(2, "1H")));

        spectrum.load(Tensor.zeros(false, 4, 2), List.of(complex(2, "1H"), real(1, "15N")));

        assertArrayEquals(new int[] {2, 1}, spectrum.order());
        assertThrows(
                InvalidOperationException.class,
                () ->
                        spectrum.load(
                                Tensor.zeros(false, 4, 2),
                                List.of(complex(2, "1H"), real(3, "15N"))));
        assertArrayEquals(new int[] {2, 1}, spectrum.order());
    }

    @Test
    void transposeOfOneDimensionalSpectrumIsInvalid() {
        Spectrum spectrum = factory.create(Tensor.zeros(false, 4), List.of(complex(1, "1H")));

        assertThrows(InvalidOperationException.class, () -> spectrum.transpose(0, 0));
    }

    @Test
    @DisplayName("Innermost complex data leaves the last axis single-interleaved")
    void innermostComplexMovesOutSingleInterleaved() {
        // Rows hold (r0, r1, i0, i1) block-interleaved points
        Tensor original = Tensor.ofReal(new double[] {1, 2, 10, 20, 3, 4, 30, 40}, 2, 4);
        Spectrum spectrum = factory.create(original, List.of(real(1, "15N"), complex(2, "1H")));

        spectrum.transpose(0, 1);

        Tensor single = LayoutCodec.interleaveBlockToSingle(original);
        assertArrayEquals(new int[] {4, 2}, spectrum.data().shape());
        for (int row = 0; row < 2; row++) {
            for (int k = 0; k < 4; k++) {
                assertEquals(single.real(row, k), spectrum.data().real(k, row));
            }
        }
        assertEquals(DataType.COMPLEX, spectrum.dataType(0));
        assertEquals(DataType.REAL, spectrum.dataType(1));
        assertArrayEquals(new int[] {2, 1}, spectrum.order());
        assertEquals("1H", spectrum.label(0));
        assertEquals(2000.0, spectrum.spectralWidth(0));
    }

    @Test
    @DisplayName("Single-interleaved complex data moving innermost becomes block-interleaved")
    void complexMovingInnermostBecomesBlockInterleaved() {
        // Axis 0 holds one complex point per column: a row of reals, then a row of imaginaries
        Tensor original = Tensor.ofReal(new double[] {1, 2, 3, 4, 5, 6, 7, 8}, 2, 4);
        Spectrum spectrum = factory.create(original, List.of(complex(1, "15N"), complex(2, "1H")));

        spectrum.transpose(0, 1);

        assertEquals(
                Tensor.ofReal(new double[] {1, 5, 3, 7, 2, 6, 4, 8}, 4, 2), spectrum.data());
        assertArrayEquals(new int[] {2, 1}, spectrum.order());
    }

    @Test
    void singleInterleavedInnermostRowsAreReorderedToBlocks() {
        // Axis 0 has two complex points (r0, i0, r1, i1) for each real column
        Tensor original = Tensor.ofReal(new double[] {1, 2, 10, 20, 3, 4, 30, 40}, 4, 2);
        Spectrum spectrum = factory.create(original, List.of(complex(1, "15N"), real(2, "1H")));

        spectrum.transpose(0, 1);

        // Column 0 is (1, 10, 3, 30) single-interleaved, i.e. 1+10i, 3+30i
        assertEquals(
                Tensor.ofReal(new double[] {1, 3, 10, 30, 2, 4, 20, 40}, 2, 4), spectrum.data());
        assertEquals(DataType.COMPLEX, spectrum.dataType(1));
    }

    @Test
    @DisplayName("Transposing the same pair twice restores data and metadata")
    void transposeIsAnInvolution() {
        Tensor original = Tensor.ofReal(range(2 * 4 * 6), 2, 4, 6);
        List<Dimension> dimensions =
                List.of(complex(1, "13C"), complex(2, "15N"), complex(3, "1H"));
        Spectrum spectrum = factory.create(original, dimensions);

        for (int[] pair : new int[][] {{0, 2}, {1, 2}, {0, 1}, {2, 0}}) {
            spectrum.transpose(pair[0], pair[1]);
            spectrum.transpose(pair[0], pair[1]);

            assertEquals(original, spectrum.data());
            assertEquals(dimensions, spectrum.dimensions());
        }
    }

    @Test
    void transposeKeepsStorageConsistentWithTheReportedLayout() {
        Spectrum spectrum =
                factory.create(
                        Tensor.ofReal(range(2 * 3 * 8), 2, 3, 8),
                        List.of(complex(1, "13C"), real(2, "15N"), complex(3, "1H")));

        spectrum.transpose(0, 2);
        spectrum.transpose(1, 2);

        // Reloading validates every axis against dataLayout
        assertDoesNotThrow(() -> spectrum.load(spectrum.data(), spectrum.dimensions()));
        assertArrayEquals(new int[] {3, 1, 2}, spectrum.order());
        assertArrayEquals(new int[] {8, 2, 3}, spectrum.data().shape());
    }

    @Test
    void ftTracksDomainAndKeepsBlockStorage() {
        Tensor fid = Tensor.ofReal(new double[] {1, 0, -1, 0, 0, 1, 0, -1}, 8);
        Spectrum spectrum = factory.create(fid, List.of(complex(1, "1H")));

        spectrum.ft(FtFlags.FORWARD);

        assertEquals(DomainType.FREQ, spectrum.domainType(0));
        assertEquals(DataType.COMPLEX, spectrum.dataType(0));
        assertFalse(spectrum.data().isComplex());
        assertArrayEquals(new int[] {8}, spectrum.data().shape());

        spectrum.ft(FtFlags.INVERSE);

        assertEquals(DomainType.TIME, spectrum.domainType(0));
        assertArrayEquals(fid.realValues(), spectrum.data().realValues(), TOLERANCE);
    }

    @Test
    void ftOfRealDataProducesComplexPoints() {
        Spectrum spectrum =
                factory.create(Tensor.ofReal(new double[] {1, 1, 1, 1}, 4), List.of(real(1, "1H")));

        spectrum.ft(FtFlags.FORWARD);

        assertEquals(DataType.COMPLEX, spectrum.dataType(0));
        assertArrayEquals(new int[] {8}, spectrum.data().shape());
        // Centred DC component: reals (0, 0, 4, 0), imaginaries all zero
        assertArrayEquals(
                new double[] {0, 0, 4, 0, 0, 0, 0, 0}, spectrum.data().realValues(), TOLERANCE);
    }

    @Test
    void autoFlagsFollowTheCurrentDomain() {
        Tensor fid = Tensor.ofReal(new double[] {3, 1, 4, 1, 5, 9, 2, 6, 5, 3, 5, 8}, 2, 6);
        Spectrum spectrum = factory.create(fid, List.of(real(1, "15N"), complex(2, "1H")));
        FtFlags auto = FtFlags.builder().auto(true).build();

        spectrum.ft(auto);
        assertEquals(DomainType.FREQ, spectrum.domainType(1));

        spectrum.ft(auto);
        assertEquals(DomainType.TIME, spectrum.domainType(1));
        assertArrayEquals(fid.realValues(), spectrum.data().realValues(), TOLERANCE);
    }

    @Test
    void phaseDiscardingImaginariesLeavesRealData() {
        Spectrum spectrum =
                factory.create(
                        Tensor.ofReal(new double[] {1, 2, 10, 20}, 4), List.of(complex(1, "1H")));

        spectrum.phase(0, 0);

        assertEquals(DataType.REAL, spectrum.dataType(0));
        assertEquals(Tensor.ofReal(new double[] {1, 2}, 2), spectrum.data());
    }

    @Test
    void phaseKeepingImaginariesReencodesBlocks() {
        Spectrum spectrum =
                factory.create(
                        Tensor.ofReal(new double[] {1, 2, 10, 20}, 4), List.of(complex(1, "1H")));

        spectrum.phase(Math.PI / 2, 0, false);

        // Multiplying by i: 1+10i -> -10+1i, 2+20i -> -20+2i
        assertArrayEquals(
                new double[] {-10, -20, 1, 2}, spectrum.data().realValues(), TOLERANCE);
        assertEquals(DataType.COMPLEX, spectrum.dataType(0));
    }

    @Test
    void failedPhaseLeavesDataUntouched() {
        Spectrum spectrum =
                factory.create(Tensor.ofReal(new double[] {1, 2}, 2), List.of(real(1, "1H")));
        Tensor before = spectrum.data();

        assertThrows(UnsupportedLayoutException.class, () -> spectrum.phase(0.5, 0));
        assertSame(before, spectrum.data());
        assertEquals(DataType.REAL, spectrum.dataType(0));
    }
}
