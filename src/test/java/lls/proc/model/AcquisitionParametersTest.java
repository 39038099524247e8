package lls.proc.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the acquisition parameter record: defaults, the angle latch, computed fields and
 * generic access by name.
 */
class AcquisitionParametersTest {

    // ==================== Defaults ====================

    @Test
    void testDefaults() {
        AcquisitionParameters p = new AcquisitionParameters();
        assertNull(p.getDz());
        assertNull(p.getDx());
        assertNull(p.getAngle());
        assertNull(p.getSamplescan());
        assertFalse(p.isDecimated());
        assertEquals(1, p.getNc());
        assertEquals(1, p.getNt());
        assertEquals(1, p.getNz());
        assertNull(p.getNy());
        assertNull(p.getNx());
        assertNull(p.getMask());
        assertNull(p.getRoi());
        assertEquals(0, p.getFileCount());
        assertTrue(p.getWavelengths().isEmpty());
        assertFalse(p.isReady());
    }

    // ==================== Angle latch ====================

    @Test
    @DisplayName("Positive angle forces samplescan on")
    void testAngleLatch_PositiveAngle() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setAngle(31.5);
        assertEquals(Boolean.TRUE, p.getSamplescan());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -5.0})
    void testAngleLatch_NonPositiveAngleLeavesSamplescanUnset(double angle) {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setAngle(angle);
        assertNull(p.getSamplescan());
    }

    @Test
    @DisplayName("Setting angle back to zero does not clear samplescan")
    void testAngleLatch_IsOneWay() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setAngle(31.5);
        p.setAngle(0.0);
        assertEquals(Boolean.TRUE, p.getSamplescan());
        p.setAngle(null);
        assertEquals(Boolean.TRUE, p.getSamplescan());
    }

    @Test
    void testAngleLatch_ExplicitFalseIsOverriddenByPositiveAngle() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setSamplescan(false);
        p.setAngle(10.0);
        assertTrue(p.isSamplescan());
    }

    // ==================== Computed fields ====================

    @ParameterizedTest
    @CsvSource({
            "0.4, 31.5, 0.209",
            "0.3, 31.5, 0.1567",
            "0.5, 90.0, 0.5"
    })
    void testDzFinal_SampleScan(double dz, double angle, double expected) {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(dz);
        p.setAngle(angle);
        assertEquals(expected, p.getDzFinal(), 1e-9);
    }

    @Test
    void testDzFinal_NoSampleScanIsRawStepRounded() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.123456);
        assertEquals(0.1235, p.getDzFinal(), 1e-9);
        assertEquals(0.0, p.getDeskew());
    }

    @ParameterizedTest
    @CsvSource({
            "0.12345, 0.1235",
            "0.10005, 0.1001",
            "0.00015, 0.0001"
    })
    void testDzFinal_TiesRoundOnBinaryValue(double dz, double expected) {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setSamplescan(false);
        p.setDz(dz);
        assertEquals(expected, p.getDzFinal(), 1e-12);
    }

    @Test
    void testDzFinal_NullWhenDzUnknown() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setAngle(31.5);
        assertNull(p.getDzFinal());
    }

    @Test
    void testDeskew_FollowsAngleInSampleScan() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setAngle(31.5);
        assertEquals(31.5, p.getDeskew());
        p.setSamplescan(false);
        assertEquals(0.0, p.getDeskew());
    }

    @Test
    void testVoxel() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.4);
        p.setDx(0.104);
        p.setAngle(31.5);
        assertEquals(Arrays.asList(0.209, 0.104, 0.104), p.getVoxel());
    }

    // ==================== Readiness ====================

    @Test
    void testIsReady_RequiresFilesAndSpacing() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.4);
        p.setDx(0.104);
        assertFalse(p.isReady(), "no files yet");
        p.setFileCount(12);
        assertTrue(p.isReady());
        p.setDx(null);
        assertFalse(p.isReady());
    }

    // ==================== Generic access ====================

    @Test
    void testGetAndSetByName() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.set("dz", 0.4);
        p.set("nt", 10L);
        p.set("angle", 31.5);
        p.set("wavelengths", List.of(488, 560.0));
        assertEquals(0.4, p.get("dz"));
        assertEquals(10, p.get("nt"));
        assertEquals(true, p.get("samplescan"));
        assertEquals(List.of(488, 560), p.get("wavelengths"));
        assertEquals(0.209, (Double) p.get("dzFinal"), 1e-9);
    }

    @Test
    void testUnknownNameIsRejected() {
        AcquisitionParameters p = new AcquisitionParameters();
        assertThrows(UnknownParameterException.class, () -> p.get("exposure"));
        assertThrows(UnknownParameterException.class, () -> p.set("exposure", 10));
    }

    @ParameterizedTest
    @ValueSource(strings = {"dzFinal", "deskew", "voxel"})
    void testComputedFieldsAreReadOnly(String name) {
        AcquisitionParameters p = new AcquisitionParameters();
        assertThrows(ReadOnlyParameterException.class, () -> p.set(name, 1.0));
    }

    @Test
    void testUpdateFromMap() {
        AcquisitionParameters p = new AcquisitionParameters(Map.of("dz", 0.4, "dx", 0.1));
        p.update(Map.of("nt", 7, "nc", 2));
        assertEquals(7, p.getNt());
        assertEquals(2, p.getNc());
        assertEquals(0.4, p.getDz());
    }

    // ==================== Equality & serialization ====================

    @Test
    void testToMapExcludesComputedFields() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.4);
        p.setAngle(31.5);
        Map<String, Object> map = p.toMap();
        assertEquals(AcquisitionParameters.STORED_FIELDS, List.copyOf(map.keySet()));
        for (String computed : AcquisitionParameters.COMPUTED_FIELDS) {
            assertFalse(map.containsKey(computed));
        }
        assertFalse(p.toString().contains("dzFinal"));
    }

    @Test
    void testEqualityOverStoredFields() {
        AcquisitionParameters a = new AcquisitionParameters();
        AcquisitionParameters b = new AcquisitionParameters();
        a.setDz(0.4);
        b.setDz(0.4);
        a.setRoi(new CameraRoi(0, 0, 511, 511));
        b.setRoi(new CameraRoi(0, 0, 511, 511));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.setNt(3);
        assertNotEquals(a, b);
    }

    @Test
    void testCopyIsIndependent() {
        AcquisitionParameters a = new AcquisitionParameters();
        a.setAngle(31.5);
        a.setSamplescan(false);
        a.setWavelengths(List.of(488));
        AcquisitionParameters copy = a.copy();
        assertEquals(a, copy);
        assertFalse(copy.isSamplescan());
        copy.setNt(5);
        assertEquals(1, a.getNt());
    }
}
