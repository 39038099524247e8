package lls.proc.service.gpu;

import lls.proc.exceptions.InvalidParametersException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.model.WorkUnit;
import lls.proc.service.CudaDeconvCommandBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadPartitionerTest {

    private static final Path INPUT = Paths.get("/data/cell1");

    private final WorkloadPartitioner partitioner = new WorkloadPartitioner(CudaDeconvCommandBuilder.ASSEMBLER);

    private static AcquisitionParameters params(int nc, int nt) {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.4);
        p.setDx(0.104);
        p.setNc(nc);
        p.setNt(nt);
        p.setAngle(31.5);
        p.setWavelengths(List.of(488, 560, 642).subList(0, nc));
        p.setFileCount(nc * nt);
        return p;
    }

    private static ProcessingOptions resolved(AcquisitionParameters p, ProcessingOptions.Builder b)
            throws InvalidParametersException {
        for (int c = 0; c < p.getNc(); c++) {
            b.otfFile(c, Paths.get("/otf/" + p.getWavelength(c) + "_otf.tif"));
        }
        return b.build().resolve(p);
    }

    // ==================== Chunking ====================

    @Test
    @DisplayName("2 channels x 10 timepoints on 4 GPUs gives 8 balanced units, channel-major")
    void testPartition_BalancedChunks() throws Exception {
        AcquisitionParameters p = params(2, 10);
        List<WorkUnit> units = partitioner.partition(p, resolved(p, ProcessingOptions.builder()), INPUT, 4);

        assertEquals(8, units.size());
        assertEquals(List.of(0, 0, 0, 0, 1, 1, 1, 1),
                units.stream().map(WorkUnit::channel).collect(Collectors.toList()));
        assertEquals(List.of(3, 3, 2, 2, 3, 3, 2, 2),
                units.stream().map(WorkUnit::size).collect(Collectors.toList()));
        assertEquals(List.of(0, 1, 2), units.get(0).timepoints());
        assertEquals(List.of(8, 9), units.get(3).timepoints());
        assertEquals("_ch0_stack(0000|0001|0002)", units.get(0).filenamePattern());
        assertEquals("_ch1_stack(0008|0009)", units.get(7).filenamePattern());
        assertFalse(units.get(0).coversFullRange());
    }

    @Test
    @DisplayName("Fewer timepoints than GPUs gives one unit per channel")
    void testPartition_FewerTimepointsThanSlots() throws Exception {
        AcquisitionParameters p = params(1, 2);
        List<WorkUnit> units = partitioner.partition(p, resolved(p, ProcessingOptions.builder()), INPUT, 4);

        assertEquals(1, units.size());
        WorkUnit unit = units.get(0);
        assertEquals("_ch0_", unit.filenamePattern());
        assertEquals(List.of(0, 1), unit.timepoints());
        assertTrue(unit.coversFullRange());
    }

    @Test
    void testPartition_SingleSlotUsesChannelFilter() throws Exception {
        AcquisitionParameters p = params(2, 5);
        List<WorkUnit> units = partitioner.partition(p, resolved(p, ProcessingOptions.builder()), INPUT, 1);

        assertEquals(2, units.size());
        assertEquals("_ch0_", units.get(0).filenamePattern());
        assertEquals("_ch1_", units.get(1).filenamePattern());
        assertEquals(5, units.get(1).size());
    }

    @Test
    void testPartition_TimepointSubsetOnSingleSlotIsRestricted() throws Exception {
        AcquisitionParameters p = params(1, 5);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder().timepoints(List.of(1, 2)));
        List<WorkUnit> units = partitioner.partition(p, o, INPUT, 1);

        assertEquals(1, units.size());
        assertEquals("_ch0_stack(0001|0002)", units.get(0).filenamePattern());
    }

    @Test
    void testPartition_ChannelSubsetKeepsOrder() throws Exception {
        AcquisitionParameters p = params(3, 4);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder().channels(List.of(2, 0)));
        List<WorkUnit> units = partitioner.partition(p, o, INPUT, 2);

        assertEquals(List.of(2, 2, 0, 0),
                units.stream().map(WorkUnit::channel).collect(Collectors.toList()));
    }

    @Test
    void testPartition_UnitsCoverEveryPairOnce() throws Exception {
        AcquisitionParameters p = params(2, 7);
        List<WorkUnit> units = partitioner.partition(p, resolved(p, ProcessingOptions.builder()), INPUT, 3);

        int covered = units.stream().mapToInt(WorkUnit::size).sum();
        assertEquals(14, covered);
        for (int c = 0; c < 2; c++) {
            final int channel = c;
            List<Integer> tps = units.stream()
                    .filter(u -> u.channel() == channel)
                    .flatMap(u -> u.timepoints().stream())
                    .collect(Collectors.toList());
            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), tps);
        }
    }

    @Test
    void testPartition_Deterministic() throws Exception {
        AcquisitionParameters p = params(2, 10);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder());
        assertEquals(partitioner.partition(p, o, INPUT, 4), partitioner.partition(p, o, INPUT, 4));
    }

    // ==================== Unit contents ====================

    @Test
    void testPartition_WavelengthInMicronsAndBackground() throws Exception {
        AcquisitionParameters p = params(2, 2);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder().defaultBackground(95).background(1, 110));
        List<WorkUnit> units = partitioner.partition(p, o, INPUT, 1);

        assertEquals(0.488, units.get(0).wavelength(), 1e-9);
        assertEquals(0.56, units.get(1).wavelength(), 1e-9);
        assertEquals(95, units.get(0).background());
        assertEquals(110, units.get(1).background());
        assertEquals(Paths.get("/otf/560_otf.tif"), units.get(1).otfFile());
        assertEquals(INPUT, units.get(1).inputDir());
    }

    @Test
    void testPartition_FlashCorrectionZeroesBackground() throws Exception {
        AcquisitionParameters p = params(1, 2);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder().correctFlash(true));
        assertEquals(0, partitioner.partition(p, o, INPUT, 1).get(0).background());
    }

    @Test
    void testPartition_ArgumentsAssembled() throws Exception {
        AcquisitionParameters p = params(1, 2);
        List<WorkUnit> units = partitioner.partition(p, resolved(p, ProcessingOptions.builder()), INPUT, 1);
        List<String> args = units.get(0).arguments();

        assertEquals("--input-dir", args.get(0));
        assertEquals(INPUT.toString(), args.get(1));
        assertTrue(args.contains("--otf-file"));
        assertTrue(args.contains("--deskew"));
    }

    // ==================== Edge cases ====================

    @Test
    void testPartition_EmptyRangeGivesNoUnits() throws Exception {
        AcquisitionParameters p = params(1, 3);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder().timepoints(List.of(7)));
        assertTrue(partitioner.partition(p, o, INPUT, 2).isEmpty());
    }

    @Test
    void testPartition_InvalidSlotCount() throws Exception {
        AcquisitionParameters p = params(1, 3);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder());
        assertThrows(IllegalArgumentException.class, () -> partitioner.partition(p, o, INPUT, 0));
    }

    @Test
    void testPartition_UnresolvedOptionsRejected() {
        AcquisitionParameters p = params(1, 3);
        assertThrows(IllegalArgumentException.class,
                () -> partitioner.partition(p, ProcessingOptions.builder().build(), INPUT, 1));
    }

    @Test
    void testPartition_MissingWavelength() throws Exception {
        AcquisitionParameters p = params(2, 3);
        ProcessingOptions o = resolved(p, ProcessingOptions.builder());
        p.setWavelengths(List.of(488));
        assertThrows(InvalidParametersException.class, () -> partitioner.partition(p, o, INPUT, 1));
    }

    @Test
    void testSplit() {
        assertEquals(List.of(List.of(1, 2), List.of(3), List.of(4)),
                WorkloadPartitioner.split(List.of(1, 2, 3, 4), 3));
        assertEquals(List.of(List.of(1), List.of(2)), WorkloadPartitioner.split(List.of(1, 2), 2));
    }
}
