package lls.proc.controller;

import lls.proc.exceptions.ConfigurationException;
import lls.proc.exceptions.MissingBinaryException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ItemOutcome;
import lls.proc.model.ProcessingOptions;
import lls.proc.service.CompressionService;
import lls.proc.service.CudaDeconvCommandBuilder;
import lls.proc.service.DatasetInspector;
import lls.proc.service.ImageCorrectionService;
import lls.proc.service.MipService;
import lls.proc.service.ProcessingServices;
import lls.proc.service.RegistrationService;
import lls.proc.service.gpu.FakeGpuWorkerFactory;
import lls.proc.utilities.ProcessingConfigManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BatchProcessorTest {

    @TempDir
    Path root;

    private DatasetInspector inspector;
    private ProcessingServices services;
    private RecordingPipelineListener listener;
    private List<Path> datasets;

    @BeforeEach
    void setUp() throws Exception {
        inspector = mock(DatasetInspector.class);
        services = new ProcessingServices(inspector, CudaDeconvCommandBuilder.ASSEMBLER,
                mock(CompressionService.class), mock(ImageCorrectionService.class),
                mock(RegistrationService.class), mock(MipService.class));
        listener = new RecordingPipelineListener();

        datasets = List.of(
                Files.createDirectory(root.resolve("cell1")),
                Files.createDirectory(root.resolve("cell2")),
                Files.createDirectory(root.resolve("cell3")));

        when(inspector.hasRawData(any())).thenReturn(true);
        when(inspector.readParameters(any())).thenAnswer(inv -> parameters());
    }

    private static AcquisitionParameters parameters() {
        AcquisitionParameters p = new AcquisitionParameters();
        p.setDz(0.4);
        p.setDx(0.104);
        p.setNt(3);
        p.setWavelengths(List.of(488));
        p.setFileCount(3);
        return p;
    }

    private BatchProcessor processor(FakeGpuWorkerFactory factory) {
        ProcessingEnvironment env = new ProcessingEnvironment(List.of(0, 1), factory, services, null);
        ProcessingOptions options = ProcessingOptions.builder().otfFile(0, Paths.get("/otf/488_otf.tif")).build();
        return new BatchProcessor(env, options, listener);
    }

    private static List<ItemOutcome.Kind> kinds(List<ItemOutcome> outcomes) {
        return outcomes.stream().map(ItemOutcome::kind).collect(Collectors.toList());
    }

    @Test
    void testProcess_AllItemsInOrder() throws Exception {
        List<ItemOutcome> outcomes = processor(new FakeGpuWorkerFactory(true))
                .process(datasets).get(10, TimeUnit.SECONDS);

        assertEquals(List.of(ItemOutcome.Kind.FINISHED, ItemOutcome.Kind.FINISHED, ItemOutcome.Kind.FINISHED),
                kinds(outcomes));
        assertEquals(datasets, outcomes.stream().map(ItemOutcome::dataset).collect(Collectors.toList()));
        assertEquals(3, listener.finished.size());
    }

    @Test
    void testProcess_SkippedItemDoesNotStopBatch() throws Exception {
        when(inspector.hasRawData(datasets.get(1))).thenReturn(false);

        List<ItemOutcome> outcomes = processor(new FakeGpuWorkerFactory(true))
                .process(datasets).get(10, TimeUnit.SECONDS);

        assertEquals(List.of(ItemOutcome.Kind.FINISHED, ItemOutcome.Kind.SKIPPED, ItemOutcome.Kind.FINISHED),
                kinds(outcomes));
    }

    @Test
    void testProcess_AbortedBeforeStart() throws Exception {
        BatchProcessor batch = processor(new FakeGpuWorkerFactory(true));
        batch.abort();

        List<ItemOutcome> outcomes = batch.process(datasets).get(10, TimeUnit.SECONDS);

        assertTrue(batch.isAborted());
        assertTrue(outcomes.stream().allMatch(o -> o.kind() == ItemOutcome.Kind.ABORTED));
        assertEquals(3, listener.finished.size());
        verify(inspector, never()).readParameters(any());
    }

    @Test
    void testProcess_AbortDuringFirstItemCancelsTheRest() throws Exception {
        FakeGpuWorkerFactory factory = new FakeGpuWorkerFactory();
        BatchProcessor batch = processor(factory);

        CompletableFuture<List<ItemOutcome>> future = batch.process(datasets);
        long deadline = System.currentTimeMillis() + 5000;
        while (factory.started().size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, factory.started().size());

        batch.abort();

        List<ItemOutcome> outcomes = future.get(10, TimeUnit.SECONDS);
        assertEquals(List.of(ItemOutcome.Kind.ABORTED, ItemOutcome.Kind.ABORTED, ItemOutcome.Kind.ABORTED),
                kinds(outcomes));
        assertEquals(2, factory.started().size());
        verify(inspector, times(1)).readParameters(any());
    }

    // ==================== Configuration ====================

    @Test
    void testFromConfig_MissingBinary() throws Exception {
        Path yml = Files.writeString(root.resolve("config.yml"),
                "gpus: [0]\nbinaries:\n  cudaDeconv: " + root.resolve("cudaDeconv") + "\n");
        ProcessingConfigManager config = ProcessingConfigManager.load(yml);
        assertThrows(MissingBinaryException.class, () -> BatchProcessor.fromConfig(config, services, listener));
    }

    @Test
    void testFromConfig_NoGpus() throws Exception {
        Path yml = Files.writeString(root.resolve("config.yml"), "gpus: []\nbinaries:\n  cudaDeconv: cudaDeconv\n");
        ProcessingConfigManager config = ProcessingConfigManager.load(yml);
        assertThrows(ConfigurationException.class, () -> BatchProcessor.fromConfig(config, services, listener));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testFromConfig_Valid() throws Exception {
        Path binary = Files.writeString(root.resolve("cudaDeconv"), "#!/bin/sh\nexit 0\n");
        assertTrue(binary.toFile().setExecutable(true));
        Path yml = Files.writeString(root.resolve("config.yml"),
                "gpus: [0, 1]\nbinaries:\n  cudaDeconv: " + binary + "\nprocessing:\n  iterations: 0\n");
        ProcessingConfigManager config = ProcessingConfigManager.load(yml);

        BatchProcessor batch = BatchProcessor.fromConfig(config, services, listener);

        assertNotNull(batch);
        assertFalse(batch.isAborted());
    }
}
