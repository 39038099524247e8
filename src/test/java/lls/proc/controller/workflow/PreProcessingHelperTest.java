package lls.proc.controller.workflow;

import lls.proc.exceptions.PipelineStageException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.service.ImageCorrectionService;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PreProcessingHelperTest {

    private static final Path DATASET = Paths.get("/data/cell1");
    private static final Path CORRECTED = DATASET.resolve("Corrected");

    private final AcquisitionParameters params = new AcquisitionParameters();
    private final ImageCorrectionService correction = mock(ImageCorrectionService.class);

    @Test
    void testIsRequired() {
        assertFalse(PreProcessingHelper.isRequired(ProcessingOptions.builder().build()));
        assertTrue(PreProcessingHelper.isRequired(ProcessingOptions.builder().correctFlash(true).build()));
        assertTrue(PreProcessingHelper.isRequired(ProcessingOptions.builder().trimY(3, 0).build()));
    }

    @Test
    void testRun_FlashCorrectionTakesPrecedence() throws Exception {
        ProcessingOptions options = ProcessingOptions.builder().correctFlash(true).medianFilter(true).build();
        when(correction.correctFlash(DATASET, params, options)).thenReturn(CORRECTED);

        assertEquals(CORRECTED, PreProcessingHelper.run(DATASET, params, options, correction));
        verify(correction, never()).medianAndTrim(any(), any(), any());
    }

    @Test
    void testRun_MedianAndTrim() throws Exception {
        ProcessingOptions options = ProcessingOptions.builder().medianFilter(true).build();
        when(correction.medianAndTrim(DATASET, params, options)).thenReturn(CORRECTED);

        assertEquals(CORRECTED, PreProcessingHelper.run(DATASET, params, options, correction));
    }

    @Test
    void testRun_NothingToDo() throws Exception {
        assertEquals(DATASET, PreProcessingHelper.run(DATASET, params, ProcessingOptions.builder().build(), correction));
        verifyNoInteractions(correction);
    }

    @Test
    void testRun_FailureNamesStage() throws Exception {
        ProcessingOptions options = ProcessingOptions.builder().correctFlash(true).build();
        when(correction.correctFlash(any(), any(), any())).thenThrow(new IOException("camera params missing"));

        PipelineStageException e = assertThrows(PipelineStageException.class,
                () -> PreProcessingHelper.run(DATASET, params, options, correction));
        assertEquals(PreProcessingHelper.FLASH_CORRECTION, e.getStage());
        assertTrue(e.getMessage().contains("camera params missing"));
    }
}
