package lls.proc.controller.workflow;

import lls.proc.exceptions.PipelineStageException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.service.ImageCorrectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Helper for the pre-processing stage of an item.
 *
 * <p>Flash correction takes precedence; trimming and median filtering run only when flash
 * correction is off. Either one replaces the working folder with the folder it wrote.
 */
public class PreProcessingHelper {
    private static final Logger logger = LoggerFactory.getLogger(PreProcessingHelper.class);

    public static final String FLASH_CORRECTION = "Flash correction";
    public static final String MEDIAN_TRIM = "Median filter and trim";

    /**
     * @return true if {@link #run} would do any work for these options
     */
    public static boolean isRequired(ProcessingOptions options) {
        return options.isCorrectFlash() || options.needsTrimOrMedian();
    }

    /**
     * @return the folder later stages should read from
     * @throws PipelineStageException if the correction fails
     */
    public static Path run(Path dataset, AcquisitionParameters params, ProcessingOptions options,
                           ImageCorrectionService correction) throws PipelineStageException {
        if (options.isCorrectFlash()) {
            logger.info("Correcting flash artifact in {} (target: {})", dataset, options.getFlashCorrectionTarget());
            try {
                return correction.correctFlash(dataset, params, options);
            } catch (IOException e) {
                throw new PipelineStageException(FLASH_CORRECTION, e.getMessage(), e);
            }
        }
        if (options.needsTrimOrMedian()) {
            logger.info("Applying median filter and/or trimming edges in {}", dataset);
            try {
                return correction.medianAndTrim(dataset, params, options);
            } catch (IOException e) {
                throw new PipelineStageException(MEDIAN_TRIM, e.getMessage(), e);
            }
        }
        return dataset;
    }
}
