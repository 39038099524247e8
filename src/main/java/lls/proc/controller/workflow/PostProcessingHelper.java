package lls.proc.controller.workflow;

import lls.proc.exceptions.CompressionException;
import lls.proc.exceptions.PipelineStageException;
import lls.proc.model.AcquisitionParameters;
import lls.proc.model.ProcessingOptions;
import lls.proc.service.ProcessingServices;
import lls.proc.utilities.DatasetFolderUtilities;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Helper for the post-processing stage of an item.
 *
 * <p>Sub-stages run in this order:
 * <ol>
 *   <li>channel registration, if requested</li>
 *   <li>MIP merging, or removal of stale combined MIPs when merging is off</li>
 *   <li>moving outputs out of a {@code Corrected} folder and deleting it unless it is kept</li>
 *   <li>raw data compression, if requested</li>
 *   <li>the JSON processing log, if requested</li>
 * </ol>
 * Combined MIP cleanup and the processing log are best effort: their failures are logged and
 * processing carries on. Every other failure ends the item. An abort request is checked before
 * each sub-stage.
 */
public class PostProcessingHelper {
    private static final Logger logger = LoggerFactory.getLogger(PostProcessingHelper.class);

    public static final String REGISTRATION = "Channel registration";
    public static final String MIP_MERGE = "MIP merge";
    public static final String MOVE_CORRECTED = "Moving corrected outputs";
    public static final String COMPRESSION = "Raw data compression";

    static final String COMBO_MIP_GLOB = "*comboMIP_*";

    private final ProcessingServices services;
    private final ProcessingLogWriter logWriter;
    private final BooleanSupplier abortRequested;
    private final Consumer<String> status;

    public PostProcessingHelper(ProcessingServices services, ProcessingLogWriter logWriter,
                                BooleanSupplier abortRequested, Consumer<String> status) {
        this.services = services;
        this.logWriter = logWriter;
        this.abortRequested = abortRequested;
        this.status = status;
    }

    /**
     * @param processed folder the GPU stage read from (the dataset, or its Corrected folder)
     * @return false if an abort request stopped the sequence early
     * @throws PipelineStageException on the first fatal sub-stage failure
     */
    public boolean run(Path processed, AcquisitionParameters params, ProcessingOptions options, String logName)
            throws PipelineStageException {
        Path path = processed;

        if (options.isDoRegistration()) {
            if (abortRequested.getAsBoolean()) return false;
            status.accept("Registering channels in " + MinorFunctions.shortName(path) + "...");
            try {
                services.registration().register(path, options);
            } catch (IOException | RuntimeException e) {
                throw new PipelineStageException(REGISTRATION, e.getMessage(), e);
            }
        }

        if (abortRequested.getAsBoolean()) return false;
        if (options.isMergeMips()) {
            status.accept("Merging MIPs in " + MinorFunctions.shortName(path) + "...");
            try {
                services.mips().mergeMips(path);
            } catch (IOException | RuntimeException e) {
                throw new PipelineStageException(MIP_MERGE, e.getMessage(), e);
            }
        } else {
            try {
                int removed = DatasetFolderUtilities.deleteMatching(path, COMBO_MIP_GLOB);
                if (removed > 0) {
                    logger.info("Removed {} stale combined MIP files", removed);
                }
            } catch (IOException e) {
                logger.warn("Could not remove stale combined MIPs under {}: {}", path, e.getMessage());
            }
        }

        if (DatasetFolderUtilities.isCorrectedFolder(path) && options.isMoveCorrected()) {
            if (abortRequested.getAsBoolean()) return false;
            Path corrected = path;
            try {
                path = DatasetFolderUtilities.moveCorrected(corrected);
                if (!options.isKeepCorrected()) {
                    DatasetFolderUtilities.deleteFolder(corrected);
                }
            } catch (IOException e) {
                throw new PipelineStageException(MOVE_CORRECTED, e.getMessage(), e);
            }
        } else if (DatasetFolderUtilities.isCorrectedFolder(path)) {
            path = path.toAbsolutePath().getParent();
        }

        if (options.isCompressRaw()) {
            if (abortRequested.getAsBoolean()) return false;
            status.accept("Compressing raw data in " + MinorFunctions.shortName(path) + "...");
            try {
                services.compression().compress(path);
            } catch (CompressionException e) {
                throw new PipelineStageException(COMPRESSION, e.getMessage(), e);
            }
        }

        if (options.isWriteLog()) {
            if (abortRequested.getAsBoolean()) return false;
            try {
                logWriter.write(path, params, options, logName);
            } catch (IOException e) {
                logger.warn("Could not write processing log in {}: {}", path, e.getMessage());
            }
        }

        return true;
    }
}
