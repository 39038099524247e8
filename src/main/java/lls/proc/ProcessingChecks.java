package lls.proc;

import lls.proc.exceptions.ConfigurationException;
import lls.proc.exceptions.MissingBinaryException;
import lls.proc.utilities.MinorFunctions;
import lls.proc.utilities.ProcessingConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ProcessingChecks verifies that the environment is ready before a batch is started:
 *
 * 1. The configuration holds every required key and selects at least one GPU.
 * 2. The cudaDeconv binary resolves to an executable.
 * 3. The compression helpers are available (warning only, they are needed for archived data).
 */
public class ProcessingChecks {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingChecks.class);

    /**
     * Runs every check.
     *
     * @throws ConfigurationException if the configuration is incomplete
     * @throws MissingBinaryException if cudaDeconv cannot be found
     */
    public static void checkEnvironment(ProcessingConfigManager config)
            throws ConfigurationException, MissingBinaryException {
        config.validateConfiguration();
        checkBinary(config.getCudaDeconvBinary());

        if (!isAvailable(config.getTarBinary()) || !isAvailable(config.getCompressionBinary())) {
            logger.warn("Compression tools not found ({} / {}); archived datasets cannot be processed",
                    config.getTarBinary(), config.getCompressionBinary());
        }
        logger.info("Environment checks passed: GPUs {}, cudaDeconv {}",
                config.getGpuSlots(), config.getCudaDeconvBinary());
    }

    /**
     * @throws MissingBinaryException if {@code binary} does not resolve to an executable
     */
    public static void checkBinary(String binary) throws MissingBinaryException {
        if (!isAvailable(binary)) {
            throw new MissingBinaryException(binary);
        }
    }

    private static boolean isAvailable(String binary) {
        return MinorFunctions.which(binary).isPresent();
    }
}
