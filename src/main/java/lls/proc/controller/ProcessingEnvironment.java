package lls.proc.controller;

import lls.proc.service.ProcessingServices;
import lls.proc.service.gpu.GpuWorkerFactory;
import lls.proc.utilities.ProcessingConfigManager;

import java.util.List;

/**
 * What every item of a batch shares: the GPU slot set, how workers are launched, the external
 * collaborators and the name of the processing log.
 */
public record ProcessingEnvironment(
        List<Integer> gpuSlots,
        GpuWorkerFactory workerFactory,
        ProcessingServices services,
        String outputLogName
) {
    public ProcessingEnvironment {
        gpuSlots = gpuSlots == null ? List.of() : List.copyOf(gpuSlots);
        if (outputLogName == null) {
            outputLogName = ProcessingConfigManager.DEFAULT_OUTPUT_LOG_NAME;
        }
    }
}
