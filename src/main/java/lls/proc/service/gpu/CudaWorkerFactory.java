package lls.proc.service.gpu;

import lls.proc.exceptions.MissingBinaryException;
import lls.proc.model.WorkUnit;
import lls.proc.utilities.MinorFunctions;

import java.io.IOException;
import java.util.Map;

/**
 * Starts a {@link CudaDeconvWorker} per unit, pinned to its slot through
 * {@code CUDA_VISIBLE_DEVICES}.
 */
public class CudaWorkerFactory implements GpuWorkerFactory {

    public static final String DEVICE_ENV = "CUDA_VISIBLE_DEVICES";

    private final String binary;

    public CudaWorkerFactory(String binary) {
        this.binary = binary;
    }

    @Override
    public GpuWorker start(int slot, WorkUnit unit, WorkerListener listener)
            throws MissingBinaryException, IOException {
        CudaDeconvWorker worker = new CudaDeconvWorker(slot, listener);
        worker.start(binary, unit.arguments(), Map.of(DEVICE_ENV, String.valueOf(slot)), null);
        return worker;
    }

    @Override
    public void verify() throws MissingBinaryException {
        if (MinorFunctions.which(binary).isEmpty()) {
            throw new MissingBinaryException(binary);
        }
    }

    public String getBinary() {
        return binary;
    }
}
