package lls.proc.service.compression;

import lls.proc.exceptions.CompressionException;
import lls.proc.exceptions.MissingBinaryException;
import lls.proc.exceptions.PathTraversalException;
import lls.proc.service.CliExecutor;
import lls.proc.service.CompressionService;
import lls.proc.service.gpu.ExitResult;
import lls.proc.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Compresses raw stacks into {@code <dataset>.tar.bz2} (or {@code .tar.gz}) and back, by running
 * {@code tar} and a parallel compressor as external processes.
 *
 * <p>Before extracting, every entry of the archive is checked; an entry that would land outside
 * the dataset folder raises {@link PathTraversalException} and nothing is extracted.
 */
public class SubprocessCompressionService implements CompressionService {
    private static final Logger logger = LoggerFactory.getLogger(SubprocessCompressionService.class);

    /** Compressor candidates per archive extension, most preferred first. */
    public static final Map<String, List<String>> EXTENSIONS;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(".bz2", List.of("lbzip2", "pbzip2", "bzip2"));
        m.put(".gz", List.of("pigz", "gzip"));
        EXTENSIONS = Collections.unmodifiableMap(m);
    }

    private final String tarBinary;
    private final String compressor;

    /**
     * Uses {@code tar} and the platform default compressor (pigz on Windows, lbzip2 elsewhere).
     */
    public SubprocessCompressionService() {
        this("tar", MinorFunctions.isWindows() ? "pigz" : "lbzip2");
    }

    public SubprocessCompressionService(String tarBinary, String compressor) {
        this.tarBinary = tarBinary;
        this.compressor = compressor;
    }

    @Override
    public boolean isCompressed(Path dataset) {
        try {
            return findArchive(dataset).isPresent();
        } catch (IOException e) {
            logger.warn("Could not list {}: {}", dataset, e.getMessage());
            return false;
        }
    }

    @Override
    public void decompress(Path dataset) throws CompressionException {
        Path archive;
        try {
            archive = findArchive(dataset)
                    .orElseThrow(() -> new CompressionException("No compressed archive in " + dataset));
        } catch (IOException e) {
            throw new CompressionException("Could not list " + dataset, e);
        }
        logger.info("Decompressing {}...", MinorFunctions.shortName(dataset));

        String ext = extensionOf(archive);
        Path tarball = archive;
        if (EXTENSIONS.containsKey(ext)) {
            String binary = resolveCompressor(ext);
            runCompressor(binary, List.of("-dv", archive.toString()));
            tarball = stripExtension(archive);
        }
        untar(tarball, dataset, true);
    }

    @Override
    public void compress(Path dataset) throws CompressionException {
        List<Path> tiffs;
        try {
            if (findArchive(dataset).isPresent()) {
                throw new CompressionException("There are both raw tiffs and a compressed file in directory: "
                        + dataset + ". Remove the existing *.tar file or decompress it first.");
            }
            tiffs = listTiffs(dataset);
        } catch (IOException e) {
            throw new CompressionException("Could not list " + dataset, e);
        }
        if (tiffs.isEmpty()) {
            throw new CompressionException("No raw tiff files to compress in " + dataset);
        }
        logger.info("Compressing {}...", MinorFunctions.shortName(dataset));

        Path tarball = dataset.resolve(MinorFunctions.shortName(dataset) + ".tar");
        List<String> args = new ArrayList<>(Arrays.asList(tarBinary, "-cf", tarball.getFileName().toString()));
        tiffs.forEach(t -> args.add(t.getFileName().toString()));
        runTar(dataset, args.toArray(new String[0]));

        for (Path t : tiffs) {
            try {
                Files.delete(t);
            } catch (IOException e) {
                throw new CompressionException("Could not remove " + t + " after archiving", e);
            }
        }

        String ext = EXTENSIONS.entrySet().stream()
                .filter(e -> e.getValue().contains(compressor))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(".bz2");
        runCompressor(resolveCompressor(ext), List.of("-v", tarball.toString()));
    }

    /**
     * Extracts {@code tarball} into {@code target}, after checking every entry stays inside it.
     */
    void untar(Path tarball, Path target, boolean delete) throws CompressionException {
        if (!Files.isRegularFile(tarball)) {
            logger.warn("Expected tarball {} not found after decompression", tarball);
            return;
        }
        String listing = runTar(target, tarBinary, "-tf", tarball.toString());
        List<String> entries = listing.isEmpty() ? List.of() : Arrays.asList(listing.split("\\R"));
        validateEntries(entries, target);

        runTar(target, tarBinary, "-xf", tarball.toString(), "-C", target.toString());
        if (delete) {
            try {
                Files.delete(tarball);
            } catch (IOException e) {
                throw new CompressionException("Could not remove " + tarball, e);
            }
        }
    }

    /**
     * @throws PathTraversalException for the first entry that resolves outside {@code target}
     */
    public static void validateEntries(List<String> entries, Path target) throws PathTraversalException {
        Path root = target.toAbsolutePath().normalize();
        for (String entry : entries) {
            Path resolved = root.resolve(entry).normalize();
            if (!resolved.startsWith(root)) {
                throw new PathTraversalException(entry, root.toString());
            }
        }
    }

    // ================== HELPERS ==================

    private String runTar(Path workingDir, String... args) throws CompressionException {
        try {
            return CliExecutor.execCommandAndGetOutput(0, workingDir, args);
        } catch (MissingBinaryException e) {
            throw new CompressionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new CompressionException("tar failed in " + workingDir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompressionException("Interrupted while running tar", e);
        }
    }

    private void runCompressor(String binary, List<String> args) throws CompressionException {
        CompressionWorker worker = new CompressionWorker();
        ExitResult exit;
        try {
            worker.start(binary, args, Map.of(), null);
            exit = worker.exitFuture().get();
        } catch (MissingBinaryException e) {
            throw new CompressionException(e.getMessage(), e);
        } catch (IOException | ExecutionException e) {
            throw new CompressionException("Failed to run " + binary, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.abort();
            throw new CompressionException("Interrupted while running " + binary, e);
        }
        if (exit.exitCode() != 0) {
            throw new CompressionException(binary + " exited with code " + exit.exitCode());
        }
        if (worker.getResultString() != null) {
            logger.info("{}: {}", binary, worker.getResultString());
        }
    }

    private String resolveCompressor(String ext) throws CompressionException {
        List<String> candidates = EXTENSIONS.get(ext);
        if (candidates.contains(compressor) && MinorFunctions.which(compressor).isPresent()) {
            return compressor;
        }
        for (String c : candidates) {
            if (MinorFunctions.which(c).isPresent()) {
                return c;
            }
        }
        throw new CompressionException("No binary found for compression program: " + candidates);
    }

    private static Optional<Path> findArchive(Path dataset) throws IOException {
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dataset, "*.tar*")) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) {
                    return Optional.of(p);
                }
            }
        }
        return Optional.empty();
    }

    private static List<Path> listTiffs(Path dataset) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dataset, "*.{tif,tiff}")) {
            ds.forEach(out::add);
        }
        out.sort(null);
        return out;
    }

    private static String extensionOf(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    private static Path stripExtension(Path p) {
        String name = p.getFileName().toString();
        return p.resolveSibling(name.substring(0, name.lastIndexOf('.')));
    }
}
