package lls.proc.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-system helpers for dataset folders: deleting intermediate folders, removing stale
 * outputs, and moving results out of a pre-processing folder.
 */
public class DatasetFolderUtilities {
    private static final Logger logger = LoggerFactory.getLogger(DatasetFolderUtilities.class);

    /** Name of the folder that flash correction and trimming write into. */
    public static final String CORRECTED_FOLDER = "Corrected";

    /**
     * Deletes a folder and everything in it. A missing folder is not an error.
     *
     * @throws IOException on the first entry that cannot be deleted
     */
    public static void deleteFolder(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            logger.warn("Folder does not exist: {}", dir);
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(dir)) {
            // deepest first, children before parents
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        logger.info("Deleting folder {} ({} entries)", dir, entries.size());
        for (Path p : entries) {
            Files.delete(p);
            logger.trace("Deleted: {}", p);
        }
    }

    /**
     * Deletes every regular file under {@code root} whose name matches a glob.
     *
     * @return number of files deleted
     */
    public static int deleteMatching(Path root, String glob) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        List<Path> matches;
        try (Stream<Path> walk = Files.walk(root)) {
            matches = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .collect(Collectors.toList());
        }
        for (Path p : matches) {
            Files.delete(p);
            logger.debug("Removed {}", p);
        }
        return matches.size();
    }

    /**
     * @return true if {@code path} is a pre-processing output folder
     */
    public static boolean isCorrectedFolder(Path path) {
        Path name = path.getFileName();
        return name != null && CORRECTED_FOLDER.equals(name.toString());
    }

    /**
     * Moves every sub-folder of a {@code Corrected} folder up into its parent, replacing
     * any existing folder of the same name.
     *
     * @return the parent folder
     */
    public static Path moveCorrected(Path corrected) throws IOException {
        Path parent = corrected.toAbsolutePath().getParent();
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(corrected, Files::isDirectory)) {
            ds.forEach(children::add);
        }
        for (Path child : children) {
            Path target = parent.resolve(child.getFileName());
            if (Files.exists(target)) {
                logger.info("Replacing existing {}", target);
                deleteFolder(target);
            }
            Files.move(child, target, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Moved {} -> {}", child, target);
        }
        return parent;
    }
}
