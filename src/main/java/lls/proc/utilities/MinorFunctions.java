package lls.proc.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

/**
 * MinorFunctions
 *
 * <p>Miscellaneous small utilities:
 *   - Platform checks and executable lookup on the PATH.
 *   - Duration formatting for progress clocks.
 *   - Anything too small to justify its own class.
 */
public class MinorFunctions {
    private static final Logger logger = LoggerFactory.getLogger(MinorFunctions.class);

    /**
     * @return true if running on Windows, false otherwise
     */
    public static boolean isWindows() {
        String os = System.getProperty("os.name");
        return os != null && os.toLowerCase().contains("win");
    }

    /**
     * Resolves an executable. A name containing a path separator is checked as given;
     * a bare name is looked up on every entry of the PATH (with ".exe" appended on Windows).
     *
     * @return the executable path, or empty if nothing executable was found
     */
    public static Optional<Path> which(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        Path direct = Paths.get(binary);
        if (direct.isAbsolute() || binary.contains("/") || binary.contains(File.separator)) {
            return isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }

        String exeName = binary + (isWindows() && !binary.endsWith(".exe") ? ".exe" : "");
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Paths.get(dir, exeName);
            if (isExecutable(candidate)) {
                logger.debug("Resolved {} to {}", binary, candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }

    /**
     * Formats a duration as HH:mm:ss. Hours are not wrapped at 24.
     */
    public static String formatDuration(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    /**
     * @return the last element of a path, for status messages
     */
    public static String shortName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
