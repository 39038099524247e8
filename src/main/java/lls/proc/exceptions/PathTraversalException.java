package lls.proc.exceptions;

/**
 * Raised when an archive entry would be extracted outside of its target directory.
 * Nothing is extracted when this is thrown.
 */
public class PathTraversalException extends CompressionException {

    private final String entry;

    public PathTraversalException(String entry, String targetDirectory) {
        super("Attempted path traversal in tar file: entry '" + entry + "' escapes " + targetDirectory);
        this.entry = entry;
    }

    public String getEntry() {
        return entry;
    }
}
