package ch.so.arp.lograg.ingest;

/**
 * A log file is not a JSON array of objects. The whole file is skipped; other
 * files are unaffected.
 */
public class SourceFileParseException extends IngestionException {

    private final String file;

    public SourceFileParseException(String file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public SourceFileParseException(String file, String message) {
        super(message);
        this.file = file;
    }

    public String getFile() {
        return file;
    }
}
