package app.chatarchive.export;

public class ExportFormatException extends RuntimeException {

    public ExportFormatException(String message) {
        super(message);
    }

    public ExportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
