package app.corvana.importer.service.parser;

public class MalformedImportException extends RuntimeException {

    public MalformedImportException(String message) {
        super(message);
    }

    public MalformedImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
