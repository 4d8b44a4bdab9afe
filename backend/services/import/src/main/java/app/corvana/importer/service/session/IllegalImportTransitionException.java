package app.corvana.importer.service.session;

public class IllegalImportTransitionException extends RuntimeException {

    public IllegalImportTransitionException(String message) {
        super(message);
    }
}
