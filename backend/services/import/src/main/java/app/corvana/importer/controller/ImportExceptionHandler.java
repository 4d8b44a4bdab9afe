package app.corvana.importer.controller;

import app.corvana.importer.service.parser.MalformedImportException;
import app.corvana.importer.service.session.IllegalImportTransitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ImportExceptionHandler {

    @ExceptionHandler(MalformedImportException.class)
    public ProblemDetail malformedFile(MalformedImportException ex) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalImportTransitionException.class)
    public ProblemDetail illegalTransition(IllegalImportTransitionException ex) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    }
}
