package app.corvana.importer.service.entity;

import java.util.List;

/**
 * One typed record built from one source row. {@code rowIndex} is the zero-based data row index.
 */
public interface CandidateEntity {

    int rowIndex();

    boolean valid();

    List<String> validationErrors();

    /**
     * Key used in per-row messages, the row's most recognizable value.
     */
    String displayKey();
}
