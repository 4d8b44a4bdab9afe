package app.corvana.importer.service.entity;

/**
 * Candidate that belongs to a parent lead named by free text.
 */
public interface LeadReference extends CandidateEntity {

    String leadName();
}
