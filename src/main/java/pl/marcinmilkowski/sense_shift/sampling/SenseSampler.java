package pl.marcinmilkowski.sense_shift.sampling;

import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.corpus.Document;

import java.util.List;

/**
 * The hierarchical Dirichlet process sampler that reassigns tokens to senses.
 *
 * Implementations live outside this project. They receive the documents after CRP
 * initialization and must keep each partition a true partition of its token positions.
 */
public interface SenseSampler {

    /**
     * Number of global senses; rows of the per-word sense count matrices.
     */
    int senseCount();

    /**
     * Set up global state from the initial partitions. Must call
     * {@link Document#assignSenses(int[])} on every document.
     */
    void initialize(List<Document> documents);

    /**
     * Resample the table of one token. When the partition gains or loses a cluster the
     * document's sense mapping must be reassigned to match it.
     *
     * @param document document holding the token
     * @param position token position
     * @param context association row of the token's word id
     */
    void resample(Document document, int position, AssociationMatrix.Row context);
}
