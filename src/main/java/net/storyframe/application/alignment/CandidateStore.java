package net.storyframe.application.alignment;

import java.util.List;
import net.storyframe.domain.image.ImageCandidate;

/**
 * Nearest-neighbour lookup over the indexed image library.
 *
 * <p>Implementations filter server-side on impact and similarity, return candidates
 * in descending similarity order, and report a failed query as an empty list.</p>
 */
public interface CandidateStore {

    List<ImageCandidate> searchCandidates(float[] embedding, int minImpact, int poolSize);
}
