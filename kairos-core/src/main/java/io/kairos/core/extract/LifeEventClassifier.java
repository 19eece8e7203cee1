package io.kairos.core.extract;

import java.util.Optional;

public interface LifeEventClassifier {

    /**
     * Returns the first life event category whose pattern matches, if any.
     */
    Optional<LifeEventCandidate> classify(String userMessage);
}
