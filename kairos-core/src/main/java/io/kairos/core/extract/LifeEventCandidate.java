package io.kairos.core.extract;

import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.LifeEventCategory;

public record LifeEventCandidate(LifeEventCategory category, Intensity importance, String description) {
}
