package com.title.reconciliation.trigger;

import com.title.reconciliation.core.model.ResolutionMode;
import com.title.reconciliation.core.model.TriggerScenario;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one person record.
 *
 * @param scenario the scenario, never null
 * @param mode     resolution mode, present exactly when the scenario requires resolution
 */
public record TriggerClassification(TriggerScenario scenario, Optional<ResolutionMode> mode) {

    private static final TriggerClassification NONE =
            new TriggerClassification(TriggerScenario.NO_TRIGGER, Optional.empty());

    public TriggerClassification {
        Objects.requireNonNull(scenario, "scenario is required");
        mode = mode != null ? mode : Optional.empty();
        if (scenario.requiresResolution() != mode.isPresent()) {
            throw new IllegalArgumentException("mode must be present exactly when " + scenario + " requires resolution");
        }
    }

    public static TriggerClassification newTitleAvailable() {
        return new TriggerClassification(TriggerScenario.NEW_TITLE_AVAILABLE, Optional.of(ResolutionMode.EXTRAPOLATE));
    }

    public static TriggerClassification titleCollision() {
        return new TriggerClassification(TriggerScenario.TITLE_COLLISION, Optional.of(ResolutionMode.ARBITRATE));
    }

    public static TriggerClassification noTrigger() {
        return NONE;
    }

    public boolean requiresResolution() {
        return scenario.requiresResolution();
    }
}
