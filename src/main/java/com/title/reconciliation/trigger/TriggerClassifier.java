package com.title.reconciliation.trigger;

import com.title.reconciliation.core.model.PersonRecord;

import java.util.Locale;

/**
 * Decides whether a person record needs a model call and in which mode.
 *
 * <p>The classification is total and deterministic, and it is the only gate on model
 * invocation:</p>
 * <ul>
 *   <li>internal title empty, feed title present: extrapolate</li>
 *   <li>both present and different ignoring case and all whitespace: arbitrate</li>
 *   <li>anything else: no trigger</li>
 * </ul>
 */
public class TriggerClassifier {

    public TriggerClassification classify(PersonRecord record) {
        boolean hasInput = record.hasTitleInput();
        boolean hasNew = record.hasTitleNew();

        if (!hasInput && hasNew) {
            return TriggerClassification.newTitleAvailable();
        }
        if (hasInput && hasNew && !comparable(record.titleInput()).equals(comparable(record.titleNew()))) {
            return TriggerClassification.titleCollision();
        }
        return TriggerClassification.noTrigger();
    }

    /**
     * Canonical form for title comparison: all whitespace removed, case folded.
     */
    static String comparable(String title) {
        return title.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
