package com.stormintel.track.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalised storms and observations of one or more source files, in source order.
 */
public record BestTrackDataset(List<Storm> storms, List<Observation> observations) {

    public BestTrackDataset {
        storms = List.copyOf(storms);
        observations = List.copyOf(observations);
    }

    public static BestTrackDataset empty() {
        return new BestTrackDataset(List.of(), List.of());
    }

    /** Appends {@code other} after this dataset, keeping both orders */
    public BestTrackDataset concat(BestTrackDataset other) {
        List<Storm> allStorms = new ArrayList<>(storms);
        allStorms.addAll(other.storms);
        List<Observation> allObservations = new ArrayList<>(observations);
        allObservations.addAll(other.observations);
        return new BestTrackDataset(allStorms, allObservations);
    }
}
