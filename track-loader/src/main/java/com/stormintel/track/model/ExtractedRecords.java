package com.stormintel.track.model;

import java.util.List;

/**
 * Output of the extractor for one source: both sequences in source order.
 */
public record ExtractedRecords(List<StormHeader> headers, List<RawObservation> observations) {

    public ExtractedRecords {
        headers = List.copyOf(headers);
        observations = List.copyOf(observations);
    }
}
