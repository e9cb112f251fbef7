package com.stormintel.track.output;

import com.stormintel.track.codes.CodeTableEntry;
import com.stormintel.track.model.BestTrackDataset;

import java.util.List;

/**
 * Hand-off to the storage layer, which bulk-loads the tables and builds the
 * keys and spatial indexes itself.
 */
public interface BestTrackSink {

    /** Storms and observations, in the order given */
    void write(BestTrackDataset dataset);

    void writeCodeTables(List<CodeTableEntry> identifiers, List<CodeTableEntry> statuses);
}
