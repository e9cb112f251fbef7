package com.stormintel.track.codes;

/** One row of a reference table as handed to the storage layer. */
public record CodeTableEntry(int codeId, String description) {}
