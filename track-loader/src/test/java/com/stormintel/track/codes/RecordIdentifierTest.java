package com.stormintel.track.codes;

import com.stormintel.track.exception.UnknownCodeException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

class RecordIdentifierTest {

    @Test
    void shouldDecodeEveryPublishedCode() {
        Assertions.assertEquals(RecordIdentifier.CLOSEST_APPROACH, RecordIdentifier.decode("C"));
        Assertions.assertEquals(RecordIdentifier.GENESIS, RecordIdentifier.decode("G"));
        Assertions.assertEquals(RecordIdentifier.INTENSITY_PEAK, RecordIdentifier.decode("I"));
        Assertions.assertEquals(RecordIdentifier.LANDFALL, RecordIdentifier.decode("L"));
        Assertions.assertEquals(RecordIdentifier.MINIMUM_PRESSURE, RecordIdentifier.decode("P"));
        Assertions.assertEquals(RecordIdentifier.RAPID_CHANGE, RecordIdentifier.decode("R"));
        Assertions.assertEquals(RecordIdentifier.STATUS_CHANGE, RecordIdentifier.decode("S"));
        Assertions.assertEquals(RecordIdentifier.TRACK_DETAIL, RecordIdentifier.decode("T"));
        Assertions.assertEquals(RecordIdentifier.MAXIMUM_WIND, RecordIdentifier.decode("W"));
    }

    @Test
    void shouldDecodeBlankAsMissing() {
        Assertions.assertNull(RecordIdentifier.decode(" "));
    }

    @Test
    void shouldRejectUnknownCode() {
        UnknownCodeException e = Assertions.assertThrows(UnknownCodeException.class,
                () -> RecordIdentifier.decode("X"));

        Assertions.assertEquals("X", e.getCode());
        Assertions.assertEquals(RecordIdentifier.TABLE_NAME, e.getTable());
    }

    @Test
    void shouldBeCaseSensitive() {
        Assertions.assertThrows(UnknownCodeException.class, () -> RecordIdentifier.decode("l"));
    }

    @Test
    void shouldListReferenceTableWithoutMissingRow() {
        List<CodeTableEntry> table = RecordIdentifier.referenceTable();

        Assertions.assertEquals(9, table.size());
        Assertions.assertEquals(IntStream.range(0, 9).boxed().toList(),
                table.stream().map(CodeTableEntry::codeId).toList());
        Assertions.assertEquals(new CodeTableEntry(3, "landfall"), table.get(3));
    }
}
