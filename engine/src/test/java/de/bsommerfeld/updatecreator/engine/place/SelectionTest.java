package de.bsommerfeld.updatecreator.engine.place;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectionTest {

    @Test
    void parse_shouldAcceptCommaSeparatedIndices() throws InvalidSelectionException {
        Selection selection = Selection.parse(" 2, 1 ", 2);

        assertFalse(selection.skip());
        assertEquals(List.of(2, 1), selection.indices());
    }

    @Test
    void parse_shouldSkipWhenZeroIsPresentAnywhere() throws InvalidSelectionException {
        assertTrue(Selection.parse("0", 2).skip());
        assertTrue(Selection.parse("1,0", 2).skip());
        assertTrue(Selection.parse("5,0,x", 2).skip());
    }

    @Test
    void parse_shouldRejectIndexAboveCount() {
        InvalidSelectionException e = assertThrows(InvalidSelectionException.class,
                () -> Selection.parse("3", 2));
        assertTrue(e.getMessage().contains("0 <= index <= 2"));
    }

    @Test
    void parse_shouldRejectMalformedInput() {
        assertThrows(InvalidSelectionException.class, () -> Selection.parse("", 2));
        assertThrows(InvalidSelectionException.class, () -> Selection.parse("one", 2));
        assertThrows(InvalidSelectionException.class, () -> Selection.parse("1,,2", 2));
        assertThrows(InvalidSelectionException.class, () -> Selection.parse("-1", 2));
    }

    @Test
    void parse_shouldCollapseDuplicates() throws InvalidSelectionException {
        assertEquals(List.of(1), Selection.parse("1,1", 3).indices());
    }
}
