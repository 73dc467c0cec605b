package de.bsommerfeld.cheru.launch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldCodesTest {

    @Test
    void strip_shouldRemoveFieldCodes() {
        assertEquals("firefox", FieldCodes.strip("firefox %u"));
        assertEquals("code", FieldCodes.strip("code %F"));
        assertEquals("gimp --new-instance", FieldCodes.strip("gimp %U --new-instance"));
        assertEquals("nautilus", FieldCodes.strip("nautilus"));
    }

    @Test
    void strip_shouldCollapseWhitespace() {
        assertEquals("app --a --b", FieldCodes.strip("  app   --a \t %i --b  "));
    }

    @Test
    void strip_shouldReturnEmptyForOnlyFieldCodes() {
        assertEquals("", FieldCodes.strip("%u %F"));
        assertEquals("", FieldCodes.strip(""));
        assertEquals("", FieldCodes.strip(null));
    }
}
