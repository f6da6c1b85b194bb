package work.lcod.spatial.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class ShortStringTest {
    @Test
    void elidesLongValues() {
        assertEquals("abcde...vwxyz", ShortString.elide("abcdefghijklmnopqrstuvwxyz"));
        assertEquals("short", ShortString.elide("short"));
    }

    @Test
    void oversizedNameIsInvalid() {
        String name = "a".repeat(ShortString.NAME_MAX) + "z";
        var error = assertThrows(
            ValidationException.class,
            () -> ShortString.check("name", name, ShortString.NAME_MAX, null)
        );
        assertEquals(Reason.INVALID, error.reason());
        assertEquals("name", error.field());
        assertTrue(error.getMessage().contains("aaaaa...aaaaz"), error.getMessage());
        assertTrue(error.getMessage().contains("(Length is 301)"), error.getMessage());
    }

    @Test
    void valuesAtTheLimitPass() {
        String name = "a".repeat(ShortString.NAME_MAX);
        assertEquals(name, ShortString.check("name", name, ShortString.NAME_MAX, null));
    }
}
