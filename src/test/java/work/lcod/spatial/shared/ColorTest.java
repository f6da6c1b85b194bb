package work.lcod.spatial.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ColorTest {
    @Test
    void hexRoundTrip() {
        assertEquals("#4286F4", new Color(66, 134, 244).toHex());
        assertEquals(new Color(66, 134, 244), Color.fromHex("#4286F4"));
        assertEquals(new Color(66, 134, 244), Color.fromHex("4286f4"));
    }

    @Test
    void shortHexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Color.fromHex("ABC"));
        assertThrows(IllegalArgumentException.class, () -> Color.fromHex("#GG0000"));
        assertThrows(IllegalArgumentException.class, () -> Color.fromHex("#\uFF11\uFF11\uFF11\uFF11\uFF11\uFF11"));
        assertThrows(IllegalArgumentException.class, () -> Color.fromHex("#12345\u0663"));
    }

    @Test
    void parseAcceptsNamesAndRandom() {
        assertEquals(new Color(255, 0, 0), Color.parse("Red"));
        assertEquals(new Color(0, 0, 128), Color.parse(" navy "));
        Color random = Color.parse("random");
        assertEquals(random, Color.fromHex(random.toHex()));
    }

    @Test
    void channelsStayInByteRange() {
        assertThrows(IllegalArgumentException.class, () -> new Color(256, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Color(0, -1, 0));
    }
}
