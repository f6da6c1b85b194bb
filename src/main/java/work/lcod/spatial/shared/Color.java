package work.lcod.spatial.shared;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * RGB color with 0-255 channels; wire form is {@code #RRGGBB}.
 */
public record Color(int red, int green, int blue) {
    private static final Map<String, Color> NAMED = Map.ofEntries(
        Map.entry("black", new Color(0, 0, 0)),
        Map.entry("white", new Color(255, 255, 255)),
        Map.entry("red", new Color(255, 0, 0)),
        Map.entry("lime", new Color(0, 255, 0)),
        Map.entry("green", new Color(0, 128, 0)),
        Map.entry("blue", new Color(0, 0, 255)),
        Map.entry("yellow", new Color(255, 255, 0)),
        Map.entry("cyan", new Color(0, 255, 255)),
        Map.entry("aqua", new Color(0, 255, 255)),
        Map.entry("magenta", new Color(255, 0, 255)),
        Map.entry("fuchsia", new Color(255, 0, 255)),
        Map.entry("gray", new Color(128, 128, 128)),
        Map.entry("grey", new Color(128, 128, 128)),
        Map.entry("silver", new Color(192, 192, 192)),
        Map.entry("maroon", new Color(128, 0, 0)),
        Map.entry("navy", new Color(0, 0, 128)),
        Map.entry("olive", new Color(128, 128, 0)),
        Map.entry("purple", new Color(128, 0, 128)),
        Map.entry("teal", new Color(0, 128, 128)),
        Map.entry("orange", new Color(255, 165, 0)),
        Map.entry("pink", new Color(255, 192, 203)),
        Map.entry("brown", new Color(165, 42, 42))
    );

    public Color {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static Color random() {
        var rnd = ThreadLocalRandom.current();
        return new Color(rnd.nextInt(256), rnd.nextInt(256), rnd.nextInt(256));
    }

    /**
     * Decodes {@code #RRGGBB} (the leading {@code #} is optional, ASCII digits are case-insensitive).
     */
    public static Color fromHex(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Invalid hex color: null");
        }
        String digits = raw.startsWith("#") ? raw.substring(1) : raw;
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Invalid hex color: " + raw);
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isHexDigit(digits.charAt(i))) {
                throw new IllegalArgumentException("Invalid hex color: " + raw);
            }
        }
        return new Color(
            Integer.parseInt(digits.substring(0, 2), 16),
            Integer.parseInt(digits.substring(2, 4), 16),
            Integer.parseInt(digits.substring(4, 6), 16)
        );
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Accepts a hex color, a basic CSS color name or {@code random}.
     */
    public static Color parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Invalid color: " + raw);
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        if ("random".equals(key)) {
            return random();
        }
        Color named = NAMED.get(key);
        if (named != null) {
            return named;
        }
        return fromHex(raw.trim());
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    public int[] toArray() {
        return new int[] {red, green, blue};
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color " + name + " channel must be in 0-255 (got " + value + ")");
        }
    }
}
