package ch.so.agi.rasterarea.lookup;

import java.util.Locale;

/**
 * 8 bit RGB colour, used as key of colour to class tables.
 */
public final class Rgb {
    public static final Rgb WHITE = new Rgb(255, 255, 255);
    public static final Rgb BLACK = new Rgb(0, 0, 0);

    private final int red;
    private final int green;
    private final int blue;

    public Rgb(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rgb)) {
            return false;
        }
        Rgb other = (Rgb) o;
        return red == other.red && green == other.green && blue == other.blue;
    }

    @Override
    public int hashCode() {
        return (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%d, %d, %d)", red, green, blue);
    }
}
