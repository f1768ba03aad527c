package io.github.galkahana.testharness;

/**
 * Foreground colors used for outcome tokens, with their ANSI SGR codes.
 */
public enum TextColor {
    RED(31),
    GREEN(32),
    YELLOW(33),
    CYAN(36);

    private final int sgrCode;

    TextColor(int sgrCode) {
        this.sgrCode = sgrCode;
    }

    public int sgrCode() {
        return sgrCode;
    }
}
