package de.bsommerfeld.launchpad.core.domain;

/**
 * Opaque OS window handle. The value {@code 0} means "no handle" and is what
 * placeholder windows carry.
 */
public record WindowHandle(long value) {

    public static final WindowHandle NONE = new WindowHandle(0L);

    public boolean isNone() {
        return value == 0L;
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(value);
    }
}
