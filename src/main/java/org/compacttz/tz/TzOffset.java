package org.compacttz.tz;

import lombok.Value;

/**
 * UTC offset in seconds east of UTC.
 */
@Value
public class TzOffset {
    public static final TzOffset ZERO = new TzOffset(0);

    int totalSeconds;

    /**
     * Creates an offset from whole minutes.
     */
    public static TzOffset ofMinutes(int minutes) {
        return minutes == 0 ? ZERO : new TzOffset(minutes * 60);
    }

    /**
     * Returns the offset in whole minutes, truncated toward zero.
     */
    public int totalMinutes() {
        return totalSeconds / 60;
    }

    /**
     * Renders the offset as {@code +HH:MM} or {@code -HH:MM}.
     */
    @Override
    public String toString() {
        int absMinutes = Math.abs(totalMinutes());
        char sign = totalSeconds < 0 ? '-' : '+';
        return String.format("%c%02d:%02d", sign, absMinutes / 60, absMinutes % 60);
    }
}
