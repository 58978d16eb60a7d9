package io.nextrun.schedule;

/**
 * Window within which a schedule may fire.
 *
 * @param mode                   {@code OFF} or {@code FLEXIBLE}
 * @param maximumWindowInMinutes window size when the mode is flexible, otherwise null
 */
public record FlexibleTimeWindow(String mode, Integer maximumWindowInMinutes) {

    public static FlexibleTimeWindow off() {
        return new FlexibleTimeWindow("OFF", null);
    }
}
