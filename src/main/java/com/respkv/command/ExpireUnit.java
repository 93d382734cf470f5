package com.respkv.command;

/**
 * Expiration options of SET, each converting its argument to absolute epoch millis.
 */
public enum ExpireUnit {
    /** Relative, in seconds. */
    EX,
    /** Relative, in milliseconds. */
    PX,
    /** Absolute unix time, in seconds. */
    EXAT,
    /** Absolute unix time, in milliseconds. */
    PXAT;

    /**
     * Convert an option argument to an absolute expiration instant.
     *
     * @param amount    the positive option argument
     * @param nowMillis current time in epoch millis
     * @return absolute expiration in epoch millis
     * @throws ArithmeticException if the result does not fit in a long
     */
    public long toAbsoluteMillis(long amount, long nowMillis) {
        switch (this) {
            case EX:
                return Math.addExact(nowMillis, Math.multiplyExact(amount, 1000L));
            case PX:
                return Math.addExact(nowMillis, amount);
            case EXAT:
                return Math.multiplyExact(amount, 1000L);
            case PXAT:
                return amount;
            default:
                throw new IllegalStateException("Unknown unit: " + this);
        }
    }

    /**
     * @param option option name as sent by the client
     * @return the unit, or null if the option is not an expiration option
     */
    static ExpireUnit fromOption(String option) {
        for (ExpireUnit unit : values()) {
            if (unit.name().equalsIgnoreCase(option)) {
                return unit;
            }
        }
        return null;
    }
}
