package com.respkv.command;

import com.respkv.core.KeyValuePair;
import com.respkv.core.SetCondition;
import com.respkv.network.protocol.RespValue;

import java.util.List;

/**
 * Parsed options of {@code SET key value [EX s|PX ms|EXAT s|PXAT ms] [NX|XX] [KEEPTTL]}.
 */
public final class SetArguments {

    private static final SetArguments PLAIN =
            new SetArguments(KeyValuePair.NO_EXPIRY, SetCondition.ALWAYS, false);

    private final long expiresAt;
    private final SetCondition condition;
    private final boolean keepTtl;

    private SetArguments(long expiresAt, SetCondition condition, boolean keepTtl) {
        this.expiresAt = expiresAt;
        this.condition = condition;
        this.keepTtl = keepTtl;
    }

    /**
     * Parse the options that follow key and value.
     * Options are case-insensitive and may appear in any order.
     *
     * @param options   request elements after the value
     * @param nowMillis current time, for relative expirations
     * @return the parsed arguments
     * @throws CommandException on conflicting, unknown, or invalid options
     */
    public static SetArguments parse(List<RespValue> options, long nowMillis) {
        if (options.isEmpty()) {
            return PLAIN;
        }

        ExpireUnit unit = null;
        long amount = 0;
        SetCondition condition = SetCondition.ALWAYS;
        boolean keepTtl = false;

        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i).asString();
            if ("NX".equalsIgnoreCase(option)) {
                if (condition == SetCondition.IF_PRESENT) {
                    throw CommandException.syntaxError();
                }
                condition = SetCondition.IF_ABSENT;
            } else if ("XX".equalsIgnoreCase(option)) {
                if (condition == SetCondition.IF_ABSENT) {
                    throw CommandException.syntaxError();
                }
                condition = SetCondition.IF_PRESENT;
            } else if ("KEEPTTL".equalsIgnoreCase(option)) {
                if (unit != null) {
                    throw CommandException.syntaxError();
                }
                keepTtl = true;
            } else {
                ExpireUnit parsed = ExpireUnit.fromOption(option);
                if (parsed == null || unit != null || keepTtl || i + 1 >= options.size()) {
                    throw CommandException.syntaxError();
                }
                unit = parsed;
                amount = parseInteger(options.get(++i).asString());
            }
        }

        long expiresAt = KeyValuePair.NO_EXPIRY;
        if (unit != null) {
            if (amount <= 0) {
                throw CommandException.invalidExpireTime("set");
            }
            try {
                expiresAt = unit.toAbsoluteMillis(amount, nowMillis);
            } catch (ArithmeticException e) {
                throw CommandException.invalidExpireTime("set");
            }
        }
        return new SetArguments(expiresAt, condition, keepTtl);
    }

    /**
     * Parse a signed decimal integer. A leading plus sign is rejected.
     */
    static long parseInteger(String text) {
        if (text == null || text.isEmpty() || text.charAt(0) == '+') {
            throw CommandException.notAnInteger();
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notAnInteger();
        }
    }

    /**
     * @return absolute expiration in epoch millis, or 0 for none
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    public SetCondition getCondition() {
        return condition;
    }

    public boolean isKeepTtl() {
        return keepTtl;
    }

    @Override
    public String toString() {
        return "SetArguments{" +
               "expiresAt=" + expiresAt +
               ", condition=" + condition +
               ", keepTtl=" + keepTtl +
               '}';
    }
}
