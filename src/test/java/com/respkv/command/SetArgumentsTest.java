package com.respkv.command;

import com.respkv.core.KeyValuePair;
import com.respkv.core.SetCondition;
import com.respkv.network.protocol.RespValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SetArgumentsTest {

    private static final long NOW = 1_700_000_000_000L;

    private static List<RespValue> options(String... parts) {
        List<RespValue> values = new ArrayList<>();
        for (String part : parts) {
            values.add(RespValue.bulkString(part));
        }
        return values;
    }

    private static SetArguments parse(String... parts) {
        return SetArguments.parse(options(parts), NOW);
    }

    @Test
    void noOptions_plainWrite() {
        SetArguments args = SetArguments.parse(Collections.emptyList(), NOW);

        assertThat(args.getExpiresAt()).isEqualTo(KeyValuePair.NO_EXPIRY);
        assertThat(args.getCondition()).isEqualTo(SetCondition.ALWAYS);
        assertThat(args.isKeepTtl()).isFalse();
    }

    @Test
    void relativeUnits_areAddedToNow() {
        assertThat(parse("EX", "10").getExpiresAt()).isEqualTo(NOW + 10_000);
        assertThat(parse("px", "250").getExpiresAt()).isEqualTo(NOW + 250);
    }

    @Test
    void absoluteUnits_ignoreNow() {
        assertThat(parse("EXAT", "1800000000").getExpiresAt()).isEqualTo(1_800_000_000_000L);
        assertThat(parse("PXAT", "1800000000123").getExpiresAt()).isEqualTo(1_800_000_000_123L);
    }

    @Test
    void optionsAreCaseInsensitiveAndUnordered() {
        SetArguments args = parse("nx", "Px", "100");

        assertThat(args.getCondition()).isEqualTo(SetCondition.IF_ABSENT);
        assertThat(args.getExpiresAt()).isEqualTo(NOW + 100);
    }

    @Test
    void repeatedFlags_areAllowed() {
        assertThat(parse("XX", "xx").getCondition()).isEqualTo(SetCondition.IF_PRESENT);
        assertThat(parse("KEEPTTL", "keepttl").isKeepTtl()).isTrue();
    }

    @Test
    void conflictingOptions_areSyntaxErrors() {
        assertThatThrownBy(() -> parse("NX", "XX"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
        assertThatThrownBy(() -> parse("EX", "1", "PX", "1"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
        assertThatThrownBy(() -> parse("EX", "1", "KEEPTTL"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
        assertThatThrownBy(() -> parse("KEEPTTL", "PXAT", "1"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
    }

    @Test
    void unknownOrIncompleteOptions_areSyntaxErrors() {
        assertThatThrownBy(() -> parse("GETX"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
        assertThatThrownBy(() -> parse("EX"))
                .isInstanceOf(CommandException.class).hasMessage("ERR syntax error");
    }

    @Test
    void nonIntegerTime_isIntegerError() {
        assertThatThrownBy(() -> parse("EX", "ten"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR value is not an integer or out of range");
        assertThatThrownBy(() -> parse("PX", "+5"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR value is not an integer or out of range");
        assertThatThrownBy(() -> parse("PX", "99999999999999999999"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR value is not an integer or out of range");
    }

    @Test
    void nonPositiveOrOverflowingTime_isInvalidExpire() {
        assertThatThrownBy(() -> parse("EX", "0"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR invalid expire time in 'set' command");
        assertThatThrownBy(() -> parse("PX", "-5"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR invalid expire time in 'set' command");
        assertThatThrownBy(() -> parse("EX", String.valueOf(Long.MAX_VALUE / 10)))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR invalid expire time in 'set' command");
    }

    @Test
    void expireUnit_overflowThrowsArithmeticException() {
        assertThatThrownBy(() -> ExpireUnit.EXAT.toAbsoluteMillis(Long.MAX_VALUE, NOW))
                .isInstanceOf(ArithmeticException.class);
        assertThat(ExpireUnit.fromOption("pxat")).isEqualTo(ExpireUnit.PXAT);
        assertThat(ExpireUnit.fromOption("nx")).isNull();
    }
}
