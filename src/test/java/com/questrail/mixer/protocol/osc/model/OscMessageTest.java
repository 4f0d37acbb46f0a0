package com.questrail.mixer.protocol.osc.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OscMessageTest {

    @Test
    void doublesBecomeFloatsAndBooleansBecomeIntegers() {
        OscMessage message = OscMessage.of("/ch/01/mix/on", 0.25, true, false, 7, "x");

        assertEquals(List.of(0.25f, 1, 0, 7, "x"), message.arguments());
    }

    @Test
    void argumentsAreACopy() {
        List<Object> args = new ArrayList<>(List.of(1));
        OscMessage message = new OscMessage("/a", args);
        args.add(2);

        assertEquals(List.of(1), message.arguments());
        assertThrows(UnsupportedOperationException.class, () -> message.arguments().add(3));
    }

    @Test
    void addressMustBeAbsolute() {
        assertThrows(IllegalArgumentException.class, () -> OscMessage.of("ch/01/mix/fader"));
        assertThrows(NullPointerException.class, () -> new OscMessage("/a", null));
    }

    @Test
    void firstArgumentIsEmptyForQueries() {
        assertEquals(Optional.empty(), OscMessage.of("/xinfo").firstArgument());
        assertEquals(Optional.of("X18"), OscMessage.of("/xinfo", "X18", "1.17").firstArgument());
    }
}
