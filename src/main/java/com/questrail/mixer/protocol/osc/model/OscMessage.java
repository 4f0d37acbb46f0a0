package com.questrail.mixer.protocol.osc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OscMessage
 * -----------------------------------------------------------------------------
 * One OSC message: a slash-delimited address and zero or more typed arguments.
 *
 * <h2>Layering note</h2>
 * This is the only message type above the codec boundary. JavaOSC types stay
 * inside {@code codec.impl}, the same way Netty types stay inside the endpoint
 * package.
 *
 * <h2>Argument normalization</h2>
 * Mixers in both families understand 32-bit floats, 32-bit integers and
 * strings only. {@link Double} arguments are narrowed to {@link Float} and
 * {@link Boolean} arguments become {@code 1}/{@code 0} integers; any other
 * non-null argument type is passed through to the serializer unchanged.
 */
public record OscMessage(String address, List<Object> arguments)
{
    public OscMessage {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(arguments, "arguments");
        if (!address.startsWith("/")) {
            throw new IllegalArgumentException("OSC address must start with '/' (was \"" + address + "\")");
        }

        List<Object> normalized = new ArrayList<>(arguments.size());
        for (Object argument : arguments) {
            normalized.add(normalize(Objects.requireNonNull(argument, "argument")));
        }
        arguments = Collections.unmodifiableList(normalized);
    }

    public static OscMessage of(String address, Object... arguments) {
        return new OscMessage(address, List.of(arguments));
    }

    /**
     * The first argument, which is the value carried by every mixer reply.
     */
    public Optional<Object> firstArgument() {
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments.get(0));
    }

    private static Object normalize(Object argument) {
        if (argument instanceof Double d) {
            return d.floatValue();
        }
        if (argument instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return argument;
    }
}
