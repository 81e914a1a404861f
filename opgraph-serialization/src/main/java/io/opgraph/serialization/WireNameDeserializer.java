package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.io.Serial;
import java.util.function.Function;

/// Reads an enum constant from its wire name through the enum's own lenient parser.
///
/// @param <E> enum type
class WireNameDeserializer<E extends Enum<E>> extends StdDeserializer<E> {

    @Serial private static final long serialVersionUID = -2473096013551628874L;

    private final transient Function<String, E> parser;

    WireNameDeserializer(Class<E> type, Function<String, E> parser) {
        super(type);
        this.parser = parser;
    }

    @Override
    public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        try {
            return parser.apply(text);
        } catch (RuntimeException e) {
            return ctxt.reportInputMismatch(
                    this, "Unknown %s '%s'", handledType().getSimpleName(), text);
        }
    }
}
