package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;
import java.util.function.Function;

/// Writes an enum constant as its lowercase wire name.
///
/// @param <E> enum type
class WireNameSerializer<E extends Enum<E>> extends StdSerializer<E> {

    @Serial private static final long serialVersionUID = 6014471389251709531L;

    private final transient Function<E, String> wireName;

    WireNameSerializer(Class<E> type, Function<E, String> wireName) {
        super(type);
        this.wireName = wireName;
    }

    @Override
    public void serialize(E value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(wireName.apply(value));
    }
}
