package org.dxworks.wikiframe;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.dxworks.wikiframe.model.Span;

import java.io.IOException;

/**
 * Reads and writes trees and errors as JSON or YAML. Reading is strict about unknown fields.
 */
public final class TreeMapper {

    private final ObjectMapper mapper;

    private TreeMapper(ObjectMapper mapper, boolean positions) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        if (!positions) {
            SimpleModule module = new SimpleModule("wikiframe-no-position");
            module.addSerializer(Span.class, new EmptySpanSerializer());
            mapper.registerModule(module);
        }
        this.mapper = mapper;
    }

    public static TreeMapper json(boolean positions) {
        return new TreeMapper(new ObjectMapper(), positions);
    }

    public static TreeMapper yaml(boolean positions) {
        YAMLFactory factory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID);
        return new TreeMapper(new ObjectMapper(factory), positions);
    }

    public String write(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    public <T> T read(String text, Class<T> type) throws JsonProcessingException {
        return mapper.readValue(text, type);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    private static class EmptySpanSerializer extends StdSerializer<Span> {

        EmptySpanSerializer() {
            super(Span.class);
        }

        @Override
        public void serialize(Span value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeEndObject();
        }
    }
}
