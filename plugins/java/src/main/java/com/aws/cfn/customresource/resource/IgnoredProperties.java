package com.aws.cfn.customresource.resource;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * For resources which take no properties but must not fail if some are given anyway. Any payload,
 * including none at all, decodes to {@link #INSTANCE} and its contents are discarded.
 */
@JsonDeserialize(using = IgnoredProperties.Deserializer.class)
public final class IgnoredProperties implements PhysicalResourceIdSuffixProvider {

    public static final IgnoredProperties INSTANCE = new IgnoredProperties();

    private IgnoredProperties() {
    }

    @Override
    public String toString() {
        return "IgnoredProperties";
    }

    public static final class Deserializer extends StdDeserializer<IgnoredProperties> {

        private static final long serialVersionUID = 8117394465802350961L;

        public Deserializer() {
            super(IgnoredProperties.class);
        }

        @Override
        public IgnoredProperties deserialize(final JsonParser p,
                                             final DeserializationContext ctxt) throws IOException {
            p.skipChildren();
            return INSTANCE;
        }

        @Override
        public IgnoredProperties getNullValue(final DeserializationContext ctxt) {
            return INSTANCE;
        }
    }
}
