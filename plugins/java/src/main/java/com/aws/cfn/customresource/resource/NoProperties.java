package com.aws.cfn.customresource.resource;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * For resources which take no properties and should reject any that are given. A missing, null or
 * empty ResourceProperties object decodes to {@link #INSTANCE}; anything else fails decoding.
 */
@JsonDeserialize(using = NoProperties.Deserializer.class)
public final class NoProperties implements PhysicalResourceIdSuffixProvider {

    public static final NoProperties INSTANCE = new NoProperties();

    private NoProperties() {
    }

    @Override
    public String toString() {
        return "NoProperties";
    }

    public static final class Deserializer extends StdDeserializer<NoProperties> {

        private static final long serialVersionUID = -2630471529513760437L;

        public Deserializer() {
            super(NoProperties.class);
        }

        @Override
        public NoProperties deserialize(final JsonParser p,
                                        final DeserializationContext ctxt) throws IOException {
            final JsonNode node = ctxt.readTree(p);
            if (node.isNull() || (node.isObject() && node.size() == 0)) {
                return INSTANCE;
            }

            return ctxt.reportInputMismatch(this,
                "Resource properties are not accepted by this resource (got %s)",
                node.getNodeType());
        }

        @Override
        public NoProperties getNullValue(final DeserializationContext ctxt) {
            return INSTANCE;
        }
    }
}
