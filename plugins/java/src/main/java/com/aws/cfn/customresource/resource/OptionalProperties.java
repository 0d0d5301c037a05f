package com.aws.cfn.customresource.resource;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.type.TypeFactory;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Resource properties which the resource supports but does not depend on. A missing or null
 * ResourceProperties field decodes to {@link #empty()}; a present one must match {@code P} exactly.
 * The physical resource ID suffix is the one of the wrapped value, or empty when there is none.
 *
 * Since the wrapped type is erased at runtime, decode through {@link #typeOf(Class)} or a
 * {@link com.fasterxml.jackson.core.type.TypeReference}.
 *
 * @param <P> Type of the wrapped resource properties
 */
@EqualsAndHashCode
@ToString
@JsonDeserialize(using = OptionalProperties.Deserializer.class)
public final class OptionalProperties<P extends PhysicalResourceIdSuffixProvider>
    implements PhysicalResourceIdSuffixProvider {

    private static final OptionalProperties<?> EMPTY = new OptionalProperties<>(null);

    private final P value;

    private OptionalProperties(final P value) {
        this.value = value;
    }

    public static <P extends PhysicalResourceIdSuffixProvider> OptionalProperties<P> of(final P value) {
        return new OptionalProperties<>(Objects.requireNonNull(value, "value"));
    }

    public static <P extends PhysicalResourceIdSuffixProvider> OptionalProperties<P> empty() {
        return new OptionalProperties<>(null);
    }

    public static JavaType typeOf(final Class<? extends PhysicalResourceIdSuffixProvider> valueType) {
        return TypeFactory.defaultInstance().constructParametricType(OptionalProperties.class, valueType);
    }

    public Optional<P> getValue() {
        return Optional.ofNullable(this.value);
    }

    public boolean isPresent() {
        return this.value != null;
    }

    @Override
    public String physicalResourceIdSuffix() {
        return this.value == null ? "" : this.value.physicalResourceIdSuffix();
    }

    public static final class Deserializer extends StdDeserializer<OptionalProperties<?>>
        implements ContextualDeserializer {

        private static final long serialVersionUID = 4262195323180581172L;

        private final JavaType valueType;

        public Deserializer() {
            this(null);
        }

        private Deserializer(final JavaType valueType) {
            super(OptionalProperties.class);
            this.valueType = valueType;
        }

        @Override
        public JsonDeserializer<?> createContextual(final DeserializationContext ctxt,
                                                    final BeanProperty property) {
            final JavaType wrapperType = property != null ? property.getType() : ctxt.getContextualType();
            return new Deserializer(wrapperType == null ? null : wrapperType.containedType(0));
        }

        @Override
        public OptionalProperties<?> deserialize(final JsonParser p,
                                                 final DeserializationContext ctxt) throws IOException {
            if (this.valueType == null) {
                return ctxt.reportBadDefinition(
                    ctxt.constructType(OptionalProperties.class),
                    "OptionalProperties requires a concrete type parameter, decode with OptionalProperties.typeOf(..)");
            }

            final PhysicalResourceIdSuffixProvider decoded = ctxt.readValue(p, this.valueType);
            return decoded == null ? EMPTY : new OptionalProperties<>(decoded);
        }

        @Override
        public OptionalProperties<?> getNullValue(final DeserializationContext ctxt) {
            return EMPTY;
        }
    }
}
