package com.gqlcanon.schema;

import com.gqlcanon.ast.OperationType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Immutable set of named types plus the root operation types. The built-in scalars
 * {@code Int}, {@code Float}, {@code String}, {@code Boolean} and {@code ID} are always present.
 */
public final class Schema {
    public static final ImmutableList<String> BUILT_IN_SCALARS = Lists.immutable.of("Int", "Float", "String", "Boolean", "ID");

    private final ImmutableMap<String, SchemaType> types;
    private final String queryTypeName;
    private final String mutationTypeName;
    private final String subscriptionTypeName;

    private Schema(Builder builder) {
        this.types = builder.types.toImmutable();
        this.queryTypeName = rootName(builder.queryTypeName, "Query");
        this.mutationTypeName = rootName(builder.mutationTypeName, "Mutation");
        this.subscriptionTypeName = rootName(builder.subscriptionTypeName, "Subscription");
    }

    private String rootName(String declared, String conventional) {
        if (declared != null) {
            if (!(types.get(declared) instanceof SchemaType.ObjectType)) {
                throw new IllegalArgumentException("Root type " + declared + " must be a defined object type");
            }
            return declared;
        }
        return types.get(conventional) instanceof SchemaType.ObjectType ? conventional : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the type, or {@code null} when the schema does not define it */
    public SchemaType namedType(String name) {
        return types.get(name);
    }

    /** @return the root type for the operation kind, or {@code null} when the schema has none */
    public SchemaType.ObjectType rootType(OperationType operation) {
        String name = switch (operation) {
            case QUERY -> queryTypeName;
            case MUTATION -> mutationTypeName;
            case SUBSCRIPTION -> subscriptionTypeName;
        };
        return name == null ? null : (SchemaType.ObjectType) types.get(name);
    }

    public ImmutableMap<String, SchemaType> types() {
        return types;
    }

    public static final class Builder {
        private final MutableMap<String, SchemaType> types = Maps.mutable.empty();
        private String queryTypeName;
        private String mutationTypeName;
        private String subscriptionTypeName;

        private Builder() {
            BUILT_IN_SCALARS.forEach(name -> types.put(name, new SchemaType.ScalarType(name)));
        }

        public Builder type(SchemaType type) {
            if (types.containsKey(type.name()) && !BUILT_IN_SCALARS.contains(type.name())) {
                throw new IllegalArgumentException("Type " + type.name() + " is defined more than once");
            }
            types.put(type.name(), type);
            return this;
        }

        public Builder queryType(String name) {
            this.queryTypeName = name;
            return this;
        }

        public Builder mutationType(String name) {
            this.mutationTypeName = name;
            return this;
        }

        public Builder subscriptionType(String name) {
            this.subscriptionTypeName = name;
            return this;
        }

        public Schema build() {
            return new Schema(this);
        }
    }
}
