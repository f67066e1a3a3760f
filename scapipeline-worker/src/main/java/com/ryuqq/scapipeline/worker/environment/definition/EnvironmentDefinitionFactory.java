package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.core.outcome.Fail;
import com.ryuqq.scapipeline.core.outcome.Ok;
import com.ryuqq.scapipeline.core.outcome.Outcome;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Creates {@link EnvironmentServiceDefinition}s from the raw properties of a configuration entry.
 *
 * <p>Creators are registered per package manager type in an immutable table built once.
 * {@link #defaults()} contains {@code maven}, {@code npm} and {@code nuget}.</p>
 *
 * <p>Every creator consumes properties through {@link DefinitionProperties}; properties that were
 * not consumed are reported as unknown.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvironmentDefinitionFactory {

    /** Property referencing the infrastructure service by name. */
    public static final String SERVICE_PROPERTY = "service";

    /** Optional comma-separated list of {@link CredentialsType} names. */
    public static final String CREDENTIALS_TYPES_PROPERTY = "credentialsTypes";

    public static final String ERROR_UNKNOWN_TYPE = "ENV_DEFINITION_UNKNOWN_TYPE";
    public static final String ERROR_INVALID_PROPERTIES = "ENV_DEFINITION_INVALID_PROPERTIES";

    private final Map<String, DefinitionCreator> creators;

    private EnvironmentDefinitionFactory(Map<String, DefinitionCreator> creators) {
        this.creators = Collections.unmodifiableMap(new LinkedHashMap<>(creators));
    }

    /**
     * Factory with the built-in definition types.
     *
     * @return factory
     */
    public static EnvironmentDefinitionFactory defaults() {
        Map<String, DefinitionCreator> creators = new LinkedHashMap<>();
        creators.put("maven", (service, types, properties) ->
            new MavenDefinition(service, types, properties.required("id"))
        );
        creators.put("npm", (service, types, properties) ->
            new NpmDefinition(
                service,
                types,
                properties.optional("scope"),
                properties.optional("email"),
                properties.optionalEnum("authMode", NpmAuthMode.class)
            )
        );
        creators.put("nuget", (service, types, properties) ->
            new NuGetDefinition(
                service,
                types,
                properties.required("sourceName"),
                properties.required("sourcePath"),
                properties.optional("sourceProtocolVersion")
            )
        );
        return new EnvironmentDefinitionFactory(creators);
    }

    /**
     * Create a definition.
     *
     * @param type package manager type (e.g. {@code maven})
     * @param service resolved service referenced by the entry
     * @param properties raw properties, including {@value #SERVICE_PROPERTY}
     * @return the definition, or a failure describing the invalid entry
     */
    public Outcome<EnvironmentServiceDefinition> createDefinition(
        String type,
        InfrastructureService service,
        Map<String, String> properties
    ) {
        DefinitionCreator creator = creators.get(type);
        if (creator == null) {
            return Fail.of(ERROR_UNKNOWN_TYPE, "Unsupported environment definition type: '" + type + "'.");
        }

        DefinitionProperties definitionProperties = new DefinitionProperties(type, properties);
        definitionProperties.optional(SERVICE_PROPERTY);
        try {
            Set<CredentialsType> types = definitionProperties.credentialsTypes();
            EnvironmentServiceDefinition definition = creator.create(service, types, definitionProperties);
            definitionProperties.checkAllConsumed();
            return Ok.of(definition);
        } catch (IllegalArgumentException e) {
            return Fail.of(ERROR_INVALID_PROPERTIES, e.getMessage(), properties.toString());
        }
    }

    /**
     * Builds one definition type from its properties.
     */
    @FunctionalInterface
    public interface DefinitionCreator {

        /**
         * @param service resolved service
         * @param credentialsTypes override from the entry, or null to use the service's
         * @param properties properties accessor
         * @return definition
         * @throws IllegalArgumentException if properties are missing or invalid
         */
        EnvironmentServiceDefinition create(
            InfrastructureService service,
            Set<CredentialsType> credentialsTypes,
            DefinitionProperties properties
        );
    }

    /**
     * Property accessor recording which properties were read.
     */
    public static final class DefinitionProperties {

        private final String type;
        private final Map<String, String> properties;
        private final Set<String> consumed = new TreeSet<>();

        DefinitionProperties(String type, Map<String, String> properties) {
            this.type = type;
            this.properties = properties == null ? Map.of() : properties;
        }

        public String required(String name) {
            consumed.add(name);
            String value = properties.get(name);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(
                    "Missing required property '" + name + "' for '" + type + "' definition: " + properties
                );
            }
            return value;
        }

        public String optional(String name) {
            consumed.add(name);
            return properties.get(name);
        }

        public <E extends Enum<E>> E optionalEnum(String name, Class<E> enumType) {
            String value = optional(name);
            if (value == null) {
                return null;
            }
            try {
                return Enum.valueOf(enumType, value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid value '" + value + "' of property '" + name + "' for '" + type + "' definition."
                );
            }
        }

        Set<CredentialsType> credentialsTypes() {
            String value = optional(CREDENTIALS_TYPES_PROPERTY);
            if (value == null) {
                return null;
            }
            Set<CredentialsType> types = EnumSet.noneOf(CredentialsType.class);
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    types.add(CredentialsType.valueOf(trimmed.toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(
                        "Invalid credentials type '" + trimmed + "' for '" + type + "' definition."
                    );
                }
            }
            return types;
        }

        void checkAllConsumed() {
            Set<String> unknown = new TreeSet<>(properties.keySet());
            unknown.removeAll(consumed);
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException(
                    "Unknown properties for '" + type + "' definition: " + unknown
                );
            }
        }
    }
}
