/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.contextkeeper.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.victools.jsonschema.generator.MemberScope;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.generator.TypeScope;
import com.github.victools.jsonschema.module.jackson.JacksonModule;

import lombok.experimental.UtilityClass;

/**
 * Json mapper and schema helpers shared by all modules
 */
@UtilityClass
public class JsonUtils {

    private static final SchemaGenerator SCHEMA_GENERATOR = createSchemaGenerator();

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    /**
     * Generates a JSON schema for the given class. Used to declare tool inputs.
     */
    public static JsonNode schema(final Class<?> clazz) {
        return SCHEMA_GENERATOR.generateSchema(clazz);
    }

    public static boolean empty(final JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() || node.isEmpty();
    }

    private static SchemaGenerator createSchemaGenerator() {
        final var configBuilder = new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12,
                                                                   OptionPreset.PLAIN_JSON);
        final var config = configBuilder
                .without(Option.EXTRA_OPEN_API_FORMAT_VALUES)
                .without(Option.SCHEMA_VERSION_INDICATOR)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT)
                .with(Option.INLINE_ALL_SCHEMAS)
                .with(new RequiredFieldsModule())
                .build();
        return new SchemaGenerator(config);
    }

    /**
     * Tool inputs are strict: every field is required
     */
    private static class RequiredFieldsModule extends JacksonModule {
        @Override
        public void applyToConfigBuilder(SchemaGeneratorConfigBuilder builder) {
            super.applyToConfigBuilder(builder);
            builder.forFields().withRequiredCheck(field -> true);
        }

        @Override
        protected String resolveDescription(MemberScope<?, ?> member) {
            return null;
        }

        @Override
        protected String resolveDescriptionForType(TypeScope scope) {
            return null;
        }
    }
}
