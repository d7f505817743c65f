/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.framework;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.opensearch.influxql.framework.models.CompileRuleSet;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads YAML test fixtures from the classpath using Jackson.
 */
public class YamlLoader {

    private static final ObjectMapper yamlMapper = createYamlMapper();

    private static ObjectMapper createYamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        return mapper;
    }

    /**
     * Load a set of compile rules from a YAML file.
     *
     * @param resourcePath path of the file, relative to the classpath root
     */
    public static CompileRuleSet loadCompileRules(String resourcePath) throws IOException {
        return load(resourcePath, CompileRuleSet.class);
    }

    private static <T> T load(String resourcePath, Class<T> type) throws IOException {
        try (InputStream is = YamlLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Test file not found: " + resourcePath);
            }
            return yamlMapper.readValue(is, type);
        }
    }
}
