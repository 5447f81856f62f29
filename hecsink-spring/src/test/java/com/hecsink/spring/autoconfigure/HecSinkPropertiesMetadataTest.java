package com.hecsink.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import org.junit.jupiter.api.Test;

class HecSinkPropertiesMetadataTest {

    @Test
    void every_property_has_a_description() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        List<String> names = new ArrayList<>();
        Enumeration<URL> files =
                getClass().getClassLoader().getResources("META-INF/spring-configuration-metadata.json");
        while (files.hasMoreElements()) {
            JsonNode metadata;
            try (InputStream in = files.nextElement().openStream()) {
                metadata = mapper.readTree(in);
            }
            for (JsonNode property : metadata.path("properties")) {
                String name = property.get("name").asText();
                if (!name.startsWith("hecsink.splunk.")) continue;
                names.add(name);
                assertThat(property.path("description").asText()).as(name).isNotBlank();
            }
        }

        assertThat(names).hasSize(14).contains(
                "hecsink.splunk.obfuscate-api-keys",
                "hecsink.splunk.obfuscate-api-keys-length",
                "hecsink.splunk.delivery-policy",
                "hecsink.splunk.max-concurrency");
    }
}
