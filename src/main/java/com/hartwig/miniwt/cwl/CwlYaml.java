package com.hartwig.miniwt.cwl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

final class CwlYaml {
    private CwlYaml() {
    }

    static ObjectMapper mapper() {
        var factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .build();
        var objectMapper = new ObjectMapper(factory);
        objectMapper.registerModule(new Jdk8Module());
        return objectMapper;
    }

    /**
     * Compact JSON, used to carry requirement blocks the model does not cover.
     */
    static ObjectMapper jsonMapper() {
        return new ObjectMapper();
    }
}
