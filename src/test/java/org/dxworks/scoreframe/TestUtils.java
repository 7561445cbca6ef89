package org.dxworks.scoreframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final String SAMPLES_BASE_PATH = "src/test/resources/samples/lilypond/";

    public static String readSample(String fileName) throws IOException {
        return Files.readString(Paths.get(SAMPLES_BASE_PATH + fileName), StandardCharsets.UTF_8);
    }
}
