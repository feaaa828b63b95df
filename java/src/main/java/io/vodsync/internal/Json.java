package io.vodsync.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Shared Jackson configuration. Service responses gain fields without notice, so unknown properties are ignored;
 * absent values are left out of written snapshots.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectWriter SNAPSHOT_WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return indented writer for documents meant to be read and diffed by people.
     */
    public static ObjectWriter snapshotWriter() {
        return SNAPSHOT_WRITER;
    }
}
