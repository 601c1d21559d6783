package org.dxworks.mdblocks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.dxworks.mdblocks.model.Node;

/**
 * JSON view of a block tree. Every node carries a {@code type} property; absent values are omitted.
 */
public final class BlockTreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private static final ObjectWriter PRETTY_WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    private BlockTreeJson() {
    }

    public static String toJson(Node node) throws JsonProcessingException {
        return MAPPER.writeValueAsString(node);
    }

    public static String toPrettyJson(Node node) throws JsonProcessingException {
        return PRETTY_WRITER.writeValueAsString(node);
    }
}
