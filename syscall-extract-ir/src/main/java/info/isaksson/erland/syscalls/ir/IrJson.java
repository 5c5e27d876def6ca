package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON reading of upstream descriptor documents and deterministic JSON writing of
 * extraction results.
 *
 * <p>A descriptor document is either a single {@link HeaderUnit} object or a bundle
 * {@code {"units": [ ... ]}}. Descriptor ids are scoped to their unit.</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IrJson() {}

    public static List<HeaderUnit> readUnits(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        return readUnitsFromString(Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Parse one descriptor document (single unit or bundle) from a JSON string. */
    public static List<HeaderUnit> readUnitsFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("descriptor document must be a JSON object");
        }
        List<HeaderUnit> out = new ArrayList<>();
        JsonNode units = root.get("units");
        if (units != null && units.isArray()) {
            for (JsonNode u : units) {
                out.add(MAPPER.treeToValue(u, HeaderUnit.class));
            }
        } else {
            out.add(MAPPER.treeToValue(root, HeaderUnit.class));
        }
        return out;
    }

    public static String toJsonString(Object value) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(value) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
