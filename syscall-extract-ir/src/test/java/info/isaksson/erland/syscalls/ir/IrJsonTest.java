package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.syscalls.model.TypeNode;
import info.isaksson.erland.syscalls.model.TypedefEntry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonTest {

    @Test
    void idReferencesResolveToTheSameDescriptor() throws Exception {
        List<HeaderUnit> units = IrJson.readUnits(resource("ir/list-unit.json"));
        assertEquals(1, units.size());

        HeaderUnit unit = units.get(0);
        assertEquals("list.h", unit.header);
        assertEquals(2, unit.functions.size());

        TypeDescriptor param = unit.functions.get(0).params.get(0).type;
        assertEquals(DescriptorKind.POINTER, param.kind);
        TypeDescriptor record = param.pointee.named;
        assertEquals(DescriptorKind.RECORD, record.kind);
        assertEquals("STRUCT", record.recordKind);

        // "next" points back at the parameter descriptor itself.
        MemberDescriptor next = record.members.get(1);
        assertEquals("next", next.name);
        assertSame(param, next.type);

        TypedefDecl td = unit.typedefs.get(0);
        assertSame(record, td.type.underlying);
        assertSame(param.pointee, td.underlying);
    }

    @Test
    void linkageAndDefaultsAreRead() throws Exception {
        HeaderUnit unit = IrJson.readUnits(resource("ir/list-unit.json")).get(0);
        assertEquals(Linkage.EXTERNAL, unit.functions.get(0).linkage);
        assertEquals(Linkage.INTERNAL, unit.functions.get(1).linkage);
        assertFalse(unit.functions.get(1).linkage.isExternal());
        assertTrue(unit.functions.get(1).params.isEmpty());
    }

    @Test
    void bundleYieldsOneUnitPerEntryAndIgnoresUnknownProperties() throws Exception {
        List<HeaderUnit> units = IrJson.readUnits(resource("ir/bundle.json"));
        assertEquals(2, units.size());
        assertEquals("unistd.h", units.get(0).header);
        assertEquals("sys/stat.h", units.get(1).header);

        FunctionDecl getpid = units.get(0).functions.get(0);
        assertEquals(Linkage.EXTERNAL, getpid.linkage, "linkage defaults to external");
        assertEquals(DescriptorKind.TYPEDEF, getpid.result.kind);
        assertEquals("int", getpid.result.underlying.spelling);
    }

    @Test
    void unknownKindMapsToUnknown() throws Exception {
        TypeDescriptor d = resultOf("{\"kind\":\"VECTOR\",\"spelling\":\"__m128\"}");
        assertEquals(DescriptorKind.UNKNOWN, d.kind);
        assertEquals("__m128", d.canonicalSpelling(), "canonical falls back to spelling");
    }

    @Test
    void qualifierFlagsUseCKeywords() throws Exception {
        TypeDescriptor d = resultOf(
                "{\"kind\":\"BUILTIN\",\"spelling\":\"const volatile int\",\"canonical\":\"const volatile int\","
                        + "\"const\":true,\"volatile\":true}");
        assertTrue(d.constQualified);
        assertTrue(d.volatileQualified);
        assertFalse(d.restrictQualified);
    }

    @Test
    void nonObjectDocumentIsRejected() {
        assertThrows(IOException.class, () -> IrJson.readUnitsFromString("[1, 2]"));
    }

    @Test
    void writingIsDeterministicAndEndsWithNewline() throws Exception {
        Map<String, Object> value = Map.of(
                "typedefs", List.of(new TypedefEntry("pid_t", "int")),
                "types", Map.of("int", TypeNode.primitive("int", "int", null)));

        String written = IrJson.toJsonString(value);
        assertTrue(written.endsWith("\n"));
        assertEquals(written, IrJson.toJsonString(Map.of(
                "types", Map.of("int", TypeNode.primitive("int", "int", null)),
                "typedefs", List.of(new TypedefEntry("pid_t", "int")))));

        JsonNode tree = new ObjectMapper().readTree(written);
        assertEquals("pid_t", tree.get("typedefs").get(0).get("name").asText());
        assertEquals("PRIMITIVE", tree.get("types").get("int").get("kind").asText());
        // Sorted keys put "typedefs" before "types".
        assertTrue(written.indexOf("\"typedefs\"") < written.indexOf("\"types\""));
    }

    /** Result type of a one-function unit wrapped around {@code descriptorJson}. */
    private static TypeDescriptor resultOf(String descriptorJson) throws IOException {
        List<HeaderUnit> units = IrJson.readUnitsFromString(
                "{\"header\":\"t.h\",\"functions\":[{\"name\":\"f\",\"result\":" + descriptorJson + "}]}");
        return units.get(0).functions.get(0).result;
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(IrJsonTest.class.getClassLoader().getResource(name).toURI());
    }
}
