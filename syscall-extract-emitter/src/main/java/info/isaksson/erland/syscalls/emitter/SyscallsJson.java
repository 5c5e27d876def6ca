package info.isaksson.erland.syscalls.emitter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.syscalls.ir.IrJson;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypeNode;
import info.isaksson.erland.syscalls.model.TypedefEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** The structured record {@code {syscalls, typedefs, types}} as deterministic JSON. */
public final class SyscallsJson {

    private static final Logger log = LoggerFactory.getLogger(SyscallsJson.class);

    private SyscallsJson() {}

    @JsonPropertyOrder({"syscalls", "typedefs", "types"})
    public static final class Document {
        /** In syscall-number order. */
        public final List<Syscall> syscalls;
        public final List<TypedefEntry> typedefs;
        public final Map<String, TypeNode> types;

        Document(SyscallsContext ctx) {
            this.syscalls = ctx.syscallsInOrder();
            this.typedefs = ctx.typedefs;
            this.types = ctx.types;
        }
    }

    public static Document document(SyscallsContext ctx) {
        if (ctx == null) throw new IllegalArgumentException("ctx is null");
        return new Document(ctx);
    }

    public static String render(SyscallsContext ctx) throws IOException {
        log.info("Formatting syscalls and typedefs as JSON");
        Document doc = document(ctx);
        log.info("Adding {} type definitions to JSON output", doc.types.size());
        return IrJson.toJsonString(doc);
    }
}
