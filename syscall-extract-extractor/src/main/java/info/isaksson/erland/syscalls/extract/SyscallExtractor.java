package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.io.DescriptorRepository;
import info.isaksson.erland.syscalls.io.MacroSource;
import info.isaksson.erland.syscalls.ir.HeaderUnit;
import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypedefEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds the syscall table and matches each syscall with the extern function of the
 * same name declared in the configured headers.
 *
 * <p>Steps:</p>
 * <ol>
 *   <li>read {@code __NR_*} numbers from the {@code sys/syscall.h} macro dump (fatal if unavailable)</li>
 *   <li>extract every configured header that has a descriptor unit; headers without one are skipped</li>
 *   <li>attach functions (a later header overrides an earlier one) and collect the typedefs they use</li>
 * </ol>
 */
public final class SyscallExtractor {

    private static final Logger log = LoggerFactory.getLogger(SyscallExtractor.class);

    private final MacroSource macros;
    private final DescriptorRepository descriptors;
    private final List<String> headers;
    private final SyscallNumberParser numberParser;
    private final Diagnostics diagnostics;

    public SyscallExtractor(MacroSource macros, DescriptorRepository descriptors, List<String> headers,
                            SyscallNumberParser numberParser, Diagnostics diagnostics) {
        if (macros == null) throw new IllegalArgumentException("macros is null");
        if (descriptors == null) throw new IllegalArgumentException("descriptors is null");
        this.macros = macros;
        this.descriptors = descriptors;
        this.headers = headers == null || headers.isEmpty() ? SystemHeaders.DEFAULT : List.copyOf(headers);
        this.numberParser = numberParser == null ? new SyscallNumberParser() : numberParser;
        this.diagnostics = diagnostics == null ? new Diagnostics() : diagnostics;
    }

    public SyscallsContext extract() {
        String syscallHeader = SystemHeaders.SYSCALL_HEADER;
        log.info("Processing header: {}", syscallHeader);
        Optional<String> expanded = macros.expandMacros(syscallHeader);
        if (expanded.isEmpty() || expanded.get().isBlank()) {
            log.error("Could not process header: {}", syscallHeader);
            throw new SyscallExtractionException("Failed to extract syscall definitions");
        }

        Map<String, Integer> numbers = numberParser.parse(expanded.get());
        if (numbers.isEmpty()) log.warn("No syscall numbers found in {}", syscallHeader);

        Map<Integer, Syscall> syscalls = new TreeMap<>();
        numbers.forEach((name, number) -> syscalls.put(number, new Syscall(name, number, syscallHeader)));

        HeaderExtractor headerExtractor = new HeaderExtractor(diagnostics);
        Map<String, FunctionSignature> functionsByName = new HashMap<>();
        Map<String, String> headerByFunction = new HashMap<>();
        Map<String, TypedefEntry> typedefsByName = new HashMap<>();
        TypeStore types = new TypeStore();

        int found = 0;
        for (String header : headers) {
            Optional<HeaderUnit> unit = descriptors.find(header);
            if (unit.isEmpty()) {
                log.debug("No descriptors for {}, skipping", header);
                diagnostics.missingHeaders.add(header);
                continue;
            }
            found++;

            HeaderExtraction extraction = headerExtractor.extract(unit.get());
            for (FunctionSignature fn : extraction.functions) {
                if (numbers.containsKey(fn.name)) {
                    functionsByName.put(fn.name, fn);
                    headerByFunction.put(fn.name, header);
                }
            }
            for (TypedefEntry td : extraction.typedefs) {
                typedefsByName.put(td.name, td);
            }
            types.merge(extraction.types);
        }
        log.info("Found {} out of {} headers", found, headers.size());

        Map<String, TypedefEntry> needed = new LinkedHashMap<>();
        numbers.forEach((name, number) -> {
            FunctionSignature fn = functionsByName.get(name);
            Syscall syscall = syscalls.get(number);
            // A number reused by a later name belongs to that name.
            if (fn == null || !syscall.name.equals(name)) return;
            String header = headerByFunction.get(name);
            syscalls.put(number, syscall.withFunction(fn, header));
            log.debug("Matched syscall {} with function definition from {}", name, header);

            for (FunctionArg arg : fn.arguments) {
                TypedefEntry td = typedefsByName.get(arg.type);
                if (td != null) needed.put(td.name, td);
            }
            TypedefEntry ret = typedefsByName.get(fn.returnType);
            if (ret != null) needed.put(ret.name, ret);
        });

        List<TypedefEntry> typedefs = new ArrayList<>(needed.values());
        typedefs.sort(Comparator.comparing(t -> t.name));

        SyscallsContext ctx = new SyscallsContext(syscalls, typedefs, types.asMap());
        log.debug("Found {} syscall definitions, {} with function definitions", syscalls.size(), ctx.matchedCount());
        log.debug("Found {} typedefs in system headers, {} needed", typedefsByName.size(), typedefs.size());
        log.debug("Found {} unique relevant types in system headers", types.size());
        return ctx;
    }
}
