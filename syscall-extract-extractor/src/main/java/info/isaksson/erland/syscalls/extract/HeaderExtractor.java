package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.ir.FunctionDecl;
import info.isaksson.erland.syscalls.ir.HeaderUnit;
import info.isaksson.erland.syscalls.ir.ParamDecl;
import info.isaksson.erland.syscalls.ir.TypedefDecl;
import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.TypeNode;
import info.isaksson.erland.syscalls.model.TypedefEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one header unit into function signatures, typedef entries and a type store
 * holding every type those declarations reach.
 *
 * <p>Only functions with external linkage are kept. A malformed declaration is logged,
 * counted and skipped; the rest of the unit is still processed.</p>
 */
public final class HeaderExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeaderExtractor.class);

    private final TypeGraphBuilder builder;
    private final Diagnostics diagnostics;

    public HeaderExtractor(Diagnostics diagnostics) {
        if (diagnostics == null) throw new IllegalArgumentException("diagnostics is null");
        this.diagnostics = diagnostics;
        this.builder = new TypeGraphBuilder(diagnostics);
    }

    public HeaderExtraction extract(HeaderUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit is null");
        String header = unit.header == null ? "" : unit.header;

        TypeStore store = new TypeStore();
        List<FunctionSignature> functions = new ArrayList<>();
        List<TypedefEntry> typedefs = new ArrayList<>();

        if (unit.functions != null) {
            for (FunctionDecl fn : unit.functions) {
                if (fn == null) continue;
                if (fn.linkage == null || !fn.linkage.isExternal()) {
                    log.debug("Skipping {} in {}: linkage {}", fn.name, header, fn.linkage);
                    continue;
                }
                try {
                    functions.add(extractFunction(fn, store));
                } catch (IllegalArgumentException ex) {
                    skip(header, "function " + fn.name, ex);
                }
            }
        }

        if (unit.typedefs != null) {
            for (TypedefDecl td : unit.typedefs) {
                if (td == null) continue;
                try {
                    typedefs.add(extractTypedef(td, store));
                } catch (IllegalArgumentException ex) {
                    skip(header, "typedef " + td.name, ex);
                }
            }
        }

        log.debug("Found {} functions in {}", functions.size(), header);
        return new HeaderExtraction(header, functions, typedefs, store);
    }

    private FunctionSignature extractFunction(FunctionDecl fn, TypeStore store) {
        if (fn.name == null || fn.name.isBlank()) throw new IllegalArgumentException("function has no name");
        if (fn.result == null) throw new IllegalArgumentException("no result type");

        TypeNode result = builder.build(fn.result);
        List<TypeNode> paramTypes = new ArrayList<>();
        List<FunctionArg> args = new ArrayList<>();
        if (fn.params != null) {
            for (ParamDecl p : fn.params) {
                if (p == null || p.type == null) throw new IllegalArgumentException("parameter without type");
                TypeNode t = builder.build(p.type);
                paramTypes.add(t);
                args.add(new FunctionArg(p.name, t.name));
            }
        }

        // Only store once the whole declaration converted.
        store.insert(result);
        paramTypes.forEach(store::insert);
        return new FunctionSignature(fn.name, result.name, args);
    }

    private TypedefEntry extractTypedef(TypedefDecl td, TypeStore store) {
        if (td.name == null || td.name.isBlank()) throw new IllegalArgumentException("typedef has no name");
        if (td.type == null) throw new IllegalArgumentException("no typedef type");

        TypeNode type = builder.build(td.type);
        TypeNode underlying = td.underlying == null ? null : builder.build(td.underlying);
        store.insert(type);
        store.insert(underlying);

        String canonical = td.underlying != null
                ? td.underlying.canonicalSpelling()
                : type.isTypedef() ? type.underlying.name : type.baseName;
        return new TypedefEntry(td.name, canonical);
    }

    private void skip(String header, String what, IllegalArgumentException ex) {
        log.error("Error processing {} in {}: {}", what, header, ex.getMessage());
        diagnostics.skipped.add(header + ": " + what + " (" + ex.getMessage() + ")");
    }
}
