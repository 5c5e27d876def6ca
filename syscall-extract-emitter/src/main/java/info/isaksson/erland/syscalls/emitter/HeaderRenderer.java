package info.isaksson.erland.syscalls.emitter;

import info.isaksson.erland.syscalls.model.AggregateKind;
import info.isaksson.erland.syscalls.model.EnumConstant;
import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.StructField;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders a compilable C header: the type declarations the matched prototypes need,
 * {@code SYS_*} number macros and the prototypes themselves.
 *
 * <p>Declaration rules:</p>
 * <ul>
 *   <li>a primitive or pointer whose unqualified name differs from its base name becomes {@code typedef <base> <name>;}</li>
 *   <li>a typedef of an anonymous struct/union/enum renders the body once; further aliases of
 *       the same body refer to the first alias</li>
 *   <li>named aggregates render their body; an elaborated name without a tag keyword uses the
 *       {@code typedef struct Foo { ... } Foo;} form</li>
 *   <li>anonymous aggregates, bare function types and arrays are never top-level; anonymous
 *       aggregates are inlined where they are used as fields</li>
 * </ul>
 * <p>Renderer instances hold per-run state; use one per header.</p>
 */
public final class HeaderRenderer {

    private static final Logger log = LoggerFactory.getLogger(HeaderRenderer.class);
    private static final String INDENT = "    ";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern UNNAMED_ENUM = Pattern.compile(
            "^enum(?:\\s+|\\s+\\w+::|::)\\((?:unnamed|anonymous)(?:\\s+enum)?\\s+at\\s+.*:\\d+:\\d+\\)$");

    /** Anonymous body name to the first typedef name that rendered it. */
    private final Map<String, String> anonymousAliases = new HashMap<>();
    /** Unqualified names of aggregates whose body has been emitted. */
    private final Set<String> defined = new HashSet<>();

    public String render(SyscallsContext ctx) {
        if (ctx == null) throw new IllegalArgumentException("ctx is null");
        log.info("Formatting syscalls and typedefs as a C header");

        List<String> lines = new ArrayList<>(List.of(
                "/* Automatically generated syscall definitions */",
                "#ifndef _SYSCALL_NUMBERS_H",
                "#define _SYSCALL_NUMBERS_H",
                "",
                "#ifdef __cplusplus",
                "extern \"C\" {",
                "#endif",
                "",
                "#ifndef restrict",
                "#define restrict __restrict",
                "#endif",
                ""));

        List<String> declarations = renderDeclarations(DeclarationCollector.collect(ctx));
        if (!declarations.isEmpty()) {
            lines.add("/* Type definitions */");
            lines.addAll(declarations);
            lines.add("");
        }

        lines.add("/* Syscall numbers */");
        for (Syscall s : ctx.syscallsInOrder()) {
            lines.add("#define SYS_" + s.name + " " + s.number);
        }

        lines.add("");
        lines.add("/* Syscall function prototypes */");
        for (Syscall s : ctx.syscallsInOrder()) {
            if (s.hasFunction()) {
                lines.add(renderPrototype(s.function, ctx.types));
            } else {
                lines.add("/* syscall " + s.name + " (#" + s.number + ") - no function definition available */");
            }
        }

        lines.addAll(List.of(
                "",
                "#ifdef __cplusplus",
                "}",
                "#endif",
                "",
                "#endif /* _SYSCALL_NUMBERS_H */",
                ""));
        return String.join("\n", lines);
    }

    /** One declaration (possibly multi-line) per element; skipped candidates contribute nothing. */
    public List<String> renderDeclarations(List<TypeNode> candidates) {
        List<String> out = new ArrayList<>();
        for (TypeNode node : candidates) {
            String decl = renderDeclaration(node);
            if (decl != null) out.add(decl);
        }
        return out;
    }

    String renderDeclaration(TypeNode node) {
        String name = node.unqualifiedName();
        switch (node.kind) {
            case PRIMITIVE:
                if (node.baseName.isEmpty() || node.baseName.equals(name)) return null;
                if (!IDENTIFIER.matcher(name).matches()) return null;
                return "typedef " + node.baseName + " " + name + ";";
            case TYPEDEF:
                return renderTypedef(node, name);
            case AGGREGATE:
                if (isUnnamed(node) || defined.contains(name)) return null;
                if (node.isForwardDeclaration()) {
                    if (node.aggregateKind == AggregateKind.ENUM) return null;
                    return hasTagKeyword(name)
                            ? name + ";"
                            : "typedef " + node.aggregateKind.keyword + " " + name + " " + name + ";";
                }
                defined.add(name);
                if (hasTagKeyword(name)) {
                    return name + " " + body(node, "") + ";";
                }
                return "typedef " + node.aggregateKind.keyword + " " + name + " " + body(node, "") + " " + name + ";";
            default:
                return null;
        }
    }

    private String renderTypedef(TypeNode node, String name) {
        TypeNode u = node.underlying;
        if (u.isStructural() && isUnnamed(u)) {
            String first = anonymousAliases.putIfAbsent(u.name, name);
            if (first != null) {
                return first.equals(name) ? null : "typedef " + first + " " + name + ";";
            }
            return "typedef " + u.aggregateKind.keyword + " " + body(u, "") + " " + name + ";";
        }
        if (u.isFunctionPointer() || u.isArray()) {
            return "typedef " + renderArgument(u, name) + ";";
        }
        String target = u.unqualifiedName();
        if (target.isEmpty() || target.equals(name)) return null;
        return "typedef " + u.name + " " + name + ";";
    }

    /** {@code { ... }} with members at {@code indent + INDENT} and the closing brace at {@code indent}. */
    private String body(TypeNode node, String indent) {
        String inner = indent + INDENT;
        StringBuilder sb = new StringBuilder("{\n");
        if (node.aggregateKind == AggregateKind.ENUM) {
            StringJoiner sj = new StringJoiner(",\n");
            for (EnumConstant c : node.constants) {
                sj.add(inner + c.name + (c.hasValue() ? " = " + c.value : ""));
            }
            if (sj.length() > 0) sb.append(sj).append('\n');
        } else {
            for (StructField f : node.fields) {
                sb.append(inner).append(renderField(f, inner)).append(";\n");
            }
        }
        return sb.append(indent).append('}').toString();
    }

    private String renderField(StructField f, String indent) {
        TypeNode t = f.type;
        if (!inlinesBody(t)) return renderArgument(t, f.name);

        boolean unnamed = isUnnamed(t);
        String head = unnamed ? t.aggregateKind.keyword : t.unqualifiedName();
        if (!unnamed) defined.add(head);
        String decl = head + " " + body(t, indent);
        return f.name.isEmpty() ? decl : decl + " " + f.name;
    }

    /** Anonymous bodies always; named ones only when not elaborated and not yet emitted. */
    private boolean inlinesBody(TypeNode t) {
        if (!t.isStructural() || t.isForwardDeclaration()) return false;
        if (isUnnamed(t)) return true;
        return !t.elaborated && !defined.contains(t.unqualifiedName());
    }

    private static String renderPrototype(FunctionSignature fn, Map<String, TypeNode> types) {
        StringJoiner args = new StringJoiner(", ");
        for (FunctionArg a : fn.arguments) {
            TypeNode t = types.get(a.type);
            args.add(t != null ? renderArgument(t, a.name) : join(a.type, a.name));
        }
        return fn.returnType + " " + fn.name + "(" + args + ");";
    }

    /**
     * C declarator for a value named {@code name} of type {@code type}: {@code int x},
     * {@code char x[16]}, {@code void (*x)(int)}, {@code void (**x)(int)} or {@code int (*x)[4]}.
     */
    public static String renderArgument(TypeNode type, String name) {
        String x = name == null ? "" : name;
        if (type.isArray()) {
            return renderArgument(type.element, x + "[" + (type.arraySize == null ? "" : type.arraySize) + "]");
        }
        if (type.isFunctionPointer()) {
            TypeNode fn = type.functionType();
            StringJoiner params = new StringJoiner(", ");
            fn.params.forEach(p -> params.add(p.name));
            return fn.returnType.name + " (*" + x + ")(" + params + ")";
        }
        if (type.isPointer() && type.pointee.isArray()) {
            return renderArgument(type.pointee, "(*" + x + ")");
        }
        if (type.isPointer() && needsDeclarator(type.pointee)) {
            return renderArgument(type.pointee, "*" + x);
        }
        return join(type.name, x);
    }

    /** A pointer chain ending in a function or an array, which cannot be spelled as {@code T x}. */
    private static boolean needsDeclarator(TypeNode t) {
        if (!t.isPointer()) return false;
        return t.pointee.isFunction() || t.pointee.isArray() || needsDeclarator(t.pointee);
    }

    private static String join(String type, String name) {
        return name.isEmpty() ? type : type + " " + name;
    }

    /** Unnamed struct/union, or an enum spelled {@code enum (unnamed at f.h:1:9)}. */
    static boolean isUnnamed(TypeNode t) {
        if (t.anonymous) return true;
        return t.aggregateKind == AggregateKind.ENUM && UNNAMED_ENUM.matcher(t.name.trim()).matches();
    }

    private static boolean hasTagKeyword(String name) {
        for (AggregateKind k : AggregateKind.values()) {
            if (name.startsWith(k.keyword + " ")) return true;
        }
        return false;
    }
}
