package info.isaksson.erland.syscalls.emitter;

import info.isaksson.erland.syscalls.extract.Diagnostics;
import info.isaksson.erland.syscalls.extract.HeaderExtraction;
import info.isaksson.erland.syscalls.extract.HeaderExtractor;
import info.isaksson.erland.syscalls.ir.ConstantDescriptor;
import info.isaksson.erland.syscalls.ir.DescriptorKind;
import info.isaksson.erland.syscalls.ir.FunctionDecl;
import info.isaksson.erland.syscalls.ir.HeaderUnit;
import info.isaksson.erland.syscalls.ir.ParamDecl;
import info.isaksson.erland.syscalls.ir.TypeDescriptor;
import info.isaksson.erland.syscalls.ir.TypedefDecl;
import info.isaksson.erland.syscalls.model.AggregateKind;
import info.isaksson.erland.syscalls.model.EnumConstant;
import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.StructField;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypeNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderRendererTest {

    private static final TypeNode INT = TypeNode.primitive("int", "int", null);
    private static final TypeNode CHAR = TypeNode.primitive("char", "char", null);
    private static final TypeNode VOID = TypeNode.primitive("void", "void", null);

    @Test
    void primitiveArgument() {
        assertEquals("int x", HeaderRenderer.renderArgument(INT, "x"));
        assertEquals("unsigned long x",
                HeaderRenderer.renderArgument(TypeNode.primitive("unsigned long", "unsigned long", null), "x"));
    }

    @Test
    void pointerArgumentKeepsTheSpelledStar() {
        TypeNode p = TypeNode.pointer("const char *", "const char *", null, CHAR);
        assertEquals("const char * x", HeaderRenderer.renderArgument(p, "x"));
    }

    @Test
    void arrayArguments() {
        TypeNode fixed = TypeNode.array("char[16]", "char[16]", null, CHAR, 16L);
        TypeNode open = TypeNode.array("char[]", "char[]", null, CHAR, null);
        TypeNode grid = TypeNode.array("int[2][3]", "int[2][3]", null,
                TypeNode.array("int[3]", "int[3]", null, INT, 3L), 2L);

        assertEquals("char x[16]", HeaderRenderer.renderArgument(fixed, "x"));
        assertEquals("char x[]", HeaderRenderer.renderArgument(open, "x"));
        assertEquals("int x[2][3]", HeaderRenderer.renderArgument(grid, "x"));
    }

    @Test
    void functionPointerArguments() {
        TypeNode fn = TypeNode.function("void (int, char *)", "void (int, char *)", null, VOID,
                List.of(INT, TypeNode.pointer("char *", "char *", null, CHAR)));
        TypeNode fp = TypeNode.pointer("void (*)(int, char *)", "void (*)(int, char *)", null, fn);
        TypeNode noParams = TypeNode.pointer("int (*)(void)", "int (*)(void)", null,
                TypeNode.function("int (void)", "int (void)", null, INT, List.of()));

        assertEquals("void (*x)(int, char *)", HeaderRenderer.renderArgument(fp, "x"));
        assertEquals("void (*x)(int, char *)", HeaderRenderer.renderArgument(fn, "x"));
        assertEquals("int (*x)()", HeaderRenderer.renderArgument(noParams, "x"));
    }

    @Test
    void pointerToFunctionPointerArgument() {
        TypeNode fn = TypeNode.function("void (int)", "void (int)", null, VOID, List.of(INT));
        TypeNode fp = TypeNode.pointer("void (*)(int)", "void (*)(int)", null, fn);
        TypeNode fpp = TypeNode.pointer("void (**)(int)", "void (**)(int)", null, fp);
        TypeNode arrp = TypeNode.pointer("int (**)[4]", "int (**)[4]", null,
                TypeNode.pointer("int (*)[4]", "int (*)[4]", null, TypeNode.array("int[4]", "int[4]", null, INT, 4L)));

        assertEquals("void (**x)(int)", HeaderRenderer.renderArgument(fpp, "x"));
        assertEquals("int (**x)[4]", HeaderRenderer.renderArgument(arrp, "x"));
        assertEquals("char ** x", HeaderRenderer.renderArgument(TypeNode.pointer("char **", "char **", null,
                TypeNode.pointer("char *", "char *", null, CHAR)), "x"));
    }

    @Test
    void pointerToArrayArgument() {
        TypeNode arr = TypeNode.array("int[4]", "int[4]", null, INT, 4L);
        TypeNode p = TypeNode.pointer("int (*)[4]", "int (*)[4]", null, arr);
        assertEquals("int (*x)[4]", HeaderRenderer.renderArgument(p, "x"));
    }

    @Test
    void anonymousStructFieldIsInlined() {
        TypeNode anon = TypeNode.record("struct (unnamed at outer.h:3:5)", "", null, AggregateKind.STRUCT,
                List.of(new StructField("x", INT)));
        TypeNode outer = TypeNode.record("struct outer", "struct outer", null, AggregateKind.STRUCT,
                List.of(new StructField("a", INT), new StructField("inner", anon))).asElaborated("struct outer");

        List<String> decls = new HeaderRenderer().renderDeclarations(List.of(anon, outer));

        assertEquals(List.of(String.join("\n",
                "struct outer {",
                "    int a;",
                "    struct {",
                "        int x;",
                "    } inner;",
                "};")), decls);
    }

    @Test
    void anonymousUnionMemberWithoutName() {
        TypeNode anon = TypeNode.record("union (unnamed at sig.h:9:3)", "", null, AggregateKind.UNION,
                List.of(new StructField("sival_int", INT), new StructField("sival_ptr",
                        TypeNode.pointer("void *", "void *", null, VOID))));
        TypeNode outer = TypeNode.record("struct sigevent", "struct sigevent", null, AggregateKind.STRUCT,
                List.of(new StructField("", anon), new StructField("sigev_signo", INT)));

        String decl = new HeaderRenderer().renderDeclarations(List.of(outer)).get(0);
        assertEquals(String.join("\n",
                "struct sigevent {",
                "    union {",
                "        int sival_int;",
                "        void * sival_ptr;",
                "    };",
                "    int sigev_signo;",
                "};"), decl);
    }

    @Test
    void twoTypedefsOfOneAnonymousBodyEmitOneBody() {
        TypeNode anon = TypeNode.record("struct (unnamed at types.h:1:9)", "", null, AggregateKind.STRUCT,
                List.of(new StructField("val", INT)));
        TypeNode fsid = TypeNode.typedef("fsid_t", anon.name, null, anon.asElaborated(anon.name));
        TypeNode kernelFsid = TypeNode.typedef("kernel_fsid_t", anon.name, null, anon.asElaborated(anon.name));

        SyscallsContext ctx = context(
                new FunctionSignature("statfs", "int", List.of(
                        new FunctionArg("a", "fsid_t"), new FunctionArg("b", "kernel_fsid_t"))),
                INT, fsid, kernelFsid);
        String header = new HeaderRenderer().render(ctx);

        assertTrue(header.contains("typedef struct {\n    int val;\n} fsid_t;"), header);
        assertTrue(header.contains("typedef fsid_t kernel_fsid_t;"), header);
        assertEquals(1, count(header, "int val;"));
        assertTrue(header.contains("int statfs(fsid_t a, kernel_fsid_t b);"));
    }

    @Test
    void selfReferentialStructRendersOnce() {
        TypeNode stub = TypeNode.nameOnly("struct node");
        TypeNode next = TypeNode.pointer("struct node *", "struct node *", null, stub);
        TypeNode node = TypeNode.record("struct node", "struct node", null, AggregateKind.STRUCT,
                List.of(new StructField("value", INT), new StructField("next", next))).asElaborated("struct node");
        TypeNode param = TypeNode.pointer("struct node *", "struct node *", null, node);

        SyscallsContext ctx = context(
                new FunctionSignature("walk", "int", List.of(new FunctionArg("head", "struct node *"))),
                INT, param);
        String header = new HeaderRenderer().render(ctx);

        assertTrue(header.contains("struct node {\n    int value;\n    struct node * next;\n};"), header);
        assertEquals(1, count(header, "struct node {"));
        assertTrue(header.contains("int walk(struct node * head);"));
    }

    @Test
    void aggregateDeclarationForms() {
        HeaderRenderer r = new HeaderRenderer();
        TypeNode forward = TypeNode.record("struct opaque", "struct opaque", null, AggregateKind.STRUCT, List.of());
        TypeNode enumForward = TypeNode.enumeration("enum later", "enum later", null, List.of());
        TypeNode color = TypeNode.enumeration("enum color", "enum color", null,
                List.of(new EnumConstant("RED", 0L), new EnumConstant("GREEN", null)));
        TypeNode tagless = TypeNode.record("struct (unnamed at f.h:2:1)", "", null, AggregateKind.STRUCT,
                List.of(new StructField("a", INT))).asElaborated("Foo");

        assertEquals("struct opaque;", r.renderDeclaration(forward));
        assertNull(r.renderDeclaration(enumForward));
        assertEquals("enum color {\n    RED = 0,\n    GREEN\n};", r.renderDeclaration(color));
        assertEquals("typedef struct Foo {\n    int a;\n} Foo;", r.renderDeclaration(tagless));
        assertNull(r.renderDeclaration(tagless), "a body is emitted once");
    }

    @Test
    void aliasDeclarations() {
        HeaderRenderer r = new HeaderRenderer();
        TypeNode u32 = TypeNode.primitive("__u32", "unsigned int", null);
        TypeNode pid = TypeNode.typedef("pid_t", "int", null, INT);
        TypeNode fn = TypeNode.function("void (int)", "void (int)", null, VOID, List.of(INT));
        TypeNode handler = TypeNode.typedef("sighandler_t", "void (*)(int)", null,
                TypeNode.pointer("void (*)(int)", "void (*)(int)", null, fn));
        TypeNode jmpBuf = TypeNode.typedef("jmp_buf", "long[8]", null,
                TypeNode.array("long[8]", "long[8]", null, TypeNode.primitive("long", "long", null), 8L));

        assertEquals("typedef unsigned int __u32;", r.renderDeclaration(u32));
        assertEquals("typedef int pid_t;", r.renderDeclaration(pid));
        assertEquals("typedef void (*sighandler_t)(int);", r.renderDeclaration(handler));
        assertEquals("typedef long jmp_buf[8];", r.renderDeclaration(jmpBuf));
        assertNull(r.renderDeclaration(INT));
        assertNull(r.renderDeclaration(TypeNode.nameOnly("struct node")));
        assertNull(r.renderDeclaration(fn));
    }

    @Test
    void pointerToTypedefParameterDeclaresOnlyTheTypedef() {
        TypeDescriptor socklen = new TypeDescriptor(DescriptorKind.TYPEDEF, "socklen_t");
        socklen.canonical = "unsigned int";
        socklen.underlying = new TypeDescriptor(DescriptorKind.BUILTIN, "unsigned int");
        TypeDescriptor lenPtr = new TypeDescriptor(DescriptorKind.POINTER, "socklen_t *");
        lenPtr.canonical = "unsigned int *";
        lenPtr.pointee = socklen;

        HeaderUnit unit = new HeaderUnit("sys/socket.h");
        unit.functions.add(new FunctionDecl("accept", new TypeDescriptor(DescriptorKind.BUILTIN, "int"), List.of(
                new ParamDecl("fd", new TypeDescriptor(DescriptorKind.BUILTIN, "int")),
                new ParamDecl("len", lenPtr))));

        String header = new HeaderRenderer().render(extracted(unit, 43));

        assertTrue(header.contains("typedef unsigned int socklen_t;"), header);
        assertEquals(1, count(header, "typedef "), header);
        assertFalse(header.contains("socklen_t *;"), header);
        assertTrue(header.contains("int accept(int fd, socklen_t * len);"), header);

        HeaderRenderer r = new HeaderRenderer();
        assertNull(r.renderDeclaration(TypeNode.pointer("__u32 *", "unsigned int *", null,
                TypeNode.primitive("__u32", "unsigned int", null))));
        assertNull(r.renderDeclaration(TypeNode.primitive("__u32[2]", "unsigned int[2]", null)));
    }

    @Test
    void typedefOfUnnamedEnumRendersBodyInline() {
        TypeDescriptor body = new TypeDescriptor(DescriptorKind.ENUM, "enum (unnamed at x.h:1:9)");
        body.constants.add(new ConstantDescriptor("P_ALL", "0"));
        body.constants.add(new ConstantDescriptor("P_PID", "1"));
        TypeDescriptor elaborated = new TypeDescriptor(DescriptorKind.ELABORATED, body.spelling);
        elaborated.named = body;
        TypeDescriptor idtype = new TypeDescriptor(DescriptorKind.TYPEDEF, "idtype_t");
        idtype.canonical = body.spelling;
        idtype.underlying = elaborated;
        TypeDescriptor mode = new TypeDescriptor(DescriptorKind.TYPEDEF, "mode_e");
        mode.canonical = body.spelling;
        mode.underlying = elaborated;

        HeaderUnit unit = new HeaderUnit("sys/wait.h");
        unit.functions.add(new FunctionDecl("waitid", new TypeDescriptor(DescriptorKind.BUILTIN, "int"), List.of(
                new ParamDecl("idtype", idtype),
                new ParamDecl("mode", mode))));
        unit.typedefs.add(new TypedefDecl("idtype_t", idtype, elaborated));

        String header = new HeaderRenderer().render(extracted(unit, 247));

        assertTrue(header.contains("typedef enum {\n    P_ALL = 0,\n    P_PID = 1\n} idtype_t;"), header);
        assertTrue(header.contains("typedef idtype_t mode_e;"), header);
        assertFalse(header.contains("(unnamed"), header);
        assertEquals(1, count(header, "P_ALL"), header);
        assertTrue(header.contains("int waitid(idtype_t idtype, mode_e mode);"), header);
    }

    @Test
    void unnamedEnumFieldIsInlined() {
        TypeNode kind = TypeNode.enumeration("enum (unnamed at ev.h:4:5)", "", null,
                List.of(new EnumConstant("EV_READ", 1L)));
        TypeNode event = TypeNode.record("struct event", "struct event", null, AggregateKind.STRUCT,
                List.of(new StructField("kind", kind), new StructField("fd", INT)));

        HeaderRenderer r = new HeaderRenderer();
        assertNull(r.renderDeclaration(kind));
        assertEquals(String.join("\n",
                "struct event {",
                "    enum {",
                "        EV_READ = 1",
                "    } kind;",
                "    int fd;",
                "};"), r.renderDeclaration(event));
    }

    @Test
    void unmatchedSyscallBecomesComment() {
        Map<Integer, Syscall> syscalls = new LinkedHashMap<>();
        syscalls.put(184, new Syscall("tuxcall", 184, "sys/syscall.h"));
        String header = new HeaderRenderer().render(new SyscallsContext(syscalls, List.of(), Map.of()));

        assertTrue(header.startsWith("/* Automatically generated syscall definitions */\n#ifndef _SYSCALL_NUMBERS_H\n"));
        assertTrue(header.contains("#define SYS_tuxcall 184"));
        assertTrue(header.contains("/* syscall tuxcall (#184) - no function definition available */"));
        assertFalse(header.contains("/* Type definitions */"));
        assertTrue(header.endsWith("#endif /* _SYSCALL_NUMBERS_H */\n"));
    }

    /** Runs {@code unit} through header extraction and matches its first function to syscall {@code number}. */
    private static SyscallsContext extracted(HeaderUnit unit, int number) {
        HeaderExtraction extraction = new HeaderExtractor(new Diagnostics()).extract(unit);
        FunctionSignature fn = extraction.functions.get(0);
        Map<Integer, Syscall> syscalls = new LinkedHashMap<>();
        syscalls.put(number, new Syscall(fn.name, number, unit.header, fn));
        return new SyscallsContext(syscalls, List.of(), extraction.types.asMap());
    }

    private static SyscallsContext context(FunctionSignature fn, TypeNode... types) {
        Map<String, TypeNode> store = new LinkedHashMap<>();
        for (TypeNode t : types) {
            store.put(t.name, t);
        }
        Map<Integer, Syscall> syscalls = new LinkedHashMap<>();
        syscalls.put(7, new Syscall(fn.name, 7, "test.h", fn));
        return new SyscallsContext(syscalls, List.of(), store);
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            n++;
        }
        return n;
    }
}
