package info.isaksson.erland.syscalls.emitter;

import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypedefEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Human-readable report: one ASCII table per providing header, then the typedefs the
 * prototypes use.
 */
public final class TextReport {

    private static final Logger log = LoggerFactory.getLogger(TextReport.class);

    private TextReport() {}

    public static String render(SyscallsContext ctx) {
        if (ctx == null) throw new IllegalArgumentException("ctx is null");
        log.info("Formatting syscalls and typedefs as structured text");

        List<String> lines = new ArrayList<>();
        lines.add("SYSCALL DEFINITIONS");
        lines.add("");

        Map<String, List<Syscall>> byHeader = new TreeMap<>();
        for (Syscall s : ctx.syscallsInOrder()) {
            byHeader.computeIfAbsent(s.headerName, k -> new ArrayList<>()).add(s);
        }

        for (Map.Entry<String, List<Syscall>> e : byHeader.entrySet()) {
            String title = e.getKey() + " (" + e.getValue().size() + " syscalls)";
            lines.add(title);
            lines.add("=".repeat(title.length()));
            lines.add("");

            List<String[]> rows = new ArrayList<>();
            for (Syscall s : e.getValue()) {
                rows.add(new String[] {String.valueOf(s.number), s.name, signature(s.function)});
            }
            table(lines, new String[] {"Number", "Name", "Function Signature"}, rows);
        }

        if (!ctx.typedefs.isEmpty()) {
            lines.add("");
            lines.add("TYPEDEF DEFINITIONS");
            lines.add("===================");
            lines.add("");

            List<TypedefEntry> typedefs = new ArrayList<>(ctx.typedefs);
            typedefs.sort(Comparator.comparing(t -> t.name));
            List<String[]> rows = new ArrayList<>();
            for (TypedefEntry t : typedefs) {
                rows.add(new String[] {t.name, t.underlyingType});
            }
            table(lines, new String[] {"Name", "Underlying Type"}, rows);
        }

        return String.join("\n", lines);
    }

    static String signature(FunctionSignature fn) {
        if (fn == null) return "N/A";
        StringJoiner args = new StringJoiner(", ");
        for (FunctionArg a : fn.arguments) {
            args.add(a.name.isEmpty() ? a.type : a.type + " " + a.name);
        }
        return fn.returnType + " " + fn.name + "(" + args + ")";
    }

    private static void table(List<String> lines, String[] headers, List<String[]> rows) {
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) {
            widths[i] = headers[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        lines.add(border(widths, '-'));
        lines.add(row(headers, widths));
        lines.add(border(widths, '='));
        for (String[] r : rows) {
            lines.add(row(r, widths));
        }
        lines.add(border(widths, '-'));
        lines.add("");
    }

    private static String border(int[] widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) {
            sb.append(String.valueOf(fill).repeat(w + 2)).append('+');
        }
        return sb.toString();
    }

    private static String row(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        return sb.toString();
    }
}
