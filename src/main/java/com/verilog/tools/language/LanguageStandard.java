package com.verilog.tools.language;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * IEEE language standards with their reserved words. Each standard extends its predecessor,
 * so {@link #keywords()} is cumulative.
 */
public enum LanguageStandard {
    V1995("1364-1995", null, Set.of(
            "always", "and", "assign", "begin", "buf", "bufif0", "bufif1",
            "case", "casex", "casez", "cmos", "deassign", "default", "defparam",
            "disable", "else", "end", "endcase", "endfunction", "endmodule",
            "endprimitive", "endspecify", "endtable", "endtask", "event",
            "for", "force", "forever", "fork", "function", "highz0", "highz1",
            "if", "initial", "inout", "input", "integer", "join", "large",
            "macromodule", "medium", "module", "nand", "negedge", "nmos",
            "nor", "not", "notif0", "notif1", "or", "output", "parameter",
            "pmos", "posedge", "primitive", "pull0", "pull1", "pulldown",
            "pullup", "rcmos", "real", "realtime", "reg", "release", "repeat",
            "rnmos", "rpmos", "rtran", "rtranif0", "rtranif1", "scalared",
            "small", "specify", "strength", "strong0", "strong1", "supply0",
            "supply1", "table", "task", "time", "tran", "tranif0", "tranif1",
            "tri", "tri0", "tri1", "triand", "trior", "trireg", "vectored",
            "wait", "wand", "weak0", "weak1", "while", "wire", "wor", "xnor", "xor")),
    V2001("1364-2001", V1995, Set.of(
            "automatic", "cell", "config", "design", "edge", "endconfig",
            "endgenerate", "generate", "genvar", "ifnone", "incdir", "include",
            "instance", "liblist", "library", "localparam", "noshowcancelled",
            "pulsestyle_ondetect", "pulsestyle_onevent", "showcancelled",
            "signed", "specparam", "unsigned", "use")),
    V2005("1364-2005", V2001, Set.of("uwire")),
    SV2005("1800-2005", V2005, Set.of(
            "alias", "always_comb", "always_ff", "always_latch", "assert",
            "assume", "before", "bind", "bins", "binsof", "bit", "break",
            "byte", "chandle", "class", "clocking", "const", "constraint",
            "context", "continue", "cover", "covergroup", "coverpoint",
            "cross", "dist", "do", "endclass", "endclocking", "endgroup",
            "endinterface", "endpackage", "endprogram", "endproperty",
            "endsequence", "enum", "expect", "export", "extends", "extern",
            "final", "first_match", "foreach", "forkjoin", "iff",
            "ignore_bins", "illegal_bins", "import", "inside", "int",
            "interface", "intersect", "join_any", "join_none", "local",
            "logic", "longint", "matches", "modport", "new", "null",
            "package", "packed", "priority", "program", "property",
            "protected", "rand", "randc", "randcase", "randsequence",
            "ref", "return", "sequence", "shortint", "shortreal",
            "solve", "static", "string", "struct", "super", "tagged",
            "this", "throughout", "type", "typedef", "union", "unique", "var",
            "virtual", "void", "wait_order", "wildcard", "with", "within")),
    SV2009("1800-2009", SV2005, Set.of(
            "accept_on", "checker", "endchecker", "eventually", "global",
            "implies", "let", "nexttime", "reject_on", "restrict", "s_always",
            "s_eventually", "s_nexttime", "s_until", "s_until_with", "strong",
            "sync_accept_on", "sync_reject_on", "unique0", "until",
            "until_with", "untyped", "weak")),
    SV2012("1800-2012", SV2009, Set.of("implements", "interconnect", "nettype", "soft")),
    SV2017("1800-2017", SV2012, Set.of()),
    SV2023("1800-2023", SV2017, Set.of()),
    VAMS("VAMS", V2005, Set.of(
            "above", "abs", "absdelay", "abstol", "ac_stim", "access", "acos",
            "acosh", "aliasparam", "analog", "analysis", "asin", "asinh",
            "atan", "atan2", "atanh", "branch", "ceil", "connect",
            "connectmodule", "connectrules", "continuous", "cos", "cosh",
            "ddt", "ddt_nature", "ddx", "discipline", "discrete", "domain",
            "driver_update", "endconnectrules", "enddiscipline", "endnature",
            "endparamset", "exclude", "exp", "final_step", "flicker_noise",
            "floor", "flow", "from", "ground", "hypot", "idt", "idt_nature",
            "idtmod", "inf", "initial_step", "laplace_nd", "laplace_np",
            "laplace_zd", "laplace_zp", "last_crossing", "limexp", "ln", "log",
            "max", "merged", "min", "nature", "net_resolution", "noise_table",
            "paramset", "potential", "pow", "resolveto", "sin", "sinh",
            "slew", "split", "sqrt", "tan", "tanh", "timer", "transition",
            "units", "white_noise", "wreal", "zi_nd", "zi_np", "zi_zd", "zi_zp"));

    private final String label;
    private final LanguageStandard base;
    private final Set<String> ownKeywords;
    private Set<String> allKeywords;

    LanguageStandard(String label, LanguageStandard base, Set<String> ownKeywords) {
        this.label = label;
        this.base = base;
        this.ownKeywords = ownKeywords;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Reserved words of this standard and every standard it extends.
     */
    public synchronized Set<String> keywords() {
        if (allKeywords == null) {
            Set<String> words = new HashSet<>(ownKeywords);
            if (base != null) {
                words.addAll(base.keywords());
            }
            allKeywords = Collections.unmodifiableSet(words);
        }
        return allKeywords;
    }

    public boolean isSystemVerilog() {
        return label.startsWith("1800");
    }

    /**
     * Look up a standard by its IEEE label ("1364-2001") or enum name ("V2001").
     */
    public static Optional<LanguageStandard> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(trimmed) || s.name().equals(trimmed.toUpperCase(Locale.ROOT)))
                .findFirst();
    }

    /**
     * The most recent standard.
     */
    public static LanguageStandard maximum() {
        return SV2023;
    }

    @Override
    public String toString() {
        return label;
    }
}
