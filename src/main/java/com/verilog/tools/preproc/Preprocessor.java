package com.verilog.tools.preproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.diagnostic.DiagnosticKind;
import com.verilog.tools.diagnostic.ToolDiagnostics;
import com.verilog.tools.language.VerilogLanguage;

/**
 * Verilog preprocessor: macro table, conditional compilation and include inlining.
 *
 * The macro table and include directories persist across calls. Each file, top-level or
 * included, gets its own conditional stack, and the in-flight include chain is tracked so
 * that re-entering a file on it is reported instead of recursing.
 *
 * Instances are not thread-safe; use one per concurrently processed file.
 */
public class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private static final Pattern DIRECTIVE_LINE = Pattern.compile("^\\s*`([A-Za-z_][A-Za-z0-9_$]*)(.*)$", Pattern.DOTALL);
    private static final Pattern NAME_ARGUMENT = Pattern.compile("^\\s+([A-Za-z_][A-Za-z0-9_$]*)(.*)$", Pattern.DOTALL);
    private static final Pattern INCLUDE_TARGET = Pattern.compile("^\\s*[\"<]([^\">]+)[\">]");
    private static final Pattern WORD = Pattern.compile("`?[A-Za-z_][A-Za-z0-9_$]*");

    private static final Set<String> PASS_THROUGH = Set.of(
            "timescale", "line", "pragma", "begin_keywords", "end_keywords");

    private final Map<String, String> defines = new LinkedHashMap<>();
    private final IncludeResolver includeResolver;
    private final boolean expandMacros;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    /** Files currently being processed, outermost first. */
    private final Set<Path> currentlyIncluding = new LinkedHashSet<>();

    private List<Path> includedFiles = new ArrayList<>();
    private String failure;

    public Preprocessor() {
        this(PreprocessorConfig.defaults());
    }

    public Preprocessor(PreprocessorConfig config) {
        this.defines.putAll(config.getDefines());
        this.includeResolver = new IncludeResolver(config.getIncludePaths());
        this.expandMacros = config.isExpandMacros();
    }

    /**
     * Preprocess a file from disk.
     *
     * @throws IOException if the file itself cannot be read
     */
    public PreprocessResult processFile(Path path) throws IOException {
        String text = Files.readString(path);
        log.info("Preprocessing {}", path);
        return process(text, path.toString());
    }

    /**
     * Preprocess {@code text}. {@code originPath} names the file the text came from; its
     * directory is searched for relative includes. It may be null for in-memory text.
     */
    public PreprocessResult process(String text, String originPath) {
        includedFiles = new ArrayList<>();
        failure = null;

        String fileName = originPath != null ? originPath : "<text>";
        Path origin = toPath(originPath);
        if (origin != null) {
            currentlyIncluding.add(origin);
        }

        String output;
        try {
            output = processUnit(text != null ? text : "", fileName, origin != null ? origin.getParent() : null);
        } finally {
            if (origin != null) {
                currentlyIncluding.remove(origin);
            }
        }

        if (failure != null) {
            return PreprocessResult.failure(failure, output, List.copyOf(includedFiles));
        }
        return PreprocessResult.builder()
                .success(true)
                .text(output)
                .includedFiles(List.copyOf(includedFiles))
                .build();
    }

    public void define(String name, String value) {
        defines.put(name, value != null ? value : "");
    }

    public void undefine(String name) {
        defines.remove(name);
    }

    public boolean isDefined(String name) {
        return defines.containsKey(name);
    }

    /**
     * Snapshot of the macro table.
     */
    public Map<String, String> getDefines() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(defines));
    }

    public void addIncludePath(Path dir) {
        includeResolver.addIncludePath(dir);
    }

    public List<Path> getIncludePaths() {
        return includeResolver.getIncludePaths();
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }

    private String processUnit(String text, String fileName, Path dir) {
        Deque<ConditionalFrame> frames = new ArrayDeque<>();
        List<String> out = new ArrayList<>();
        String[] physical = text.split("\n", -1);

        int i = 0;
        while (i < physical.length) {
            int lineNumber = i + 1;
            StringBuilder logical = new StringBuilder(physical[i]);
            while (endsWithContinuation(logical)) {
                joinContinuation(logical);
                if (i + 1 >= physical.length) {
                    break;
                }
                i++;
                logical.append(physical[i]);
            }
            i++;
            processLine(logical.toString(), lineNumber, fileName, dir, frames, out);
        }

        if (!frames.isEmpty()) {
            Iterator<ConditionalFrame> open = frames.descendingIterator();
            while (open.hasNext()) {
                ConditionalFrame frame = open.next();
                String message = "`" + frame.getKind().name().toLowerCase(Locale.ROOT) + " opened at line "
                        + frame.getLine() + " has no matching `endif";
                log.error("{}: {}", fileName, message);
                diagnostics.error(DiagnosticKind.UNBALANCED_CONDITIONAL, message, fileName, frame.getLine());
                if (failure == null) {
                    failure = fileName + ": " + message;
                }
            }
        }

        return String.join("\n", out);
    }

    private void processLine(String line, int lineNumber, String fileName, Path dir,
                             Deque<ConditionalFrame> frames, List<String> out) {
        Matcher directive = DIRECTIVE_LINE.matcher(line);
        if (directive.matches()
                && handleDirective(directive.group(1), directive.group(2), line, lineNumber, fileName, dir, frames, out)) {
            return;
        }

        if (isActive(frames)) {
            out.add(expandMacros ? expand(line) : line);
        }
    }

    /**
     * @return false when the line is not a directive after all but starts with a macro use
     */
    private boolean handleDirective(String name, String rest, String line, int lineNumber, String fileName,
                                    Path dir, Deque<ConditionalFrame> frames, List<String> out) {
        switch (name) {
            case "ifdef":
                openConditional(ConditionalFrame.Kind.IFDEF, rest, lineNumber, fileName, frames);
                return true;
            case "ifndef":
                openConditional(ConditionalFrame.Kind.IFNDEF, rest, lineNumber, fileName, frames);
                return true;
            case "elsif":
                handleElsif(rest, lineNumber, fileName, frames);
                return true;
            case "else":
                handleElse(lineNumber, fileName, frames);
                return true;
            case "endif":
                if (frames.isEmpty()) {
                    warn(DiagnosticKind.UNBALANCED_CONDITIONAL, "`endif without matching `ifdef/`ifndef", fileName, lineNumber);
                } else {
                    frames.pop();
                }
                return true;
            default:
                break;
        }

        if (!isActive(frames)) {
            return true;
        }

        switch (name) {
            case "define":
                handleDefine(rest, lineNumber, fileName);
                return true;
            case "undef":
                handleUndef(rest, lineNumber, fileName);
                return true;
            case "include":
                handleInclude(rest, lineNumber, fileName, dir, out);
                return true;
            default:
                if (PASS_THROUGH.contains(name)) {
                    out.add(line);
                    return true;
                }
                if (defines.containsKey(name)) {
                    return false;
                }
                log.debug("{}:{}: passing through unknown directive `{}", fileName, lineNumber, name);
                out.add(line);
                return true;
        }
    }

    private void openConditional(ConditionalFrame.Kind kind, String rest, int lineNumber, String fileName,
                                 Deque<ConditionalFrame> frames) {
        Optional<String> macro = nameArgument(rest);
        if (macro.isEmpty()) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "`" + kind.name().toLowerCase(Locale.ROOT) + " without a macro name", fileName, lineNumber);
            frames.push(new ConditionalFrame(kind, false, lineNumber));
            return;
        }
        boolean defined = defines.containsKey(macro.get());
        frames.push(new ConditionalFrame(kind, kind == ConditionalFrame.Kind.IFDEF ? defined : !defined, lineNumber));
    }

    private void handleElsif(String rest, int lineNumber, String fileName, Deque<ConditionalFrame> frames) {
        if (frames.isEmpty()) {
            warn(DiagnosticKind.UNBALANCED_CONDITIONAL, "`elsif without matching `ifdef/`ifndef", fileName, lineNumber);
            return;
        }
        ConditionalFrame frame = frames.peek();
        if (frame.isHadElse()) {
            warn(DiagnosticKind.UNBALANCED_CONDITIONAL, "`elsif after `else", fileName, lineNumber);
            return;
        }
        Optional<String> macro = nameArgument(rest);
        if (macro.isEmpty()) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "`elsif without a macro name", fileName, lineNumber);
        }
        frame.elsif(macro.map(defines::containsKey).orElse(false));
    }

    private void handleElse(int lineNumber, String fileName, Deque<ConditionalFrame> frames) {
        if (frames.isEmpty()) {
            warn(DiagnosticKind.UNBALANCED_CONDITIONAL, "`else without matching `ifdef/`ifndef", fileName, lineNumber);
            return;
        }
        ConditionalFrame frame = frames.peek();
        if (frame.isHadElse()) {
            warn(DiagnosticKind.UNBALANCED_CONDITIONAL, "Multiple `else in conditional block", fileName, lineNumber);
            return;
        }
        frame.otherwise();
    }

    private void handleDefine(String rest, int lineNumber, String fileName) {
        Matcher m = NAME_ARGUMENT.matcher(rest);
        if (!m.matches()) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "`define without a macro name", fileName, lineNumber);
            return;
        }
        String name = m.group(1);
        String body = m.group(2);
        if (body.startsWith("(")) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "Macro arguments are not supported: " + name, fileName, lineNumber);
            return;
        }
        String value = VerilogLanguage.stripComments(body).strip();
        log.debug("{}:{}: define {} = '{}'", fileName, lineNumber, name, value);
        defines.put(name, value);
    }

    private void handleUndef(String rest, int lineNumber, String fileName) {
        Optional<String> macro = nameArgument(rest);
        if (macro.isEmpty()) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "`undef without a macro name", fileName, lineNumber);
            return;
        }
        defines.remove(macro.get());
    }

    private void handleInclude(String rest, int lineNumber, String fileName, Path dir, List<String> out) {
        Matcher m = INCLUDE_TARGET.matcher(rest);
        if (!m.find()) {
            warn(DiagnosticKind.MALFORMED_DIRECTIVE, "`include without a quoted file name", fileName, lineNumber);
            return;
        }
        String target = m.group(1);

        Optional<Path> resolved = includeResolver.resolve(target, dir);
        if (resolved.isEmpty()) {
            warn(DiagnosticKind.UNRESOLVED_INCLUDE, "Include file not found: " + target, fileName, lineNumber);
            return;
        }
        Path path = resolved.get();

        if (currentlyIncluding.contains(path)) {
            warn(DiagnosticKind.CYCLIC_INCLUDE, "Cyclic include of " + path, fileName, lineNumber);
            return;
        }

        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            warn(DiagnosticKind.UNRESOLVED_INCLUDE, "Cannot read include file " + path + " (" + e.getMessage() + ")", fileName, lineNumber);
            return;
        }

        log.debug("{}:{}: including {}", fileName, lineNumber, path);
        includedFiles.add(path);
        currentlyIncluding.add(path);
        try {
            String included = processUnit(content, path.toString(), path.getParent());
            if (included.endsWith("\n")) {
                included = included.substring(0, included.length() - 1);
            }
            if (!included.isEmpty()) {
                out.add(included);
            }
        } finally {
            currentlyIncluding.remove(path);
        }
    }

    /**
     * Substitute every known macro used as a whole word, with or without a leading backtick.
     * Replacement text is not scanned again.
     */
    private String expand(String line) {
        if (defines.isEmpty()) {
            return line;
        }

        Matcher m = WORD.matcher(line);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            String word = m.group();
            boolean ticked = word.charAt(0) == '`';
            String name = ticked ? word.substring(1) : word;
            String value = defines.get(name);
            if (value == null) {
                continue;
            }
            if (!ticked && m.start() > 0 && continuesWord(line.charAt(m.start() - 1))) {
                continue;
            }
            sb.append(line, last, m.start()).append(value);
            last = m.end();
        }
        sb.append(line, last, line.length());
        return sb.toString();
    }

    // a digit or quote before a letter means a literal such as 8'hFF or 1W, not a word
    private static boolean continuesWord(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '\'';
    }

    private static boolean isActive(Deque<ConditionalFrame> frames) {
        for (ConditionalFrame frame : frames) {
            if (!frame.isActive()) {
                return false;
            }
        }
        return true;
    }

    private static Optional<String> nameArgument(String rest) {
        Matcher m = NAME_ARGUMENT.matcher(rest);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static boolean endsWithContinuation(CharSequence line) {
        return line.toString().stripTrailing().endsWith("\\");
    }

    private static void joinContinuation(StringBuilder line) {
        int backslash = line.toString().stripTrailing().length() - 1;
        line.setLength(backslash);
        line.append(' ');
    }

    private void warn(DiagnosticKind kind, String message, String fileName, int line) {
        log.warn("{}:{}: {}", fileName, line, message);
        diagnostics.warning(kind, message, fileName, line);
    }

    private static Path toPath(String originPath) {
        if (originPath == null || originPath.isBlank()) {
            return null;
        }
        try {
            return Path.of(originPath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.debug("Origin '{}' is not a file path", originPath);
            return null;
        }
    }
}
