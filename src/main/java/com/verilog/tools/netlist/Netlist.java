package com.verilog.tools.netlist;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.diagnostic.DiagnosticKind;
import com.verilog.tools.diagnostic.ToolDiagnostics;
import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.parser.DeclarationCollector;
import com.verilog.tools.parser.StructuralParser;
import com.verilog.tools.parser.model.ModuleDeclaration;
import com.verilog.tools.preproc.PreprocessResult;
import com.verilog.tools.preproc.Preprocessor;

/**
 * The module table built from a set of source files.
 *
 * Call {@link #readFile(Path)} for every input, then {@link #link()} once all of them are
 * read, since an instance may refer to a module defined in a later file. Reading is
 * single-threaded; once linking is done the query methods only read.
 */
public class Netlist {
    private static final Logger log = LoggerFactory.getLogger(Netlist.class);

    private final NetlistConfig config;
    private final NetlistBuilder builder;
    private final Linker linker;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    private final Map<String, Module> modules = new LinkedHashMap<>();
    private final List<Module> pending = new ArrayList<>();
    private final List<Path> inputFiles = new ArrayList<>();
    private final Map<String, List<Path>> includedFiles = new LinkedHashMap<>();
    private final Set<String> libraryMisses = new HashSet<>();

    public Netlist() {
        this(NetlistConfig.defaults());
    }

    public Netlist(NetlistConfig config) {
        this.config = config;
        this.builder = new NetlistBuilder(config.isImplicitWires());
        this.linker = new Linker(this);
    }

    /**
     * Preprocess, parse and register every module of one file.
     *
     * A file that cannot be read is reported as {@link DiagnosticKind#MISSING_TOP_LEVEL_FILE}
     * and yields a failed result; other files are unaffected.
     */
    public FileReadResult readFile(Path path) {
        log.info("Reading {}", path);
        Preprocessor preprocessor = new Preprocessor(config.getPreprocessor());

        PreprocessResult preprocessed;
        try {
            preprocessed = preprocessor.processFile(path);
        } catch (IOException e) {
            String message = "Cannot read " + path + " (" + e.getMessage() + ")";
            log.error(message);
            diagnostics.error(DiagnosticKind.MISSING_TOP_LEVEL_FILE, message, path.toString(), 0);
            return FileReadResult.failure(path.toString(), message);
        }

        inputFiles.add(path);
        return ingest(preprocessor, preprocessed, path.toString());
    }

    /**
     * Same as {@link #readFile(Path)} for source text that is already in memory.
     */
    public FileReadResult readText(String text, String originName) {
        Preprocessor preprocessor = new Preprocessor(config.getPreprocessor());
        return ingest(preprocessor, preprocessor.process(text, originName), originName);
    }

    private FileReadResult ingest(Preprocessor preprocessor, PreprocessResult preprocessed, String fileName) {
        diagnostics.addAll(preprocessor.getDiagnostics());
        includedFiles.put(fileName, preprocessed.getIncludedFiles());

        if (!preprocessed.isSuccess()) {
            log.error("Skipping {}: {}", fileName, preprocessed.getErrorMessage());
            FileReadResult failed = FileReadResult.failure(fileName, preprocessed.getErrorMessage());
            failed.setIncludedFiles(preprocessed.getIncludedFiles());
            return failed;
        }

        DeclarationCollector collector = new DeclarationCollector(fileName);
        new StructuralParser(collector, config.getLanguage()).parse(preprocessed.getText());
        diagnostics.addAll(collector.getDiagnostics());

        List<String> names = new ArrayList<>();
        for (ModuleDeclaration declaration : collector.getModules()) {
            Module module = builder.build(declaration, diagnostics);
            if (register(module)) {
                names.add(module.getName());
            }
        }
        log.debug("{}: {} module(s) {}", fileName, names.size(), names);

        return FileReadResult.builder()
                .success(true)
                .file(fileName)
                .moduleNames(names)
                .includedFiles(preprocessed.getIncludedFiles())
                .build();
    }

    private boolean register(Module module) {
        Module existing = modules.get(module.getName());
        if (existing != null) {
            String message = "Module " + module.getName() + " already defined in " + existing.getSourceFile()
                    + ", keeping the first definition";
            log.warn("{}:{}: {}", module.getSourceFile(), module.getLine(), message);
            diagnostics.warning(DiagnosticKind.DUPLICATE_DECLARATION, message, module.getSourceFile(), module.getLine());
            return false;
        }
        modules.put(module.getName(), module);
        pending.add(module);
        return true;
    }

    /**
     * Resolve instances to modules. May be called again after more files were read.
     *
     * @return number of cells resolved by this call
     */
    public int link() {
        return linker.link();
    }

    public Collection<Module> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public Optional<Module> findModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Modules no resolved cell refers to, in registration order. Recomputed on every call.
     */
    public List<Module> getTopModules() {
        Set<String> referenced = new HashSet<>();
        for (Module module : modules.values()) {
            for (Cell cell : module.getCells()) {
                if (cell.isResolved()) {
                    referenced.add(cell.getResolvedModule().getName());
                }
            }
        }
        return modules.values().stream()
                .filter(m -> !referenced.contains(m.getName()))
                .collect(Collectors.toList());
    }

    /**
     * Names of modules that are instantiated but were never found.
     */
    public SortedSet<String> getMissingModuleNames() {
        SortedSet<String> missing = new TreeSet<>();
        for (Module module : modules.values()) {
            for (Cell cell : module.getCells()) {
                if (!cell.isResolved()) {
                    missing.add(cell.getModuleName());
                }
            }
        }
        return missing;
    }

    /**
     * Files read successfully, library files included, in reading order.
     */
    public List<Path> getInputFiles() {
        return Collections.unmodifiableList(inputFiles);
    }

    public List<Path> getIncludedFiles(String file) {
        return includedFiles.getOrDefault(file, List.of());
    }

    /**
     * Every file read, mapped to the files it included.
     */
    public Map<String, List<Path>> getIncludedFiles() {
        return Collections.unmodifiableMap(includedFiles);
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Human-readable listing of every module with its ports, nets, cells and parameters.
     */
    public String dump() {
        return new NetlistDumper().dump(this);
    }

    /**
     * Regenerated Verilog skeleton of every module.
     */
    public String verilogText() {
        return new VerilogTextWriter().write(getModules());
    }

    int cellCount() {
        return modules.values().stream().mapToInt(m -> m.getCells().size()).sum();
    }

    List<Module> drainPending() {
        List<Module> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    /**
     * Look for {@code name} in the library directories and read the first matching file.
     * Each name is searched at most once.
     */
    Optional<Module> readLibraryModule(String name) {
        if (!config.isLinkRead() || config.getLibraryDirs().isEmpty() || libraryMisses.contains(name)) {
            return Optional.empty();
        }
        for (Path dir : config.getLibraryDirs()) {
            Path root = dir.toAbsolutePath().normalize();
            for (String extension : config.effectiveLibraryExtensions()) {
                Path candidate = libraryCandidate(root, name + extension);
                if (candidate != null && Files.isRegularFile(candidate)) {
                    log.info("Reading library module {} from {}", name, candidate);
                    diagnostics.info("Library module " + name + " read from " + candidate);
                    readFile(candidate);
                    Optional<Module> found = findModule(name);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
        }
        libraryMisses.add(name);
        return Optional.empty();
    }

    /**
     * {@code fileName} inside {@code root}, or null when it is not a usable path or
     * leaves the directory, as escaped identifiers may contain any printable character.
     */
    private static Path libraryCandidate(Path root, String fileName) {
        Path candidate;
        try {
            candidate = root.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            log.debug("Module name {} is not a file name: {}", fileName, e.getMessage());
            return null;
        }
        if (!candidate.startsWith(root) || candidate.equals(root)) {
            log.debug("Skipping {} outside library directory {}", candidate, root);
            return null;
        }
        return candidate;
    }
}
