package com.dfanalyzer.trace.filter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/**
 * Exclusion lists applied after ingestion: system and runtime file paths,
 * framework bookkeeping functions and checkpoint markers.
 */
public class FilterConfig {

    public static final String FILE_PATTERNS = "filter.files.ignore.patterns";
    public static final String FUNC_NAMES = "filter.functions.ignore.names";
    public static final String FUNC_PATTERNS = "filter.functions.ignore.patterns";

    private final Set<String> ignoredFilePatterns = new LinkedHashSet<>();
    private final Set<String> ignoredFuncNames = new LinkedHashSet<>();
    private final Set<String> ignoredFuncPatterns = new LinkedHashSet<>();

    public FilterConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        ignoredFilePatterns.addAll(Arrays.asList(
            "/dev/",
            "/etc/",
            "/gapps/python",
            "/lib/python",
            "/proc/",
            "/software/",
            "/sys/",
            "/usr/lib",
            "/usr/tce/backend",
            "/usr/tce/packages",
            "/venv",
            "__pycache__"
        ));

        ignoredFuncNames.addAll(Arrays.asList(
            "DLIOBenchmark.__init__",
            "DLIOBenchmark.initialize",
            "FileStorage.__init__",
            "IndexedBinaryMMapReader.__init__",
            "IndexedBinaryMMapReader.load_index",
            "IndexedBinaryMMapReader.next",
            "IndexedBinaryMMapReader.read_index",
            "NPZReader.__init__",
            "NPZReader.next",
            "NPZReader.read_index",
            "PyTorchCheckpointing.__init__",
            "PyTorchCheckpointing.finalize",
            "PyTorchCheckpointing.get_tensor",
            "SCRPyTorchCheckpointing.__init__",
            "SCRPyTorchCheckpointing.finalize",
            "SCRPyTorchCheckpointing.get_tensor",
            "TFCheckpointing.__init__",
            "TFCheckpointing.finalize",
            "TFCheckpointing.get_tensor",
            "TFDataLoader.__init__",
            "TFDataLoader.finalize",
            "TFDataLoader.next",
            "TFDataLoader.read",
            "TFFramework.get_loader",
            "TFFramework.init_loader",
            "TFFramework.is_nativeio_available",
            "TFFramework.trace_object",
            "TFReader.__init__",
            "TFReader.next",
            "TFReader.read_index",
            "TorchDataLoader.__init__",
            "TorchDataLoader.finalize",
            "TorchDataLoader.next",
            "TorchDataLoader.read",
            "TorchDataset.__init__",
            "TorchFramework.get_loader",
            "TorchFramework.init_loader",
            "TorchFramework.is_nativeio_available",
            "TorchFramework.trace_object"
        ));

        // checkpoint save and marker calls
        ignoredFuncPatterns.addAll(Arrays.asList(
            ".save_state",
            "checkpoint_end_",
            "checkpoint_start_"
        ));
    }

    /**
     * Load lists from properties. For each list prefix:
     * - {@code <prefix>}: comma-separated list (replaces defaults)
     * - {@code <prefix>.add}: comma-separated list (adds to defaults)
     * - {@code <prefix>.remove}: comma-separated list (removes from current set)
     */
    public void loadFromProperties(Properties props) {
        load(props, FILE_PATTERNS, ignoredFilePatterns);
        load(props, FUNC_NAMES, ignoredFuncNames);
        load(props, FUNC_PATTERNS, ignoredFuncPatterns);
    }

    private static void load(Properties props, String key, Set<String> target) {
        String replace = props.getProperty(key);
        if (replace != null && !replace.trim().isEmpty()) {
            target.clear();
            addPatterns(replace, target);
        }

        String additional = props.getProperty(key + ".add");
        if (additional != null && !additional.trim().isEmpty()) {
            addPatterns(additional, target);
        }

        String remove = props.getProperty(key + ".remove");
        if (remove != null && !remove.trim().isEmpty()) {
            for (String pattern : remove.split(",")) {
                target.remove(pattern.trim());
            }
        }
    }

    private static void addPatterns(String patternList, Set<String> target) {
        for (String pattern : patternList.split(",")) {
            String trimmed = pattern.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }

    public Set<String> getIgnoredFilePatterns() {
        return new LinkedHashSet<>(ignoredFilePatterns);
    }

    public Set<String> getIgnoredFuncNames() {
        return new LinkedHashSet<>(ignoredFuncNames);
    }

    public Set<String> getIgnoredFuncPatterns() {
        return new LinkedHashSet<>(ignoredFuncPatterns);
    }

    public boolean shouldIgnoreFile(String fileName) {
        return fileName != null && ignoredFilePatterns.stream().anyMatch(fileName::contains);
    }

    public boolean shouldIgnoreFunction(String funcName) {
        if (funcName == null) {
            return false;
        }
        return ignoredFuncNames.contains(funcName) || ignoredFuncPatterns.stream().anyMatch(funcName::contains);
    }
}
