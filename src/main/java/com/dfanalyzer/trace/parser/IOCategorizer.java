package com.dfanalyzer.trace.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.json.JSONObject;

import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.IOCategory;

/**
 * Classifies low-level I/O calls and extracts their transfer size.
 */
public class IOCategorizer {

    public static final String CAT_POSIX = "posix";
    public static final String CAT_STDIO = "stdio";

    static final Set<String> METADATA_FUNCTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "__fxstat", "__fxstat64", "__lxstat", "__lxstat64", "__xstat", "__xstat64",
            "access", "chdir", "chmod", "chown", "close", "closedir", "creat", "creat64",
            "dup", "dup2", "faccessat", "fclose", "fcntl", "fileno", "fopen", "fopen64",
            "fseek", "fstat", "fstat64", "ftell", "ftruncate", "getcwd", "link", "lseek",
            "lseek64", "lstat", "lstat64", "mkdir", "mknod", "open", "open64", "openat",
            "opendir", "readdir", "readlink", "remove", "rename", "rewind", "rmdir", "seekdir",
            "stat", "stat64", "statfs", "symlink", "telldir", "truncate", "umask", "unlink",
            "utime")));

    static final Map<String, IOCategory> IO_CAT_MAPPING;

    static {
        Map<String, IOCategory> mapping = new HashMap<>();
        for (String read : Arrays.asList("read", "pread", "pread64", "readv", "preadv", "preadv2",
                "fread", "fgets", "fgetc", "getc", "fscanf", "getline")) {
            mapping.put(read, IOCategory.READ);
        }
        for (String write : Arrays.asList("write", "pwrite", "pwrite64", "writev", "pwritev", "pwritev2",
                "fwrite", "fputs", "fputc", "putc", "fprintf")) {
            mapping.put(write, IOCategory.WRITE);
        }
        IO_CAT_MAPPING = Collections.unmodifiableMap(mapping);
    }

    public static IOCategory classify(String funcName) {
        if (funcName == null) {
            return IOCategory.OTHER;
        }
        if (METADATA_FUNCTIONS.contains(funcName)) {
            return IOCategory.METADATA;
        }
        return IO_CAT_MAPPING.getOrDefault(funcName, IOCategory.OTHER);
    }

    public static boolean isLowLevelCategory(String cat) {
        return CAT_POSIX.equalsIgnoreCase(cat) || CAT_STDIO.equalsIgnoreCase(cat);
    }

    /**
     * Fills the I/O columns of {@code event} from the raw event object.
     * Size precedence: {@code size_sum}, then the return value of a low-level
     * read or write, and only outside the low-level categories an image index.
     * An aggregated {@code size_sum} event is always {@link IOCategory#OTHER}.
     */
    public static void apply(JSONObject raw, String cat, EventRecord.Builder event) {
        String name = raw.optString("name", null);
        boolean lowLevel = isLowLevelCategory(cat);
        IOCategory ioCategory = lowLevel ? classify(name) : IOCategory.OTHER;
        event.ioCategory(ioCategory);

        JSONObject args = raw.optJSONObject("args");
        if (args == null) {
            return;
        }
        if (args.has("fhash")) {
            event.fileHash(String.valueOf(args.get("fhash")));
        }
        if (args.has("size_sum")) {
            event.ioCategory(IOCategory.OTHER);
            event.size(args.getLong("size_sum"));
        } else if (lowLevel) {
            if (args.has("ret")) {
                long ret = args.getLong("ret");
                if (ret > 0 && ioCategory.isDataTransfer()) {
                    event.size(ret);
                }
            }
        } else if (args.has("image_idx")) {
            long imageId = args.getLong("image_idx");
            if (imageId > 0) {
                event.imageId(imageId);
            }
        }
    }
}
