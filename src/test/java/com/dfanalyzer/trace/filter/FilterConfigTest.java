package com.dfanalyzer.trace.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class FilterConfigTest {

    @Test
    public void testDefaults() {
        FilterConfig config = new FilterConfig();
        assertTrue(config.shouldIgnoreFile("/usr/lib64/libc.so"));
        assertTrue(config.shouldIgnoreFile("/home/u/venv/lib/site.py"));
        assertFalse(config.shouldIgnoreFile("/lustre/data/img_0.npz"));
        assertFalse(config.shouldIgnoreFile(null));

        assertTrue(config.shouldIgnoreFunction("TorchFramework.init_loader"));
        assertTrue(config.shouldIgnoreFunction("checkpoint_start_epoch"));
        assertTrue(config.shouldIgnoreFunction("PyTorchCheckpointing.save_state"));
        assertFalse(config.shouldIgnoreFunction("read"));
        assertFalse(config.shouldIgnoreFunction(null));
    }

    @Test
    public void testAddAndRemove() {
        Properties props = new Properties();
        props.setProperty(FilterConfig.FILE_PATTERNS + ".add", "/scratch/tmp, /opt/");
        props.setProperty(FilterConfig.FILE_PATTERNS + ".remove", "/venv");
        props.setProperty(FilterConfig.FUNC_NAMES + ".add", "MyLoader.__init__");

        FilterConfig config = new FilterConfig();
        config.loadFromProperties(props);

        assertTrue(config.shouldIgnoreFile("/scratch/tmp/x"));
        assertTrue(config.shouldIgnoreFile("/opt/app/bin"));
        assertFalse(config.shouldIgnoreFile("/home/u/venv/lib/site.py"));
        assertTrue(config.shouldIgnoreFile("/proc/self/maps"));
        assertTrue(config.shouldIgnoreFunction("MyLoader.__init__"));
    }

    @Test
    public void testReplace() {
        Properties props = new Properties();
        props.setProperty(FilterConfig.FUNC_PATTERNS, "warmup_");

        FilterConfig config = new FilterConfig();
        config.loadFromProperties(props);

        assertEquals(1, config.getIgnoredFuncPatterns().size());
        assertTrue(config.shouldIgnoreFunction("warmup_step"));
        assertFalse(config.shouldIgnoreFunction("checkpoint_end_epoch"));
        assertTrue(config.shouldIgnoreFunction("TFReader.next"));
    }
}
