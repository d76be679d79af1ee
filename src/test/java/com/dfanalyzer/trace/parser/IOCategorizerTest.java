package com.dfanalyzer.trace.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.IOCategory;

public class IOCategorizerTest {

    @Test
    public void testClassify() {
        assertEquals(IOCategory.READ, IOCategorizer.classify("pread64"));
        assertEquals(IOCategory.READ, IOCategorizer.classify("fread"));
        assertEquals(IOCategory.WRITE, IOCategorizer.classify("pwrite"));
        assertEquals(IOCategory.WRITE, IOCategorizer.classify("fwrite"));
        assertEquals(IOCategory.METADATA, IOCategorizer.classify("open64"));
        assertEquals(IOCategory.METADATA, IOCategorizer.classify("__fxstat64"));
        assertEquals(IOCategory.OTHER, IOCategorizer.classify("mmap"));
        assertEquals(IOCategory.OTHER, IOCategorizer.classify(null));
    }

    @Test
    public void testLowLevelCategory() {
        assertTrue(IOCategorizer.isLowLevelCategory("posix"));
        assertTrue(IOCategorizer.isLowLevelCategory("STDIO"));
        assertFalse(IOCategorizer.isLowLevelCategory("posix_ssd"));
        assertFalse(IOCategorizer.isLowLevelCategory(null));
    }

    @Test
    public void testOnlyLowLevelEventsAreClassified() {
        EventRecord.Builder event = new EventRecord.Builder().name("read").ts(0).dur(1);
        IOCategorizer.apply(new JSONObject("{\"name\":\"read\",\"args\":{\"ret\":10}}"), "app", event);
        EventRecord built = event.build();
        assertEquals(IOCategory.OTHER, built.getIoCategory());
        assertNull(built.getSize());
    }

    @Test
    public void testNoArgs() {
        EventRecord.Builder event = new EventRecord.Builder().name("write").ts(0).dur(1);
        IOCategorizer.apply(new JSONObject("{\"name\":\"write\"}"), "posix", event);
        EventRecord built = event.build();
        assertEquals(IOCategory.WRITE, built.getIoCategory());
        assertNull(built.getSize());
        assertNull(built.getFileHash());
    }
}
