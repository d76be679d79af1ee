package com.dfanalyzer.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.batch.TraceBatch;
import com.dfanalyzer.trace.model.ParsedRecord;
import com.dfanalyzer.trace.parser.RecordParser;
import com.dfanalyzer.trace.parser.TraceParseException;

/**
 * Reads and parses one batch. Tasks share nothing but the immutable parser.
 */
class TraceParserTask implements Callable<BatchResult> {

    private static final Logger logger = LoggerFactory.getLogger(TraceParserTask.class);

    private final TraceBatch batch;
    private final RecordParser parser;
    private final boolean debug;

    TraceParserTask(TraceBatch batch, RecordParser parser, boolean debug) {
        this.batch = batch;
        this.parser = parser;
        this.debug = debug;
    }

    @Override
    public BatchResult call() throws Exception {
        List<String> lines = batch.readLines();
        logger.debug("Read {} json lines for batch {}", lines.size(), batch);

        List<ParsedRecord> records = new ArrayList<>(lines.size());
        long localSkipped = 0;
        long localParseErrors = 0;

        for (String currentLine : lines) {
            ParsedRecord record;
            try {
                record = parser.parse(currentLine);
            } catch (TraceParseException e) {
                localParseErrors++;
                if (debug && localParseErrors <= 3) {
                    logger.warn("Parse error in batch {} ({}): {}", batch, e.getMessage(),
                            currentLine.substring(0, Math.min(200, currentLine.length())));
                } else {
                    logger.debug("Processing {} failed with {}", currentLine, e.getMessage());
                }
                continue;
            }
            if (record == null) {
                localSkipped++;
                continue;
            }
            records.add(record);
        }

        return new BatchResult(batch.getOrdinal(), records,
                new ProcessingStats(lines.size(), records.size(), localSkipped, localParseErrors));
    }
}
