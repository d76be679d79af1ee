package com.dfanalyzer.trace.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;

import com.dfanalyzer.trace.ConfigurationException;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.HashEntry;
import com.dfanalyzer.trace.model.MetadataEntry;
import com.dfanalyzer.trace.model.ParsedRecord;
import com.dfanalyzer.trace.model.RecordKind;

/**
 * Turns one raw trace line into at most one {@link ParsedRecord}.
 * <p>
 * Instances are immutable and shared by all parser threads.
 */
public class RecordParser {

    static final String PHASE_METADATA = "M";
    static final char NON_ASCII_PLACEHOLDER = '#';

    private final double timeGranularity;
    private final boolean timeApproximate;
    private final Map<String, String> extraColumns;
    private final ExtraColumnsFunction extraColumnsFn;

    public RecordParser(double timeGranularity, boolean timeApproximate) {
        this(timeGranularity, timeApproximate, null, null);
    }

    /**
     * @param extraColumns column name to declared type; every event must
     *            produce all of them
     * @param extraColumnsFn producer of the extra columns, required when any
     *            are declared
     */
    public RecordParser(double timeGranularity, boolean timeApproximate, Map<String, String> extraColumns,
            ExtraColumnsFunction extraColumnsFn) {
        if (!(timeGranularity > 0) || Double.isInfinite(timeGranularity)) {
            throw new ConfigurationException("Time granularity must be a positive number: " + timeGranularity);
        }
        Map<String, String> columns = extraColumns == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraColumns));
        if (!columns.isEmpty() && extraColumnsFn == null) {
            throw new ConfigurationException("Extra columns " + columns.keySet()
                    + " are declared but no function produces them");
        }
        for (String column : columns.keySet()) {
            if (Columns.isReserved(column)) {
                throw new ConfigurationException("Extra column '" + column + "' clashes with a built-in column");
            }
        }
        this.timeGranularity = timeGranularity;
        this.timeApproximate = timeApproximate;
        this.extraColumns = columns;
        this.extraColumnsFn = extraColumnsFn;
    }

    /**
     * @return the record, or null when the line carries none (blank lines,
     *         array delimiters, objects without a name)
     * @throws TraceParseException if the line is not a usable JSON object
     * @throws MissingColumnException if a declared extra column was not
     *             produced
     */
    public ParsedRecord parse(String line) throws TraceParseException {
        if (line == null || line.isEmpty() || line.charAt(0) == '[' || line.charAt(0) == ']'
                || line.trim().isEmpty()) {
            return null;
        }

        JSONObject raw;
        try {
            raw = new JSONObject(sanitize(line));
        } catch (JSONException e) {
            throw new TraceParseException("Malformed trace line: " + e.getMessage(), e);
        }

        try {
            if (!raw.has("name")) {
                return null;
            }
            String name = String.valueOf(raw.get("name"));
            Long pid = optLong(raw, "pid");
            Long tid = optLong(raw, "tid");
            JSONObject args = raw.optJSONObject("args");
            String hostHash = args != null && args.has("hhash") ? String.valueOf(args.get("hhash")) : null;

            if (PHASE_METADATA.equals(raw.optString("ph", null))) {
                return parseMetadata(name, args, pid, tid, hostHash);
            }
            return parseEvent(raw, line, name, args, pid, tid, hostHash);
        } catch (JSONException e) {
            throw new TraceParseException("Unusable trace line: " + e.getMessage(), e);
        }
    }

    private ParsedRecord parseMetadata(String marker, JSONObject args, Long pid, Long tid, String hostHash) {
        RecordKind kind = RecordKind.findByMarker(marker);
        String name = marker;
        String value = null;
        if (args != null && args.has("name") && args.has("value")) {
            name = String.valueOf(args.get("name"));
            value = String.valueOf(args.get("value"));
        }
        if (kind.isHashEntry()) {
            return new HashEntry(kind, name, value, pid, tid, hostHash);
        }
        return new MetadataEntry(kind, name, value, pid, tid, hostHash);
    }

    private EventRecord parseEvent(JSONObject raw, String line, String name, JSONObject args, Long pid, Long tid,
            String hostHash) throws TraceParseException {
        if (!raw.has("ts") || !raw.has("dur")) {
            throw new TraceParseException("Event '" + name + "' has no ts/dur");
        }
        long ts = raw.getLong("ts");
        long dur = raw.getLong("dur");
        String cat = raw.has("cat") ? String.valueOf(raw.get("cat")).toLowerCase() : null;

        EventRecord.Builder event = new EventRecord.Builder()
                .name(name)
                .cat(cat)
                .pid(pid)
                .tid(tid)
                .hostHash(hostHash)
                .ts(ts)
                .dur(dur)
                .trange((long) Math.floor((ts + dur / 2.0) / timeGranularity));
        if (!timeApproximate) {
            event.timeInterval("[" + ts + "," + (ts + dur) + "]");
        }
        if (args != null && args.has("step")) {
            long step = args.getLong("step");
            if (step > 0) {
                event.step(step);
            }
        }

        IOCategorizer.apply(raw, cat, event);

        if (extraColumnsFn != null) {
            event.extraColumns(extraColumnsFn.extract(raw));
        }
        if (!extraColumns.isEmpty()) {
            List<String> missing = new ArrayList<>();
            for (String column : extraColumns.keySet()) {
                if (!event.hasExtraColumn(column)) {
                    missing.add(column);
                }
            }
            if (!missing.isEmpty()) {
                throw new MissingColumnException(missing, line);
            }
        }
        return event.build();
    }

    /**
     * Replaces every non-ASCII code point with a placeholder; trace writers do
     * not reliably emit valid UTF-8.
     */
    static String sanitize(String line) {
        int i = 0;
        int n = line.length();
        while (i < n && line.charAt(i) < 128) {
            i++;
        }
        if (i == n) {
            return line;
        }
        StringBuilder sb = new StringBuilder(n);
        sb.append(line, 0, i);
        line.codePoints().skip(i).forEach(cp -> sb.append(cp < 128 ? (char) cp : NON_ASCII_PLACEHOLDER));
        return sb.toString();
    }

    private static Long optLong(JSONObject raw, String key) {
        if (!raw.has(key) || raw.isNull(key)) {
            return null;
        }
        return raw.getLong(key);
    }

    public double getTimeGranularity() {
        return timeGranularity;
    }

    public boolean isTimeApproximate() {
        return timeApproximate;
    }

    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }
}
