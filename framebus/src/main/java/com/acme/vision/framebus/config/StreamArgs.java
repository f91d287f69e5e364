package com.acme.vision.framebus.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for per-stream, per-substream argument lists.
 *
 * <p>Streams are separated by {@code ';'}, substreams by {@code ','}, and every entry
 * is trimmed: {@code "left, right; depth"} yields {@code [[left, right], [depth]]}.
 * Empty entries are kept so positions stay aligned with substream indices.
 */
public final class StreamArgs {
    private StreamArgs() {
    }

    public static List<String> parse(String raw, char separator) {
        List<String> out = new ArrayList<>();
        String in = raw == null ? "" : raw;
        int start = 0;
        for (int i = 0; i <= in.length(); i++) {
            if (i == in.length() || in.charAt(i) == separator) {
                out.add(in.substring(start, i).trim());
                start = i + 1;
            }
        }
        return List.copyOf(out);
    }

    public static List<List<String>> parse2D(String raw) {
        List<List<String>> out = new ArrayList<>();
        for (String stream : parse(raw, ';')) {
            out.add(parse(stream, ','));
        }
        return List.copyOf(out);
    }

    /** Entry at {@code [stream][substream]}, or {@code ""} when absent. */
    public static String at(List<List<String>> args, int stream, int substream) {
        if (stream < 0 || stream >= args.size()) {
            return "";
        }
        List<String> row = args.get(stream);
        if (substream < 0 || substream >= row.size()) {
            return "";
        }
        return row.get(substream);
    }
}
