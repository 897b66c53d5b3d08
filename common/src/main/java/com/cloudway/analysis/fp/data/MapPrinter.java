/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders maps and map differences in a human readable form, for
 * debugging purposes.
 *
 * <p>A map is rendered as {@code [k1 ↦ v1, k2 ↦ v2]}. The difference of two
 * maps is rendered as {@code [-- [k ↦ v]; ++ [k ↦ v]; [k ↦ d]]; } where
 * {@code --} marks a binding only in the left map, {@code ++} a binding only
 * in the right map, and {@code d} is the rendering of two unequal values.
 * Nothing is written if the maps have no difference.</p>
 */
public final class MapPrinter {
    private MapPrinter() {}

    static final String MAPSTO = " ↦ ";

    /**
     * Writes the bindings of a map to the given sink, in key order.
     *
     * @param out the output sink
     * @param map the map to render
     * @param showKey renders a key
     * @param showValue renders a value
     * @throws IOException if the sink fails
     */
    public static <K, V> void pp(Appendable out, TreePMap<K, V> map,
                                 Function<? super K, String> showKey,
                                 Function<? super V, String> showValue)
        throws IOException
    {
        out.append('[');
        boolean first = true;
        for (Map.Entry<K, V> e : map) {
            if (!first)
                out.append(", ");
            first = false;
            out.append(showKey.apply(e.getKey()))
               .append(MAPSTO)
               .append(showValue.apply(e.getValue()));
        }
        out.append(']');
    }

    /**
     * Writes the symmetric difference of two maps to the given sink, in key
     * order. Writes nothing if the maps are equivalent.
     *
     * @param out the output sink
     * @param left the left map
     * @param right the right map
     * @param equal the equality of values
     * @param showKey renders a key
     * @param showValue renders a value that only appears in one map
     * @param showUnequal renders the left and right values of a key
     * @throws IOException if the sink fails
     */
    public static <K, V> void ppDiff(Appendable out, TreePMap<K, V> left, TreePMap<K, V> right,
                                     BiPredicate<? super V, ? super V> equal,
                                     Function<? super K, String> showKey,
                                     Function<? super V, String> showValue,
                                     BiFunction<? super V, ? super V, String> showUnequal)
        throws IOException
    {
        Seq<Map.Entry<K, Diff<V>>> diff = left.symmetricDiff(right, equal);
        if (diff.isEmpty())
            return;

        out.append('[');
        boolean first = true;
        for (Map.Entry<K, Diff<V>> e : diff) {
            if (!first)
                out.append("; ");
            first = false;

            Diff<V> d = e.getValue();
            String key = showKey.apply(e.getKey());
            switch (d.kind()) {
            case LEFT:
                out.append("-- [").append(key).append(MAPSTO)
                   .append(showValue.apply(d.leftValue().get())).append(']');
                break;
            case RIGHT:
                out.append("++ [").append(key).append(MAPSTO)
                   .append(showValue.apply(d.rightValue().get())).append(']');
                break;
            case UNEQUAL:
                out.append('[').append(key).append(MAPSTO)
                   .append(showUnequal.apply(d.leftValue().get(), d.rightValue().get())).append(']');
                break;
            default:
                throw new IllegalStateException("unknown diff: " + d);
            }
        }
        out.append("]; ");
    }

    /**
     * Renders a map to a string.
     */
    public static <K, V> String show(TreePMap<K, V> map,
                                     Function<? super K, String> showKey,
                                     Function<? super V, String> showValue) {
        StringBuilder buf = new StringBuilder();
        try {
            pp(buf, map, showKey, showValue);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return buf.toString();
    }

    /**
     * Renders the difference of two maps to a string. Returns an empty string
     * if the maps are equivalent.
     */
    public static <K, V> String showDiff(TreePMap<K, V> left, TreePMap<K, V> right,
                                         BiPredicate<? super V, ? super V> equal,
                                         Function<? super K, String> showKey,
                                         Function<? super V, String> showValue,
                                         BiFunction<? super V, ? super V, String> showUnequal) {
        StringBuilder buf = new StringBuilder();
        try {
            ppDiff(buf, left, right, equal, showKey, showValue, showUnequal);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return buf.toString();
    }

    /**
     * Logs the difference of two maps. The difference is only computed if the
     * logger is enabled for the given level, and nothing is logged if the maps
     * are equivalent.
     *
     * @return {@code true} if a message was logged
     */
    public static <K, V> boolean logDiff(Logger logger, Level level,
                                         TreePMap<K, V> left, TreePMap<K, V> right,
                                         BiPredicate<? super V, ? super V> equal,
                                         Function<? super K, String> showKey,
                                         Function<? super V, String> showValue,
                                         BiFunction<? super V, ? super V, String> showUnequal) {
        if (!logger.isLoggable(level))
            return false;

        String diff = showDiff(left, right, equal, showKey, showValue, showUnequal);
        if (diff.isEmpty())
            return false;

        logger.log(level, diff);
        return true;
    }
}
