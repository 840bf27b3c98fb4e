package org.pvcoder.dict.util;

/*
 * This file is part of PVCoder.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PVCoder is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PVCoder is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PVCoder.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Dependency-free static logger used across PVCoder.
 *
 * <p>Each line carries a timestamp, the thread name and the level. WARN and ERROR go
 * to stderr, everything else to stdout. Configured once at class load through:</p>
 * <ul>
 *   <li><b>pvcoder.log.level</b>: minimum level printed (default INFO)</li>
 *   <li><b>pvcoder.log.datetime</b>: timestamp pattern (default yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 * Messages use {@code {}} placeholders; surplus arguments are appended.
 */
public final class Logger {

    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null || s.isBlank()) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    public static final String SYS_PROP_LEVEL = "pvcoder.log.level";
    public static final String SYS_PROP_DATETIME = "pvcoder.log.datetime";

    private static final Level MIN_LEVEL = Level.parse(System.getProperty(SYS_PROP_LEVEL), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(System.getProperty(SYS_PROP_DATETIME, "yyyy-MM-dd HH:mm:ss"));

    private Logger() {}

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { write(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { write(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { write(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { write(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { write(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { write(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { write(Level.ERROR, t, msg, args); }

    private static void write(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        String line = "[" + LocalDateTime.now().format(TS) + "] ["
                + Thread.currentThread().getName() + "] "
                + level + " " + format(msg, args);
        PrintStream out = level.ordinal() >= Level.WARN.ordinal() ? System.err : System.out;

        synchronized (Logger.class) {
            out.println(line);
            if (t != null) t.printStackTrace(out);
        }
    }

    /** Replaces each {@code {}} with the next argument. */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int next = 0;
        int from = 0;
        int at;
        while (next < args.length && (at = template.indexOf("{}", from)) >= 0) {
            sb.append(template, from, at).append(args[next++]);
            from = at + 2;
        }
        sb.append(template.substring(from));
        while (next < args.length) {
            sb.append(' ').append(args[next++]);
        }
        return sb.toString();
    }
}
