package com.pocketapps.automation.cron;

import java.util.BitSet;

/**
 * The five fields of a cron expression and their natural bounds.
 */
enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    String label() {
        return label;
    }

    /**
     * Parse one field into the set of values it matches.
     * Grammar: comma-separated items, each {@code *}, {@code n}, {@code lo-hi},
     * optionally followed by {@code /step}.
     *
     * @throws IllegalArgumentException with a human-readable reason
     */
    BitSet parse(String text) {
        BitSet values = new BitSet(max + 1);
        for (String item : text.split(",", -1)) {
            parseItem(item, values);
        }
        return values;
    }

    private void parseItem(String item, BitSet values) {
        if (item.isEmpty()) {
            throw new IllegalArgumentException("empty list item in " + label + " field");
        }

        String rangePart = item;
        int step = 1;
        boolean stepped = false;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            rangePart = item.substring(0, slash);
            step = parseNumber(item.substring(slash + 1), "step");
            if (step < 1) {
                throw new IllegalArgumentException(label + " step must be at least 1");
            }
            stepped = true;
        }

        int lo;
        int hi;
        if (rangePart.equals("*")) {
            lo = min;
            hi = max;
        } else if (rangePart.contains("-")) {
            String[] bounds = rangePart.split("-", -1);
            if (bounds.length != 2) {
                throw new IllegalArgumentException("malformed range '" + rangePart + "' in " + label + " field");
            }
            lo = parseValue(bounds[0]);
            hi = parseValue(bounds[1]);
            if (lo > hi) {
                throw new IllegalArgumentException("range start after end in " + label + " field");
            }
        } else {
            lo = parseValue(rangePart);
            // "base/step" strides from base to the end of the field
            hi = stepped ? max : lo;
        }

        for (int v = lo; v <= hi; v += step) {
            values.set(v);
        }
    }

    private int parseValue(String text) {
        int value = parseNumber(text, "value");
        if (value < min || value > max) {
            throw new IllegalArgumentException(label + " value " + value + " outside " + min + "-" + max);
        }
        return value;
    }

    private int parseNumber(String text, String what) {
        if (text.isEmpty() || text.length() > 4) {
            throw new IllegalArgumentException("malformed " + what + " '" + text + "' in " + label + " field");
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                throw new IllegalArgumentException("malformed " + what + " '" + text + "' in " + label + " field");
            }
        }
        return Integer.parseInt(text);
    }
}
