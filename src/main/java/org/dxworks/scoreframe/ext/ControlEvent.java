package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Zero-width events replayed between notes: bar checks, bar lines, markup and staff signature changes.
 */
public abstract class ControlEvent {
    public final String type;

    protected ControlEvent(String type) {
        this.type = type;
    }

    public static final class BarCheck extends ControlEvent {
        public BarCheck() {
            super("bar-check");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BarCheck;
        }

        @Override
        public int hashCode() {
            return BarCheck.class.hashCode();
        }
    }

    public static final class BarLine extends ControlEvent {
        public final String style;

        public BarLine(String style) {
            super("bar-line");
            this.style = Objects.requireNonNull(style, "style");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BarLine && style.equals(((BarLine) o).style);
        }

        @Override
        public int hashCode() {
            return style.hashCode();
        }
    }

    public static final class Markup extends ControlEvent {
        public final String serialized;

        public Markup(String serialized) {
            super("markup");
            this.serialized = Objects.requireNonNull(serialized, "serialized");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Markup && serialized.equals(((Markup) o).serialized);
        }

        @Override
        public int hashCode() {
            return serialized.hashCode();
        }
    }

    public static final class MarkupList extends ControlEvent {
        public final String serialized;

        public MarkupList(String serialized) {
            super("markup-list");
            this.serialized = Objects.requireNonNull(serialized, "serialized");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MarkupList && serialized.equals(((MarkupList) o).serialized);
        }

        @Override
        public int hashCode() {
            return serialized.hashCode() * 31;
        }
    }

    public static final class Clef extends ControlEvent {
        public final String name;

        public Clef(String name) {
            super("clef");
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Clef && name.equals(((Clef) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    /**
     * Key change; the tonic is kept in LilyPond spelling ("g", "bes", "fis").
     */
    public static final class Key extends ControlEvent {
        public final String tonic;
        public final String mode;

        public Key(String tonic, String mode) {
            super("key");
            this.tonic = Objects.requireNonNull(tonic, "tonic");
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return tonic.equals(other.tonic) && mode.equals(other.mode);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tonic, mode);
        }
    }

    public static final class Time extends ControlEvent {
        public final int numerator;
        public final int denominator;

        public Time(int numerator, int denominator) {
            super("time");
            this.numerator = numerator;
            this.denominator = denominator;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Time)) return false;
            Time other = (Time) o;
            return numerator == other.numerator && denominator == other.denominator;
        }

        @Override
        public int hashCode() {
            return Objects.hash(numerator, denominator);
        }
    }
}
