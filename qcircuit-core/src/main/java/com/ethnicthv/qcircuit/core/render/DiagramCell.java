package com.ethnicthv.qcircuit.core.render;

import com.ethnicthv.qcircuit.core.label.TargetShape;

/**
 * Content of one (wire, column) position of a diagram.
 * <p>
 * Three kinds of cell exist as far as serialization is concerned: plain wire
 * ({@link Through}), drawn content (every other record) and the suppressed continuation of a
 * multi-wire box ({@link GhostSpan}). Keeping the ghost explicit avoids overloading an empty
 * token for "covered by a box above".
 */
public sealed interface DiagramCell {

    Through THROUGH = new Through();
    GhostSpan GHOST = new GhostSpan();

    /**
     * quantikz token of the cell.
     */
    String token();

    /**
     * True if the cell is covered by a span box opened on another wire.
     */
    default boolean suppressed() {
        return false;
    }

    /** Plain wire continuation. */
    record Through() implements DiagramCell {
        @Override
        public String token() {
            return "\\qw";
        }
    }

    /** Single-wire operator box. */
    record Box(String label) implements DiagramCell {
        @Override
        public String token() {
            return "\\gate{" + label + "}";
        }
    }

    /** Box opened on the lowest wire of a range and stretched over {@code span} wires. */
    record SpanBox(int span, String label) implements DiagramCell {
        @Override
        public String token() {
            return "\\gate[" + span + "]{" + label + "}";
        }
    }

    /** Non-anchor wire under a span box. */
    record GhostSpan() implements DiagramCell {
        @Override
        public String token() {
            return "";
        }

        @Override
        public boolean suppressed() {
            return true;
        }
    }

    /** Control dot with a vertical line reaching {@code offset} wires down (negative: up). */
    record Control(int offset) implements DiagramCell {
        @Override
        public String token() {
            return "\\ctrl{" + offset + "}";
        }
    }

    /** Target of a controlled operation; {@code label} is only drawn for {@link TargetShape#BOX}. */
    record Target(TargetShape shape, String label) implements DiagramCell {
        @Override
        public String token() {
            return switch (shape) {
                case CROSS -> "\\targ{}";
                case DOT -> "\\ctrl{0}";
                case BOX -> "\\gate{" + label + "}";
            };
        }
    }

    /** Upper end of an exchange, with the line reaching {@code offset} wires down. */
    record SwapAnchor(int offset) implements DiagramCell {
        @Override
        public String token() {
            return "\\swap{" + offset + "}";
        }
    }

    /** Lower end of an exchange. */
    record SwapPartner() implements DiagramCell {
        @Override
        public String token() {
            return "\\targX{}";
        }
    }
}
