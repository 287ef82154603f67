package com.ethnicthv.qcircuit;

import com.ethnicthv.qcircuit.core.circuit.Circuit;
import com.ethnicthv.qcircuit.core.circuit.InitialStateLabeler;
import com.ethnicthv.qcircuit.core.label.LabelFormatter;
import com.ethnicthv.qcircuit.core.label.ParameterFormatter;
import com.ethnicthv.qcircuit.core.layout.ColumnAssignment;
import com.ethnicthv.qcircuit.core.layout.ColumnScheduler;
import com.ethnicthv.qcircuit.core.layout.LayoutMode;
import com.ethnicthv.qcircuit.core.render.DiagramGrid;
import com.ethnicthv.qcircuit.core.render.DiagramRenderer;
import com.ethnicthv.qcircuit.core.render.GhostCellPolicy;
import com.ethnicthv.qcircuit.core.render.QuantikzSerializer;
import com.ethnicthv.qcircuit.core.render.TikzPicture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quantikz - the single entry point (Facade) for circuit diagram rendering.
 * <p>
 * Wraps ColumnScheduler, DiagramRenderer and QuantikzSerializer into one API.
 * Instances are immutable and can be shared between threads; every call works on its own
 * frontier and grid.
 * <pre>{@code
 * Quantikz quantikz = Quantikz.builder()
 *         .layout(LayoutMode.PACKED)
 *         .ghostCells(GhostCellPolicy.PLACEHOLDER)
 *         .build();
 * String latex = quantikz.toQuantikz(circuit);
 * }</pre>
 */
public final class Quantikz {

    private static final Logger LOG = LoggerFactory.getLogger(Quantikz.class);

    private final LayoutMode layout;
    private final DiagramRenderer renderer;
    private final QuantikzSerializer serializer;

    // Private constructor, use Quantikz.builder() instead.
    private Quantikz(LayoutMode layout, DiagramRenderer renderer, QuantikzSerializer serializer) {
        this.layout = layout;
        this.renderer = renderer;
        this.serializer = serializer;
    }

    /**
     * Create a new Builder instance to configure rendering.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Renderer with the defaults: packed layout, filtered ghost cells, angles in units of π.
     */
    public static Quantikz defaults() {
        return builder().build();
    }

    // =================================================================
    // Public API
    // =================================================================

    /**
     * Column of every operation under the configured layout.
     */
    public ColumnAssignment schedule(Circuit circuit) {
        return ColumnScheduler.schedule(circuit, layout);
    }

    /**
     * Cell grid of the circuit under the configured layout.
     */
    public DiagramGrid grid(Circuit circuit) {
        return renderer.render(circuit, schedule(circuit));
    }

    /**
     * Complete {@code quantikz} environment for the circuit.
     * Initial-state labels are resolved before any column is assigned, so an arity problem
     * surfaces before any rendering work.
     */
    public String toQuantikz(Circuit circuit) {
        InitialStateLabeler labels = labeler(circuit);
        String latex = serializer.serialize(grid(circuit), labels);
        LOG.debug("Rendered quantikz for {} ({} layout)", circuit, layout);
        return latex;
    }

    /**
     * The circuit as a TikZ picture with {@code \&} cell separators.
     */
    public TikzPicture toTikzPicture(Circuit circuit) {
        InitialStateLabeler labels = labeler(circuit);
        String body = serializer.body(grid(circuit), labels, QuantikzSerializer.ESCAPED_CELL_SEPARATOR);
        return TikzPicture.quantikz(body);
    }

    private static InitialStateLabeler labeler(Circuit circuit) {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit must not be null");
        }
        return InitialStateLabeler.of(circuit);
    }

    public LayoutMode layout() {
        return layout;
    }

    public GhostCellPolicy ghostCells() {
        return serializer.ghostCells();
    }

    /**
     * Copy of this configuration with another layout.
     */
    public Quantikz withLayout(LayoutMode layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout must not be null");
        }
        return new Quantikz(layout, renderer, serializer);
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private LayoutMode layout = LayoutMode.PACKED;
        private GhostCellPolicy ghostCells = GhostCellPolicy.FILTER;
        private ParameterFormatter parameters = ParameterFormatter.PI;

        public Builder layout(LayoutMode layout) {
            if (layout == null) {
                throw new IllegalArgumentException("layout must not be null");
            }
            this.layout = layout;
            return this;
        }

        /**
         * Select the layout by name ({@code serial}, {@code horizontal}, {@code packed},
         * {@code parallel} or {@code vertical}).
         *
         * @throws com.ethnicthv.qcircuit.core.UnsupportedLayoutModeException for any other name
         */
        public Builder layout(String name) {
            this.layout = LayoutMode.fromName(name);
            return this;
        }

        public Builder ghostCells(GhostCellPolicy ghostCells) {
            if (ghostCells == null) {
                throw new IllegalArgumentException("ghostCells must not be null");
            }
            this.ghostCells = ghostCells;
            return this;
        }

        /**
         * Unit used for compact angle labels, e.g. {@code (Math.PI, "\\pi")} (the default).
         */
        public Builder referenceConstant(double value, String symbol) {
            this.parameters = new ParameterFormatter(value, symbol);
            return this;
        }

        public Quantikz build() {
            DiagramRenderer renderer = new DiagramRenderer(new LabelFormatter(parameters));
            return new Quantikz(layout, renderer, new QuantikzSerializer(ghostCells));
        }
    }
}
