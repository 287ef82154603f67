package com.ethnicthv.qcircuit.core.circuit;

/**
 * Starting state of one wire, or of every wire at once.
 * <p>
 * A descriptor provides two strings per wire: the label displayed in the diagram and the
 * state name handed to the numerical backend.
 */
public sealed interface InitialState permits BasisState, NamedState, ProductState {

    /**
     * Display text for the given wire (1-based), without the ket decoration.
     */
    String displayLabel(int wire);

    /**
     * State name understood by the simulation backend for the given wire (1-based).
     */
    String stateName(int wire);
}
