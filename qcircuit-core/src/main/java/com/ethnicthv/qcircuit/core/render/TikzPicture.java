package com.ethnicthv.qcircuit.core.render;

/**
 * A quantikz diagram packaged for a TikZ picture: the row body uses {@code \&} as cell
 * separator, together with the environment options and preamble needed to typeset it.
 *
 * @param data        rows of the diagram, cells separated by {@code \&}
 * @param options     environment options, {@code ampersand replacement=\&}
 * @param preamble    preamble line loading quantikz
 * @param environment environment name, {@code quantikz}
 */
public record TikzPicture(String data, String options, String preamble, String environment) {

    public static final String QUANTIKZ_OPTIONS = "ampersand replacement=\\&";
    public static final String QUANTIKZ_PREAMBLE = "\\usepackage{quantikz}";
    public static final String QUANTIKZ_ENVIRONMENT = "quantikz";

    public static TikzPicture quantikz(String data) {
        return new TikzPicture(data, QUANTIKZ_OPTIONS, QUANTIKZ_PREAMBLE, QUANTIKZ_ENVIRONMENT);
    }

    /**
     * The environment with its options wrapped around the data.
     */
    public String toLatex() {
        return "\\begin{" + environment + "}[" + options + "]\n" + data + "\n\\end{" + environment + "}";
    }
}
