package com.truthtable.formula;

import com.truthtable.config.Constants;

/**
 * 公式显示所用的符号体系。每种符号都能被词法分析器重新识别。
 */
public enum Notation {
    UNICODE(Constants.GLYPH_TRUE, Constants.GLYPH_FALSE, Constants.GLYPH_NOT,
            Constants.GLYPH_AND, Constants.GLYPH_OR, Constants.GLYPH_IMPLIES, Constants.GLYPH_IFF),
    ASCII("T", "F", "~", "/\\", "\\/", "->", "<->"),
    LATEX("\\top", "\\bot", "\\lnot ", "\\land", "\\lor", "\\to", "\\leftrightarrow");

    private final String trueGlyph;
    private final String falseGlyph;
    private final String notGlyph;
    private final String andGlyph;
    private final String orGlyph;
    private final String impliesGlyph;
    private final String iffGlyph;

    Notation(String trueGlyph, String falseGlyph, String notGlyph,
             String andGlyph, String orGlyph, String impliesGlyph, String iffGlyph) {
        this.trueGlyph = trueGlyph;
        this.falseGlyph = falseGlyph;
        this.notGlyph = notGlyph;
        this.andGlyph = andGlyph;
        this.orGlyph = orGlyph;
        this.impliesGlyph = impliesGlyph;
        this.iffGlyph = iffGlyph;
    }

    public String constant(boolean value) {
        return value ? trueGlyph : falseGlyph;
    }

    public String not() {
        return notGlyph;
    }

    public String and() {
        return andGlyph;
    }

    public String or() {
        return orGlyph;
    }

    public String implies() {
        return impliesGlyph;
    }

    public String iff() {
        return iffGlyph;
    }

    /**
     * 二元节点一律加括号：(左 符号 右)。
     */
    String binary(String left, String glyph, String right) {
        return "(" + left + " " + glyph + " " + right + ")";
    }
}
