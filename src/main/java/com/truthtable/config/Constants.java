package com.truthtable.config;

/**
 * 全局常量定义
 *
 * 包含词法哨兵、显示符号、输入限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 词法参数 ====================
    /** 词法分析内部追加的输入结束哨兵，不属于合法输入字符 */
    public static final char EOF_SENTINEL = '$';

    // ==================== Unicode 显示符号 ====================
    public static final String GLYPH_TRUE = "⊤";
    public static final String GLYPH_FALSE = "⊥";
    public static final String GLYPH_NOT = "¬";
    public static final String GLYPH_AND = "∧";
    public static final String GLYPH_OR = "∨";
    public static final String GLYPH_IMPLIES = "→";
    public static final String GLYPH_IFF = "↔";

    // ==================== 真值表单元格 ====================
    /** 真值表中“真”的单元格文本 */
    public static final String CELL_TRUE = "T";
    /** 真值表中“假”的单元格文本 */
    public static final String CELL_FALSE = "F";

    // ==================== 输入限制 ====================
    /** 默认变量数上限，2^16 行 */
    public static final int DEFAULT_MAX_VARIABLES = 16;
    /** 变量数安全上限，超过后拒绝枚举 */
    public static final int MAX_VARIABLES_LIMIT = 24;
    /** 公式最大字符数 */
    public static final int MAX_FORMULA_LENGTH = 4096;
}
