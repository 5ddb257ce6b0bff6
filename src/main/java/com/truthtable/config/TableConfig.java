package com.truthtable.config;

import com.truthtable.formula.Notation;

/**
 * 真值表运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class TableConfig {
    private int maxVariables = Constants.DEFAULT_MAX_VARIABLES;
    private Notation notation = Notation.UNICODE;
    private String outputFormat = "text";
    private boolean showAssignments = true;

    public int getMaxVariables() {
        return maxVariables;
    }

    public void setMaxVariables(int maxVariables) {
        this.maxVariables = maxVariables;
    }

    public Notation getNotation() {
        return notation;
    }

    public void setNotation(Notation notation) {
        this.notation = notation;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isShowAssignments() {
        return showAssignments;
    }

    public void setShowAssignments(boolean showAssignments) {
        this.showAssignments = showAssignments;
    }

    /**
     * 判断变量数是否在当前配置允许的范围内。
     */
    public boolean allowsVariableCount(int variableCount) {
        return variableCount <= Math.min(maxVariables, Constants.MAX_VARIABLES_LIMIT);
    }

    /**
     * 使用默认配置创建实例
     */
    public static TableConfig defaults() {
        return new TableConfig();
    }
}
