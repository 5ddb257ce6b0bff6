package com.truthtable.table;

/**
 * 真值表逐行回调。assignment 会在两次回调之间被原地修改，需要保留时请复制。
 */
@FunctionalInterface
public interface RowSink {

    void accept(boolean[] assignment, boolean result);
}
