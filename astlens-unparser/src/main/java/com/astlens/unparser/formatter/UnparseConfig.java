package com.astlens.unparser.formatter;

/**
 * 反解析输出配置
 */
public class UnparseConfig {
    private boolean showScriptFreeForm = true;
    private boolean showScriptClass = true;
    private int indentSize = 4;
    private boolean useSpaces = true;

    public UnparseConfig() {
    }

    public UnparseConfig(boolean showScriptFreeForm, boolean showScriptClass) {
        this.showScriptFreeForm = showScriptFreeForm;
        this.showScriptClass = showScriptClass;
    }

    /** 是否输出脚本顶层语句（类之外的部分） */
    public boolean isShowScriptFreeForm() {
        return showScriptFreeForm;
    }

    public void setShowScriptFreeForm(boolean showScriptFreeForm) {
        this.showScriptFreeForm = showScriptFreeForm;
    }

    /** 是否输出编译器合成的脚本类 */
    public boolean isShowScriptClass() {
        return showScriptClass;
    }

    public void setShowScriptClass(boolean showScriptClass) {
        this.showScriptClass = showScriptClass;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
