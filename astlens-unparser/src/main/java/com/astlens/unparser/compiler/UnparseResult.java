package com.astlens.unparser.compiler;

/**
 * 一次反解析的结果：渲染出的源码文本，以及编译失败时附带的诊断信息。
 * 失败前已渲染的部分保留在文本中，诊断追加在其后。
 */
public final class UnparseResult {
    private final String text;
    private final Throwable failure;

    private UnparseResult(String text, Throwable failure) {
        this.text = text;
        this.failure = failure;
    }

    public static UnparseResult rendered(String text) {
        return new UnparseResult(text, null);
    }

    public static UnparseResult renderedWithDiagnostic(String text, Throwable failure) {
        return new UnparseResult(text, failure);
    }

    public String getText() {
        return text;
    }

    public boolean hasDiagnostic() {
        return failure != null;
    }

    /** 导致诊断的异常，正常渲染时为 null */
    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return text;
    }
}
