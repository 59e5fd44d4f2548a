package com.astlens.unparser.formatter;

/**
 * 输出缓冲区，跟踪缩进、待缩进状态与空白折叠。
 *
 * <p>不了解任何 AST 结构，只提供写入、换行、空行与缩进作用域四个原语。
 * 缓冲区末尾最多保留两个连续换行；渲染规则之间拼出的相邻空格会被折叠为一个。</p>
 */
public class ScriptPrinter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private String indent = "";
    private boolean readyToIndent = true;

    public ScriptPrinter(UnparseConfig config) {
        this.indentUnit = config.getIndentString();
    }

    public ScriptPrinter() {
        this(new UnparseConfig());
    }

    /**
     * 追加文本。
     *
     * <p>处于行首时先输出当前缩进并去掉文本的全部前导空格；
     * 缓冲区已以空格结尾时再去掉文本的一个前导空格。</p>
     */
    public void write(String text) {
        if (text == null || text.isEmpty()) return;
        String out = text;
        if (readyToIndent) {
            output.append(indent);
            readyToIndent = false;
            int start = 0;
            while (start < out.length() && out.charAt(start) == ' ') {
                start++;
            }
            out = out.substring(start);
        }
        if (endsWith(' ') && out.startsWith(" ")) {
            out = out.substring(1);
        }
        output.append(out);
    }

    /**
     * 换行（已在行尾时不重复输出）
     */
    public void lineBreak() {
        if (!endsWith('\n')) {
            output.append('\n');
        }
        readyToIndent = true;
    }

    /**
     * 确保缓冲区以恰好一个空行结尾
     */
    public void doubleBreak() {
        int length = output.length();
        if (length >= 2 && output.charAt(length - 1) == '\n' && output.charAt(length - 2) == '\n') {
            // 已有空行
        } else if (endsWith('\n')) {
            output.append('\n');
        } else {
            output.append("\n\n");
        }
        readyToIndent = true;
    }

    /**
     * 在多一层缩进下执行 body，任何退出路径都恢复原缩进
     */
    public void indented(Runnable body) {
        String startingIndent = indent;
        indent = indent + indentUnit;
        try {
            body.run();
        } finally {
            indent = startingIndent;
        }
    }

    public String getIndent() {
        return indent;
    }

    public boolean isEmpty() {
        return output.length() == 0;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private boolean endsWith(char c) {
        return output.length() > 0 && output.charAt(output.length() - 1) == c;
    }
}
