package com.astlens.unparser.formatter;

/**
 * Groovy 源码字面量转义与类型描述符工具
 */
public final class GroovySourceStrings {

    private GroovySourceStrings() {}

    /**
     * 转义字符串内容（用于单引号包裹的字符串）。
     * <p>只处理反斜杠、单引号与控制字符，不尝试还原 GString 插值。</p>
     */
    public static String escapeSingleQuoted(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 转义双引号字符串（GString）的常量段，{@code $} 同样转义以免被当作插值
     */
    public static String escapeDoubleQuoted(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '$': sb.append("\\$"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 单引号包裹的字符串字面量 */
    public static String quote(String s) {
        return "'" + escapeSingleQuoted(s) + "'";
    }

    /**
     * 将 JVM 数组描述符（如 {@code [[Ljava.lang.String;}、{@code [I}）还原为源码写法
     * {@code java.lang.String[][]}、{@code int[]}。
     *
     * @return 还原后的类型名，不是数组描述符时返回 null
     */
    public static String unwrapArrayDescriptor(String name) {
        if (name == null || !name.startsWith("[")) return null;
        int dimensions = 0;
        while (dimensions < name.length() && name.charAt(dimensions) == '[') {
            dimensions++;
        }
        String rest = name.substring(dimensions);
        String element;
        if (rest.startsWith("L") && rest.endsWith(";") && rest.length() > 2) {
            element = rest.substring(1, rest.length() - 1);
        } else if (rest.length() == 1) {
            element = primitiveName(rest.charAt(0));
            if (element == null) return null;
        } else {
            return null;
        }
        StringBuilder sb = new StringBuilder(element);
        for (int i = 0; i < dimensions; i++) {
            sb.append("[]");
        }
        return sb.toString();
    }

    /** 能否不加引号直接作为 map 键或属性名 */
    public static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty() || !Character.isJavaIdentifierStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); i++) {
            if (!Character.isJavaIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }

    /** 去掉包名，保留简单类名 */
    public static String simpleName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }

    private static String primitiveName(char descriptor) {
        switch (descriptor) {
            case 'Z': return "boolean";
            case 'B': return "byte";
            case 'C': return "char";
            case 'S': return "short";
            case 'I': return "int";
            case 'J': return "long";
            case 'F': return "float";
            case 'D': return "double";
            default: return null;
        }
    }
}
