package com.astlens.unparser.compiler;

import com.astlens.unparser.formatter.AstSourceRenderer;
import com.astlens.unparser.formatter.UnparseConfig;
import groovy.lang.GroovyClassLoader;
import groovy.lang.GroovyCodeSource;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.control.CompilerConfiguration;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groovy 源码到 AST 再到源码的反解析入口。
 *
 * <p>把脚本交给 Groovy 编译器编译到指定阶段，在该阶段对每个主类节点执行
 * {@link AstSourceRenderer}，返回渲染出的源码。编译失败不会抛出，
 * 而是把诊断信息追加在已渲染的部分之后。</p>
 *
 * <p>每次调用使用独立的渲染器和编译单元，实例本身无状态，可在线程间共享。</p>
 */
public class AstUnparser {

    private static final Logger LOG = Logger.getLogger(AstUnparser.class.getName());

    private static final String SCRIPT_CODE_BASE = "/groovy/script";
    private static final String COMPILATION_ERROR_HEADER =
            "Unable to produce AST for this phase due to earlier compilation error:";
    private static final String UNEXPECTED_ERROR_HEADER =
            "Unable to produce AST for this phase due to an error:";
    private static final String RETRY_HINT = "Fix the above error(s) and then try again";

    /**
     * 使用默认配置与本类的类加载器反解析
     */
    public UnparseResult unparse(String script, CompilePhase phase) {
        return unparse(script, phase, AstUnparser.class.getClassLoader(), new UnparseConfig());
    }

    /**
     * 按阶段编号反解析，编号无法对应到 {@link CompilePhase} 时返回诊断结果
     */
    public UnparseResult unparse(String script, int phaseNumber, ClassLoader classLoader, UnparseConfig config) {
        CompilePhase phase = phaseFor(phaseNumber);
        if (phase == null) {
            String message = "Compile phase " + phaseNumber
                    + " cannot be mapped to a org.codehaus.groovy.control.CompilePhase.";
            LOG.fine(message);
            return UnparseResult.renderedWithDiagnostic(message + "\n", new IllegalArgumentException(message));
        }
        return unparse(script, phase, classLoader, config);
    }

    public UnparseResult unparse(String script, CompilePhase phase, ClassLoader classLoader, UnparseConfig config) {
        AstSourceRenderer renderer = new AstSourceRenderer(config);
        ClassLoader parent = classLoader != null ? classLoader : AstUnparser.class.getClassLoader();
        boolean ownsLoader = !(parent instanceof GroovyClassLoader);
        GroovyClassLoader groovyClassLoader = ownsLoader
                ? new GroovyClassLoader(parent)
                : (GroovyClassLoader) parent;

        String scriptName = "script" + System.currentTimeMillis() + ".groovy";
        GroovyCodeSource codeSource = new GroovyCodeSource(script, scriptName, SCRIPT_CODE_BASE);
        CompilationUnit unit = new CompilationUnit(CompilerConfiguration.DEFAULT,
                codeSource.getCodeSource(), groovyClassLoader);
        unit.addPhaseOperation(renderer, phase.getPhaseNumber());
        unit.addSource(codeSource.getName(), script);

        LOG.fine("Unparsing " + scriptName + " at phase " + phase);
        try {
            unit.compile(phase.getPhaseNumber());
        } catch (CompilationFailedException e) {
            LOG.fine("Compilation stopped before " + phase + ": " + e.getMessage());
            String text = appendDiagnostic(renderer.getOutput(), COMPILATION_ERROR_HEADER, e.getMessage());
            return UnparseResult.renderedWithDiagnostic(text, e);
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Unexpected failure while unparsing " + scriptName, t);
            String text = appendDiagnostic(renderer.getOutput(), UNEXPECTED_ERROR_HEADER, t.getMessage());
            return UnparseResult.renderedWithDiagnostic(text, t);
        } finally {
            if (ownsLoader) {
                close(groovyClassLoader);
            }
        }

        String output = terminate(renderer.getOutput());
        LOG.fine("Rendered " + output.length() + " characters at phase " + phase);
        return UnparseResult.rendered(output);
    }

    /**
     * 反解析并只返回文本，诊断信息（如有）已包含在文本中
     */
    public String compileToScript(String script, int phaseNumber) {
        return compileToScript(script, phaseNumber, AstUnparser.class.getClassLoader(), true, true);
    }

    public String compileToScript(String script, int phaseNumber, ClassLoader classLoader,
                                  boolean showScriptFreeForm, boolean showScriptClass) {
        UnparseConfig config = new UnparseConfig(showScriptFreeForm, showScriptClass);
        return unparse(script, phaseNumber, classLoader, config).getText();
    }

    static CompilePhase phaseFor(int phaseNumber) {
        for (CompilePhase phase : CompilePhase.values()) {
            if (phase.getPhaseNumber() == phaseNumber) {
                return phase;
            }
        }
        return null;
    }

    /**
     * 诊断不经过渲染器的缩进与空白折叠，消息原样逐行输出
     */
    private static String appendDiagnostic(String partial, String header, String message) {
        StringBuilder sb = new StringBuilder(partial);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        sb.append(header).append('\n');
        if (message != null) {
            for (String line : message.split("\\R")) {
                sb.append(line).append('\n');
            }
        }
        sb.append(RETRY_HINT).append('\n');
        return sb.toString();
    }

    private static void close(GroovyClassLoader groovyClassLoader) {
        try {
            groovyClassLoader.close();
        } catch (IOException e) {
            LOG.fine("Failed to close class loader: " + e.getMessage());
        }
    }

    private static String terminate(String output) {
        if (output.isEmpty() || output.endsWith("\n")) {
            return output;
        }
        return output + "\n";
    }
}
