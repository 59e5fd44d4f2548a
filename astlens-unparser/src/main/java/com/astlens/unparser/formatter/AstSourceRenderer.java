package com.astlens.unparser.formatter;

import org.codehaus.groovy.ast.*;
import org.codehaus.groovy.ast.expr.*;
import org.codehaus.groovy.ast.stmt.*;
import org.codehaus.groovy.classgen.BytecodeExpression;
import org.codehaus.groovy.classgen.GeneratorContext;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.syntax.Types;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Groovy AST 反解析器
 *
 * <p>遍历编译器在某个编译阶段产出的语法树，输出语义等价、可读的 Groovy 源码。
 * 输出不保留原始格式与注释。每次渲染使用独立的实例，实例内部持有输出缓冲区与类名栈，
 * 不能在多次渲染或多个线程之间共享。</p>
 *
 * <p>既可作为 {@link CompilationUnit.IPrimaryClassNodeOperation} 注册到编译管线，
 * 也可通过 {@link #render(ASTNode)} 直接渲染单个节点。</p>
 */
public class AstSourceRenderer implements GroovyCodeVisitor, GroovyClassVisitor,
        CompilationUnit.IPrimaryClassNodeOperation {

    private static final String CONSTRUCTOR_NAME = "<init>";
    private static final String STATIC_INITIALIZER_NAME = "<clinit>";

    private static final int CLASS_MODIFIERS = Modifier.classModifiers() | Modifier.INTERFACE;
    private static final int METHOD_MODIFIERS = Modifier.methodModifiers();
    private static final int FIELD_MODIFIERS = Modifier.fieldModifiers();
    private static final int PARAMETER_MODIFIERS = Modifier.parameterModifiers();

    /** 可在字段声明处直接输出初始值的常量类型 */
    private static final Set<String> CONSTANT_INITIALIZER_TYPES = new HashSet<>(Arrays.asList(
            "boolean", "byte", "char", "short", "int", "long", "float", "double", "java.lang.String"));

    private final ScriptPrinter out;
    private final UnparseConfig config;
    private final Deque<String> classNameStack = new ArrayDeque<>();

    private boolean headerVisited;
    private boolean scriptHasBeenVisited;
    private boolean inControlStatement;
    private boolean commandCallAllowed;

    public AstSourceRenderer(UnparseConfig config) {
        this.config = config;
        this.out = new ScriptPrinter(config);
    }

    public AstSourceRenderer() {
        this(new UnparseConfig());
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return out.getOutput();
    }

    /** 当前尚未闭合的类声明层数，一次完整渲染结束后应为 0 */
    public int getOpenClassCount() {
        return classNameStack.size();
    }

    // ============ 入口 ============

    /**
     * 编译阶段回调：每个主类节点调用一次。
     * 包声明与导入只在第一次调用时输出，脚本顶层语句同样只输出一次。
     */
    @Override
    public void call(SourceUnit source, GeneratorContext context, ClassNode classNode) {
        renderUnit(source != null ? source.getAST() : null, classNode);
    }

    /**
     * 渲染任意节点：声明节点按种类分派，语句与表达式交给节点自身的 visit。
     */
    public void render(ASTNode node) {
        if (node == null) return;
        if (node instanceof ModuleNode) {
            ModuleNode module = (ModuleNode) node;
            for (ClassNode classNode : module.getClasses()) {
                renderUnit(module, classNode);
            }
        } else if (node instanceof ClassNode) {
            visitClass((ClassNode) node);
        } else if (node instanceof ConstructorNode) {
            visitConstructor((ConstructorNode) node);
        } else if (node instanceof MethodNode) {
            visitMethod((MethodNode) node);
        } else if (node instanceof FieldNode) {
            visitField((FieldNode) node);
        } else if (node instanceof PropertyNode) {
            visitProperty((PropertyNode) node);
        } else if (node instanceof PackageNode) {
            visitPackage((PackageNode) node);
        } else if (node instanceof ImportNode) {
            visitImport((ImportNode) node);
        } else if (node instanceof AnnotationNode) {
            visitAnnotationNode((AnnotationNode) node);
        } else if (node instanceof Parameter) {
            visitParameters(new Parameter[]{(Parameter) node});
        } else {
            node.visit(this);
        }
    }

    private void renderUnit(ModuleNode module, ClassNode classNode) {
        if (module != null && !headerVisited) {
            headerVisited = true;
            visitPackage(module.getPackage());
            visitAllImports(module);
        }
        if (config.isShowScriptFreeForm() && !scriptHasBeenVisited) {
            scriptHasBeenVisited = true;
            BlockStatement statements = module != null ? module.getStatementBlock() : null;
            if (statements != null && !statements.isEmpty()) {
                statements.visit(this);
            }
        }
        if (classNode != null && (config.isShowScriptClass() || !classNode.isScript())) {
            visitClass(classNode);
        }
    }

    // ============ 声明 ============

    public void visitPackage(PackageNode packageNode) {
        if (packageNode == null) return;
        renderAnnotations(packageNode.getAnnotations());
        String text = packageNode.getText();
        if (text.endsWith(".")) {
            text = text.substring(0, text.length() - 1);
        }
        out.write(text);
        out.doubleBreak();
    }

    private void visitAllImports(ModuleNode module) {
        boolean staticImportsPresent = false;
        for (ImportNode node : module.getStaticImports().values()) {
            visitImport(node);
            staticImportsPresent = true;
        }
        for (ImportNode node : module.getStaticStarImports().values()) {
            visitImport(node);
            staticImportsPresent = true;
        }
        if (staticImportsPresent) {
            out.doubleBreak();
        }

        boolean importsPresent = false;
        for (ImportNode node : module.getImports()) {
            visitImport(node);
            importsPresent = true;
        }
        for (ImportNode node : module.getStarImports()) {
            visitImport(node);
            importsPresent = true;
        }
        if (importsPresent) {
            out.doubleBreak();
        }
    }

    public void visitImport(ImportNode node) {
        if (node == null) return;
        renderAnnotations(node.getAnnotations());
        out.write(importText(node));
        out.lineBreak();
    }

    /**
     * 编译器为普通导入记录的别名就是简单类名，与名称相同的别名不输出
     */
    private static String importText(ImportNode node) {
        String alias = node.getAlias();
        if (!node.isStar() && alias != null) {
            if (node.isStatic() && alias.equals(node.getFieldName())) {
                return "import static " + node.getClassName() + "." + alias;
            }
            if (!node.isStatic() && node.getType() != null
                    && alias.equals(node.getType().getNameWithoutPackage())) {
                return "import " + node.getClassName();
            }
        }
        return node.getText();
    }

    @Override
    public void visitClass(ClassNode node) {
        String className = node.getNameWithoutPackage();
        classNameStack.push(className);
        try {
            renderAnnotations(node.getAnnotations());
            visitModifiers(node.getModifiers() & CLASS_MODIFIERS);
            out.write("class " + className);
            out.write(genericsText(node.getGenericsTypes()));

            ClassNode[] interfaces = node.getUnresolvedInterfaces();
            if (interfaces != null && interfaces.length > 0) {
                out.write(" implements ");
                writeJoined(Arrays.asList(interfaces), ", ", type -> out.write(typeName(type)));
            }
            // 父类总是输出，未声明时即 Object
            ClassNode superClass = node.getUnresolvedSuperClass();
            out.write(" extends ");
            out.write(typeName(superClass != null ? superClass : ClassHelper.OBJECT_TYPE));
            out.write(" {");
            out.doubleBreak();

            out.indented(() -> {
                for (PropertyNode property : node.getProperties()) {
                    visitProperty(property);
                }
                for (FieldNode field : node.getFields()) {
                    visitField(field);
                }
                out.doubleBreak();
                for (ConstructorNode constructor : node.getDeclaredConstructors()) {
                    visitConstructor(constructor);
                }
                for (MethodNode method : node.getMethods()) {
                    visitMethod(method);
                }
            });
            out.write("}");
            out.lineBreak();
        } finally {
            classNameStack.pop();
        }
    }

    @Override
    public void visitConstructor(ConstructorNode node) {
        visitMethod(node);
    }

    @Override
    public void visitMethod(MethodNode node) {
        renderAnnotations(node.getAnnotations());
        visitModifiers(node.getModifiers() & METHOD_MODIFIERS);

        String name = node.getName();
        if (CONSTRUCTOR_NAME.equals(name)) {
            out.write(enclosingClassName(node) + "(");
            visitParameters(node.getParameters());
            out.write(") {");
        } else if (STATIC_INITIALIZER_NAME.equals(name)) {
            // static 已由修饰符输出
            out.write("{");
        } else {
            out.write(typeText(node.getReturnType()));
            out.write(" " + name + "(");
            visitParameters(node.getParameters());
            out.write(")");
            ClassNode[] exceptions = node.getExceptions();
            if (exceptions != null && exceptions.length > 0) {
                out.write(" throws ");
                writeJoined(Arrays.asList(exceptions), ", ", type -> out.write(typeName(type)));
            }
            out.write(" {");
        }
        out.lineBreak();

        Statement code = node.getCode();
        out.indented(() -> {
            if (code != null) {
                code.visit(this);
            }
        });
        out.lineBreak();
        out.write("}");
        out.doubleBreak();
    }

    @Override
    public void visitField(FieldNode node) {
        renderAnnotations(node.getAnnotations());
        visitModifiers(node.getModifiers() & FIELD_MODIFIERS);
        out.write(typeText(node.getType()));
        out.write(" " + node.getName());

        // 非常量字段的初始化发生在生成的构造器中，只有 static final 常量在声明处输出
        Expression initial = node.getInitialValueExpression();
        if (isConstantInitializer(node, initial)) {
            out.write(" = ");
            out.write(constantInitializerText((ConstantExpression) initial, node.getType()));
        }
        out.lineBreak();
    }

    @Override
    public void visitProperty(PropertyNode node) {
        // 属性由其支撑字段输出，避免重复
    }

    public void visitAnnotationNode(AnnotationNode node) {
        out.write("@" + node.getClassNode().getName());
        Map<String, Expression> members = node.getMembers();
        if (members != null && !members.isEmpty()) {
            out.write("(");
            writeJoined(members.entrySet(), ", ", member -> {
                out.write(member.getKey() + " = ");
                renderExpression(member.getValue());
            });
            out.write(")");
        }
    }

    private void renderAnnotations(List<AnnotationNode> annotations) {
        if (annotations == null || annotations.isEmpty()) return;
        for (AnnotationNode annotation : annotations) {
            visitAnnotationNode(annotation);
            out.lineBreak();
        }
    }

    /**
     * 按固定顺序输出修饰符，与声明时的顺序无关
     */
    private void visitModifiers(int modifiers) {
        if (Modifier.isAbstract(modifiers)) out.write("abstract ");
        if (Modifier.isFinal(modifiers)) out.write("final ");
        if (Modifier.isInterface(modifiers)) out.write("interface ");
        if (Modifier.isNative(modifiers)) out.write("native ");
        if (Modifier.isPrivate(modifiers)) out.write("private ");
        if (Modifier.isProtected(modifiers)) out.write("protected ");
        if (Modifier.isPublic(modifiers)) out.write("public ");
        if (Modifier.isStatic(modifiers)) out.write("static ");
        if (Modifier.isSynchronized(modifiers)) out.write("synchronized ");
        if (Modifier.isTransient(modifiers)) out.write("transient ");
        if (Modifier.isVolatile(modifiers)) out.write("volatile ");
    }

    private void visitParameters(Parameter[] parameters) {
        if (parameters == null) return;
        writeJoined(Arrays.asList(parameters), ", ", this::visitParameter);
    }

    private void visitParameter(Parameter parameter) {
        for (AnnotationNode annotation : parameter.getAnnotations()) {
            visitAnnotationNode(annotation);
            out.write(" ");
        }
        visitModifiers(parameter.getModifiers() & PARAMETER_MODIFIERS);
        out.write(typeText(parameter.getType()));
        out.write(" " + parameter.getName());
        Expression initial = parameter.getInitialExpression();
        if (parameter.hasInitialExpression() && initial != null && !(initial instanceof EmptyExpression)) {
            out.write(" = ");
            renderExpression(initial);
        }
    }

    // ============ 语句 ============

    @Override
    public void visitBlockStatement(BlockStatement block) {
        for (Statement statement : block.getStatements()) {
            renderLabels(statement);
            statement.visit(this);
            out.lineBreak();
        }
        out.lineBreak();
    }

    @Override
    public void visitForLoop(ForStatement statement) {
        out.write("for (");
        boolean previous = inControlStatement;
        inControlStatement = true;
        Parameter variable = statement.getVariable();
        if (variable != ForStatement.FOR_LOOP_DUMMY) {
            visitParameters(new Parameter[]{variable});
            out.write(" : ");
        }
        statement.getCollectionExpression().visit(this);
        inControlStatement = previous;
        out.write(") {");
        out.lineBreak();
        out.indented(() -> statement.getLoopBlock().visit(this));
        out.lineBreak();
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitIfElse(IfStatement ifElse) {
        out.write("if (");
        boolean previous = inControlStatement;
        inControlStatement = true;
        ifElse.getBooleanExpression().visit(this);
        inControlStatement = previous;
        out.write(") {");
        out.lineBreak();
        out.indented(() -> ifElse.getIfBlock().visit(this));
        out.lineBreak();

        Statement elseBlock = ifElse.getElseBlock();
        if (elseBlock != null && !(elseBlock instanceof EmptyStatement)) {
            out.write("} else {");
            out.lineBreak();
            out.indented(() -> elseBlock.visit(this));
            out.lineBreak();
        }
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitExpressionStatement(ExpressionStatement statement) {
        Expression expression = statement.getExpression();
        // 只有语句级的方法调用可以使用命令式写法（省略括号）
        commandCallAllowed = expression instanceof MethodCallExpression;
        expression.visit(this);
        commandCallAllowed = false;
    }

    @Override
    public void visitReturnStatement(ReturnStatement statement) {
        if (statement.isReturningNullOrVoid()) {
            out.write("return");
        } else {
            out.write("return ");
            renderExpression(statement.getExpression());
        }
    }

    @Override
    public void visitAssertStatement(AssertStatement statement) {
        out.write("assert ");
        statement.getBooleanExpression().visit(this);
        out.write(" : ");
        statement.getMessageExpression().visit(this);
    }

    /**
     * finally 子句总是输出，源码中没有时输出空块
     */
    @Override
    public void visitTryCatchFinally(TryCatchStatement statement) {
        out.write("try {");
        out.lineBreak();
        out.indented(() -> statement.getTryStatement().visit(this));
        out.lineBreak();
        out.write("}");
        for (CatchStatement catchStatement : statement.getCatchStatements()) {
            out.write(" ");
            visitCatchStatement(catchStatement);
        }
        out.write(" finally {");
        out.lineBreak();
        Statement finallyStatement = statement.getFinallyStatement();
        out.indented(() -> {
            if (finallyStatement != null) {
                finallyStatement.visit(this);
            }
        });
        out.lineBreak();
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitCatchStatement(CatchStatement statement) {
        out.write("catch (");
        visitParameters(new Parameter[]{statement.getVariable()});
        out.write(") {");
        out.lineBreak();
        out.indented(() -> statement.getCode().visit(this));
        out.lineBreak();
        out.write("}");
    }

    @Override
    public void visitSwitch(SwitchStatement statement) {
        out.write("switch (");
        statement.getExpression().visit(this);
        out.write(") {");
        out.lineBreak();
        out.indented(() -> {
            for (CaseStatement caseStatement : statement.getCaseStatements()) {
                visitCaseStatement(caseStatement);
            }
            Statement defaultStatement = statement.getDefaultStatement();
            if (defaultStatement != null && !(defaultStatement instanceof EmptyStatement)) {
                out.write("default:");
                out.lineBreak();
                out.indented(() -> defaultStatement.visit(this));
            }
        });
        out.lineBreak();
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitCaseStatement(CaseStatement statement) {
        out.write("case ");
        renderExpression(statement.getExpression());
        out.write(":");
        out.lineBreak();
        out.indented(() -> statement.getCode().visit(this));
        out.lineBreak();
    }

    @Override
    public void visitBreakStatement(BreakStatement statement) {
        out.write("break");
        if (statement.getLabel() != null) {
            out.write(" " + statement.getLabel());
        }
        out.lineBreak();
    }

    @Override
    public void visitContinueStatement(ContinueStatement statement) {
        out.write("continue");
        if (statement.getLabel() != null) {
            out.write(" " + statement.getLabel());
        }
        out.lineBreak();
    }

    @Override
    public void visitThrowStatement(ThrowStatement statement) {
        out.write("throw ");
        renderExpression(statement.getExpression());
        out.lineBreak();
    }

    @Override
    public void visitSynchronizedStatement(SynchronizedStatement statement) {
        out.write("synchronized (");
        renderExpression(statement.getExpression());
        out.write(") {");
        out.lineBreak();
        out.indented(() -> statement.getCode().visit(this));
        out.lineBreak();
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitWhileLoop(WhileStatement statement) {
        out.write("while (");
        boolean previous = inControlStatement;
        inControlStatement = true;
        statement.getBooleanExpression().visit(this);
        inControlStatement = previous;
        out.write(") {");
        out.lineBreak();
        out.indented(() -> statement.getLoopBlock().visit(this));
        out.lineBreak();
        out.write("}");
        out.lineBreak();
    }

    @Override
    public void visitDoWhileLoop(DoWhileStatement statement) {
        out.write("do {");
        out.lineBreak();
        out.indented(() -> statement.getLoopBlock().visit(this));
        out.lineBreak();
        out.write("} while (");
        boolean previous = inControlStatement;
        inControlStatement = true;
        statement.getBooleanExpression().visit(this);
        inControlStatement = previous;
        out.write(")");
        out.lineBreak();
    }

    @Override
    public void visitEmptyStatement(EmptyStatement statement) {
    }

    /** 语句标签与语句写在同一行，如 {@code outer: for (...)} */
    private void renderLabels(Statement statement) {
        List<String> labels = statement.getStatementLabels();
        if (labels == null) return;
        for (String label : labels) {
            out.write(label + ": ");
        }
    }

    // ============ 表达式 ============

    @Override
    public void visitMethodCallExpression(MethodCallExpression call) {
        boolean command = commandCallAllowed && !inControlStatement;
        commandCallAllowed = false;

        if (!call.isImplicitThis()) {
            renderReceiver(call.getObjectExpression());
            out.write(call.isSpreadSafe() ? "*." : call.isSafe() ? "?." : ".");
        }
        Expression method = call.getMethod();
        if (method instanceof ConstantExpression) {
            renderConstant((ConstantExpression) method, true);
        } else {
            method.visit(this);
        }
        renderArguments(call.getArguments(), !command);
    }

    @Override
    public void visitStaticMethodCallExpression(StaticMethodCallExpression call) {
        out.write(call.getOwnerType().getName() + "." + call.getMethod());
        Expression arguments = call.getArguments();
        if (arguments instanceof VariableExpression || arguments instanceof MethodCallExpression) {
            out.write("(");
            renderExpression(arguments);
            out.write(")");
        } else {
            renderArguments(arguments, true);
        }
    }

    @Override
    public void visitConstructorCallExpression(ConstructorCallExpression call) {
        if (call.isSuperCall()) {
            out.write("super");
        } else if (call.isThisCall()) {
            out.write("this");
        } else {
            out.write("new " + typeName(call.getType()));
        }
        renderArguments(call.getArguments(), true);
    }

    @Override
    public void visitTernaryExpression(TernaryExpression expression) {
        expression.getBooleanExpression().visit(this);
        out.write(" ? ");
        renderExpression(expression.getTrueExpression());
        out.write(" : ");
        renderExpression(expression.getFalseExpression());
    }

    @Override
    public void visitShortTernaryExpression(ElvisOperatorExpression expression) {
        visitTernaryExpression(expression);
    }

    /**
     * 下标运算符的左方括号属于运算符文本，右方括号由此处补齐
     */
    @Override
    public void visitBinaryExpression(BinaryExpression expression) {
        String operation = expression.getOperation().getText();
        boolean assignment = Types.isAssignment(expression.getOperation().getType());
        renderOperand(expression.getLeftExpression(), !assignment);
        if (operation.endsWith("[")) {
            out.write(operation);
            renderExpression(expression.getRightExpression());
            out.write("]");
        } else {
            out.write(" " + operation + " ");
            renderOperand(expression.getRightExpression(), !assignment);
        }
    }

    @Override
    public void visitPrefixExpression(PrefixExpression expression) {
        out.write(expression.getOperation().getText());
        out.write("(");
        renderExpression(expression.getExpression());
        out.write(")");
    }

    @Override
    public void visitPostfixExpression(PostfixExpression expression) {
        out.write("(");
        renderExpression(expression.getExpression());
        out.write(")");
        out.write(expression.getOperation().getText());
    }

    @Override
    public void visitBooleanExpression(BooleanExpression expression) {
        expression.getExpression().visit(this);
    }

    @Override
    public void visitClosureExpression(ClosureExpression expression) {
        out.write("{");
        Parameter[] parameters = expression.getParameters();
        if (parameters != null && parameters.length > 0) {
            out.write(" ");
            visitParameters(parameters);
            out.write(" ->");
        }
        renderFunctionBody(expression.getCode());
    }

    @Override
    public void visitLambdaExpression(LambdaExpression expression) {
        out.write("(");
        visitParameters(expression.getParameters());
        out.write(") -> {");
        renderFunctionBody(expression.getCode());
    }

    /**
     * 闭包与 lambda 的函数体，不含开头的左花括号
     */
    private void renderFunctionBody(Statement code) {
        out.lineBreak();
        // 函数体是独立的语句上下文，不受外层控制语句的括号规则影响
        boolean previous = inControlStatement;
        inControlStatement = false;
        out.indented(() -> {
            if (code != null) {
                code.visit(this);
            }
        });
        inControlStatement = previous;
        out.lineBreak();
        out.write("}");
    }

    @Override
    public void visitTupleExpression(TupleExpression expression) {
        renderArguments(expression, true);
    }

    @Override
    public void visitArgumentlistExpression(ArgumentListExpression expression) {
        renderArguments(expression, true);
    }

    /**
     * 具名参数列表直接输出条目，其余 map 字面量带方括号
     */
    @Override
    public void visitMapExpression(MapExpression expression) {
        boolean named = expression instanceof NamedArgumentListExpression;
        if (!named) out.write("[");
        List<MapEntryExpression> entries = expression.getMapEntryExpressions();
        if (entries.isEmpty()) {
            out.write(":");
        } else {
            writeJoined(entries, ", ", this::visitMapEntryExpression);
        }
        if (!named) out.write("]");
    }

    @Override
    public void visitMapEntryExpression(MapEntryExpression expression) {
        Expression key = expression.getKeyExpression();
        if (key instanceof SpreadMapExpression) {
            out.write("*");
        } else if (key instanceof ConstantExpression) {
            Object value = ((ConstantExpression) key).getValue();
            boolean bare = value instanceof Number
                    || (value instanceof String && GroovySourceStrings.isIdentifier((String) value));
            renderConstant((ConstantExpression) key, bare);
        } else {
            out.write("(");
            renderExpression(key);
            out.write(")");
        }
        out.write(": ");
        renderExpression(expression.getValueExpression());
    }

    @Override
    public void visitListExpression(ListExpression expression) {
        out.write("[");
        writeJoined(expression.getExpressions(), ", ", this::renderExpression);
        out.write("]");
    }

    @Override
    public void visitRangeExpression(RangeExpression expression) {
        out.write("(");
        renderExpression(expression.getFrom());
        out.write(expression.isInclusive() ? ".." : "..<");
        renderExpression(expression.getTo());
        out.write(")");
    }

    @Override
    public void visitPropertyExpression(PropertyExpression expression) {
        if (!expression.isImplicitThis()) {
            renderReceiver(expression.getObjectExpression());
            out.write(expression.isSpreadSafe() ? "*." : expression.isSafe() ? "?." : ".");
            if (expression instanceof AttributeExpression) {
                out.write("@");
            }
        }
        Expression property = expression.getProperty();
        if (property instanceof ConstantExpression) {
            renderConstant((ConstantExpression) property, true);
        } else {
            property.visit(this);
        }
    }

    @Override
    public void visitAttributeExpression(AttributeExpression expression) {
        visitPropertyExpression(expression);
    }

    @Override
    public void visitFieldExpression(FieldExpression expression) {
        out.write(expression.getField().getName());
    }

    @Override
    public void visitMethodPointerExpression(MethodPointerExpression expression) {
        renderReceiver(expression.getExpression());
        out.write(".&");
        Expression methodName = expression.getMethodName();
        if (methodName instanceof ConstantExpression) {
            renderConstant((ConstantExpression) methodName, true);
        } else {
            methodName.visit(this);
        }
    }

    @Override
    public void visitMethodReferenceExpression(MethodReferenceExpression expression) {
        renderReceiver(expression.getExpression());
        out.write("::");
        Expression methodName = expression.getMethodName();
        if (methodName instanceof ConstantExpression) {
            renderConstant((ConstantExpression) methodName, true);
        } else {
            methodName.visit(this);
        }
    }

    @Override
    public void visitConstantExpression(ConstantExpression expression) {
        renderConstant(expression, false);
    }

    @Override
    public void visitClassExpression(ClassExpression expression) {
        out.write(expression.getType().getNameWithoutPackage());
    }

    @Override
    public void visitVariableExpression(VariableExpression expression) {
        renderVariable(expression, true);
    }

    @Override
    public void visitDeclarationExpression(DeclarationExpression expression) {
        if (expression.isMultipleAssignmentDeclaration()) {
            out.write("def (");
            writeJoined(expression.getTupleExpression().getExpressions(), ", ", element -> {
                ClassNode declared = declaredType(element);
                if (!isDynamic(declared)) {
                    out.write(typeText(declared) + " ");
                }
                renderExpression(element);
            });
            out.write(") " + expression.getOperation().getText() + " ");
            renderExpression(expression.getRightExpression());
        } else {
            out.write(typeText(declaredType(expression.getLeftExpression())) + " ");
            visitBinaryExpression(expression);
        }
    }

    /**
     * 插值字符串按常量段与插值段重建，常量段重新转义，插值统一写成 {@code ${...}}
     */
    @Override
    public void visitGStringExpression(GStringExpression expression) {
        List<ConstantExpression> strings = expression.getStrings();
        List<Expression> values = expression.getValues();
        out.write("\"");
        for (int i = 0; i < Math.max(strings.size(), values.size()); i++) {
            if (i < strings.size()) {
                out.write(GroovySourceStrings.escapeDoubleQuoted(String.valueOf(strings.get(i).getValue())));
            }
            if (i < values.size()) {
                out.write("${");
                renderExpression(values.get(i));
                out.write("}");
            }
        }
        out.write("\"");
    }

    @Override
    public void visitArrayExpression(ArrayExpression expression) {
        out.write("new " + typeName(expression.getElementType()));
        List<Expression> sizes = expression.getSizeExpression();
        if (sizes != null) {
            out.write("[");
            writeJoined(sizes, ", ", this::renderExpression);
            out.write("]");
        } else {
            out.write("[] {");
            writeJoined(expression.getExpressions(), ", ", this::renderExpression);
            out.write("}");
        }
    }

    @Override
    public void visitSpreadExpression(SpreadExpression expression) {
        out.write("*");
        renderExpression(expression.getExpression());
    }

    @Override
    public void visitSpreadMapExpression(SpreadMapExpression expression) {
        out.write("*:");
        renderExpression(expression.getExpression());
    }

    @Override
    public void visitNotExpression(NotExpression expression) {
        renderWrapped("!", expression.getExpression());
    }

    @Override
    public void visitUnaryMinusExpression(UnaryMinusExpression expression) {
        renderWrapped("-", expression.getExpression());
    }

    @Override
    public void visitUnaryPlusExpression(UnaryPlusExpression expression) {
        renderWrapped("+", expression.getExpression());
    }

    @Override
    public void visitBitwiseNegationExpression(BitwiseNegationExpression expression) {
        renderWrapped("~", expression.getExpression());
    }

    @Override
    public void visitCastExpression(CastExpression expression) {
        out.write("((");
        renderExpression(expression.getExpression());
        out.write(") as " + typeName(expression.getType()) + ")");
    }

    @Override
    public void visitClosureListExpression(ClosureListExpression expression) {
        writeJoined(expression.getExpressions(), "; ", element -> element.visit(this));
    }

    /**
     * 字节码表达式只出现在较晚的编译阶段，没有对应的源码形式
     */
    @Override
    public void visitBytecodeExpression(BytecodeExpression expression) {
        out.write("/*BytecodeExpression*/");
        out.lineBreak();
    }

    @Override
    public void visitEmptyExpression(EmptyExpression expression) {
    }

    // ============ 类型 ============

    /**
     * 声明处的类型写法：Object 输出为 def
     */
    String typeText(ClassNode type) {
        if (isDynamic(type)) return "def";
        return typeName(type);
    }

    /**
     * 类型的源码写法：简单类名加泛型参数，数组逐维展开为 []
     */
    String typeName(ClassNode type) {
        if (type.isArray()) {
            return typeName(type.getComponentType()) + "[]";
        }
        String descriptor = GroovySourceStrings.unwrapArrayDescriptor(type.getName());
        if (descriptor != null) {
            return GroovySourceStrings.simpleName(descriptor);
        }
        if (type.isGenericsPlaceHolder()) {
            return type.getUnresolvedName();
        }
        return type.getNameWithoutPackage() + genericsText(type.getGenericsTypes());
    }

    private String genericsText(GenericsType[] generics) {
        if (generics == null || generics.length == 0) return "";
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < generics.length; i++) {
            GenericsType generic = generics[i];
            if (i > 0) sb.append(", ");
            if (generic.isPlaceholder() || generic.isWildcard()) {
                sb.append(generic.getName());
            } else {
                sb.append(typeName(generic.getType()));
            }
            ClassNode[] upperBounds = generic.getUpperBounds();
            if (upperBounds != null && upperBounds.length > 0) {
                sb.append(" extends ");
                for (int j = 0; j < upperBounds.length; j++) {
                    if (j > 0) sb.append(" & ");
                    sb.append(typeName(upperBounds[j]));
                }
            }
            if (generic.getLowerBound() != null) {
                sb.append(" super ").append(typeName(generic.getLowerBound()));
            }
        }
        return sb.append('>').toString();
    }

    /** 变量声明的原始类型：基本类型不会被替换为包装类型 */
    private static ClassNode declaredType(Expression target) {
        if (target instanceof VariableExpression) {
            return ((VariableExpression) target).getOriginType();
        }
        return target.getType();
    }

    private static boolean isDynamic(ClassNode type) {
        return !type.isArray() && !type.isGenericsPlaceHolder() && "Object".equals(type.getNameWithoutPackage());
    }

    // ============ 辅助方法 ============

    private String enclosingClassName(MethodNode constructor) {
        if (!classNameStack.isEmpty()) {
            return classNameStack.peek();
        }
        ClassNode declaringClass = constructor.getDeclaringClass();
        if (declaringClass != null) {
            return declaringClass.getNameWithoutPackage();
        }
        throw new IllegalStateException("Constructor rendered outside of any class");
    }

    private boolean isConstantInitializer(FieldNode node, Expression initial) {
        int modifiers = node.getModifiers();
        if (!Modifier.isStatic(modifiers) || !Modifier.isFinal(modifiers)) return false;
        if (!(initial instanceof ConstantExpression)) return false;
        String fieldType = node.getType().getName();
        String constantType = ClassHelper.getUnwrapper(initial.getType()).getName();
        return fieldType.equals(constantType) && CONSTANT_INITIALIZER_TYPES.contains(fieldType);
    }

    private static String constantInitializerText(ConstantExpression initial, ClassNode type) {
        String text = String.valueOf(initial.getValue());
        if ("java.lang.String".equals(type.getName()) || "char".equals(type.getName())) {
            return GroovySourceStrings.quote(text);
        }
        return text;
    }

    /**
     * 输出参数列表。命令式写法（{@code println x}）只在首个参数不会被误读时使用。
     */
    private void renderArguments(Expression arguments, boolean parenthesized) {
        if (!(arguments instanceof TupleExpression)) {
            out.write("(");
            renderExpression(arguments);
            out.write(")");
            return;
        }
        List<Expression> expressions = ((TupleExpression) arguments).getExpressions();
        if (expressions.isEmpty()) {
            out.write(parenthesized ? "()" : " ()");
            return;
        }
        boolean withParens = parenthesized || !isCommandArgument(expressions.get(0));
        int count = expressions.size();
        out.write(withParens ? "(" : " ");
        writeJoined(expressions, ", ", argument -> {
            if (argument instanceof MapExpression && count > 1) {
                out.write("(");
                argument.visit(this);
                out.write(")");
            } else {
                renderExpression(argument);
            }
        });
        if (withParens) out.write(")");
    }

    private static boolean isCommandArgument(Expression first) {
        if (first instanceof ConstantExpression) {
            Object value = ((ConstantExpression) first).getValue();
            return !(value instanceof Number) || ((Number) value).doubleValue() >= 0;
        }
        return first instanceof VariableExpression
                || first instanceof GStringExpression
                || first instanceof ClosureExpression
                || first instanceof PropertyExpression
                || first instanceof MethodCallExpression
                || first instanceof StaticMethodCallExpression
                || first instanceof ConstructorCallExpression
                || first instanceof ClassExpression
                || first instanceof NamedArgumentListExpression
                || first instanceof NotExpression;
    }

    /**
     * 输出子表达式：变量不加前导空格，常量字符串带引号
     */
    private void renderExpression(Expression expression) {
        if (expression instanceof VariableExpression) {
            renderVariable((VariableExpression) expression, false);
        } else if (expression instanceof ConstantExpression) {
            renderConstant((ConstantExpression) expression, false);
        } else {
            expression.visit(this);
        }
    }

    /** 方法调用与属性访问的接收者，复合表达式加括号 */
    private void renderReceiver(Expression receiver) {
        renderOperand(receiver, true);
    }

    private void renderOperand(Expression operand, boolean wrapCompound) {
        boolean wrap = wrapCompound && isCompound(operand);
        if (wrap) out.write("(");
        renderExpression(operand);
        if (wrap) out.write(")");
    }

    private static boolean isCompound(Expression expression) {
        if (expression instanceof TernaryExpression) return true;
        if (expression instanceof BinaryExpression && !(expression instanceof DeclarationExpression)) {
            return !((BinaryExpression) expression).getOperation().getText().endsWith("[");
        }
        return false;
    }

    private void renderWrapped(String operator, Expression operand) {
        out.write(operator + "(");
        renderExpression(operand);
        out.write(")");
    }

    private void renderVariable(VariableExpression expression, boolean spacePad) {
        out.write(spacePad ? " " + expression.getName() : expression.getName());
    }

    private void renderConstant(ConstantExpression expression, boolean unwrapQuotes) {
        Object value = expression.getValue();
        if (value instanceof String && !unwrapQuotes) {
            out.write(GroovySourceStrings.quote((String) value));
        } else {
            out.write(String.valueOf(value));
        }
    }

    private <T> void writeJoined(Iterable<T> items, String separator, Consumer<T> renderer) {
        boolean first = true;
        for (T item : items) {
            if (!first) {
                out.write(separator);
            }
            first = false;
            renderer.accept(item);
        }
    }
}
