package com.astlens.unparser.formatter;

import org.codehaus.groovy.ast.*;
import org.codehaus.groovy.ast.expr.*;
import org.codehaus.groovy.ast.stmt.*;
import org.codehaus.groovy.classgen.BytecodeExpression;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.syntax.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstSourceRenderer 测试")
class AstSourceRendererTest {

    // ============ 辅助方法 ============

    private static String render(ASTNode node) {
        AstSourceRenderer renderer = new AstSourceRenderer();
        renderer.render(node);
        return renderer.getOutput();
    }

    private static Token op(String text) {
        return Token.newSymbol(text, -1, -1);
    }

    private static VariableExpression var(String name) {
        return new VariableExpression(name);
    }

    private static ConstantExpression constant(Object value) {
        return new ConstantExpression(value);
    }

    private static Statement call(String method, Expression... args) {
        MethodCallExpression call = new MethodCallExpression(VariableExpression.THIS_EXPRESSION, method,
                new ArgumentListExpression(args));
        call.setImplicitThis(true);
        return new ExpressionStatement(call);
    }

    private static BlockStatement block(Statement... statements) {
        return new BlockStatement(Arrays.asList(statements), new VariableScope());
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("类与成员")
    class Declarations {

        @Test
        @DisplayName("空类输出父类与空行")
        void testEmptyClass() {
            ClassNode foo = new ClassNode("Foo", Modifier.PUBLIC, ClassHelper.OBJECT_TYPE);
            assertThat(render(foo)).isEqualTo("public class Foo extends Object {\n\n}\n");
        }

        @Test
        @DisplayName("字段、构造器按固定布局输出")
        void testClassWithConstructor() {
            ClassNode widget = new ClassNode("com.example.Widget", Modifier.PUBLIC, ClassHelper.OBJECT_TYPE);
            widget.addField(new FieldNode("size", Modifier.PRIVATE, ClassHelper.int_TYPE, widget, null));
            Statement assign = new ExpressionStatement(new BinaryExpression(
                    new PropertyExpression(var("this"), "size"), op("="), var("size")));
            widget.addConstructor(new ConstructorNode(Modifier.PUBLIC,
                    new Parameter[]{new Parameter(ClassHelper.int_TYPE, "size")},
                    ClassNode.EMPTY_ARRAY, block(assign)));

            AstSourceRenderer renderer = new AstSourceRenderer();
            renderer.render(widget);

            assertThat(renderer.getOutput()).isEqualTo(
                    "public class Widget extends Object {\n\n"
                            + "    private int size\n\n"
                            + "    public Widget(int size) {\n"
                            + "        this.size = size\n"
                            + "    }\n\n"
                            + "}\n");
            assertThat(renderer.getOpenClassCount()).isZero();
        }

        @Test
        @DisplayName("泛型与接口")
        void testGenericsAndInterfaces() {
            ClassNode box = new ClassNode("Box", Modifier.PUBLIC, ClassHelper.OBJECT_TYPE,
                    new ClassNode[]{ClassHelper.make(Runnable.class)}, MixinNode.EMPTY_ARRAY);
            GenericsType t = new GenericsType(ClassHelper.makeWithoutCaching("T"),
                    new ClassNode[]{ClassHelper.make(Number.class)}, null);
            t.setPlaceholder(true);
            box.setGenericsTypes(new GenericsType[]{t});

            assertThat(render(box)).startsWith("public class Box<T extends Number> implements Runnable extends Object {");
        }

        @Test
        @DisplayName("修饰符按固定顺序输出")
        void testModifierOrder() {
            FieldNode count = new FieldNode("count", Modifier.VOLATILE | Modifier.STATIC | Modifier.PRIVATE,
                    ClassHelper.int_TYPE, null, null);
            assertThat(render(count)).isEqualTo("private static volatile int count\n");
        }

        @Test
        @DisplayName("static final 常量输出初始值")
        void testConstantInitializer() {
            FieldNode max = new FieldNode("MAX", Modifier.PUBLIC | Modifier.STATIC | Modifier.FINAL,
                    ClassHelper.int_TYPE, null, constant(42));
            assertThat(render(max)).isEqualTo("final public static int MAX = 42\n");

            FieldNode name = new FieldNode("NAME", Modifier.PRIVATE | Modifier.STATIC | Modifier.FINAL,
                    ClassHelper.STRING_TYPE, null, constant("it's"));
            assertThat(render(name)).isEqualTo("final private static String NAME = 'it\\'s'\n");
        }

        @Test
        @DisplayName("非常量字段不输出初始值")
        void testNonConstantInitializerOmitted() {
            FieldNode x = new FieldNode("x", Modifier.PRIVATE, ClassHelper.int_TYPE, null, constant(1));
            assertThat(render(x)).isEqualTo("private int x\n");

            FieldNode dynamic = new FieldNode("y", Modifier.PRIVATE, ClassHelper.OBJECT_TYPE, null, null);
            assertThat(render(dynamic)).isEqualTo("private def y\n");
        }

        @Test
        @DisplayName("方法：返回类型、默认参数、throws")
        void testMethod() {
            Parameter greeting = new Parameter(ClassHelper.STRING_TYPE, "greeting", constant("hi"));
            MethodNode greet = new MethodNode("greet", Modifier.PUBLIC, ClassHelper.STRING_TYPE,
                    new Parameter[]{new Parameter(ClassHelper.STRING_TYPE, "name"), greeting},
                    new ClassNode[]{ClassHelper.make(java.io.IOException.class)},
                    block(new ReturnStatement(var("name"))));

            assertThat(render(greet)).isEqualTo(
                    "public String greet(String name, String greeting = 'hi') throws IOException {\n"
                            + "    return name\n"
                            + "}\n\n");
        }

        @Test
        @DisplayName("方法注解")
        void testAnnotatedMethod() {
            MethodNode run = new MethodNode("run", Modifier.PUBLIC, ClassHelper.VOID_TYPE,
                    Parameter.EMPTY_ARRAY, ClassNode.EMPTY_ARRAY, block());
            AnnotationNode deprecated = new AnnotationNode(ClassHelper.make(Deprecated.class));
            deprecated.addMember("since", constant("1.0"));
            run.addAnnotation(deprecated);

            assertThat(render(run)).startsWith("@java.lang.Deprecated(since = '1.0')\npublic void run() {\n");
        }

        @Test
        @DisplayName("静态初始化块")
        void testStaticInitializer() {
            MethodNode clinit = new MethodNode("<clinit>", Modifier.STATIC, ClassHelper.VOID_TYPE,
                    Parameter.EMPTY_ARRAY, ClassNode.EMPTY_ARRAY, block(call("init")));
            assertThat(render(clinit)).isEqualTo("static {\n    init ()\n}\n\n");
        }

        @Test
        @DisplayName("编译器回调渲染多个类后类名栈为空")
        void testCompilerDrivenClasses() {
            AstSourceRenderer renderer = new AstSourceRenderer();
            CompilationUnit unit = new CompilationUnit();
            unit.addPhaseOperation(renderer, CompilePhase.CONVERSION.getPhaseNumber());
            unit.addSource("Two.groovy", "class A {}\nclass B {}\n");
            unit.compile(CompilePhase.CONVERSION.getPhaseNumber());

            assertThat(renderer.getOutput())
                    .contains("public class A extends Object {")
                    .contains("public class B extends Object {");
            assertThat(renderer.getOpenClassCount()).isZero();
        }

        @Test
        @DisplayName("类外的构造器没有类名可用")
        void testConstructorOutsideClass() {
            ConstructorNode orphan = new ConstructorNode(Modifier.PUBLIC, block());
            assertThatThrownBy(() -> render(orphan)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("同一节点多次渲染结果一致")
        void testDeterministic() {
            ClassNode foo = new ClassNode("Foo", Modifier.PUBLIC, ClassHelper.OBJECT_TYPE);
            foo.addField(new FieldNode("a", Modifier.PRIVATE, ClassHelper.STRING_TYPE, foo, null));
            assertThat(render(foo)).isEqualTo(render(foo));
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class Statements {

        @Test
        @DisplayName("if/else 与命令式调用")
        void testIfElse() {
            IfStatement ifElse = new IfStatement(new BooleanExpression(var("x")), block(call("a")), block(call("b")));
            assertThat(render(block(ifElse))).isEqualTo("if ( x) {\n    a ()\n} else {\n    b ()\n}\n");
        }

        @Test
        @DisplayName("没有 else 时不输出 else 块")
        void testIfWithoutElse() {
            IfStatement ifOnly = new IfStatement(new BooleanExpression(var("x")), block(call("a")), EmptyStatement.INSTANCE);
            assertThat(render(block(ifOnly))).isEqualTo("if ( x) {\n    a ()\n}\n");
        }

        @Test
        @DisplayName("控制语句条件中的调用带括号")
        void testCallInsideGuard() {
            MethodCallExpression hasNext = new MethodCallExpression(VariableExpression.THIS_EXPRESSION, "hasNext",
                    ArgumentListExpression.EMPTY_ARGUMENTS);
            hasNext.setImplicitThis(true);
            WhileStatement loop = new WhileStatement(new BooleanExpression(hasNext), block(call("a")));
            assertThat(render(block(loop))).isEqualTo("while (hasNext()) {\n    a ()\n}\n");
        }

        @Test
        @DisplayName("try/catch/finally")
        void testTryCatch() {
            TryCatchStatement tryCatch = new TryCatchStatement(block(call("a")), EmptyStatement.INSTANCE);
            tryCatch.addCatch(new CatchStatement(new Parameter(ClassHelper.make(Exception.class), "e"), block(call("b"))));
            assertThat(render(block(tryCatch))).isEqualTo(
                    "try {\n    a ()\n} catch (Exception e) {\n    b ()\n} finally {\n}\n");
        }

        @Test
        @DisplayName("switch 的 case 与 default")
        void testSwitch() {
            CaseStatement one = new CaseStatement(constant(1), block(call("a"), new BreakStatement()));
            SwitchStatement switchStatement = new SwitchStatement(var("x"),
                    Collections.singletonList(one), block(call("b")));
            assertThat(render(block(switchStatement))).isEqualTo(
                    "switch ( x) {\n"
                            + "    case 1:\n"
                            + "        a ()\n"
                            + "        break\n"
                            + "    default:\n"
                            + "        b ()\n"
                            + "}\n");
        }

        @Test
        @DisplayName("返回 null 只输出 return")
        void testReturn() {
            assertThat(render(new ReturnStatement(ConstantExpression.NULL))).isEqualTo("return");
            assertThat(render(new ReturnStatement(constant("done")))).isEqualTo("return 'done'");
        }

        @Test
        @DisplayName("assert 总是带消息")
        void testAssert() {
            AssertStatement assertion = new AssertStatement(new BooleanExpression(var("ok")), constant("failed"));
            assertThat(render(assertion)).isEqualTo("assert ok : 'failed'");
        }

        @Test
        @DisplayName("带参数的命令式调用")
        void testCommandCallWithArguments() {
            assertThat(render(block(call("println", var("x"))))).isEqualTo("println x\n");
            assertThat(render(block(call("println", constant("hi"))))).isEqualTo("println 'hi'\n");
        }

        @Test
        @DisplayName("带标签的循环")
        void testLabelledLoop() {
            ForStatement loop = new ForStatement(new Parameter(ClassHelper.OBJECT_TYPE, "i"), var("items"),
                    block(new BreakStatement("outer")));
            loop.addStatementLabel("outer");
            assertThat(render(block(loop))).isEqualTo("outer: for (def i : items) {\n    break outer\n}\n");
        }

        @Test
        @DisplayName("列表参数不使用命令式写法")
        void testListArgumentKeepsParentheses() {
            ListExpression list = new ListExpression(Arrays.asList(constant(1), constant(2)));
            assertThat(render(block(call("foo", list)))).isEqualTo("foo([1, 2])\n");
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class Expressions {

        @Test
        @DisplayName("map 字面量")
        void testMaps() {
            assertThat(render(new MapExpression())).isEqualTo("[:]");

            MapExpression quoted = new MapExpression();
            quoted.addMapEntryExpression(constant("my key"), constant(1));
            quoted.addMapEntryExpression(constant("b"), constant(2));
            assertThat(render(quoted)).isEqualTo("['my key': 1, b: 2]");

            NamedArgumentListExpression named = new NamedArgumentListExpression();
            named.addMapEntryExpression(constant("a"), constant(1));
            assertThat(render(named)).isEqualTo("a: 1");
        }

        @Test
        @DisplayName("列表与区间")
        void testListAndRange() {
            assertThat(render(new ListExpression(Arrays.asList(constant(1), constant("two"))))).isEqualTo("[1, 'two']");
            assertThat(render(new RangeExpression(constant(1), constant(5), true))).isEqualTo("(1..5)");
            assertThat(render(new RangeExpression(constant(1), constant(5), false))).isEqualTo("(1..<5)");
        }

        @Test
        @DisplayName("一元运算与类型转换包裹操作数")
        void testWrappedOperands() {
            assertThat(render(new CastExpression(ClassHelper.STRING_TYPE, var("x")))).isEqualTo("((x) as String)");
            assertThat(render(new NotExpression(var("done")))).isEqualTo("!(done)");
            assertThat(render(new UnaryMinusExpression(var("n")))).isEqualTo("-(n)");
            assertThat(render(new BitwiseNegationExpression(var("bits")))).isEqualTo("~(bits)");
            assertThat(render(new PostfixExpression(var("i"), op("++")))).isEqualTo("(i)++");
            assertThat(render(new PrefixExpression(op("--"), var("i")))).isEqualTo("--(i)");
        }

        @Test
        @DisplayName("嵌套二元表达式加括号，下标不加空格")
        void testBinary() {
            BinaryExpression sum = new BinaryExpression(var("a"), op("+"), var("b"));
            assertThat(render(new BinaryExpression(sum, op("*"), var("c")))).isEqualTo("(a + b) * c");
            assertThat(render(new BinaryExpression(var("a"), op("["), constant(0)))).isEqualTo("a[0]");
        }

        @Test
        @DisplayName("属性、属性直访、方法指针")
        void testPropertyAccess() {
            assertThat(render(new PropertyExpression(var("obj"), constant("name"), true))).isEqualTo("obj?.name");
            assertThat(render(new AttributeExpression(var("obj"), constant("field")))).isEqualTo("obj.@field");
            assertThat(render(new MethodPointerExpression(var("list"), constant("add")))).isEqualTo("list.&add");
        }

        @Test
        @DisplayName("方法引用")
        void testMethodReference() {
            MethodReferenceExpression valueOf = new MethodReferenceExpression(
                    new ClassExpression(ClassHelper.STRING_TYPE), constant("valueOf"));
            assertThat(render(valueOf)).isEqualTo("String::valueOf");
        }

        @Test
        @DisplayName("无参闭包与 lambda")
        void testClosureAndLambda() {
            ClosureExpression noArgs = new ClosureExpression(Parameter.EMPTY_ARRAY, block(call("a")));
            assertThat(render(noArgs)).isEqualTo("{\n    a ()\n}");

            LambdaExpression twice = new LambdaExpression(
                    new Parameter[]{new Parameter(ClassHelper.OBJECT_TYPE, "x")},
                    block(new ExpressionStatement(new BinaryExpression(var("x"), op("*"), constant(2)))));
            assertThat(render(twice)).isEqualTo("(def x) -> {\n    x * 2\n}");
        }

        @Test
        @DisplayName("字节码表达式输出占位注释")
        void testBytecodeMarker() {
            assertThat(render(BytecodeExpression.NOP)).isEqualTo("/*BytecodeExpression*/\n");
        }

        @Test
        @DisplayName("展开运算")
        void testSpread() {
            assertThat(render(new SpreadExpression(var("list")))).isEqualTo("*list");
            assertThat(render(new SpreadMapExpression(var("m")))).isEqualTo("*:m");
        }

        @Test
        @DisplayName("三元与 Elvis")
        void testTernary() {
            TernaryExpression ternary = new TernaryExpression(new BooleanExpression(var("c")), constant(1), constant(2));
            assertThat(render(ternary)).isEqualTo("c ? 1 : 2");
            assertThat(render(new ElvisOperatorExpression(var("a"), constant("x")))).isEqualTo("a ? a : 'x'");
        }

        @Test
        @DisplayName("构造调用与静态调用总是带括号")
        void testCalls() {
            ConstructorCallExpression newWidget = new ConstructorCallExpression(ClassHelper.make("Widget"),
                    new ArgumentListExpression(constant(3)));
            assertThat(render(newWidget)).isEqualTo("new Widget(3)");

            StaticMethodCallExpression max = new StaticMethodCallExpression(ClassHelper.make(Math.class), "max",
                    new ArgumentListExpression(constant(1), constant(2)));
            assertThat(render(max)).isEqualTo("java.lang.Math.max(1, 2)");
        }

        @Test
        @DisplayName("变量声明与多重赋值")
        void testDeclarations() {
            DeclarationExpression single = new DeclarationExpression(
                    new VariableExpression("x", ClassHelper.int_TYPE), op("="), constant(1));
            assertThat(render(single)).isEqualTo("int x = 1");

            TupleExpression targets = new TupleExpression(new VariableExpression("a", ClassHelper.int_TYPE), var("b"));
            DeclarationExpression multiple = new DeclarationExpression(targets, op("="),
                    new ListExpression(Arrays.asList(constant(1), constant(2))));
            assertThat(render(multiple)).isEqualTo("def (int a, b) = [1, 2]");
        }

        @Test
        @DisplayName("插值字符串与数组创建")
        void testGStringAndArray() {
            GStringExpression hello = new GStringExpression("Hello $name",
                    Arrays.asList(constant("Hello "), constant("")), Arrays.<Expression>asList(var("name")));
            assertThat(render(hello)).isEqualTo("\"Hello ${name}\"");
            ArrayExpression grid = new ArrayExpression(ClassHelper.int_TYPE, null,
                    Arrays.asList(constant(2), constant(3)));
            assertThat(render(grid)).isEqualTo("new int[2, 3]");
        }
    }
}
