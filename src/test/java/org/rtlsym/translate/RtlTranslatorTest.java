package org.rtlsym.translate;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Model;
import org.rtlsym.model.Provenance;
import org.rtlsym.model.UFPlaceholder;
import org.rtlsym.rtl.*;
import org.rtlsym.symbolic.TermManager;
import org.rtlsym.symbolic.Z3Oracle;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.rtlsym.rtl.RtlExpr.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RtlTranslatorTest {

    private TermManager tm;
    private Context ctx;
    private Z3Oracle oracle;
    private RtlTranslator translator;

    private static final SignalSort BV2 = SignalSort.bitVector(2);
    private static final SignalSort BV3 = SignalSort.bitVector(3);
    private static final SignalSort BV4 = SignalSort.bitVector(4);

    @BeforeAll
    void setUp() {
        tm = new TermManager();
        ctx = tm.getCtx();
        oracle = new Z3Oracle(tm);
        translator = new RtlTranslator(tm);
    }

    @AfterAll
    void tearDown() {
        oracle.close();
        tm.close();
    }

    private Expr v(String name, SignalSort sort) {
        return tm.var(name, sort);
    }

    private BitVecExpr bv(String name, SignalSort sort) {
        return (BitVecExpr) tm.var(name, sort);
    }

    private BoolExpr b(String name) {
        return (BoolExpr) tm.var(name, SignalSort.bool());
    }

    private static Map<String, RtlExpr> ports(Object... pairs) {
        Map<String, RtlExpr> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (RtlExpr) pairs[i + 1]);
        }
        return map;
    }

    /**
     * 两个自增寄存器 a、b，经由线网 a_p1、b_p1；result = ~a | ~b。
     */
    private RtlDesign twoCounters() {
        RtlModule top = RtlModule.builder("top")
                .input("clk", 1)
                .input("should_inc", 1)
                .output("result", 3)
                .reg("a", 3)
                .reg("b", 3)
                .wire("a_p1", 3)
                .wire("b_p1", 3)
                .always(AlwaysBlock.clocked("clk", List.of(
                        RtlStatement.ifThen(ref("should_inc"), List.of(
                                RtlStatement.assign(ref("a"), ref("a_p1")),
                                RtlStatement.assign(ref("b"), ref("b_p1")))))))
                .assign(ref("a_p1"), binary(BinaryOperator.ADD, ref("a"), literal(1, 3)))
                .assign(ref("b_p1"), binary(BinaryOperator.ADD, ref("b"), literal(1, 3)))
                .assign(ref("result"), binary(BinaryOperator.OR,
                        unary(UnaryOperator.BITWISE_NOT, ref("a")),
                        unary(UnaryOperator.BITWISE_NOT, ref("b"))))
                .build();
        return RtlDesign.of(top);
    }

    /**
     * in -> a -> b -> c -> out 的三级寄存器流水线，b 还与 ignore 按位与。
     */
    private RtlDesign pipeline() {
        RtlModule top = RtlModule.builder("top")
                .input("clk", 1)
                .input("in", 2)
                .input("ignore", 2)
                .output("out", 2)
                .reg("a", 2)
                .reg("b", 2)
                .reg("c", 2)
                .always(AlwaysBlock.clocked("clk", List.of(
                        RtlStatement.assignNonBlocking(ref("a"), binary(BinaryOperator.ADD, ref("in"), unsized(1))),
                        RtlStatement.assignNonBlocking(ref("b"), binary(BinaryOperator.AND, ref("a"), ref("ignore"))),
                        RtlStatement.assignNonBlocking(ref("c"), ref("b")))))
                .assign(ref("out"), ref("c"))
                .build();
        return RtlDesign.of(top);
    }

    /**
     * inner 保存 i_inner 的或累积，rst 时清零；top 把 i_top 延迟一拍后送入 inner。
     */
    private RtlModule inner() {
        return RtlModule.builder("inner")
                .input("clk", 1)
                .input("rst", 1)
                .input("i_inner", 1)
                .output("o_inner", 1)
                .reg("i_state", 1)
                .always(AlwaysBlock.clocked("clk", List.of(
                        RtlStatement.ifThenElse(ref("rst"),
                                List.of(RtlStatement.assign(ref("i_state"), literal(0, 3))),
                                List.of(RtlStatement.assign(ref("i_state"),
                                        binary(BinaryOperator.OR, ref("i_inner"), ref("i_state"))))))))
                .assign(ref("o_inner"), ref("i_state"))
                .build();
    }

    private RtlModule topWithChild(String... instanceNames) {
        RtlModule.Builder builder = RtlModule.builder("top")
                .input("clk", 1)
                .input("rst", 1)
                .input("i_top", 1)
                .output("o_top", 1)
                .reg("i_top_last", 1)
                .wire("i_out_next", 1);
        for (String instanceName : instanceNames) {
            builder.instantiate(new Instantiation("inner", instanceName, ports(
                    "clk", ref("clk"),
                    "rst", ref("rst"),
                    "i_inner", ref("i_top_last"),
                    "o_inner", ref("i_out_next"))));
        }
        return builder
                .always(AlwaysBlock.clocked("clk", List.of(
                        RtlStatement.assign(ref("i_top_last"), ref("i_top")),
                        RtlStatement.assign(ref("o_top"), ref("i_out_next")))))
                .build();
    }

    @Nested
    @DisplayName("完整保真的翻译 (Full-fidelity translation)")
    class FullFidelityTests {

        @Test
        @DisplayName("时钟块成为 default_next，连续赋值成为 logic，时钟被丢弃")
        void testCounters() {
            Model model = translator.translate(twoCounters(), "top");
            BoolExpr inc = b("should_inc");
            assertAll("two counters",
                    () -> assertEquals(List.of(Variable.bool("should_inc")), model.getInputs()),
                    () -> assertEquals(List.of(Variable.of("result", BV3)), model.getOutputs()),
                    () -> assertEquals(List.of(Variable.of("a", BV3), Variable.of("b", BV3),
                            Variable.of("a_p1", BV3), Variable.of("b_p1", BV3)), model.getState()),
                    () -> assertEquals(ctx.mkITE(inc, v("a_p1", BV3), v("a", BV3)), model.getDefaultNext().get(v("a", BV3))),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVAdd(bv("a", BV3), tm.bv(1, 3)),
                            model.getLogic().get(v("a_p1", BV3)))),
                    () -> assertTrue(oracle.areEquivalent(
                            ctx.mkBVOR(ctx.mkBVNot(bv("a", BV3)), ctx.mkBVNot(bv("b", BV3))),
                            model.getLogic().get(v("result", BV3)))),
                    () -> assertTrue(model.getUfs().isEmpty() && model.getNextUfs().isEmpty()),
                    () -> assertEquals(Provenance.SYNTAX_GENERATED, model.getProvenance()),
                    () -> assertTrue(model.validate().isValid())
            );
        }

        @Test
        @DisplayName("1 位信号与更宽的常量混合时按位 0 截断，宽信号按 ite(b, 1, 0) 扩展")
        void testBoolWidening() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("rst", 1)
                    .input("i_inner", 1)
                    .output("o_inner", 1)
                    .reg("i_state", 3)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.ifThenElse(ref("rst"),
                                    List.of(RtlStatement.assign(ref("i_state"), literal(0, 3))),
                                    List.of(RtlStatement.assign(ref("i_state"),
                                            binary(BinaryOperator.OR, ref("i_inner"), ref("i_state"))))))))
                    .assign(ref("o_inner"), index(ref("i_state"), literal(0, 32)))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            Expr expectedNext = ctx.mkITE(b("rst"), tm.bv(0, 3),
                    ctx.mkBVOR(tm.boolToBitVector(b("i_inner"), 3), bv("i_state", BV3)));
            Expr expectedOut = ctx.mkEq(tm.extract(bv("i_state", BV3), 0, 0), tm.bv(1, 1));
            assertAll("bool widening",
                    () -> assertTrue(oracle.areEquivalent(expectedNext, model.getDefaultNext().get(v("i_state", BV3)))),
                    () -> assertTrue(oracle.areEquivalent(expectedOut, model.getLogic().get(b("o_inner")))),
                    () -> assertEquals(List.of(Variable.bool("rst"), Variable.bool("i_inner")), model.getInputs())
            );
        }

        @Test
        @DisplayName("变量下标的读写使用移位与掩码")
        void testVariableIndex() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("bit", 1)
                    .input("idx", 3)
                    .output("out", 1)
                    .reg("op", 8)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(index(ref("op"), ref("idx")), ref("bit")))))
                    .assign(ref("out"), index(ref("op"), ref("idx")))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            SignalSort bv8 = SignalSort.bitVector(8);
            BitVecExpr op = bv("op", bv8);
            Expr next = model.getDefaultNext().get(op);
            Expr out = model.getLogic().get(b("out"));
            assertNotNull(next);
            for (int i = 0; i < 8; i++) {
                BoolExpr atIndex = ctx.mkEq(bv("idx", BV3), tm.bv(i, 3));
                BoolExpr opBit = ctx.mkEq(tm.extract(op, i, i), tm.bv(1, 1));
                BoolExpr nextBit = ctx.mkEq(tm.extract(next, i, i), tm.bv(1, 1));
                assertTrue(oracle.isValid(ctx.mkImplies(atIndex, ctx.mkEq(out, opBit))), "read bit " + i);
                assertTrue(oracle.isValid(ctx.mkImplies(atIndex, ctx.mkEq(nextBit, b("bit")))), "write bit " + i);
                for (int j = 0; j < 8; j++) {
                    if (j != i) {
                        Expr untouched = ctx.mkEq(tm.extract(next, j, j), tm.extract(op, j, j));
                        assertTrue(oracle.isValid(ctx.mkImplies(atIndex, (BoolExpr) untouched)), "keep bit " + j);
                    }
                }
            }
        }

        @Test
        @DisplayName("下标比目标更宽时，越界的写入不改变目标，越界的读取为 0")
        void testWideVariableIndex() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("bit", 1)
                    .input("idx", 3)
                    .output("out", 1)
                    .reg("op", 2)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(index(ref("op"), ref("idx")), ref("bit")))))
                    .assign(ref("out"), index(ref("op"), ref("idx")))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            BitVecExpr op = bv("op", BV2);
            Expr next = model.getDefaultNext().get(op);
            Expr out = model.getLogic().get(b("out"));
            assertNotNull(next);
            assertEquals(2, TermManager.widthOf((BitVecExpr) next));
            for (int i = 2; i < 8; i++) {
                BoolExpr atIndex = ctx.mkEq(bv("idx", BV3), tm.bv(i, 3));
                assertTrue(oracle.isValid(ctx.mkImplies(atIndex, ctx.mkEq(next, op))), "write to op[" + i + "] changed op");
                assertTrue(oracle.isValid(ctx.mkImplies(atIndex, ctx.mkNot((BoolExpr) out))), "read of op[" + i + "]");
            }
            BoolExpr atOne = ctx.mkEq(bv("idx", BV3), tm.bv(1, 3));
            BoolExpr nextHigh = ctx.mkEq(tm.extract(next, 1, 1), tm.bv(1, 1));
            assertTrue(oracle.isValid(ctx.mkImplies(atOne, ctx.mkEq(nextHigh, b("bit")))));
            assertTrue(oracle.isValid(ctx.mkImplies(atOne, ctx.mkEq(tm.extract(next, 0, 0), tm.extract(op, 0, 0)))));
        }

        @Test
        @DisplayName("位区间赋值保留为 extract 键，拼接左值按最高位优先拆分")
        void testSliceAndConcatAssignments() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("in", 4)
                    .output("out", 2)
                    .reg("s0", 2)
                    .reg("s1", 4)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(index(ref("s1"), literal(2, 32)), index(ref("in"), literal(2, 32))),
                            RtlStatement.assign(slice(ref("s1"), 1, 0), slice(ref("s0"), 1, 0)))))
                    .assign(concat(ref("out"), ref("s0")), ref("in"))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            BitVecExpr in = bv("in", BV4);
            BitVecExpr s1 = bv("s1", BV4);
            assertAll("slices",
                    () -> assertEquals(tm.extract(in, 3, 2), model.getLogic().get(v("out", BV2))),
                    () -> assertEquals(tm.extract(in, 1, 0), model.getLogic().get(v("s0", BV2))),
                    () -> assertEquals(tm.extract(in, 2, 2), model.getDefaultNext().get(tm.extract(s1, 2, 2))),
                    () -> assertEquals(v("s0", BV2), model.getDefaultNext().get(tm.extract(s1, 1, 0))),
                    () -> assertEquals(2, model.getDefaultNext().size())
            );
        }

        @Test
        @DisplayName("进位加法：{c, out} = a + b 在 5 位上计算")
        void testCarryAdd() {
            RtlModule top = RtlModule.builder("top")
                    .input("a", 4)
                    .input("b", 4)
                    .output("c", 1)
                    .output("out", 4)
                    .assign(concat(ref("c"), ref("out")), binary(BinaryOperator.ADD, ref("a"), ref("b")))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            BitVecExpr wide = ctx.mkBVAdd(tm.zeroExtendTo(bv("a", BV4), 5), tm.zeroExtendTo(bv("b", BV4), 5));
            assertAll("carry add",
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVAdd(bv("a", BV4), bv("b", BV4)),
                            model.getLogic().get(v("out", BV4)))),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkEq(tm.extract(wide, 4, 4), tm.bv(1, 1)),
                            model.getLogic().get(b("c"))))
            );
        }

        @Test
        @DisplayName("存储器写入的键是 select，读取看到上一周期的内容")
        void testMemory() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("wen", 1)
                    .input("ra", 2)
                    .input("wdata", 4)
                    .output("rdata", 4)
                    .memory("arr", 4, 3)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.ifThen(ref("wen"), List.of(
                                    RtlStatement.assignNonBlocking(index(ref("arr"), ref("ra")), ref("wdata")))))))
                    .assign(ref("rdata"), index(ref("arr"), ref("ra")))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            Expr arr = v("arr", SignalSort.memory(3, 4));
            Expr element = ctx.mkSelect((com.microsoft.z3.ArrayExpr) arr, bv("ra", BV2));
            assertAll("memory",
                    () -> assertEquals(List.of(Variable.of("arr", SignalSort.memory(3, 4))), model.getState()),
                    () -> assertEquals(element, model.getLogic().get(v("rdata", BV4))),
                    () -> assertEquals(ctx.mkITE(b("wen"), v("wdata", BV4), element), model.getDefaultNext().get(element))
            );
        }

        @Test
        @DisplayName("寄存器初值进入 initValues")
        void testInitValues() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .output("count", 4)
                    .reg("r", 4, 5)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assignNonBlocking(ref("r"), binary(BinaryOperator.ADD, ref("r"), unsized(1))))))
                    .assign(ref("count"), ref("r"))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            assertEquals(Map.of(Variable.of("r", BV4), tm.bv(5, 4)), model.getInitValues());
        }

        @Test
        @DisplayName("阻塞赋值对之后的读取可见，非阻塞赋值不可见")
        void testBlockingVisibility() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("in", 4)
                    .reg("x", 4)
                    .reg("y", 4)
                    .reg("p", 4)
                    .reg("q", 4)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(ref("x"), ref("in")),
                            RtlStatement.assign(ref("y"), ref("x")),
                            RtlStatement.assignNonBlocking(ref("p"), ref("in")),
                            RtlStatement.assignNonBlocking(ref("q"), ref("p")))))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            assertAll("visibility",
                    () -> assertEquals(v("in", BV4), model.getDefaultNext().get(v("y", BV4))),
                    () -> assertEquals(v("p", BV4), model.getDefaultNext().get(v("q", BV4)))
            );
        }
    }

    @Nested
    @DisplayName("重要信号与 COI 策略 (Important signals and COI policies)")
    class AbstractionTests {

        @Test
        @DisplayName("NO_COI：被引用的省略信号成为无参数、带自由参数的 UF")
        void testNoCoi() {
            Model model = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("should_inc", "b", "b_p1", "result")
                    .coiPolicy(CoiPolicy.NO_COI)
                    .build());
            assertAll("NO_COI",
                    () -> assertEquals(List.of(Variable.bool("should_inc")), model.getInputs()),
                    () -> assertEquals(List.of(Variable.of("result", BV3)), model.getOutputs()),
                    () -> assertEquals(List.of(Variable.of("b", BV3), Variable.of("b_p1", BV3)), model.getState()),
                    () -> assertEquals(List.of(UFPlaceholder.nondeterministic("a", BV3)), model.getUfs()),
                    () -> assertTrue(model.getNextUfs().isEmpty()),
                    () -> assertEquals(2, model.getLogic().size()),
                    () -> assertEquals(ctx.mkITE(b("should_inc"), v("b_p1", BV3), v("b", BV3)),
                            model.getDefaultNext().get(v("b", BV3)))
            );
        }

        @Test
        @DisplayName("NO_COI 是默认策略")
        void testDefaultPolicy() {
            TranslationOptions options = TranslationOptions.builder().importantSignals("result").build();
            assertEquals(CoiPolicy.NO_COI, options.getCoiPolicy());
        }

        @Test
        @DisplayName("UF_ARGS_COI：省略的寄存器成为以前沿信号为参数的时序 UF")
        void testUfArgsRegister() {
            Model model = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("should_inc", "b", "b_p1", "result")
                    .coiPolicy(CoiPolicy.UF_ARGS_COI)
                    .build());
            // a 经由省略的线网 a_p1 依赖自身的上一周期值，需要自由参数
            UFPlaceholder a = new UFPlaceholder("a", BV3, List.of(Variable.bool("should_inc")), true);
            assertAll("UF_ARGS_COI",
                    () -> assertTrue(model.getUfs().isEmpty()),
                    () -> assertEquals(List.of(a), model.getNextUfs()),
                    () -> assertTrue(model.getNextUfs().get(0).isHasFreeArgument()),
                    () -> assertEquals(List.of(Variable.of("b", BV3), Variable.of("b_p1", BV3)), model.getState()),
                    () -> assertTrue(model.validate().isValid())
            );
        }

        @Test
        @DisplayName("UF_ARGS_COI：省略另一个计数器时结果对称")
        void testUfArgsRegisterSymmetric() {
            Model model = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("should_inc", "a", "a_p1", "result")
                    .coiPolicy(CoiPolicy.UF_ARGS_COI)
                    .build());
            assertAll("UF_ARGS_COI without b",
                    () -> assertEquals(List.of(new UFPlaceholder("b", BV3, List.of(Variable.bool("should_inc")), true)),
                            model.getNextUfs()),
                    () -> assertEquals(List.of(Variable.of("a", BV3), Variable.of("a_p1", BV3)), model.getState()),
                    () -> assertEquals(ctx.mkITE(b("should_inc"), v("a_p1", BV3), v("a", BV3)),
                            model.getDefaultNext().get(v("a", BV3)))
            );
        }

        @Test
        @DisplayName("UF_ARGS_COI：直接由重要信号决定的省略线网没有自由参数")
        void testUfArgsWireWithoutFreeArgument() {
            RtlModule top = RtlModule.builder("top")
                    .input("x", 4)
                    .input("y", 4)
                    .output("o", 4)
                    .wire("sum", 4)
                    .assign(ref("sum"), binary(BinaryOperator.ADD, ref("x"), ref("y")))
                    .assign(ref("o"), ref("sum"))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top", TranslationOptions.builder()
                    .importantSignals("x", "y", "o")
                    .coiPolicy(CoiPolicy.UF_ARGS_COI)
                    .build());
            assertEquals(List.of(new UFPlaceholder("sum", BV4, List.of(Variable.of("x", BV4), Variable.of("y", BV4)), false)),
                    model.getUfs());
        }

        @Test
        @DisplayName("UF_ARGS_COI：跨周期的依赖形成时序 UF 链，非重要输入带来自由参数")
        void testUfArgsTemporalChain() {
            Model model = translator.translate(pipeline(), "top", TranslationOptions.builder()
                    .importantSignals("out", "in")
                    .coiPolicy(CoiPolicy.UF_ARGS_COI)
                    .build());
            assertAll("temporal chain",
                    () -> assertEquals(List.of(Variable.of("in", BV2)), model.getInputs()),
                    () -> assertEquals(List.of(Variable.of("out", BV2)), model.getOutputs()),
                    () -> assertTrue(model.getState().isEmpty()),
                    () -> assertEquals(List.of(
                            new UFPlaceholder("c", BV2, List.of(Variable.of("b", BV2)), false),
                            new UFPlaceholder("b", BV2, List.of(Variable.of("a", BV2)), true),
                            new UFPlaceholder("a", BV2, List.of(Variable.of("in", BV2)), false)), model.getNextUfs()),
                    () -> assertEquals(Map.of(v("out", BV2), v("c", BV2)), model.getLogic())
            );
        }

        @Test
        @DisplayName("KEEP_COI：保留传递影响锥，不引入 UF")
        void testKeepCoi() {
            Model model = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("b")
                    .coiPolicy(CoiPolicy.KEEP_COI)
                    .build());
            assertAll("KEEP_COI",
                    () -> assertEquals(List.of(Variable.bool("should_inc")), model.getInputs()),
                    () -> assertTrue(model.getOutputs().isEmpty()),
                    () -> assertEquals(List.of(Variable.of("b", BV3), Variable.of("b_p1", BV3)), model.getState()),
                    () -> assertTrue(model.getUfs().isEmpty()),
                    () -> assertTrue(model.getNextUfs().isEmpty()),
                    () -> assertEquals(1, model.getLogic().size()),
                    () -> assertEquals(1, model.getDefaultNext().size())
            );
        }

        @Test
        @DisplayName("重要信号集合在 KEEP_COI 下单调：更大的集合保留更多信号")
        void testKeepCoiMonotone() {
            Model small = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("b").coiPolicy(CoiPolicy.KEEP_COI).build());
            Model large = translator.translate(twoCounters(), "top", TranslationOptions.builder()
                    .importantSignals("b", "result").coiPolicy(CoiPolicy.KEEP_COI).build());
            assertTrue(large.getState().containsAll(small.getState()));
            assertTrue(large.getInputs().containsAll(small.getInputs()));
            assertTrue(large.getState().size() > small.getState().size());
        }

        @Test
        @DisplayName("KEEP_COI 可能比 UF_ARGS_COI 保留更多状态：UF 链截断了寄存器流水线")
        void testKeepCoiLargerThanUfArgs() {
            Model keep = translator.translate(pipeline(), "top", TranslationOptions.builder()
                    .importantSignals("out", "in").coiPolicy(CoiPolicy.KEEP_COI).build());
            Model ufArgs = translator.translate(pipeline(), "top", TranslationOptions.builder()
                    .importantSignals("out", "in").coiPolicy(CoiPolicy.UF_ARGS_COI).build());
            assertAll("size",
                    () -> assertEquals(List.of(Variable.of("a", BV2), Variable.of("b", BV2), Variable.of("c", BV2)),
                            keep.getState()),
                    () -> assertEquals(3, keep.getDefaultNext().size()),
                    () -> assertTrue(ufArgs.getState().isEmpty()),
                    () -> assertTrue(ufArgs.getDefaultNext().isEmpty()),
                    () -> assertTrue(keep.getState().size() + keep.getLogic().size()
                            > ufArgs.getState().size() + ufArgs.getLogic().size())
            );
        }

        @Test
        @DisplayName("未声明的重要信号应抛出 UNKNOWN_SIGNAL")
        void testUnknownImportantSignal() {
            TranslationException e = assertThrows(TranslationException.class, () ->
                    translator.translate(twoCounters(), "top", TranslationOptions.builder().importantSignals("nope").build()));
            assertEquals(TranslationFault.UNKNOWN_SIGNAL, e.getFault());
        }
    }

    @Nested
    @DisplayName("子模块 (Submodules)")
    class SubmoduleTests {

        @Test
        @DisplayName("子模块递归翻译，输出通过限定名引用，时钟连接被丢弃")
        void testOneChild() {
            Model model = translator.translate(RtlDesign.of(inner(), topWithChild("sub")), "top");
            Model child = model.getInstances().get("sub").getModel();
            BoolExpr rst = b("rst");
            assertAll("one child",
                    () -> assertEquals(List.of(Variable.bool("rst"), Variable.bool("i_inner")), child.getInputs()),
                    () -> assertEquals(ctx.mkITE(rst, ctx.mkFalse(), ctx.mkOr(b("i_inner"), b("i_state"))),
                            child.getDefaultNext().get(b("i_state"))),
                    () -> assertEquals(b("i_state"), child.getLogic().get(b("o_inner"))),
                    () -> assertEquals(List.of(Variable.bool("rst"), Variable.bool("i_top")), model.getInputs()),
                    () -> assertEquals(List.of(Variable.bool("i_top_last"), Variable.bool("i_out_next")), model.getState()),
                    () -> assertEquals(b("sub.o_inner"), model.getLogic().get(b("i_out_next"))),
                    () -> assertEquals(b("i_out_next"), model.getDefaultNext().get(b("o_top"))),
                    () -> assertEquals(Map.of(Variable.bool("rst"), rst, Variable.bool("i_inner"), b("i_top_last")),
                            model.getInstances().get("sub").getInputs())
            );
        }

        @Test
        @DisplayName("多层嵌套的子模块，各层信号同名，内层时钟不连接")
        void testNestedChildren() {
            RtlModule inner2 = RtlModule.builder("inner2")
                    .input("clk", 1)
                    .input("value", 4)
                    .output("o", 4)
                    .reg("state", 4)
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(ref("state"), binary(BinaryOperator.ADD, ref("value"), literal(1, 4))))))
                    .assign(ref("o"), binary(BinaryOperator.XOR, ref("state"), literal(0b1111, 4)))
                    .build();
            RtlModule inner1 = RtlModule.builder("inner1")
                    .input("clk", 1)
                    .input("value", 4)
                    .output("o", 4)
                    .reg("state", 4)
                    .wire("inner_s", 4)
                    .instantiate(new Instantiation("inner2", "inst", ports("value", ref("value"), "o", ref("inner_s"))))
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(ref("state"), binary(BinaryOperator.XOR, ref("inner_s"), ref("value"))))))
                    .assign(ref("o"), binary(BinaryOperator.OR, ref("state"), literal(0b110, 4)))
                    .build();
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("value", 4)
                    .output("o", 4)
                    .reg("state", 4)
                    .wire("inner_s", 4)
                    .instantiate(new Instantiation("inner1", "inst", ports("value", ref("state"), "o", ref("inner_s"))))
                    .always(AlwaysBlock.clocked("clk", List.of(
                            RtlStatement.assign(ref("state"), binary(BinaryOperator.AND, ref("inner_s"), ref("value"))))))
                    .assign(ref("o"), ref("inner_s"))
                    .build();

            Model model = translator.translate(RtlDesign.of(inner2, inner1, top), "top");
            Model middle = model.getInstances().get("inst").getModel();
            Model innermost = middle.getInstances().get("inst").getModel();
            Variable value = Variable.of("value", BV4);
            Variable o = Variable.of("o", BV4);
            Variable state = Variable.of("state", BV4);
            Variable innerS = Variable.of("inner_s", BV4);
            BitVecExpr valueTerm = bv("value", BV4);
            BitVecExpr stateTerm = bv("state", BV4);
            BitVecExpr innerSTerm = bv("inner_s", BV4);
            assertAll("inner2",
                    () -> assertEquals("inner2", innermost.getName()),
                    () -> assertEquals(List.of(value), innermost.getInputs()),
                    () -> assertEquals(List.of(o), innermost.getOutputs()),
                    () -> assertEquals(List.of(state), innermost.getState()),
                    () -> assertTrue(innermost.getInstances().isEmpty()),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVXOR(stateTerm, tm.bv(0b1111, 4)),
                            innermost.getLogic().get(bv("o", BV4)))),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVAdd(valueTerm, tm.bv(1, 4)),
                            innermost.getDefaultNext().get(stateTerm)))
            );
            assertAll("inner1",
                    () -> assertEquals("inner1", middle.getName()),
                    () -> assertEquals(List.of(value), middle.getInputs()),
                    () -> assertEquals(List.of(o), middle.getOutputs()),
                    () -> assertEquals(List.of(state, innerS), middle.getState()),
                    () -> assertEquals(Map.of(value, valueTerm), middle.getInstances().get("inst").getInputs()),
                    () -> assertEquals(bv("inst.o", BV4), middle.getLogic().get(innerSTerm)),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVOR(stateTerm, tm.bv(0b110, 4)),
                            middle.getLogic().get(bv("o", BV4)))),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVXOR(innerSTerm, valueTerm),
                            middle.getDefaultNext().get(stateTerm)))
            );
            assertAll("top",
                    () -> assertEquals(List.of(value), model.getInputs()),
                    () -> assertEquals(List.of(o), model.getOutputs()),
                    () -> assertEquals(List.of(state, innerS), model.getState()),
                    () -> assertEquals(Map.of(value, stateTerm), model.getInstances().get("inst").getInputs()),
                    () -> assertEquals(bv("inst.o", BV4), model.getLogic().get(innerSTerm)),
                    () -> assertEquals(innerSTerm, model.getLogic().get(bv("o", BV4))),
                    () -> assertTrue(oracle.areEquivalent(ctx.mkBVAND(innerSTerm, valueTerm),
                            model.getDefaultNext().get(stateTerm))),
                    () -> assertTrue(innermost.validate().isValid()),
                    () -> assertTrue(middle.validate().isValid()),
                    () -> assertTrue(model.validate().isValid())
            );
        }

        @Test
        @DisplayName("预先提供的子模型替代 RTL 翻译")
        void testDefinedModule() {
            Model innerDef = Model.builder("inner")
                    .input(Variable.bool("rst"))
                    .input(Variable.bool("i_inner"))
                    .output(Variable.bool("o_inner"))
                    .logic(b("o_inner"), tm.bool(false))
                    .build();
            Model model = translator.translate(RtlDesign.of(inner(), topWithChild("sub")), "top",
                    TranslationOptions.builder().definedModule(innerDef).build());
            assertSame(innerDef, model.getInstances().get("sub").getModel());
            assertTrue(model.validate().isValid());
        }

        @Test
        @DisplayName("同一子模块的多个实例共享同一个 Model")
        void testSharedChild() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("rst", 1)
                    .input("i_top", 1)
                    .output("o0", 1)
                    .output("o1", 1)
                    .instantiate(new Instantiation("inner", "s0", ports(
                            "clk", ref("clk"), "rst", ref("rst"), "i_inner", ref("i_top"), "o_inner", ref("o0"))))
                    .instantiate(new Instantiation("inner", "s1", ports(
                            "clk", ref("clk"), "rst", ref("rst"), "i_inner", ref("o0"), "o_inner", ref("o1"))))
                    .build();
            Model model = translator.translate(RtlDesign.of(inner(), top), "top");
            assertSame(model.getInstances().get("s0").getModel(), model.getInstances().get("s1").getModel());
            assertEquals(b("s0.o_inner"), model.getLogic().get(b("o0")));
        }

        @Test
        @DisplayName("递归实例化应抛出 RECURSIVE_INSTANTIATION")
        void testRecursiveInstantiation() {
            RtlModule loop = RtlModule.builder("loop")
                    .input("x", 1)
                    .output("y", 1)
                    .instantiate(new Instantiation("loop", "self", ports("x", ref("x"), "y", ref("y"))))
                    .build();
            RtlModule top = RtlModule.builder("top")
                    .input("x", 1)
                    .output("y", 1)
                    .instantiate(new Instantiation("loop", "l", ports("x", ref("x"), "y", ref("y"))))
                    .build();
            TranslationException e = assertThrows(TranslationException.class,
                    () -> translator.translate(RtlDesign.of(loop, top), "top"));
            assertEquals(TranslationFault.RECURSIVE_INSTANTIATION, e.getFault());
        }

        @Test
        @DisplayName("未连接的子模块输入与不存在的端口")
        void testPortFaults() {
            RtlModule unbound = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("rst", 1)
                    .output("o", 1)
                    .instantiate(new Instantiation("inner", "sub", ports("rst", ref("rst"), "o_inner", ref("o"))))
                    .build();
            RtlModule unknownPort = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("rst", 1)
                    .output("o", 1)
                    .instantiate(new Instantiation("inner", "sub", ports(
                            "rst", ref("rst"), "i_inner", ref("rst"), "bogus", ref("o"))))
                    .build();
            TranslationException e1 = assertThrows(TranslationException.class,
                    () -> translator.translate(RtlDesign.of(inner(), unbound), "top"));
            TranslationException e2 = assertThrows(TranslationException.class,
                    () -> translator.translate(RtlDesign.of(inner(), unknownPort), "top"));
            assertEquals(TranslationFault.UNBOUND_PORT, e1.getFault());
            assertEquals(TranslationFault.UNKNOWN_PORT, e2.getFault());
        }
    }

    @Nested
    @DisplayName("翻译错误 (Translation faults)")
    class FaultTests {

        private TranslationFault faultOf(RtlModule top) {
            return assertThrows(TranslationException.class,
                    () -> translator.translate(RtlDesign.of(top), top.getName())).getFault();
        }

        @Test
        @DisplayName("找不到顶层模块")
        void testUnknownModule() {
            TranslationException e = assertThrows(TranslationException.class,
                    () -> translator.translate(twoCounters(), "missing"));
            assertEquals(TranslationFault.UNKNOWN_MODULE, e.getFault());
            assertEquals("missing", e.getModuleName());
        }

        @Test
        @DisplayName("引用未声明的信号")
        void testUnknownSignal() {
            RtlModule top = RtlModule.builder("top").output("o", 4).assign(ref("o"), ref("ghost")).build();
            assertEquals(TranslationFault.UNKNOWN_SIGNAL, faultOf(top));
        }

        @Test
        @DisplayName("前端无法分类的构造")
        void testUnsupportedConstruct() {
            RtlModule statement = RtlModule.builder("top")
                    .input("clk", 1)
                    .reg("r", 4)
                    .always(AlwaysBlock.clocked("clk", List.of(RtlStatement.opaque("case (r) endcase"))))
                    .build();
            RtlModule expression = RtlModule.builder("top").output("o", 4).assign(ref("o"), opaque("$random")).build();
            assertEquals(TranslationFault.UNSUPPORTED_CONSTRUCT, faultOf(statement));
            assertEquals(TranslationFault.UNSUPPORTED_CONSTRUCT, faultOf(expression));
        }

        @Test
        @DisplayName("多个时钟域")
        void testMultipleClocks() {
            RtlModule top = RtlModule.builder("top")
                    .input("clk_a", 1)
                    .input("clk_b", 1)
                    .input("in", 4)
                    .reg("x", 4)
                    .reg("y", 4)
                    .always(AlwaysBlock.clocked("clk_a", List.of(RtlStatement.assignNonBlocking(ref("x"), ref("in")))))
                    .always(AlwaysBlock.clocked("clk_b", List.of(RtlStatement.assignNonBlocking(ref("y"), ref("in")))))
                    .build();
            assertEquals(TranslationFault.MULTIPLE_CLOCK_DOMAINS, faultOf(top));
        }

        @Test
        @DisplayName("同一信号被两处整体驱动")
        void testMultipleDrivers() {
            RtlModule top = RtlModule.builder("top")
                    .input("a", 4)
                    .input("b", 4)
                    .output("o", 4)
                    .assign(ref("o"), ref("a"))
                    .assign(ref("o"), ref("b"))
                    .build();
            assertEquals(TranslationFault.MULTIPLE_DRIVERS, faultOf(top));
        }

        @Test
        @DisplayName("不同块驱动同一信号的不同位区间是允许的")
        void testDisjointSliceDrivers() {
            RtlModule top = RtlModule.builder("top")
                    .input("a", 2)
                    .input("b", 2)
                    .output("o", 4)
                    .assign(slice(ref("o"), 3, 2), ref("a"))
                    .assign(slice(ref("o"), 1, 0), ref("b"))
                    .build();
            Model model = translator.translate(RtlDesign.of(top), "top");
            assertEquals(2, model.getLogic().size());
            assertTrue(model.validate().isValid());
        }

        @Test
        @DisplayName("位区间超出信号宽度")
        void testWidthMismatch() {
            RtlModule top = RtlModule.builder("top")
                    .input("a", 4)
                    .output("o", 2)
                    .assign(ref("o"), slice(ref("a"), 5, 4))
                    .build();
            assertEquals(TranslationFault.WIDTH_MISMATCH, faultOf(top));
        }

        @Test
        @DisplayName("超出 int 范围的常量下标同样报告 WIDTH_MISMATCH")
        void testHugeConstantIndex() {
            RtlExpr huge = literal(1L << 32, 40);
            RtlModule write = RtlModule.builder("top")
                    .input("clk", 1)
                    .input("bit", 1)
                    .reg("r", 4)
                    .always(AlwaysBlock.clocked("clk", List.of(RtlStatement.assign(index(ref("r"), huge), ref("bit")))))
                    .build();
            RtlModule read = RtlModule.builder("top")
                    .input("a", 4)
                    .output("o", 1)
                    .assign(ref("o"), index(ref("a"), huge))
                    .build();
            assertEquals(TranslationFault.WIDTH_MISMATCH, faultOf(write));
            assertEquals(TranslationFault.WIDTH_MISMATCH, faultOf(read));
        }
    }
}
