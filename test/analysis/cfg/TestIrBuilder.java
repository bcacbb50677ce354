package analysis.cfg;

import static ast.AstFactory.stmts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import junit.framework.TestCase;
import analysis.cfg.CompilationUnit.CfgCallback;
import analysis.cfg.CompilationUnit.CfgFolder;
import ast.AstFactory;
import ast.AstStore;
import ast.ContractDef;
import ast.FunctionDef;
import ast.ItemOrigin;
import ast.statements.ConditionStatement;
import ast.statements.ReturnStatement;
import ast.statements.Statement;
import ast.statements.TryStatement;
import ast.statements.WhileStatement;

/**
 * Shapes of the control-flow graphs built for each kind of statement
 */
public class TestIrBuilder extends TestCase {

    private AstFactory f;

    @Override
    protected void setUp() {
        f = new AstFactory();
    }

    private static BasicBlock blockOf(Cfg cfg, Statement s) {
        for (BasicBlock bb : cfg.getBasicBlocks()) {
            if (bb.getStmtIds().contains(s.getId())) {
                return bb;
            }
        }
        fail("No block for statement #" + s.getId());
        return null;
    }

    private static Set<BasicBlock> succs(Cfg cfg, BasicBlock bb) {
        return new HashSet<>(cfg.getSuccessors(bb.getIdx()));
    }

    private static Set<BasicBlock> set(BasicBlock... bbs) {
        return new HashSet<>(Arrays.asList(bbs));
    }

    private static Cfg build(FunctionDef fun) {
        return AstFactory.build(AstFactory.store(fun)).findFunctionCfgByName(fun.getName());
    }

    public void testSequence() {
        Statement a = f.let("a", f.num(1));
        Statement b = f.let("b", f.num(2));
        Statement r = f.ret(f.id("a"));
        Cfg cfg = build(f.function("seq", a, b, r));

        assertEquals(3, cfg.getNumberOfBasicBlocks());
        assertEquals(2, cfg.getEdges().size());
        assertSame(blockOf(cfg, a), cfg.getEntry());
        assertEquals(set(blockOf(cfg, b)), succs(cfg, blockOf(cfg, a)));
        assertEquals(set(blockOf(cfg, r)), succs(cfg, blockOf(cfg, b)));
        assertEquals(BasicBlockKind.REGULAR, blockOf(cfg, a).getKind());
        assertEquals(BasicBlockKind.EXIT, blockOf(cfg, r).getKind());
        assertEquals(Collections.singletonList(blockOf(cfg, r)), cfg.getExitNodes());
        assertEquals(Collections.singletonList(a.getId()), cfg.getEntry().getStmtIds());
    }

    public void testIfElse() {
        Statement t = f.expr(f.call("x"));
        Statement e = f.expr(f.call("y"));
        ConditionStatement cond = f.ifElse(f.id("c"), stmts(t), stmts(e));
        Statement next = f.expr(f.call("z"));
        Cfg cfg = build(f.function("branch", cond, next));

        BasicBlock condBB = blockOf(cfg, cond);
        assertEquals(BasicBlockKind.BRANCH, condBB.getKind());
        assertEquals(set(blockOf(cfg, t), blockOf(cfg, e)), succs(cfg, condBB));
        assertEquals(set(blockOf(cfg, next)), succs(cfg, blockOf(cfg, t)));
        assertEquals(set(blockOf(cfg, next)), succs(cfg, blockOf(cfg, e)));
        assertEquals(2, cfg.getPredecessors(blockOf(cfg, next).getIdx()).size());
        assertEquals(BasicBlockKind.EXIT, blockOf(cfg, next).getKind());
    }

    public void testIfWithoutElse() {
        Statement t = f.expr(f.call("x"));
        ConditionStatement cond = f.ifThen(f.id("c"), stmts(t));
        Statement next = f.ret(f.num(0));
        Cfg cfg = build(f.function("branch", cond, next));

        BasicBlock condBB = blockOf(cfg, cond);
        assertEquals(set(blockOf(cfg, t), blockOf(cfg, next)), succs(cfg, condBB));
        assertEquals(set(blockOf(cfg, next)), succs(cfg, blockOf(cfg, t)));
    }

    public void testEmptyBranches() {
        ConditionStatement cond = f.ifElse(f.id("c"), stmts(), stmts());
        Statement next = f.ret(f.num(0));
        Cfg cfg = build(f.function("branch", cond, next));

        assertEquals(2, cfg.getNumberOfBasicBlocks());
        assertEquals(1, cfg.getEdges().size());
        assertEquals(set(blockOf(cfg, next)), succs(cfg, blockOf(cfg, cond)));
    }

    public void testWhileLoop() {
        Statement init = f.let("i", f.num(0));
        Statement body = f.augAssign("+", f.id("i"), f.num(1));
        WhileStatement loop = f.whileLoop(f.bin("<", f.id("i"), f.num(10)), body);
        Statement after = f.ret(f.id("i"));
        Cfg cfg = build(f.function("loop", init, loop, after));

        BasicBlock header = blockOf(cfg, loop);
        assertEquals(BasicBlockKind.LOOP_HEADER, header.getKind());
        assertEquals(set(blockOf(cfg, body), blockOf(cfg, after)), succs(cfg, header));
        assertEquals(set(header), succs(cfg, blockOf(cfg, body)));
        assertEquals(set(blockOf(cfg, init), blockOf(cfg, body)), new HashSet<>(cfg.getPredecessors(header.getIdx())));
        assertEquals(Collections.singletonList(blockOf(cfg, after)), cfg.getExitNodes());
    }

    public void testNestedLoops() {
        Statement inner = f.expr(f.call("work"));
        Statement innerLoop = f.repeat(f.num(3), inner);
        Statement outerLoop = f.forEach("k", "v", f.id("m"), innerLoop);
        Cfg cfg = build(f.function("nested", outerLoop));

        BasicBlock outer = blockOf(cfg, outerLoop);
        BasicBlock innerHeader = blockOf(cfg, innerLoop);
        assertEquals(set(innerHeader), succs(cfg, outer));
        assertEquals(set(outer, blockOf(cfg, inner)), succs(cfg, innerHeader));
        assertEquals(set(innerHeader), succs(cfg, blockOf(cfg, inner)));
        // Every block lies on a cycle
        assertTrue(cfg.getExitNodes().isEmpty());
    }

    public void testEmptyLoopBody() {
        Statement loop = f.whileLoop(f.id("c"));
        Statement after = f.ret(f.num(1));
        Cfg cfg = build(f.function("spin", loop, after));
        assertEquals(set(blockOf(cfg, after)), succs(cfg, blockOf(cfg, loop)));
    }

    public void testReturnEndsPath() {
        ReturnStatement early = f.ret(f.num(1));
        ConditionStatement cond = f.ifThen(f.id("c"), stmts((Statement) early));
        ReturnStatement late = f.ret(f.num(2));
        Cfg cfg = build(f.function("early", cond, late));

        assertTrue(succs(cfg, blockOf(cfg, early)).isEmpty());
        assertEquals(BasicBlockKind.EXIT, blockOf(cfg, early).getKind());
        assertEquals(set(blockOf(cfg, early), blockOf(cfg, late)), new HashSet<>(cfg.getExitNodes()));
    }

    public void testStatementsAfterReturnAreUnreachable() {
        Statement r = f.ret(null);
        Statement dead = f.expr(f.call("never"));
        Cfg cfg = build(f.function("dead", r, dead));
        assertTrue(cfg.getPredecessors(blockOf(cfg, dead).getIdx()).isEmpty());
    }

    public void testTryCatch() {
        Statement body = f.expr(f.call("risky"));
        Statement handler = f.expr(f.call("recover"));
        TryStatement t = f.tryCatch(stmts(body), "e", stmts(handler));
        Statement after = f.ret(f.num(0));
        Cfg cfg = build(f.function("guarded", t, after));

        BasicBlock tryBB = blockOf(cfg, t);
        assertEquals(BasicBlockKind.BRANCH, tryBB.getKind());
        assertEquals(set(blockOf(cfg, body), blockOf(cfg, handler)), succs(cfg, tryBB));
        assertEquals(set(blockOf(cfg, after)), succs(cfg, blockOf(cfg, body)));
        assertEquals(set(blockOf(cfg, after)), succs(cfg, blockOf(cfg, handler)));
    }

    public void testTryWithoutCatch() {
        Statement body = f.expr(f.call("risky"));
        TryStatement t = f.tryCatch(stmts(body), null, null);
        Statement after = f.ret(f.num(0));
        Cfg cfg = build(f.function("unguarded", t, after));

        assertEquals(BasicBlockKind.REGULAR, blockOf(cfg, t).getKind());
        assertEquals(set(blockOf(cfg, body)), succs(cfg, blockOf(cfg, t)));
    }

    public void testCallBlocks() {
        FunctionDef helper = f.function("helper", f.ret(f.num(1)));
        Statement call = f.let("x", f.call("helper"));
        Statement external = f.expr(f.call("dump", f.id("x")));
        Statement r = f.ret(f.id("x"));
        FunctionDef main = f.function("main", call, external, r);
        CompilationUnit cu = AstFactory.build(AstFactory.store(helper, main));

        Cfg cfg = cu.findFunctionCfgByName("main");
        Cfg helperCfg = cu.findFunctionCfgByName("helper");
        BasicBlock callBB = blockOf(cfg, call);
        assertEquals(BasicBlockKind.CALL, callBB.getKind());
        assertEquals(Collections.singleton(helperCfg.getIdx()), callBB.getCallees());
        // Functions not defined in the program are not callees
        assertEquals(BasicBlockKind.REGULAR, blockOf(cfg, external).getKind());
        assertTrue(blockOf(cfg, external).getCallees().isEmpty());
    }

    public void testSelfMethodCalls() {
        FunctionDef helper = f.function("helper", f.ret(f.num(1)));
        Statement call = f.expr(f.method(f.self(), "helper"));
        Statement reply = f.expr(f.method(f.self(), "reply", f.id("body")));
        FunctionDef receiver = f.receiver(call, reply);
        ContractDef c = f.contract("Wallet", Collections.<String> emptyList(), helper, receiver);
        FunctionDef freeHelper = f.function("helper", f.ret(f.num(2)));
        AstStore ast = AstFactory.store(Collections.singletonList(freeHelper), Collections.singletonList(c));
        CompilationUnit cu = AstFactory.build(ast);

        Cfg receiveCfg = cu.findMethodCfgByName("Wallet", "receive_" + receiver.getId());
        assertNotNull(receiveCfg);
        assertEquals(FunctionKind.RECEIVE, receiveCfg.getKind());
        Cfg methodCfg = cu.findMethodCfgByName("Wallet", "helper");
        assertEquals(FunctionKind.METHOD, methodCfg.getKind());
        assertEquals(Collections.singleton(methodCfg.getIdx()), blockOf(receiveCfg, call).getCallees());
        assertTrue(blockOf(receiveCfg, reply).getCallees().isEmpty());
    }

    public void testEmptyFunction() {
        FunctionDef empty = f.function("empty");
        Cfg cfg = build(empty);
        assertTrue(cfg.isEmpty());
        assertNull(cfg.getEntry());
        assertTrue(cfg.getExitNodes().isEmpty());
        assertEquals(empty.getId(), cfg.getAstId());
    }

    public void testCompilationUnit() {
        FunctionDef free = f.function("free", f.ret(f.num(0)));
        FunctionDef lib = f.stdlibFunction("now");
        FunctionDef init = f.init(f.assign(f.selfField("owner"), f.id("sender")));
        FunctionDef getter = f.getter("owner", f.ret(f.selfField("owner")));
        ContractDef c = f.contract("Owned", Collections.singletonList("owner"), init, getter);
        AstStore ast = AstFactory.store(Arrays.asList(free, lib), Collections.singletonList(c));
        CompilationUnit cu = AstFactory.build(ast);

        assertEquals("test", cu.getProjectName());
        assertEquals(2, cu.getFunctions().size());
        assertEquals(1, cu.getContracts().size());
        assertEquals(4, cu.getAllCfgs(true).size());
        assertEquals(3, cu.getAllCfgs(false).size());

        final List<String> names = new ArrayList<>();
        cu.forEachCFG(new CfgCallback() {

            @Override
            public void visit(Cfg cfg) {
                names.add(cfg.getName());
            }
        });
        assertEquals(Arrays.asList("free", "init_" + init.getId(), "owner"), names);

        int blocks = cu.foldCFGs(0, new CfgFolder<Integer>() {

            @Override
            public Integer fold(Integer acc, Cfg cfg) {
                return acc + cfg.getNumberOfBasicBlocks();
            }
        }, true);
        assertEquals(3, blocks);

        Cfg initCfg = cu.findMethodCfgByName("Owned", "init_" + init.getId());
        assertEquals(FunctionKind.METHOD, initCfg.getKind());
        assertEquals(ItemOrigin.USER, initCfg.getOrigin());
        assertSame(cu.findContractByName("Owned"), cu.findContractOf(initCfg));
        assertNull(cu.findContractOf(cu.findFunctionCfgByName("free")));
        assertSame(initCfg, cu.findCfgByIdx(initCfg.getIdx()));
        assertEquals(ItemOrigin.STDLIB, cu.findFunctionCfgByName("now").getOrigin());
        assertNull(cu.findFunctionCfgByName("missing"));
        assertNull(cu.findMethodCfgByName("Missing", "owner"));
        assertNull(cu.findCfgByIdx(-1));
    }

    public void testIndicesAreUnique() {
        FunctionDef a = f.function("a", f.let("x", f.num(1)), f.ret(f.id("x")));
        FunctionDef b = f.function("b", f.let("y", f.num(1)), f.ret(f.id("y")));
        CompilationUnit cu = AstFactory.build(AstFactory.store(a, b));
        Set<Integer> bbs = new HashSet<>();
        Set<Integer> cfgs = new HashSet<>();
        for (Cfg cfg : cu.getAllCfgs(true)) {
            assertTrue(cfgs.add(cfg.getIdx()));
            for (BasicBlock bb : cfg.getBasicBlocks()) {
                assertTrue(bbs.add(bb.getIdx()));
            }
        }
        assertEquals(4, bbs.size());
    }
}
