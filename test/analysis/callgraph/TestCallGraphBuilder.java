package analysis.callgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import ast.AstFactory;
import ast.ContractDef;
import ast.FunctionDef;

import org.junit.Before;
import org.junit.Test;

public class TestCallGraphBuilder {

    private AstFactory f;

    @Before
    public void setUp() {
        f = new AstFactory();
    }

    private static CGNode node(CallGraph cg, String name) {
        Integer id = cg.getNodeIdByName(name);
        assertNotNull("No node " + name, id);
        return cg.getNode(id);
    }

    @Test
    public void freeFunctions() {
        FunctionDef clock = f.function("clock", f.ret(f.call("now")));
        FunctionDef roll = f.function("roll", f.ret(f.call("random", f.num(1), f.num(6))));
        FunctionDef seed = f.function("seed", f.expr(f.call("nativeRandomizeLt")));
        FunctionDef main = f.function("main", f.expr(f.call("clock")), f.let("r", f.call("roll")));
        CallGraph cg = AstFactory.build(AstFactory.store(clock, roll, seed, main)).getCallGraph();

        CGNode mainNode = node(cg, "main");
        assertTrue(node(cg, "clock").hasDirectEffect(Effect.ACCESS_DATETIME));
        assertTrue(node(cg, "roll").hasDirectEffect(Effect.PRG_USE));
        assertTrue(node(cg, "seed").hasDirectEffect(Effect.PRG_SEED_INIT));
        assertTrue(mainNode.hasEffect(Effect.ACCESS_DATETIME));
        assertTrue(mainNode.hasEffect(Effect.PRG_USE));
        assertFalse(mainNode.hasEffect(Effect.PRG_SEED_INIT));
        assertFalse(mainNode.hasDirectEffect(Effect.ACCESS_DATETIME));
        assertTrue(cg.areConnected(mainNode.getIdx(), node(cg, "clock").getIdx()));
        assertEquals(main.getId(), mainNode.getAstId().intValue());

        // Library calls without a definition still get a node
        CGNode now = node(cg, "now");
        assertFalse(now.isDefined());
        assertTrue(cg.areConnected(mainNode.getIdx(), now.getIdx()));
    }

    @Test
    public void contractMembers() {
        FunctionDef init = f.init(f.assign(f.selfField("owner"), f.id("sender")));
        FunctionDef pay = f.function("pay", f.expr(f.call("send", f.id("params"))));
        FunctionDef receiver = f.receiver(f.expr(f.method(f.self(), "pay")),
                                          f.expr(f.method(f.field(f.self(), "balances"), "set", f.id("k"),
                                                          f.num(1))));
        FunctionDef owner = f.getter("owner", f.ret(f.selfField("owner")));
        FunctionDef notify = f.function("notify", f.expr(f.method(f.self(), "reply", f.id("body"))));
        ContractDef c = f.contract("Vault", Arrays.asList("owner", "balances"), init, pay, receiver, owner, notify);
        CallGraph cg = AstFactory.build(AstFactory.store(Collections.<FunctionDef> emptyList(),
                                                         Collections.singletonList(c))).getCallGraph();

        CGNode initNode = node(cg, "Vault::init_" + init.getId());
        assertTrue(initNode.hasDirectEffect(Effect.STATE_WRITE));
        assertEquals(Collections.singleton("owner"), initNode.getFieldsWritten());
        assertFalse(initNode.hasDirectEffect(Effect.STATE_READ));

        CGNode receiveNode = node(cg, "Vault::receive_" + receiver.getId());
        assertTrue(receiveNode.hasEffect(Effect.SEND));
        assertFalse(receiveNode.hasDirectEffect(Effect.SEND));
        assertEquals(Collections.singleton("balances"), receiveNode.getFieldsWritten());
        assertTrue(cg.areConnected(receiveNode.getIdx(), node(cg, "Vault::pay").getIdx()));

        CGNode getter = node(cg, "Vault::owner");
        assertTrue(getter.hasDirectEffect(Effect.STATE_READ));
        assertEquals(Collections.singleton("owner"), getter.getFieldsRead());
        assertFalse(getter.hasEffect(Effect.STATE_WRITE));

        assertTrue(node(cg, "Vault::notify").hasDirectEffect(Effect.SEND));
        assertFalse(node(cg, "Vault::reply").isDefined());
    }

    @Test
    public void calleeNames() {
        assertEquals("foo", CallGraphBuilder.getCalleeName(f.call("foo"), "C"));
        assertEquals("C::foo", CallGraphBuilder.getCalleeName(f.method(f.self(), "foo"), "C"));
        assertEquals("foo", CallGraphBuilder.getCalleeName(f.method(f.self(), "foo"), null));
        assertEquals("toCell", CallGraphBuilder.getCalleeName(f.method(f.id("x"), "toCell"), "C"));
    }

    @Test
    public void recursion() {
        FunctionDef even = f.function("even", f.ret(f.call("odd", f.id("n"))));
        FunctionDef odd = f.function("odd", f.expr(f.call("send", f.id("p"))), f.ret(f.call("even", f.id("n"))));
        CallGraph cg = AstFactory.build(AstFactory.store(even, odd)).getCallGraph();
        assertTrue(node(cg, "even").hasEffect(Effect.SEND));
        assertTrue(cg.areConnected(node(cg, "even").getIdx(), node(cg, "odd").getIdx()));
        assertTrue(cg.areConnected(node(cg, "odd").getIdx(), node(cg, "even").getIdx()));
    }
}
