package ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import ast.expressions.Expression;
import ast.expressions.MethodCallExpr;
import ast.expressions.StaticCallExpr;

/**
 * Names of standard library functions and methods with a known meaning to the analyses
 */
public class Stdlib {

    /**
     * Methods of this class are static
     */
    private Stdlib() {
        // Intentionally blank
    }

    private static Set<String> setOf(String... names) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
    }

    public static final Set<String> SEND_FUNCTIONS = setOf("send", "nativeSendMessage");
    /**
     * Contract methods that send a message, called on {@code self}
     */
    public static final Set<String> SEND_METHODS = setOf("reply", "forward", "notify", "emit");
    public static final Set<String> DATETIME_FUNCTIONS = setOf("now", "timestamp");
    public static final Set<String> PRG_USE_FUNCTIONS = setOf("random",
                                                              "randomInt",
                                                              "nativeRandom",
                                                              "nativeRandomInterval");
    public static final Set<String> PRG_INIT_FUNCTIONS = setOf("nativePrepareRandom",
                                                               "nativeRandomize",
                                                               "nativeRandomizeLt");
    /**
     * Methods of maps, strings and builders that modify the receiver
     */
    public static final Set<String> MUTATING_METHODS = setOf("set",
                                                             "del",
                                                             "replace",
                                                             "append",
                                                             "storeRef",
                                                             "storeBits",
                                                             "storeInt",
                                                             "storeUint",
                                                             "storeBool",
                                                             "storeBit",
                                                             "storeCoins",
                                                             "storeAddress",
                                                             "storeSlice",
                                                             "storeBuilder",
                                                             "storeMaybeRef");

    /**
     * @return whether e sends a message, e.g. {@code send(...)} or {@code self.reply(...)}
     */
    public static boolean isSendCall(Expression e) {
        if (e instanceof StaticCallExpr) {
            return SEND_FUNCTIONS.contains(((StaticCallExpr) e).getFunction());
        }
        if (e instanceof MethodCallExpr) {
            MethodCallExpr mc = (MethodCallExpr) e;
            return AstUtil.isSelf(mc.getSelf()) && SEND_METHODS.contains(mc.getMethod());
        }
        return false;
    }

    /**
     * @return whether e reads the current time
     */
    public static boolean isDatetimeCall(Expression e) {
        return e instanceof StaticCallExpr && DATETIME_FUNCTIONS.contains(((StaticCallExpr) e).getFunction());
    }

    /**
     * Name of the contract field modified by a mutating method call such as {@code self.m.set(k, v)} or
     * {@code self.b.storeUint(1, 8).storeRef(c)}
     *
     * @param mc
     *            method call
     * @return the modified field or null if mc does not modify a contract field
     */
    public static String findMutatedField(MethodCallExpr mc) {
        boolean mutating = false;
        Expression receiver = mc;
        while (receiver instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) receiver;
            mutating |= MUTATING_METHODS.contains(call.getMethod());
            receiver = call.getSelf();
        }
        return mutating ? AstUtil.getSelfField(receiver) : null;
    }
}
