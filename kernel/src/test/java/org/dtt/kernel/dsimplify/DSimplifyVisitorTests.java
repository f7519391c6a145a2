/*
 * Copyright 2023 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dtt.kernel.dsimplify;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.KernelOptions;
import org.dtt.kernel.context.CanonizeResult;
import org.dtt.kernel.context.FunInfoProvider;
import org.dtt.kernel.context.ICancellationCheck;
import org.dtt.kernel.context.IDefeqCanonizer;
import org.dtt.kernel.errors.CancellationRequestedException;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.errors.ResourceExhaustedException;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.dtt.kernel.simp.SimpLemmas;
import org.dtt.util.Logger;
import org.junit.Assert;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

public class DSimplifyVisitorTests extends BaseKernelTests {
    /** Canonicalizer which never changes anything. */
    static class IdentityCanonizer implements IDefeqCanonizer {
        int calls = 0;

        @Override
        public CanonizeResult canonize(DTTExpression expression) {
            this.calls++;
            return new CanonizeResult(expression, false);
        }
    }

    DSimplifyVisitor visitor(IDefeqCanonizer canonizer, IDSimplifyHooks hooks, long maxSteps, boolean visitInstances) {
        return new DSimplifyVisitor(this.context, new FunInfoProvider(this.context), canonizer,
                hooks, ICancellationCheck.NONE, maxSteps, visitInstances);
    }

    DSimplifyVisitor visitor(IDSimplifyHooks hooks) {
        return this.visitor(new IdentityCanonizer(), hooks, KernelOptions.DEFAULT_MAX_STEPS, false);
    }

    /** f ?x = g ?x, g ?x = h ?x */
    SimpLemmas chain() {
        return new SimpLemmas()
                .insert("f_g", this.f.call(meta("x")), this.g.call(meta("x")))
                .insert("g_h", this.g.call(meta("x")), this.h.call(meta("x")));
    }

    @Test
    public void testNoOpReturnsSameObject() {
        // fun (x : Nat) (y : Nat) => triple (g x) [m y a] (let z : Nat := g y in f z)
        DTTExpression let = new DTTLetExpression("z", this.nat, this.g.call(bvar(0)), this.f.call(bvar(0)));
        DTTExpression body = this.triple.call(
                this.g.call(bvar(1)),
                new DTTMacroExpression("m", bvar(0), this.a),
                let);
        DTTExpression e = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("y", this.nat, body));
        DTTExpression pi = new DTTPiExpression("x", this.nat, this.f.call(bvar(0)));

        DSimplifyVisitor visitor = this.visitor(IDSimplifyHooks.NONE);
        Assert.assertSame(e, visitor.apply(e));
        Assert.assertSame(pi, visitor.apply(pi));
        Assert.assertSame(this.a, visitor.apply(this.a));
        // Lemmas which do not apply
        DSimplifyVisitor rewriting = this.visitor(new ReflLemmaRewriter(
                new SimpLemmas().insert("c_a", this.c, this.a)));
        Assert.assertSame(e, rewriting.apply(e));
    }

    @Test
    public void testBinderHygiene() {
        // fun x x => f x, where the innermost x is used
        DTTExpression inner = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("x", this.nat, this.f.call(bvar(0))));
        // fun x x => f x, where the outermost x is used
        DTTExpression outer = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("x", this.nat, this.f.call(bvar(1))));
        ReflLemmaRewriter rewriter = new ReflLemmaRewriter(this.chain());

        DTTExpression result = this.visitor(rewriter).apply(inner);
        DTTExpression expected = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("x", this.nat, this.h.call(bvar(0))));
        Assert.assertEquals(expected, result);
        DTTLambdaExpression lambda = result.to(DTTLambdaExpression.class);
        Assert.assertEquals("x", lambda.name);
        Assert.assertEquals("x", lambda.body.to(DTTLambdaExpression.class).name);

        result = this.visitor(rewriter).apply(outer);
        expected = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("x", this.nat, this.h.call(bvar(1))));
        Assert.assertEquals(expected, result);
        Assert.assertFalse(result.hasLooseBVars());
        Assert.assertEquals(0, this.context.size());
    }

    @Test
    public void testDependentDomains() {
        // Pi (x : Nat) (y : F x), f y   with   F := fun _ => Nat as a free constant
        DTTConstantExpression fam = new DTTConstantExpression("F");
        this.environment.addAxiom("F", this.arrow(this.nat, this.nat));
        DTTExpression e = new DTTPiExpression("x", this.nat,
                new DTTPiExpression("y", fam.call(this.f.call(bvar(0))), this.f.call(bvar(0))));
        DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(e);
        DTTExpression expected = new DTTPiExpression("x", this.nat,
                new DTTPiExpression("y", fam.call(this.h.call(bvar(0))), this.h.call(bvar(0))));
        Assert.assertEquals(expected, result);
    }

    @Test
    public void testLet() {
        // let y : Nat := f a in pair y (f b)
        DTTExpression e = new DTTLetExpression("y", this.nat, this.f.call(this.a),
                this.pair.call(bvar(0), this.f.call(this.b)));
        DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(e);
        // The bound value is kept as written, the body is simplified
        DTTExpression expected = new DTTLetExpression("y", this.nat, this.f.call(this.a),
                this.pair.call(bvar(0), this.h.call(this.b)));
        Assert.assertEquals(expected, result);
        Assert.assertTrue(result.is(DTTLetExpression.class));
        Assert.assertEquals("y", result.to(DTTLetExpression.class).name);
    }

    @Test
    public void testDependentLetChain() {
        // let x : Nat := f a in let y : Nat := f x in pair (g x) y
        DTTExpression e = new DTTLetExpression("x", this.nat, this.f.call(this.a),
                new DTTLetExpression("y", this.nat, this.f.call(bvar(0)),
                        this.pair.call(this.g.call(bvar(1)), bvar(0))));
        DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(e);
        DTTExpression expected = new DTTLetExpression("x", this.nat, this.f.call(this.a),
                new DTTLetExpression("y", this.nat, this.f.call(bvar(0)),
                        this.pair.call(this.h.call(bvar(1)), bvar(0))));
        Assert.assertEquals(expected, result);
        Assert.assertEquals(0, this.context.size());

        // Only the values change: the chain is rebuilt with the values as written
        DTTExpression valuesOnly = new DTTLetExpression("x", this.nat, this.f.call(this.a),
                new DTTLetExpression("y", this.nat, this.f.call(bvar(0)),
                        this.pair.call(bvar(1), bvar(0))));
        Assert.assertEquals(valuesOnly, this.visitor(new ReflLemmaRewriter(this.chain())).apply(valuesOnly));
    }

    @Test
    public void testMacroRebuild() {
        DTTMacroExpression e = new DTTMacroExpression("m", this.f.call(this.a), this.b);
        DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(e);
        Assert.assertNotSame(e, result);
        DTTMacroExpression macro = result.to(DTTMacroExpression.class);
        Assert.assertEquals("m", macro.definition);
        Assert.assertEquals(this.h.call(this.a), macro.arguments[0]);
        Assert.assertSame(e.arguments[1], macro.arguments[1]);
    }

    @Test
    public void testStructuralSharing() {
        DTTExpression e = this.triple.call(this.a, this.f.call(this.b), this.c);
        DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(e);
        Assert.assertNotSame(e, result);
        DTTAppExpression app = result.to(DTTAppExpression.class);
        DTTAppExpression original = e.to(DTTAppExpression.class);
        Assert.assertSame(original.function, app.function);
        Assert.assertSame(original.arguments[0], app.arguments[0]);
        Assert.assertSame(original.arguments[2], app.arguments[2]);
        Assert.assertEquals(this.h.call(this.b), app.arguments[1]);
    }

    @Test
    public void testFixedPoint() {
        ReflLemmaRewriter rewriter = new ReflLemmaRewriter(this.chain());
        DSimplifyVisitor visitor = this.visitor(rewriter);
        DTTExpression result = visitor.apply(this.f.call(this.a));
        Assert.assertEquals(this.h.call(this.a), result);
        Assert.assertEquals(2, rewriter.getRewriteCount());
        // visit (f a), visit a, rewrite a, 3 attempts on (f a), 1 attempt on (h a)
        Assert.assertEquals(7, visitor.getNumSteps());
        Assert.assertEquals(0, visitor.getRestartCount());
    }

    @Test
    public void testCache() {
        ReflLemmaRewriter rewriter = new ReflLemmaRewriter(this.chain());
        DSimplifyVisitor visitor = this.visitor(rewriter);
        // The two arguments are equal but distinct objects
        DTTExpression result = visitor.apply(this.pair.call(this.f.call(this.a), this.f.call(this.a)));
        Assert.assertEquals(this.pair.call(this.h.call(this.a), this.h.call(this.a)), result);
        Assert.assertEquals(2, rewriter.getRewriteCount());
    }

    @Test
    public void testPreHookStop() {
        IDSimplifyHooks hooks = new IDSimplifyHooks() {
            @Nullable
            @Override
            public HookResult pre(DTTExpression expression, DSimplifyVisitor engine) {
                if (expression.getAppFn().equals(f))
                    return HookResult.stop(c);
                return null;
            }
        };
        DTTExpression result = this.visitor(hooks).apply(this.pair.call(this.f.call(this.a), this.b));
        Assert.assertEquals(this.pair.call(this.c, this.b), result);
    }

    @Test
    public void testPreHookContinue() {
        // The replacement is itself simplified
        IDSimplifyHooks hooks = new IDSimplifyHooks() {
            @Nullable
            @Override
            public HookResult pre(DTTExpression expression, DSimplifyVisitor engine) {
                if (expression.equals(a))
                    return HookResult.cont(f.call(b));
                return null;
            }

            @Nullable
            @Override
            public HookResult post(DTTExpression expression, DSimplifyVisitor engine) {
                if (expression.equals(b))
                    return HookResult.stop(c);
                return null;
            }
        };
        DTTExpression result = this.visitor(hooks).apply(this.g.call(this.a));
        Assert.assertEquals(this.g.call(this.f.call(this.c)), result);
    }

    @Test
    public void testInstanceImplicitBypass() {
        // k : Nat -> [Nat] -> Nat -> Nat
        DTTConstantExpression k = new DTTConstantExpression("k");
        this.environment.addAxiom("k", this.pi(BinderInfo.DEFAULT, this.nat,
                this.pi(BinderInfo.INST_IMPLICIT, this.nat, this.arrow(this.nat, this.nat))));
        DTTConstantExpression sentinel = new DTTConstantExpression("sentinel");
        IDefeqCanonizer canonizer = expression -> new CanonizeResult(sentinel, false);
        DTTExpression e = k.call(this.a, this.f.call(this.a), this.f.call(this.b));

        DTTExpression result = this.visitor(canonizer, new ReflLemmaRewriter(this.chain()),
                KernelOptions.DEFAULT_MAX_STEPS, false).apply(e);
        DTTAppExpression app = result.to(DTTAppExpression.class);
        Assert.assertSame(this.a, app.arguments[0]);
        Assert.assertSame(sentinel, app.arguments[1]);
        Assert.assertEquals(this.h.call(this.b), app.arguments[2]);

        // When instances are visited the canonicalizer is not used
        result = this.visitor(canonizer, new ReflLemmaRewriter(this.chain()),
                KernelOptions.DEFAULT_MAX_STEPS, true).apply(e);
        Assert.assertEquals(k.call(this.a, this.h.call(this.a), this.h.call(this.b)), result);
    }

    @Test
    public void testRestartOnMutation() {
        // k2 : [Nat] -> [Nat] -> Nat
        DTTConstantExpression k2 = new DTTConstantExpression("k2");
        this.environment.addAxiom("k2", this.pi(BinderInfo.INST_IMPLICIT, this.nat,
                this.pi(BinderInfo.INST_IMPLICIT, this.nat, this.nat)));

        class MutateOnce implements IDefeqCanonizer {
            final Set<DTTExpression> seen = new HashSet<>();
            boolean fired = false;
            int calls = 0;

            @Override
            public CanonizeResult canonize(DTTExpression expression) {
                this.calls++;
                this.seen.add(expression);
                if (!this.fired && this.seen.size() == 2) {
                    this.fired = true;
                    return new CanonizeResult(expression, true);
                }
                return new CanonizeResult(expression, false);
            }
        }

        MutateOnce canonizer = new MutateOnce();
        ReflLemmaRewriter rewriter = new ReflLemmaRewriter(this.chain());
        DSimplifyVisitor visitor = this.visitor(canonizer, rewriter, KernelOptions.DEFAULT_MAX_STEPS, false);
        DTTExpression e = this.pair.call(k2.call(this.a, this.b), this.f.call(this.c));
        DTTExpression result = visitor.apply(e);
        Assert.assertEquals(this.pair.call(k2.call(this.a, this.b), this.h.call(this.c)), result);
        Assert.assertEquals(1, visitor.getRestartCount());
        Assert.assertEquals(4, canonizer.calls);
        // The rewrites are performed again after the restart
        Assert.assertEquals(4, rewriter.getRewriteCount());
    }

    @Test
    public void testResourceCeiling() {
        final int maxSteps = 10;
        // f x -> f x, always reported as a change
        IDSimplifyHooks loop = new IDSimplifyHooks() {
            @Nullable
            @Override
            public HookResult post(DTTExpression expression, DSimplifyVisitor engine) {
                engine.incNumSteps();
                if (expression.getAppFn().equals(f))
                    return HookResult.cont(f.call(expression.getAppArgs()));
                return null;
            }
        };
        DSimplifyVisitor visitor = this.visitor(new IdentityCanonizer(), loop, maxSteps, false);
        try {
            visitor.apply(this.f.call(this.a));
            Assert.fail("Expected an exception");
        } catch (ResourceExhaustedException ex) {
            Assert.assertEquals(maxSteps, ex.maxSteps);
            Assert.assertEquals(maxSteps, visitor.getNumSteps());
        }
    }

    @Test
    public void testCyclicLemmas() {
        SimpLemmas lemmas = new SimpLemmas()
                .insert("f_g", this.f.call(meta("x")), this.g.call(meta("x")))
                .insert("g_f", this.g.call(meta("x")), this.f.call(meta("x")));
        DSimplifyVisitor visitor = this.visitor(new IdentityCanonizer(), new ReflLemmaRewriter(lemmas), 100, false);
        Assert.assertThrows(ResourceExhaustedException.class, () -> visitor.apply(this.f.call(this.a)));
        Assert.assertEquals(100, visitor.getNumSteps());
    }

    @Test
    public void testBoundVariable() {
        DSimplifyVisitor visitor = this.visitor(IDSimplifyHooks.NONE);
        InternalKernelError error = Assert.assertThrows(InternalKernelError.class,
                () -> visitor.apply(this.f.call(bvar(0))));
        Assert.assertNotNull(error.dttNode);
        Assert.assertEquals(0, this.context.size());
    }

    @Test
    public void testLocalsReleasedOnFailure() {
        DTTExpression e = new DTTLambdaExpression("x", this.nat,
                new DTTLambdaExpression("y", this.nat, this.f.call(bvar(2))));
        DSimplifyVisitor visitor = this.visitor(IDSimplifyHooks.NONE);
        Assert.assertThrows(InternalKernelError.class, () -> visitor.apply(e));
        Assert.assertEquals(0, this.context.size());
    }

    @Test
    public void testCancellation() {
        DSimplify simplify = new DSimplify(this.context);
        Thread.currentThread().interrupt();
        try {
            Assert.assertThrows(CancellationRequestedException.class,
                    () -> simplify.simplify(this.f.call(this.a), this.chain(), 100, false));
            // The host still sees the interrupt
            Assert.assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Assert.assertTrue(Thread.interrupted());
        }
        Assert.assertEquals(0, this.context.size());
    }

    @Test
    public void testTrace() {
        StringBuilder builder = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(builder);
        int level = Logger.INSTANCE.setLoggingLevel(DSimplifyVisitor.class, 4);
        try {
            DTTExpression result = this.visitor(new ReflLemmaRewriter(this.chain())).apply(this.f.call(this.a));
            Assert.assertEquals(this.h.call(this.a), result);
        } finally {
            Logger.INSTANCE.setLoggingLevel(DSimplifyVisitor.class, level);
            Logger.INSTANCE.setDebugStream(previous);
        }
        String trace = builder.toString();
        Assert.assertTrue(trace, trace.contains("dsimplify [1]: (f a)"));
        // The input is dumped as JSON
        Assert.assertTrue(trace, trace.contains("Input: "));
        Assert.assertTrue(trace, trace.contains("DTTAppExpression"));
    }
}
