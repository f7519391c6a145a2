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

package org.dtt.kernel.context;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.errors.ResourceExhaustedException;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.junit.Assert;
import org.junit.Test;

public class TypeContextTests extends BaseKernelTests {
    @Test
    public void testFrameIsReleased() {
        try (TmpLocals locals = this.context.tmpLocals()) {
            DTTLocalExpression x = locals.pushLocal("x", this.nat, BinderInfo.DEFAULT);
            DTTLocalExpression y = locals.pushLet("y", this.nat, this.a);
            Assert.assertEquals(2, this.context.size());
            Assert.assertTrue(this.context.inScope(x));
            Assert.assertSame(this.a, this.context.getLetValue(y));
            Assert.assertNull(this.context.getLetValue(x));
            Assert.assertNotEquals(x.uniqueName, y.uniqueName);
        }
        Assert.assertEquals(0, this.context.size());
    }

    @Test
    public void testCorruptedPop() {
        TmpLocals outer = this.context.tmpLocals();
        outer.pushLocal("x", this.nat, BinderInfo.DEFAULT);
        TmpLocals inner = this.context.tmpLocals();
        inner.pushLocal("y", this.nat, BinderInfo.DEFAULT);
        Assert.assertThrows(InternalKernelError.class, outer::close);
    }

    @Test
    public void testMkLambdaAndPi() {
        DTTExpression lambda;
        DTTExpression pi;
        try (TmpLocals locals = this.context.tmpLocals()) {
            DTTLocalExpression x = locals.pushLocal("x", this.nat, BinderInfo.IMPLICIT);
            DTTConstantExpression fam = new DTTConstantExpression("F");
            DTTLocalExpression y = locals.pushLocal("y", fam.call(x), BinderInfo.DEFAULT);
            lambda = locals.mkLambda(this.pair.call(x, y));
            pi = locals.mkPi(this.f.call(y));
        }
        DTTExpression fam = new DTTConstantExpression("F");
        DTTExpression expected = new DTTLambdaExpression("x", this.nat, BinderInfo.IMPLICIT,
                new DTTLambdaExpression("y", fam.call(bvar(0)), this.pair.call(bvar(1), bvar(0))));
        Assert.assertEquals(expected, lambda);
        Assert.assertEquals(BinderInfo.IMPLICIT, lambda.to(DTTLambdaExpression.class).binderInfo);
        expected = new DTTPiExpression("x", this.nat, BinderInfo.IMPLICIT,
                new DTTPiExpression("y", fam.call(bvar(0)), this.f.call(bvar(0))));
        Assert.assertEquals(expected, pi);
    }

    @Test
    public void testMkLet() {
        DTTExpression let;
        try (TmpLocals locals = this.context.tmpLocals()) {
            DTTLocalExpression x = locals.pushLet("x", this.nat, this.a);
            DTTLocalExpression y = locals.pushLet("y", this.nat, this.f.call(x));
            let = locals.mkLet(this.pair.call(x, y));
        }
        DTTExpression expected = new DTTLetExpression("x", this.nat, this.a,
                new DTTLetExpression("y", this.nat, this.f.call(bvar(0)), this.pair.call(bvar(1), bvar(0))));
        Assert.assertEquals(expected, let);
    }

    @Test
    public void testIsDefEq() {
        this.environment.addDefinition("fa", this.nat, this.f.call(this.a));
        this.environment.addDefinition("id", this.arrow(this.nat, this.nat),
                new DTTLambdaExpression("x", this.nat, bvar(0)));
        DTTConstantExpression fa = new DTTConstantExpression("fa");
        DTTConstantExpression id = new DTTConstantExpression("id");

        Assert.assertTrue(this.context.isDefEq(this.a, this.a));
        Assert.assertFalse(this.context.isDefEq(this.a, this.b));
        // delta
        Assert.assertTrue(this.context.isDefEq(fa, this.f.call(this.a)));
        Assert.assertTrue(this.context.isDefEq(this.g.call(fa), this.g.call(this.f.call(this.a))));
        Assert.assertFalse(this.context.isDefEq(fa, this.f.call(this.b)));
        // beta
        Assert.assertTrue(this.context.isDefEq(id.call(this.a), this.a));
        Assert.assertTrue(this.context.isDefEq(id.call(id.call(fa)), this.f.call(this.a)));
        // zeta
        DTTExpression let = new DTTLetExpression("y", this.nat, this.a, this.f.call(bvar(0)));
        Assert.assertTrue(this.context.isDefEq(let, this.f.call(this.a)));
        // under binders
        DTTExpression left = new DTTLambdaExpression("x", this.nat, this.pair.call(id.call(bvar(0)), fa));
        DTTExpression right = new DTTLambdaExpression("z", this.nat, this.pair.call(bvar(0), this.f.call(this.a)));
        Assert.assertTrue(this.context.isDefEq(left, right));
    }

    @Test
    public void testNonTerminatingDefinition() {
        // loop := (fun x => x x) (fun x => x x)
        DTTExpression omega = new DTTLambdaExpression("x", this.nat, bvar(0).call(bvar(0)));
        this.environment.addDefinition("loop", this.nat, omega.call(omega));
        Assert.assertThrows(ResourceExhaustedException.class,
                () -> this.context.isDefEq(new DTTConstantExpression("loop"), this.a));
    }
}
