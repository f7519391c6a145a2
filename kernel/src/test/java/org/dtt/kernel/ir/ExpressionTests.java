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

package org.dtt.kernel.ir;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.junit.Assert;
import org.junit.Test;

public class ExpressionTests extends BaseKernelTests {
    @Test
    public void testLooseRange() {
        Assert.assertEquals(1, bvar(0).looseBVarRange);
        Assert.assertEquals(4, this.pair.call(bvar(0), bvar(3)).looseBVarRange);
        Assert.assertEquals(0, new DTTLambdaExpression("x", this.nat, bvar(0)).looseBVarRange);
        Assert.assertEquals(2, new DTTLambdaExpression("x", this.nat, bvar(2)).looseBVarRange);
        Assert.assertEquals(1, new DTTPiExpression("x", bvar(0), this.nat).looseBVarRange);
        Assert.assertEquals(1, new DTTLetExpression("x", this.nat, bvar(0), bvar(0)).looseBVarRange);
        Assert.assertEquals(2, new DTTMacroExpression("m", this.a, bvar(1)).looseBVarRange);
    }

    @Test
    public void testWeight() {
        Assert.assertEquals(1, this.a.weight);
        Assert.assertEquals(3, this.f.call(this.a).weight);
        Assert.assertEquals(5, new DTTLambdaExpression("x", this.nat, this.f.call(bvar(0))).weight);
    }

    @Test
    public void testEquality() {
        // Binder names and binder information do not matter
        DTTExpression left = new DTTLambdaExpression("x", this.nat, BinderInfo.IMPLICIT, this.f.call(bvar(0)));
        DTTExpression right = new DTTLambdaExpression("y", this.nat, this.f.call(bvar(0)));
        Assert.assertEquals(left, right);
        Assert.assertEquals(left.hashCode(), right.hashCode());
        // Binder kinds do
        Assert.assertNotEquals(left, new DTTPiExpression("x", this.nat, this.f.call(bvar(0))));
        Assert.assertNotEquals(this.f.call(this.a), this.f.call(this.b));
        // Locals are identified by their unique name
        DTTLocalExpression x0 = new DTTLocalExpression("x.0", "x", this.nat, BinderInfo.DEFAULT);
        DTTLocalExpression x1 = new DTTLocalExpression("x.1", "x", this.nat, BinderInfo.DEFAULT);
        Assert.assertNotEquals(x0, x1);
        Assert.assertEquals(x0, new DTTLocalExpression("x.0", "y", this.a, BinderInfo.DEFAULT));
    }

    @Test
    public void testCall() {
        DTTExpression app = this.pair.call(this.a).call(this.b);
        DTTAppExpression result = app.to(DTTAppExpression.class);
        Assert.assertSame(this.pair, result.function);
        Assert.assertEquals(2, result.arguments.length);
        Assert.assertSame(this.pair, app.getAppFn());
        Assert.assertSame(this.b, app.getAppArgs()[1]);
        Assert.assertSame(this.a, this.a.call());
        Assert.assertEquals("(pair a b)", app.toString());
    }

    @Test
    public void testMalformedApplication() {
        Assert.assertThrows(InternalKernelError.class,
                () -> new DTTAppExpression(this.f.call(this.a), this.b));
        Assert.assertThrows(InternalKernelError.class, () -> new DTTAppExpression(this.f));
    }

    @Test
    public void testOpenLocalType() {
        Assert.assertThrows(InternalKernelError.class,
                () -> new DTTLocalExpression("x.0", "x", bvar(0), BinderInfo.DEFAULT));
    }
}
