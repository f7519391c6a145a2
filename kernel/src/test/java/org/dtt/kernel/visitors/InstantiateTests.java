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

package org.dtt.kernel.visitors;

import org.dtt.kernel.BaseKernelTests;
import org.dtt.kernel.errors.InternalKernelError;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class InstantiateTests extends BaseKernelTests {
    final DTTLocalExpression x = new DTTLocalExpression("x.0", "x", this.nat, BinderInfo.DEFAULT);
    final DTTLocalExpression y = new DTTLocalExpression("y.1", "y", this.nat, BinderInfo.DEFAULT);

    @Test
    public void testInstantiateRev() {
        // The last value replaces index 0
        DTTExpression e = this.pair.call(bvar(0), bvar(1));
        DTTExpression result = new Instantiate(Linq.list(this.x, this.y)).apply(e);
        Assert.assertEquals(this.pair.call(this.y, this.x), result);
        Assert.assertFalse(result.hasLooseBVars());
    }

    @Test
    public void testUnderBinder() {
        // fun z => pair z #1, where #1 is loose
        DTTExpression e = new DTTLambdaExpression("z", this.nat, this.pair.call(bvar(0), bvar(1)));
        DTTExpression result = new Instantiate(Linq.list(this.x)).apply(e);
        Assert.assertEquals(new DTTLambdaExpression("z", this.nat, this.pair.call(bvar(0), this.x)), result);
    }

    @Test
    public void testLowering() {
        DTTExpression e = this.pair.call(bvar(0), bvar(3));
        DTTExpression result = new Instantiate(Linq.list(this.x)).apply(e);
        Assert.assertEquals(this.pair.call(this.x, bvar(2)), result);
        Assert.assertEquals(3, result.looseBVarRange);
    }

    @Test
    public void testClosedIsUnchanged() {
        DTTExpression e = new DTTLambdaExpression("z", this.nat, this.f.call(bvar(0)));
        Assert.assertSame(e, new Instantiate(Linq.list(this.x)).apply(e));
    }

    @Test
    public void testOpenValue() {
        Assert.assertThrows(InternalKernelError.class, () -> new Instantiate(Linq.list(bvar(0))));
    }

    @Test
    public void testAbstractIsInverse() {
        List<DTTLocalExpression> locals = Linq.list(this.x, this.y);
        DTTExpression open = new DTTLambdaExpression("z", this.nat,
                this.triple.call(bvar(0), bvar(1), bvar(2)));
        DTTExpression closed = new Instantiate(locals).apply(open);
        Assert.assertEquals(new DTTLambdaExpression("z", this.nat,
                this.triple.call(bvar(0), this.y, this.x)), closed);
        Assert.assertEquals(open, new AbstractLocals(locals).apply(closed));
    }

    @Test
    public void testAbstractLiftsLooseVariables() {
        DTTExpression e = this.pair.call(this.x, bvar(0));
        DTTExpression result = new AbstractLocals(Linq.list(this.x)).apply(e);
        Assert.assertEquals(this.pair.call(bvar(0), bvar(1)), result);
    }

    @Test
    public void testCollectMetas() {
        CollectMetas collect = new CollectMetas();
        collect.apply(this.pair.call(meta("b"), this.f.call(meta("a"))).call(meta("b")));
        Assert.assertEquals(Linq.list("b", "a"), Linq.list(collect.metas.iterator()));
    }
}
